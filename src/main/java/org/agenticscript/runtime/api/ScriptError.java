package org.agenticscript.runtime.api;

/**
 * Base class of all errors raised while executing a script. Each error carries an
 * {@link ErrorCode}; the subclasses exist for the errors callers commonly handle specifically.
 */
public class ScriptError extends RuntimeException {

    private final ErrorCode code;

    public ScriptError(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ScriptError(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static ScriptError typeError(String message) {
        return new ScriptError(ErrorCode.TYPE_ERROR, message);
    }

    public static ScriptError argumentError(String message) {
        return new ScriptError(ErrorCode.ARGUMENT_ERROR, message);
    }
}
