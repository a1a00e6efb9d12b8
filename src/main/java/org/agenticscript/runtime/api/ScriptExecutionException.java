package org.agenticscript.runtime.api;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * An exception that is thrown when a statement fails at runtime.
 * <p>
 * It is part of the public API and wraps the internal {@link ScriptError} together with the
 * position of the failing statement.
 */
public class ScriptExecutionException extends Exception {

    private final ExecutionError error;

    /**
     * Constructs a new execution exception.
     * @param cause The runtime error raised by the statement.
     * @param sourceInfo The position of the failing statement.
     */
    public ScriptExecutionException(ScriptError cause, SourceInfo sourceInfo) {
        super(String.format("%s at %s", cause.getMessage(), sourceInfo), cause);
        this.error = new ExecutionError(cause.getCode(), cause.getMessage(), sourceInfo);
    }

    public ExecutionError getError() {
        return error;
    }

    public ErrorCode getCode() {
        return error.code();
    }
}
