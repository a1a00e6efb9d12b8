package org.agenticscript.runtime.api;

public class UnknownMethodException extends ScriptError {

    public UnknownMethodException(String method) {
        super(ErrorCode.UNKNOWN_METHOD, "Unknown agent method: " + method);
    }
}
