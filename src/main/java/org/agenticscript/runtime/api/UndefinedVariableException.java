package org.agenticscript.runtime.api;

public class UndefinedVariableException extends ScriptError {

    public UndefinedVariableException(String name) {
        super(ErrorCode.UNDEFINED_VARIABLE, "Undefined variable: " + name);
    }
}
