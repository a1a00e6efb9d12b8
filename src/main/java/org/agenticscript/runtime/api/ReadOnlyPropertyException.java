package org.agenticscript.runtime.api;

public class ReadOnlyPropertyException extends ScriptError {

    public ReadOnlyPropertyException(String property) {
        super(ErrorCode.READ_ONLY_PROPERTY, "Cannot modify read-only property: " + property);
    }
}
