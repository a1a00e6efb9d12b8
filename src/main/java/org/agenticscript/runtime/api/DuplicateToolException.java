package org.agenticscript.runtime.api;

public class DuplicateToolException extends ScriptError {

    public DuplicateToolException(String tool) {
        super(ErrorCode.DUPLICATE_TOOL, "Tool already registered: " + tool);
    }
}
