package org.agenticscript.runtime.api;

public class UnknownToolException extends ScriptError {

    public UnknownToolException(String tool) {
        super(ErrorCode.UNKNOWN_TOOL, "Unknown tool: " + tool);
    }
}
