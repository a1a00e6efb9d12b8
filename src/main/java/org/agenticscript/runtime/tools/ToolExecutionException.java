package org.agenticscript.runtime.tools;

import org.agenticscript.runtime.api.ErrorCode;
import org.agenticscript.runtime.api.ScriptError;

/**
 * Raised by a tool handler when it cannot complete a call.
 */
public class ToolExecutionException extends ScriptError {

    public ToolExecutionException(String message) {
        super(ErrorCode.TOOL_EXECUTION_ERROR, message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(ErrorCode.TOOL_EXECUTION_ERROR, message, cause);
    }
}
