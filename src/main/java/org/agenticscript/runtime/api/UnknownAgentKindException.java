package org.agenticscript.runtime.api;

public class UnknownAgentKindException extends ScriptError {

    public UnknownAgentKindException(String kind) {
        super(ErrorCode.UNKNOWN_AGENT_KIND, "Unknown agent kind: " + kind + " (import it first)");
    }
}
