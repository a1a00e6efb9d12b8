package org.agenticscript.runtime.api;

/**
 * Raised when a name or id does not resolve to a live agent.
 */
public class UnknownAgentException extends ScriptError {

    public UnknownAgentException(String agent) {
        super(ErrorCode.UNKNOWN_AGENT, "Unknown agent: " + agent);
    }
}
