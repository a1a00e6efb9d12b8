package org.agenticscript.runtime.api;

/**
 * Raised at the call site of an ask when the recipient failed while handling it.
 */
public class AgentProcessingException extends ScriptError {

    public AgentProcessingException(String agentId, Throwable cause) {
        super(ErrorCode.AGENT_PROCESSING_ERROR, "Agent " + agentId + " failed to process message: " + cause.getMessage(), cause);
    }
}
