package org.agenticscript.runtime.agent;

import org.agenticscript.runtime.bus.Message;
import org.agenticscript.runtime.model.AgentStatus;
import org.agenticscript.runtime.model.Value;

/**
 * Decides how an agent reacts to the messages its worker takes from the mailbox.
 * Called only from that agent's worker thread.
 */
public interface AgentBehavior {

    /**
     * Produces the reply to an ask.
     *
     * @param agent The receiving agent.
     * @param ask The ask message.
     * @param statusBefore The agent's status before it started processing the message.
     * @return The reply payload.
     */
    Value onAsk(Agent agent, Message ask, AgentStatus statusBefore);

    /**
     * Handles a tell. The default records it in the agent's received log.
     */
    default void onTell(Agent agent, Message tell) {
        agent.recordReceived(tell);
    }
}
