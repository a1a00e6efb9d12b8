package org.agenticscript.runtime.agent;

import org.agenticscript.runtime.bus.Message;
import org.agenticscript.runtime.model.AgentStatus;
import org.agenticscript.runtime.model.Value;

import java.util.Locale;

/**
 * Deterministic stand-in for a language model. Replies are chosen by keywords in the message,
 * matched case-insensitively in the order hello, status, error, busy.
 */
public class ScriptedAgentBehavior implements AgentBehavior {

    @Override
    public Value onAsk(Agent agent, Message ask, AgentStatus statusBefore) {
        String message = ask.getPayload().display();
        String lower = message.toLowerCase(Locale.ROOT);
        String name = agent.getName();
        if (lower.contains("hello")) {
            return Value.of("Hello from " + name + "!");
        }
        if (lower.contains("status")) {
            return Value.of("Agent " + name + " status: " + statusBefore.label());
        }
        if (lower.contains("error")) {
            return Value.of("Error handling: " + message);
        }
        if (lower.contains("busy")) {
            return Value.of(name + " was busy but processed: " + message);
        }
        return Value.of(name + " (" + agent.getModel() + ") received: " + message);
    }
}
