package org.agenticscript.runtime.stdlib;

import org.agenticscript.runtime.api.UnknownAgentException;
import org.agenticscript.runtime.bus.Message;
import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.tools.Tool;
import org.agenticscript.runtime.tools.ToolContext;
import org.agenticscript.runtime.tools.ToolExecutionException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Forwards a payload, as the calling agent, to the agents bound to its AgentRouting assignment.
 * <p>
 * {@code execute_tool("AgentRouting", payload)} tells every bound target;
 * {@code execute_tool("AgentRouting", payload, "x")} tells only the bound target whose id is
 * {@code x} or starts with {@code x_}.
 */
public class AgentRoutingTool implements Tool {

    @Override
    public Value execute(ToolContext context, List<Value> args) {
        if (args.isEmpty() || args.size() > 2) {
            throw new ToolExecutionException("AgentRouting expects 1 or 2 arguments (payload[, agent]) but got " + args.size());
        }
        if (context.boundAgentIds().isEmpty()) {
            throw new ToolExecutionException("AgentRouting has no target agents bound for " + context.callerAgentId());
        }

        List<String> targets = context.boundAgentIds();
        if (args.size() == 2) {
            String wanted = args.get(1).display();
            targets = targets.stream()
                    .filter(id -> id.equals(wanted) || id.startsWith(wanted + "_"))
                    .limit(1)
                    .toList();
            if (targets.isEmpty()) {
                throw new ToolExecutionException("Agent '" + wanted + "' is not a routing target of "
                        + context.callerAgentId() + " (targets: " + context.boundAgentIds() + ")");
            }
        }

        Value payload = args.get(0);
        try {
            List<Message> sent = targets.stream()
                    .map(target -> context.bus().tell(context.callerAgentId(), target, payload))
                    .toList();
            return Value.of("Message routed to " + sent.stream()
                    .map(m -> m.getRecipientId() + " (" + m.getId() + ")")
                    .collect(Collectors.joining(", ")));
        } catch (UnknownAgentException e) {
            throw new ToolExecutionException("Routing failed: " + e.getMessage(), e);
        }
    }
}
