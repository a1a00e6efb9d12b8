package org.agenticscript.cli.debug;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.agenticscript.runtime.RuntimeContext;
import org.agenticscript.runtime.agent.Agent;
import org.agenticscript.runtime.bus.BusStatistics;
import org.agenticscript.runtime.bus.FlowStats;
import org.agenticscript.runtime.bus.Message;
import org.agenticscript.runtime.model.ToolBinding;
import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.tools.ToolStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only text reports over a {@link RuntimeContext}. Nothing here changes agent, bus or
 * registry state.
 */
public class DebugInspector {

    static final int DEFAULT_MESSAGE_LIMIT = 20;

    private final RuntimeContext context;

    public DebugInspector(RuntimeContext context) {
        this.context = context;
    }

    /**
     * One line per agent in creation order.
     */
    public List<String> agents() {
        List<Agent> all = context.getAgents().all();
        if (all.isEmpty()) {
            return List.of("No agents.");
        }
        List<String> lines = new ArrayList<>();
        for (Agent agent : all) {
            lines.add(String.format("%-12s %-16s %-16s %-8s processed=%d pending=%d tools=%s",
                    agent.getName(), agent.getId(), agent.getKind().name(), agent.getStatus().label(),
                    agent.getProcessedCount(), context.getBus().pendingCount(agent.getId()),
                    agent.getTools().toolNames()));
        }
        return lines;
    }

    /**
     * Full state of one agent, looked up by id or script name.
     */
    public List<String> dump(String idOrName) {
        Optional<Agent> found = context.getAgents().find(idOrName);
        if (found.isEmpty()) {
            return List.of("Unknown agent: " + idOrName);
        }
        Agent agent = found.get();
        List<String> lines = new ArrayList<>();
        lines.add("Agent " + agent.getName() + " (" + agent.getId() + ")");
        lines.add("  kind:      " + agent.getKind().name());
        lines.add("  model:     " + agent.getModel());
        lines.add("  status:    " + agent.getStatus().label());
        lines.add("  created:   " + agent.getCreatedAt());
        lines.add("  processed: " + agent.getProcessedCount());
        lines.add("  pending:   " + context.getBus().pendingCount(agent.getId()));
        lines.add("  properties:");
        for (Map.Entry<String, Value> entry : agent.propertyEntries()) {
            lines.add("    " + entry.getKey() + " = " + entry.getValue().repr());
        }
        lines.add("  tools:");
        for (ToolBinding binding : agent.getTools().bindings()) {
            lines.add(binding.targetAgentIds().isEmpty()
                    ? "    " + binding.toolName()
                    : "    " + binding.toolName() + " -> " + binding.targetAgentIds());
        }
        List<Message> received = agent.getReceivedMessages();
        lines.add("  received (" + received.size() + "):");
        received.forEach(m -> lines.add("    " + m));
        return lines;
    }

    /**
     * The most recent bus messages, oldest first.
     */
    public List<String> messages(int limit) {
        List<Message> recent = context.getBus().recentMessages(limit);
        if (recent.isEmpty()) {
            return List.of("No messages.");
        }
        return recent.stream().map(Message::toString).toList();
    }

    /**
     * Bus totals followed by the per sender/recipient counters.
     */
    public List<String> flows() {
        BusStatistics stats = context.getBus().statistics();
        List<String> lines = new ArrayList<>();
        lines.add(String.format("sent=%d delivered=%d failed=%d timed_out=%d discarded=%d pending=%d avg_latency=%.2fms",
                stats.totalSent(), stats.totalDelivered(), stats.totalFailed(), stats.totalTimedOut(),
                stats.discardedReplies(), stats.pending(), stats.averageDeliveryMillis()));
        for (FlowStats flow : stats.flows()) {
            lines.add(String.format("  %s -> %s: sent=%d delivered=%d",
                    flow.senderId(), flow.recipientId(), flow.sent(), flow.delivered()));
        }
        return lines;
    }

    /**
     * Overview of the whole session: agents by status, bus totals, tools and modules.
     */
    public List<String> system() {
        List<Agent> all = context.getAgents().all();
        Map<String, Long> byStatus = all.stream()
                .collect(Collectors.groupingBy(a -> a.getStatus().label(), TreeMap::new, Collectors.counting()));
        BusStatistics stats = context.getBus().statistics();
        List<ToolStatistics> tools = context.getRegistry().statistics();
        long enabled = tools.stream().filter(ToolStatistics::enabled).count();
        List<String> lines = new ArrayList<>();
        lines.add("agents:   " + all.size() + (byStatus.isEmpty() ? "" : " " + byStatus));
        lines.add(String.format("messages: sent=%d delivered=%d failed=%d timed_out=%d pending=%d subscriptions=%d",
                stats.totalSent(), stats.totalDelivered(), stats.totalFailed(), stats.totalTimedOut(),
                stats.pending(), stats.activeSubscriptions()));
        lines.add("tools:    " + tools.size() + " registered, " + enabled + " enabled");
        lines.add("plugins:  " + context.getRegistry().listPlugins());
        lines.add("modules:  " + context.getModules().importedModules());
        return lines;
    }

    public List<String> tools() {
        List<String> lines = new ArrayList<>();
        for (ToolStatistics tool : context.getRegistry().statistics()) {
            lines.add(String.format("%-14s calls=%d failures=%d tags=%s%s  %s",
                    tool.name(), tool.callCount(), tool.failureCount(), tool.tags(),
                    tool.enabled() ? "" : " disabled", tool.description()));
        }
        return lines.isEmpty() ? List.of("No tools registered.") : lines;
    }

    public List<String> help() {
        return List.of(
                "debug agents          list all agents",
                "debug dump <agent>    show one agent in detail",
                "debug system          show a session overview",
                "debug messages [n]    show the last n bus messages",
                "debug flows           show bus counters and message flows",
                "debug tools           show registered tools and usage",
                "debug history [n]     show the last n input lines",
                "debug clear           clear the message history and bus counters",
                "debug help            show this help",
                "exit | quit           leave the REPL");
    }

    /**
     * Builds the statistics document printed by {@code run --stats}.
     *
     * @param mapper The mapper that creates the JSON nodes.
     * @return A JSON object with {@code agents}, {@code bus} and {@code tools} sections.
     */
    public ObjectNode statistics(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();

        ArrayNode agentsNode = root.putArray("agents");
        for (Agent agent : context.getAgents().all()) {
            ObjectNode node = agentsNode.addObject();
            node.put("id", agent.getId());
            node.put("name", agent.getName());
            node.put("kind", agent.getKind().name());
            node.put("model", agent.getModel());
            node.put("status", agent.getStatus().label());
            node.put("processed", agent.getProcessedCount());
            ArrayNode toolsNode = node.putArray("tools");
            agent.getTools().toolNames().forEach(toolsNode::add);
        }

        BusStatistics stats = context.getBus().statistics();
        ObjectNode busNode = root.putObject("bus");
        busNode.put("totalSent", stats.totalSent());
        busNode.put("totalDelivered", stats.totalDelivered());
        busNode.put("totalFailed", stats.totalFailed());
        busNode.put("totalTimedOut", stats.totalTimedOut());
        busNode.put("discardedReplies", stats.discardedReplies());
        busNode.put("pending", stats.pending());
        busNode.put("averageDeliveryMillis", stats.averageDeliveryMillis());
        busNode.put("activeSubscriptions", stats.activeSubscriptions());
        ArrayNode flowsNode = busNode.putArray("flows");
        for (FlowStats flow : stats.flows()) {
            ObjectNode node = flowsNode.addObject();
            node.put("sender", flow.senderId());
            node.put("recipient", flow.recipientId());
            node.put("sent", flow.sent());
            node.put("delivered", flow.delivered());
        }

        ArrayNode toolsNode = root.putArray("tools");
        for (ToolStatistics tool : context.getRegistry().statistics()) {
            ObjectNode node = toolsNode.addObject();
            node.put("name", tool.name());
            node.put("enabled", tool.enabled());
            node.put("callCount", tool.callCount());
            node.put("failureCount", tool.failureCount());
            node.put("lastUsed", tool.lastUsed() == null ? null : tool.lastUsed().toString());
        }
        return root;
    }
}
