package org.agenticscript.runtime.agent;

import org.agenticscript.runtime.bus.Mailbox;
import org.agenticscript.runtime.bus.Message;
import org.agenticscript.runtime.model.AgentStatus;
import org.agenticscript.runtime.model.ToolBinding;
import org.agenticscript.runtime.model.Value;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A live agent: identity, model descriptor, status, properties, assigned tools and mailbox.
 * <p>
 * The interpreter thread and the agent's worker thread both touch an agent, so all mutable
 * state is either atomic or guarded by the agent's monitor.
 */
public class Agent {

    /** Names that scripts can read but not assign. */
    public static final Set<String> READ_ONLY_PROPERTIES = Set.of("status", "model", "name", "id");

    private final String id;
    private final String name;
    private final AgentKind kind;
    private final String model;
    private final Instant createdAt = Instant.now();
    private final Mailbox mailbox = new Mailbox();
    private final AtomicReference<AgentStatus> status = new AtomicReference<>(AgentStatus.IDLE);
    private final AtomicLong processedCount = new AtomicLong();
    private final Map<String, Value> properties = new LinkedHashMap<>();
    private final Map<String, ToolBinding> tools = new LinkedHashMap<>();
    private final Deque<Message> received = new ArrayDeque<>();
    private final int receivedLimit;

    /**
     * @param id The unique agent id.
     * @param name The script-level name.
     * @param kind The agent kind; its default properties are copied in.
     * @param model The opaque model descriptor.
     * @param receivedLimit How many received tells are remembered.
     */
    public Agent(String id, String name, AgentKind kind, String model, int receivedLimit) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.model = model;
        this.receivedLimit = receivedLimit;
        this.properties.putAll(kind.defaultProperties());
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public AgentKind getKind() {
        return kind;
    }

    public String getModel() {
        return model;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Mailbox getMailbox() {
        return mailbox;
    }

    public AgentStatus getStatus() {
        return status.get();
    }

    public void setStatus(AgentStatus newStatus) {
        status.set(newStatus);
    }

    /**
     * Sets the status and returns the previous one.
     */
    public AgentStatus swapStatus(AgentStatus newStatus) {
        return status.getAndSet(newStatus);
    }

    /**
     * Sets the status to {@code newStatus} only if it is still {@code expected}, so that a
     * status written by the worker in the meantime is kept.
     * @return {@code true} if the status was changed.
     */
    public boolean restoreStatus(AgentStatus expected, AgentStatus newStatus) {
        return status.compareAndSet(expected, newStatus);
    }

    /**
     * @return The property value, or {@link Value#NULL} if it has never been set.
     */
    public synchronized Value getProperty(String property) {
        return properties.getOrDefault(property, Value.NULL);
    }

    public synchronized boolean hasProperty(String property) {
        return properties.containsKey(property);
    }

    public synchronized void setProperty(String property, Value value) {
        properties.put(property, value);
    }

    /**
     * @return The property names and values in insertion order.
     */
    public synchronized List<Map.Entry<String, Value>> propertyEntries() {
        return properties.entrySet().stream().map(e -> Map.entry(e.getKey(), e.getValue())).toList();
    }

    public synchronized Value.ToolSet getTools() {
        return new Value.ToolSet(List.copyOf(tools.values()));
    }

    /**
     * Replaces the assigned tools.
     */
    public synchronized void setTools(Value.ToolSet toolSet) {
        tools.clear();
        toolSet.bindings().forEach(b -> tools.put(b.toolName(), b));
    }

    public synchronized boolean hasTool(String toolName) {
        return tools.containsKey(toolName);
    }

    public synchronized Optional<ToolBinding> toolBinding(String toolName) {
        return Optional.ofNullable(tools.get(toolName));
    }

    /**
     * Remembers a received tell, dropping the oldest beyond the configured limit.
     */
    public synchronized void recordReceived(Message message) {
        received.addLast(message);
        while (received.size() > receivedLimit) {
            received.removeFirst();
        }
    }

    public synchronized List<Message> getReceivedMessages() {
        return List.copyOf(received);
    }

    public long getProcessedCount() {
        return processedCount.get();
    }

    void incrementProcessed() {
        processedCount.incrementAndGet();
    }

    @Override
    public String toString() {
        return kind.name() + "(" + id + ", " + model + ", " + getStatus().label() + ")";
    }
}
