package org.agenticscript.runtime.bus;

import org.agenticscript.runtime.api.AgentProcessingException;
import org.agenticscript.runtime.api.AskTimeoutException;
import org.agenticscript.runtime.api.ErrorCode;
import org.agenticscript.runtime.api.ScriptError;
import org.agenticscript.runtime.api.UnknownAgentException;
import org.agenticscript.runtime.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Routes asks and tells between agents.
 * <p>
 * Guarantees:
 * <ul>
 *   <li>Messages of one kind reach a recipient in the order they were sent.</li>
 *   <li>A message to an unknown recipient is recorded as {@link DeliveryState#FAILED} and the
 *       sender gets an {@link UnknownAgentException}; nothing is dropped silently.</li>
 *   <li>Each ask is answered by at most one reply, matched by its correlation id. Late and
 *       duplicate replies are discarded and counted.</li>
 * </ul>
 * The history of recent messages is bounded; the counters are not affected by eviction.
 * Subscribers of an agent are called on the sender's thread for every message enqueued for it.
 */
public class MessageBus {

    /** Sender id used for messages issued by the script itself rather than by an agent. */
    public static final String SYSTEM_SENDER = "system";

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final Map<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Map<String, PendingAsk> pendingAsks = new ConcurrentHashMap<>();
    private final Map<FlowKey, FlowCounter> flows = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<Message>>> subscribers = new ConcurrentHashMap<>();
    private final Deque<Message> history = new ArrayDeque<>();
    private final int historyLimit;

    private final AtomicLong messageCounter = new AtomicLong();
    private final AtomicLong totalSent = new AtomicLong();
    private final AtomicLong totalDelivered = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong totalTimedOut = new AtomicLong();
    private final AtomicLong discardedReplies = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();

    /**
     * @param historyLimit The number of most recent messages kept for inspection.
     */
    public MessageBus(int historyLimit) {
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("History limit must be positive but was " + historyLimit);
        }
        this.historyLimit = historyLimit;
    }

    /**
     * Registers the mailbox of an agent.
     * @throws IllegalStateException if the agent is already registered.
     */
    public void register(String agentId, Mailbox mailbox) {
        if (mailboxes.putIfAbsent(agentId, mailbox) != null) {
            throw new IllegalStateException("Agent already registered with the bus: " + agentId);
        }
        subscribers.put(agentId, new CopyOnWriteArrayList<>());
        log.debug("Registered mailbox for {}", agentId);
    }

    /**
     * Removes an agent from the bus. Messages still queued for it are marked failed, and
     * asks waiting on it fail with {@link UnknownAgentException}.
     * @return {@code true} if the agent was registered.
     */
    public boolean unregister(String agentId) {
        Mailbox mailbox = mailboxes.remove(agentId);
        if (mailbox == null) {
            return false;
        }
        subscribers.remove(agentId);
        Message leftover;
        try {
            while ((leftover = mailbox.poll(0, TimeUnit.MILLISECONDS)) != null) {
                if (leftover.transition(DeliveryState.FAILED)) {
                    totalFailed.incrementAndGet();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pendingAsks.values().removeIf(pending -> {
            if (pending.message().getRecipientId().equals(agentId)) {
                pending.reply().completeExceptionally(new UnknownAgentException(agentId));
                return true;
            }
            return false;
        });
        log.debug("Unregistered mailbox for {}", agentId);
        return true;
    }

    /**
     * Sends a fire-and-forget message. Never blocks.
     * @return The enqueued message.
     * @throws UnknownAgentException if the recipient is not registered.
     */
    public Message tell(String senderId, String recipientId, Value payload) {
        Message message = newMessage(senderId, recipientId, payload, MessageKind.TELL, null, null);
        enqueue(message);
        return message;
    }

    /**
     * Sends a request and blocks until the correlated reply arrives.
     *
     * @param timeout The maximum time to wait; a non-positive timeout fails without sending.
     * @return The reply payload.
     * @throws UnknownAgentException if the recipient is not registered.
     * @throws AskTimeoutException if no reply arrives in time.
     * @throws AgentProcessingException if the recipient failed while handling the ask.
     */
    public Value ask(String senderId, String recipientId, Value payload, Duration timeout) {
        Message message = newMessage(senderId, recipientId, payload, MessageKind.ASK, timeout, UUID.randomUUID().toString());
        if (timeout.isZero() || timeout.isNegative()) {
            if (!mailboxes.containsKey(recipientId)) {
                markFailed(message);
                throw new UnknownAgentException(recipientId);
            }
            message.transition(DeliveryState.TIMED_OUT);
            totalTimedOut.incrementAndGet();
            remember(message);
            throw new AskTimeoutException(recipientId, timeout);
        }

        CompletableFuture<Value> reply = new CompletableFuture<>();
        pendingAsks.put(message.getCorrelationId(), new PendingAsk(message, reply));
        try {
            enqueue(message);
        } catch (UnknownAgentException e) {
            pendingAsks.remove(message.getCorrelationId());
            throw e;
        }

        try {
            return reply.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw expire(message, timeout);
        } catch (InterruptedException e) {
            pendingAsks.remove(message.getCorrelationId());
            message.transition(DeliveryState.FAILED);
            Thread.currentThread().interrupt();
            throw new ScriptError(ErrorCode.TIMEOUT, "Interrupted while waiting for reply from " + recipientId, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ScriptError scriptError) {
                throw scriptError;
            }
            throw new AgentProcessingException(recipientId, e.getCause());
        }
    }

    /**
     * Gives up on an ask whose wait has ended. A reply that took the ask after the wait ended
     * never reaches the caller and is counted as discarded.
     */
    AskTimeoutException expire(Message ask, Duration timeout) {
        if (pendingAsks.remove(ask.getCorrelationId()) == null) {
            discardedReplies.incrementAndGet();
        }
        ask.transition(DeliveryState.TIMED_OUT);
        totalTimedOut.incrementAndGet();
        log.debug("Ask {} to {} timed out after {}", ask.getId(), ask.getRecipientId(), timeout);
        return new AskTimeoutException(ask.getRecipientId(), timeout);
    }

    /**
     * Completes the ask with the given reply payload.
     * @return {@code true} if the reply was matched, {@code false} if it was discarded because the
     *         ask had already been answered or had timed out.
     */
    public boolean reply(Message ask, Value payload) {
        PendingAsk pending = pendingAsks.remove(ask.getCorrelationId());
        if (pending == null) {
            discardedReplies.incrementAndGet();
            log.debug("Discarded reply to {} from {}", ask.getId(), ask.getRecipientId());
            return false;
        }
        return pending.reply().complete(payload);
    }

    /**
     * Fails the ask so that its sender receives the given error instead of a reply.
     * @return {@code true} if the ask was still waiting.
     */
    public boolean fail(Message ask, ScriptError error) {
        PendingAsk pending = pendingAsks.remove(ask.getCorrelationId());
        if (pending == null) {
            discardedReplies.incrementAndGet();
            return false;
        }
        return pending.reply().completeExceptionally(error);
    }

    /**
     * Marks a message as delivered when its recipient takes it from the mailbox.
     * @return {@code false} if the message must be skipped because it is no longer pending,
     *         e.g. an ask whose sender already gave up.
     */
    public boolean acknowledge(Message message) {
        if (!message.transition(DeliveryState.DELIVERED)) {
            return false;
        }
        totalDelivered.incrementAndGet();
        totalLatencyNanos.addAndGet(Duration.between(message.getEnqueuedAt(), message.getDeliveredAt()).toNanos());
        flow(message).delivered.incrementAndGet();
        return true;
    }

    /**
     * Tells the payload to every registered agent except the sender and the excluded ids.
     * @return The enqueued messages.
     */
    public List<Message> broadcast(String senderId, Value payload, Set<String> exclude) {
        List<Message> sent = new ArrayList<>();
        for (String recipient : registeredAgents()) {
            if (recipient.equals(senderId) || exclude.contains(recipient)) {
                continue;
            }
            try {
                sent.add(tell(senderId, recipient, payload));
            } catch (UnknownAgentException e) {
                log.debug("Broadcast recipient {} left before delivery", recipient);
            }
        }
        return sent;
    }

    /**
     * Calls {@code listener} with every message enqueued for the agent from now on, until it is
     * unsubscribed or the agent leaves the bus. A failing listener is logged and does not affect
     * delivery.
     * @return {@code false} if the agent is not registered.
     */
    public boolean subscribe(String agentId, Consumer<Message> listener) {
        List<Consumer<Message>> listeners = subscribers.get(agentId);
        if (listeners == null) {
            return false;
        }
        listeners.add(listener);
        return true;
    }

    /**
     * @return {@code true} if the listener was subscribed to the agent.
     */
    public boolean unsubscribe(String agentId, Consumer<Message> listener) {
        List<Consumer<Message>> listeners = subscribers.get(agentId);
        return listeners != null && listeners.remove(listener);
    }

    public int subscriptionCount() {
        return subscribers.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Forgets the message history and resets the counters and flows. Queued messages and asks
     * still waiting for a reply are not affected.
     */
    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
        flows.clear();
        totalSent.set(0);
        totalDelivered.set(0);
        totalFailed.set(0);
        totalTimedOut.set(0);
        discardedReplies.set(0);
        totalLatencyNanos.set(0);
        log.debug("Cleared message history");
    }

    /**
     * @return The number of queued messages for the agent, or -1 if it is not registered.
     */
    public int pendingCount(String agentId) {
        Mailbox mailbox = mailboxes.get(agentId);
        return mailbox == null ? -1 : mailbox.size();
    }

    public SortedSet<String> registeredAgents() {
        return new TreeSet<>(mailboxes.keySet());
    }

    public boolean isRegistered(String agentId) {
        return mailboxes.containsKey(agentId);
    }

    /**
     * @return Up to {@code limit} most recent messages, oldest first.
     */
    public List<Message> recentMessages(int limit) {
        synchronized (history) {
            List<Message> all = new ArrayList<>(history);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    /**
     * @return Up to {@code limit} most recent messages sent or received by the agent, oldest first.
     */
    public List<Message> messagesFor(String agentId, int limit) {
        synchronized (history) {
            List<Message> matching = history.stream()
                    .filter(m -> m.getSenderId().equals(agentId) || m.getRecipientId().equals(agentId))
                    .toList();
            return List.copyOf(matching.subList(Math.max(0, matching.size() - limit), matching.size()));
        }
    }

    public BusStatistics statistics() {
        long delivered = totalDelivered.get();
        double averageMillis = delivered == 0 ? 0.0 : totalLatencyNanos.get() / (double) delivered / 1_000_000.0;
        int pending = mailboxes.values().stream().mapToInt(Mailbox::size).sum();
        List<FlowStats> flowStats = flows.entrySet().stream()
                .map(e -> new FlowStats(e.getKey().senderId(), e.getKey().recipientId(),
                        e.getValue().sent.get(), e.getValue().delivered.get()))
                .sorted(Comparator.comparing(FlowStats::senderId).thenComparing(FlowStats::recipientId))
                .toList();
        return new BusStatistics(totalSent.get(), delivered, totalFailed.get(), totalTimedOut.get(),
                discardedReplies.get(), pending, averageMillis, subscriptionCount(), flowStats);
    }

    private Message newMessage(String senderId, String recipientId, Value payload, MessageKind kind,
                               Duration timeout, String correlationId) {
        String id = String.format("msg_%06d", messageCounter.incrementAndGet());
        return new Message(id, senderId, recipientId, payload, kind, timeout, correlationId, Instant.now());
    }

    private void enqueue(Message message) {
        Mailbox mailbox = mailboxes.get(message.getRecipientId());
        if (mailbox == null) {
            markFailed(message);
            throw new UnknownAgentException(message.getRecipientId());
        }
        remember(message);
        totalSent.incrementAndGet();
        flow(message).sent.incrementAndGet();
        mailbox.put(message);
        log.debug("Sent {}", message);
        notifySubscribers(message);
    }

    private void notifySubscribers(Message message) {
        List<Consumer<Message>> listeners = subscribers.get(message.getRecipientId());
        if (listeners == null) {
            return;
        }
        for (Consumer<Message> listener : listeners) {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                log.warn("Subscriber of {} failed on {}: {}", message.getRecipientId(), message.getId(), e.getMessage());
                log.debug("Exception details:", e);
            }
        }
    }

    private void markFailed(Message message) {
        message.transition(DeliveryState.FAILED);
        totalFailed.incrementAndGet();
        remember(message);
        log.debug("Failed {}: unknown recipient", message.getId());
    }

    private void remember(Message message) {
        synchronized (history) {
            history.addLast(message);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
    }

    private FlowCounter flow(Message message) {
        return flows.computeIfAbsent(new FlowKey(message.getSenderId(), message.getRecipientId()), k -> new FlowCounter());
    }

    private record PendingAsk(Message message, CompletableFuture<Value> reply) {}

    private record FlowKey(String senderId, String recipientId) {}

    private static final class FlowCounter {
        final AtomicLong sent = new AtomicLong();
        final AtomicLong delivered = new AtomicLong();
    }
}
