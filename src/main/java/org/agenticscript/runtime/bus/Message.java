package org.agenticscript.runtime.bus;

import org.agenticscript.runtime.model.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A message routed by the {@link MessageBus}. All fields are fixed at creation except the
 * delivery state and timestamp, which only the bus changes.
 */
public final class Message {

    private final String id;
    private final String senderId;
    private final String recipientId;
    private final Value payload;
    private final MessageKind kind;
    private final Duration timeout;
    private final String correlationId;
    private final Instant enqueuedAt;
    private final AtomicReference<DeliveryState> state = new AtomicReference<>(DeliveryState.PENDING);
    private volatile Instant deliveredAt;

    Message(String id, String senderId, String recipientId, Value payload, MessageKind kind,
            Duration timeout, String correlationId, Instant enqueuedAt) {
        this.id = id;
        this.senderId = senderId;
        this.recipientId = recipientId;
        this.payload = payload;
        this.kind = kind;
        this.timeout = timeout;
        this.correlationId = correlationId;
        this.enqueuedAt = enqueuedAt;
    }

    public String getId() {
        return id;
    }

    public String getSenderId() {
        return senderId;
    }

    public String getRecipientId() {
        return recipientId;
    }

    public Value getPayload() {
        return payload;
    }

    public MessageKind getKind() {
        return kind;
    }

    /**
     * @return The ask timeout, or null for tells.
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * @return The token matching the reply to this ask, or null for tells.
     */
    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    /**
     * @return When the recipient took the message from its mailbox, or null if it has not yet.
     */
    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    public DeliveryState getState() {
        return state.get();
    }

    /**
     * Moves the message out of {@link DeliveryState#PENDING}. Only the first transition wins.
     * @return {@code true} if this call changed the state.
     */
    boolean transition(DeliveryState target) {
        boolean changed = state.compareAndSet(DeliveryState.PENDING, target);
        if (changed && target == DeliveryState.DELIVERED) {
            deliveredAt = Instant.now();
        }
        return changed;
    }

    @Override
    public String toString() {
        return String.format("%s %s %s->%s [%s] %s", id, kind, senderId, recipientId, getState(), payload.display());
    }
}
