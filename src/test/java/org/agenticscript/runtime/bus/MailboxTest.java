package org.agenticscript.runtime.bus;

import org.agenticscript.runtime.model.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the two-lane ordering of the {@link Mailbox}. Messages are produced by a real bus
 * without a worker, so nothing consumes them behind the test's back.
 */
@Tag("unit")
class MailboxTest {

    private final MessageBus bus = new MessageBus(100);
    private final Mailbox mailbox = new Mailbox();

    @BeforeEach
    void setUp() {
        bus.register("b_001", mailbox);
    }

    @Test
    void tellsFromOneSenderKeepTheirOrder() throws InterruptedException {
        // Arrange
        bus.tell("a_001", "b_001", Value.of("first"));
        bus.tell("a_001", "b_001", Value.of("second"));
        bus.tell("a_001", "b_001", Value.of("third"));

        // Act & Assert
        assertThat(mailbox.size()).isEqualTo(3);
        assertThat(mailbox.take().getPayload()).isEqualTo(Value.of("first"));
        assertThat(mailbox.take().getPayload()).isEqualTo(Value.of("second"));
        assertThat(mailbox.take().getPayload()).isEqualTo(Value.of("third"));
        assertThat(mailbox.isEmpty()).isTrue();
    }

    @Test
    void asksAreServedBeforeQueuedTells() throws InterruptedException {
        // Arrange
        Message tell = bus.tell("a_001", "b_001", Value.of("background"));
        Message ask = new Message("msg_x", "a_001", "b_001", Value.of("urgent"), MessageKind.ASK,
                Duration.ofSeconds(1), "corr-1", Instant.now());
        mailbox.put(ask);

        // Act & Assert
        assertThat(mailbox.take()).isSameAs(ask);
        assertThat(mailbox.take()).isSameAs(tell);
    }

    @Test
    void pollReturnsNullWhenNothingArrives() throws InterruptedException {
        // Act
        Message message = mailbox.poll(20, TimeUnit.MILLISECONDS);

        // Assert
        assertThat(message).isNull();
    }
}
