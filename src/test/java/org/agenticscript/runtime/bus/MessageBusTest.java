package org.agenticscript.runtime.bus;

import org.agenticscript.junit.extensions.logging.AllowLog;
import org.agenticscript.junit.extensions.logging.LogLevel;
import org.agenticscript.junit.extensions.logging.LogWatchExtension;
import org.agenticscript.runtime.api.AgentProcessingException;
import org.agenticscript.runtime.api.AskTimeoutException;
import org.agenticscript.runtime.api.ErrorCode;
import org.agenticscript.runtime.api.UnknownAgentException;
import org.agenticscript.runtime.model.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for the {@link MessageBus}. The recipient side is driven by hand through its mailbox,
 * which makes delivery timing deterministic.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class MessageBusTest {

    private MessageBus bus;
    private Mailbox inbox;

    @BeforeEach
    void setUp() {
        bus = new MessageBus(100);
        inbox = new Mailbox();
        bus.register("b_001", inbox);
    }

    @Test
    void tellCountsExactlyOneSentMessage() {
        // Act
        Message message = bus.tell("a_001", "b_001", Value.of("hi"));

        // Assert
        BusStatistics stats = bus.statistics();
        assertThat(stats.totalSent()).isEqualTo(1);
        assertThat(stats.pending()).isEqualTo(1);
        assertThat(stats.flows()).containsExactly(new FlowStats("a_001", "b_001", 1, 0));
        assertThat(message.getKind()).isEqualTo(MessageKind.TELL);
        assertThat(message.getState()).isEqualTo(DeliveryState.PENDING);
        assertThat(message.getId()).isEqualTo("msg_000001");
    }

    @Test
    void acknowledgeMarksDelivery() throws InterruptedException {
        // Arrange
        bus.tell("a_001", "b_001", Value.of("hi"));
        Message taken = inbox.take();

        // Act
        boolean first = bus.acknowledge(taken);
        boolean second = bus.acknowledge(taken);

        // Assert
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(taken.getState()).isEqualTo(DeliveryState.DELIVERED);
        assertThat(taken.getDeliveredAt()).isNotNull();
        assertThat(bus.statistics().totalDelivered()).isEqualTo(1);
        assertThat(bus.statistics().flows()).containsExactly(new FlowStats("a_001", "b_001", 1, 1));
    }

    @Test
    void tellToUnknownRecipientFailsLoudly() {
        // Act & Assert
        assertThatThrownBy(() -> bus.tell("a_001", "ghost", Value.of("hi")))
                .isInstanceOf(UnknownAgentException.class)
                .hasMessage("Unknown agent: ghost");

        BusStatistics stats = bus.statistics();
        assertThat(stats.totalFailed()).isEqualTo(1);
        assertThat(stats.totalSent()).isZero();
        assertThat(bus.recentMessages(10)).singleElement()
                .extracting(Message::getState).isEqualTo(DeliveryState.FAILED);
    }

    @Test
    void askWithZeroTimeoutFailsWithoutEnqueueing() {
        // Act & Assert
        assertThatThrownBy(() -> bus.ask("a_001", "b_001", Value.of("q"), Duration.ZERO))
                .isInstanceOf(AskTimeoutException.class)
                .satisfies(e -> assertThat(((AskTimeoutException) e).getCode()).isEqualTo(ErrorCode.TIMEOUT));

        assertThat(inbox.isEmpty()).isTrue();
        assertThat(bus.statistics().totalTimedOut()).isEqualTo(1);
        assertThat(bus.statistics().totalSent()).isZero();
    }

    @Test
    void askWithZeroTimeoutToUnknownRecipientReportsUnknownAgent() {
        // Act & Assert
        assertThatThrownBy(() -> bus.ask("a_001", "ghost", Value.of("q"), Duration.ZERO))
                .isInstanceOf(UnknownAgentException.class);
    }

    @Test
    void askReturnsTheCorrelatedReply() throws Exception {
        // Arrange
        CompletableFuture<Value> answer = CompletableFuture.supplyAsync(
                () -> bus.ask("a_001", "b_001", Value.of("question"), Duration.ofSeconds(5)));
        Message ask = inbox.take();

        // Act
        assertThat(bus.acknowledge(ask)).isTrue();
        boolean matched = bus.reply(ask, Value.of("answer"));

        // Assert
        assertThat(matched).isTrue();
        assertThat(answer.get()).isEqualTo(Value.of("answer"));
        assertThat(ask.getKind()).isEqualTo(MessageKind.ASK);
        assertThat(ask.getCorrelationId()).isNotBlank();
        assertThat(bus.reply(ask, Value.of("again"))).isFalse();
        assertThat(bus.statistics().discardedReplies()).isEqualTo(1);
    }

    @Test
    void lateReplyIsDiscardedAfterTimeout() throws InterruptedException {
        // Arrange
        assertThatThrownBy(() -> bus.ask("a_001", "b_001", Value.of("slow"), Duration.ofMillis(50)))
                .isInstanceOf(AskTimeoutException.class);
        Message ask = inbox.take();

        // Act
        boolean acknowledged = bus.acknowledge(ask);
        boolean matched = bus.reply(ask, Value.of("too late"));

        // Assert
        assertThat(ask.getState()).isEqualTo(DeliveryState.TIMED_OUT);
        assertThat(acknowledged).isFalse();
        assertThat(matched).isFalse();
        BusStatistics stats = bus.statistics();
        assertThat(stats.totalTimedOut()).isEqualTo(1);
        assertThat(stats.discardedReplies()).isEqualTo(1);
    }

    @Test
    void failedAskRaisesTheErrorAtTheCaller() throws InterruptedException {
        // Arrange
        CompletableFuture<Value> answer = CompletableFuture.supplyAsync(
                () -> bus.ask("a_001", "b_001", Value.of("question"), Duration.ofSeconds(5)));
        Message ask = inbox.take();
        bus.acknowledge(ask);

        // Act
        bus.fail(ask, new AgentProcessingException("b_001", new IllegalStateException("boom")));

        // Assert
        assertThat(answer).failsWithin(Duration.ofSeconds(5))
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(AgentProcessingException.class)
                .withMessageContaining("boom");
    }

    @Test
    void unregisterFailsWaitingAsks() {
        // Arrange
        CompletableFuture<Value> answer = CompletableFuture.supplyAsync(
                () -> bus.ask("a_001", "b_001", Value.of("question"), Duration.ofSeconds(5)));
        await().atMost(Duration.ofSeconds(5)).until(() -> bus.pendingCount("b_001") == 1);

        // Act
        boolean removed = bus.unregister("b_001");

        // Assert
        assertThat(removed).isTrue();
        assertThat(bus.isRegistered("b_001")).isFalse();
        assertThat(bus.pendingCount("b_001")).isEqualTo(-1);
        assertThat(answer).failsWithin(Duration.ofSeconds(5))
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(UnknownAgentException.class);
        assertThat(bus.statistics().totalFailed()).isEqualTo(1);
    }

    @Test
    void historyKeepsOnlyTheMostRecentMessages() {
        // Arrange
        MessageBus small = new MessageBus(3);
        small.register("b_001", new Mailbox());

        // Act
        for (int i = 0; i < 5; i++) {
            small.tell("a_001", "b_001", Value.of(i));
        }

        // Assert
        assertThat(small.recentMessages(10)).extracting(Message::getId)
                .containsExactly("msg_000003", "msg_000004", "msg_000005");
        assertThat(small.recentMessages(2)).extracting(Message::getId)
                .containsExactly("msg_000004", "msg_000005");
        assertThat(small.statistics().totalSent()).isEqualTo(5);
    }

    @Test
    void broadcastSkipsSenderAndExcludedAgents() {
        // Arrange
        Mailbox a = new Mailbox();
        Mailbox c = new Mailbox();
        bus.register("a_001", a);
        bus.register("c_001", c);

        // Act
        List<Message> sent = bus.broadcast("a_001", Value.of("news"), Set.of("c_001"));

        // Assert
        assertThat(sent).extracting(Message::getRecipientId).containsExactly("b_001");
        assertThat(a.isEmpty()).isTrue();
        assertThat(c.isEmpty()).isTrue();
        assertThat(inbox.size()).isEqualTo(1);
        assertThat(bus.registeredAgents()).containsExactly("a_001", "b_001", "c_001");
    }

    @Test
    void messagesForFiltersBySenderOrRecipient() {
        // Arrange
        bus.register("c_001", new Mailbox());
        bus.tell("a_001", "b_001", Value.of(1));
        bus.tell("a_001", "c_001", Value.of(2));
        bus.tell("c_001", "b_001", Value.of(3));

        // Act
        List<Message> forC = bus.messagesFor("c_001", 10);

        // Assert
        assertThat(forC).extracting(Message::getPayload).containsExactly(Value.of(2), Value.of(3));
    }

    @Test
    void registeringTwiceIsRejected() {
        // Act & Assert
        assertThatThrownBy(() -> bus.register("b_001", new Mailbox()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void replyRacingTheTimeoutIsCountedAsDiscarded() throws InterruptedException {
        // Arrange
        CompletableFuture<Value> answer = CompletableFuture.supplyAsync(
                () -> bus.ask("a_001", "b_001", Value.of("question"), Duration.ofSeconds(30)));
        Message ask = inbox.take();
        bus.acknowledge(ask);
        bus.reply(ask, Value.of("answer"));

        // Act
        AskTimeoutException timeout = bus.expire(ask, Duration.ofSeconds(30));

        // Assert
        assertThat(timeout.getCode()).isEqualTo(ErrorCode.TIMEOUT);
        BusStatistics stats = bus.statistics();
        assertThat(stats.discardedReplies()).isEqualTo(1);
        assertThat(stats.totalTimedOut()).isEqualTo(1);
        assertThat(answer).succeedsWithin(Duration.ofSeconds(5)).isEqualTo(Value.of("answer"));
    }

    @Test
    void subscribersSeeMessagesForTheirAgent() {
        // Arrange
        bus.register("c_001", new Mailbox());
        List<Message> seen = new CopyOnWriteArrayList<>();
        Consumer<Message> listener = seen::add;

        // Act
        boolean subscribed = bus.subscribe("b_001", listener);
        bus.tell("a_001", "b_001", Value.of(1));
        bus.tell("a_001", "c_001", Value.of(2));
        boolean unsubscribed = bus.unsubscribe("b_001", listener);
        bus.tell("a_001", "b_001", Value.of(3));

        // Assert
        assertThat(subscribed).isTrue();
        assertThat(unsubscribed).isTrue();
        assertThat(seen).extracting(Message::getPayload).containsExactly(Value.of(1));
        assertThat(bus.unsubscribe("b_001", listener)).isFalse();
        assertThat(bus.statistics().activeSubscriptions()).isZero();
    }

    @Test
    void subscribingToUnknownAgentIsRefused() {
        // Act & Assert
        assertThat(bus.subscribe("ghost", message -> { })).isFalse();
        assertThat(bus.unsubscribe("ghost", message -> { })).isFalse();
    }

    @Test
    void subscriptionsEndWhenTheAgentLeaves() {
        // Arrange
        bus.subscribe("b_001", message -> { });
        assertThat(bus.statistics().activeSubscriptions()).isEqualTo(1);

        // Act
        bus.unregister("b_001");

        // Assert
        assertThat(bus.subscriptionCount()).isZero();
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*MessageBus", messagePattern = "Subscriber of b_001 failed on msg_000001: .*")
    void failingSubscriberDoesNotStopDelivery() {
        // Arrange
        List<Message> seen = new CopyOnWriteArrayList<>();
        bus.subscribe("b_001", message -> {
            throw new IllegalStateException("listener broke");
        });
        bus.subscribe("b_001", seen::add);

        // Act
        Message message = bus.tell("a_001", "b_001", Value.of("hi"));

        // Assert
        assertThat(inbox.size()).isEqualTo(1);
        assertThat(seen).containsExactly(message);
        assertThat(bus.statistics().totalSent()).isEqualTo(1);
    }

    @Test
    void clearHistoryResetsHistoryAndCounters() {
        // Arrange
        bus.tell("a_001", "b_001", Value.of(1));
        bus.tell("a_001", "b_001", Value.of(2));
        assertThatThrownBy(() -> bus.tell("a_001", "ghost", Value.of(3)))
                .isInstanceOf(UnknownAgentException.class);

        // Act
        bus.clearHistory();

        // Assert
        assertThat(bus.recentMessages(10)).isEmpty();
        BusStatistics stats = bus.statistics();
        assertThat(stats.totalSent()).isZero();
        assertThat(stats.totalFailed()).isZero();
        assertThat(stats.flows()).isEmpty();
        assertThat(stats.pending()).isEqualTo(2);
        assertThat(bus.tell("a_001", "b_001", Value.of(4)).getId()).isEqualTo("msg_000004");
    }
}
