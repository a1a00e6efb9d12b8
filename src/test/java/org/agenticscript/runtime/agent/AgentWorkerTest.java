package org.agenticscript.runtime.agent;

import org.agenticscript.junit.extensions.logging.ExpectLog;
import org.agenticscript.junit.extensions.logging.LogLevel;
import org.agenticscript.junit.extensions.logging.LogWatchExtension;
import org.agenticscript.runtime.api.AgentProcessingException;
import org.agenticscript.runtime.bus.Message;
import org.agenticscript.runtime.bus.MessageBus;
import org.agenticscript.runtime.model.AgentStatus;
import org.agenticscript.runtime.model.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests the message loop of {@link AgentWorker} against a real bus.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AgentWorkerTest {

    private final MessageBus bus = new MessageBus(100);
    private final List<AgentWorker> workers = new ArrayList<>();

    @AfterEach
    void tearDown() {
        workers.forEach(AgentWorker::stop);
    }

    private Agent start(String name, AgentBehavior behavior, Duration delay) {
        Agent agent = new Agent(name + "_001", name, AgentKind.BASIC, "test-model", 10);
        bus.register(agent.getId(), agent.getMailbox());
        AgentWorker worker = new AgentWorker(agent, bus, behavior, delay);
        workers.add(worker);
        worker.start();
        return agent;
    }

    @Test
    void tellMakesAgentBusyThenIdle() {
        // Arrange
        Agent agent = start("worker", new ScriptedAgentBehavior(), Duration.ofMillis(300));
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.IDLE);

        // Act
        Message tell = bus.tell(MessageBus.SYSTEM_SENDER, agent.getId(), Value.of("do it"));

        // Assert
        await().atMost(Duration.ofSeconds(5)).until(() -> agent.getStatus() == AgentStatus.BUSY);
        await().atMost(Duration.ofSeconds(5)).until(() -> agent.getStatus() == AgentStatus.IDLE);
        await().atMost(Duration.ofSeconds(5)).until(() -> agent.getProcessedCount() == 1);
        assertThat(agent.getReceivedMessages()).containsExactly(tell);
    }

    @Test
    void askIsAnsweredAndAgentIsIdleAfterwards() {
        // Arrange
        Agent agent = start("helper", new ScriptedAgentBehavior(), Duration.ZERO);

        // Act
        Value reply = bus.ask(MessageBus.SYSTEM_SENDER, agent.getId(), Value.of("Hello there"), Duration.ofSeconds(5));

        // Assert
        assertThat(reply).isEqualTo(Value.of("Hello from helper!"));
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.IDLE);
    }

    @Test
    void concurrentAsksAreAnsweredOneAfterAnother() throws Exception {
        // Arrange
        Agent agent = start("serial", new ScriptedAgentBehavior(), Duration.ofMillis(50));

        // Act
        CompletableFuture<Value> first = CompletableFuture.supplyAsync(
                () -> bus.ask(MessageBus.SYSTEM_SENDER, agent.getId(), Value.of("one"), Duration.ofSeconds(5)));
        CompletableFuture<Value> second = CompletableFuture.supplyAsync(
                () -> bus.ask(MessageBus.SYSTEM_SENDER, agent.getId(), Value.of("two"), Duration.ofSeconds(5)));

        // Assert
        assertThat(first.get()).isEqualTo(Value.of("serial (test-model) received: one"));
        assertThat(second.get()).isEqualTo(Value.of("serial (test-model) received: two"));
        await().atMost(Duration.ofSeconds(5)).until(() -> agent.getProcessedCount() == 2);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*AgentWorker", messagePattern = "Agent broken_001 failed to process .*")
    void failingBehaviorSetsErrorAndFailsTheAsk() {
        // Arrange
        Agent agent = start("broken", (a, ask, before) -> {
            throw new IllegalStateException("model unavailable");
        }, Duration.ZERO);

        // Act & Assert
        assertThatThrownBy(() -> bus.ask(MessageBus.SYSTEM_SENDER, agent.getId(), Value.of("hi"), Duration.ofSeconds(5)))
                .isInstanceOf(AgentProcessingException.class)
                .hasMessageContaining("model unavailable");
        assertThat(agent.getStatus()).isEqualTo(AgentStatus.ERROR);

        // The worker survives the failure.
        bus.tell(MessageBus.SYSTEM_SENDER, agent.getId(), Value.of("still there?"));
        await().atMost(Duration.ofSeconds(5)).until(() -> agent.getStatus() == AgentStatus.IDLE);
        assertThat(agent.getReceivedMessages()).hasSize(1);
    }

    @Test
    void stopEndsTheWorkerThread() {
        // Arrange
        Agent agent = start("stoppable", new ScriptedAgentBehavior(), Duration.ZERO);
        AgentWorker worker = workers.get(0);
        assertThat(worker.getCurrentState()).isEqualTo(AgentWorker.State.RUNNING);

        // Act
        worker.stop();

        // Assert
        assertThat(worker.getCurrentState()).isEqualTo(AgentWorker.State.STOPPED);
        assertThat(worker.getAgent()).isSameAs(agent);
        assertThatThrownBy(worker::start).isInstanceOf(IllegalStateException.class);
    }
}
