package org.agenticscript.runtime.agent;

import org.agenticscript.runtime.api.AgentProcessingException;
import org.agenticscript.runtime.bus.Message;
import org.agenticscript.runtime.bus.MessageBus;
import org.agenticscript.runtime.bus.MessageKind;
import org.agenticscript.runtime.model.AgentStatus;
import org.agenticscript.runtime.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The thread that serves one agent's mailbox. Messages are processed strictly one at a time,
 * so concurrent asks to the same agent are answered one after another.
 * <p>
 * Error Handling: a failure while processing a message sets the agent to
 * {@link AgentStatus#ERROR}, fails the pending ask if there is one, and the worker continues
 * with the next message.
 */
public class AgentWorker {

    /**
     * Lifecycle of a worker.
     */
    public enum State {
        NEW,
        RUNNING,
        STOPPED
    }

    private static final Logger log = LoggerFactory.getLogger(AgentWorker.class);

    private final Agent agent;
    private final MessageBus bus;
    private final AgentBehavior behavior;
    private final Duration processingDelay;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.NEW);
    private Thread workerThread;

    public AgentWorker(Agent agent, MessageBus bus, AgentBehavior behavior, Duration processingDelay) {
        this.agent = agent;
        this.bus = bus;
        this.behavior = behavior;
        this.processingDelay = processingDelay;
    }

    /**
     * Starts the daemon thread {@code agent-<id>}.
     * @throws IllegalStateException if the worker was already started.
     */
    public void start() {
        if (!currentState.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start worker for '%s' as it is in state %s", agent.getId(), currentState.get()));
        }
        workerThread = new Thread(this::runWorker);
        workerThread.setName("agent-" + agent.getId());
        workerThread.setDaemon(true);
        workerThread.start();
        log.debug("Worker for {} started", agent.getId());
    }

    /**
     * Interrupts the worker and waits up to 5 seconds for it to terminate.
     */
    public void stop() {
        if (currentState.get() != State.RUNNING) {
            return;
        }
        workerThread.interrupt();
        try {
            workerThread.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for worker of {} to stop", agent.getId());
        }
        if (workerThread.isAlive()) {
            log.error("Worker of {} did not stop within 5 seconds", agent.getId());
        }
        currentState.set(State.STOPPED);
        log.debug("Worker for {} stopped", agent.getId());
    }

    public State getCurrentState() {
        return currentState.get();
    }

    public Agent getAgent() {
        return agent;
    }

    private void runWorker() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                process(agent.getMailbox().take());
            }
        } catch (InterruptedException e) {
            log.debug("Worker of {} interrupted, shutting down.", agent.getId());
            Thread.currentThread().interrupt();
        } finally {
            currentState.set(State.STOPPED);
        }
    }

    private void process(Message message) throws InterruptedException {
        if (!bus.acknowledge(message)) {
            log.debug("{} skips {} in state {}", agent.getId(), message.getId(), message.getState());
            return;
        }
        AgentStatus before = agent.swapStatus(AgentStatus.BUSY);
        try {
            if (!processingDelay.isZero()) {
                Thread.sleep(processingDelay.toMillis());
            }
            if (message.getKind() == MessageKind.ASK) {
                Value reply = behavior.onAsk(agent, message, before);
                agent.setStatus(AgentStatus.IDLE);
                bus.reply(message, reply);
            } else {
                behavior.onTell(agent, message);
                agent.setStatus(AgentStatus.IDLE);
            }
            agent.incrementProcessed();
        } catch (InterruptedException e) {
            agent.setStatus(AgentStatus.IDLE);
            if (message.getKind() == MessageKind.ASK) {
                bus.fail(message, new AgentProcessingException(agent.getId(), e));
            }
            throw e;
        } catch (RuntimeException e) {
            log.warn("Agent {} failed to process {}: {}", agent.getId(), message.getId(), e.getMessage());
            log.debug("Exception details:", e);
            agent.setStatus(AgentStatus.ERROR);
            if (message.getKind() == MessageKind.ASK) {
                bus.fail(message, new AgentProcessingException(agent.getId(), e));
            }
        }
    }
}
