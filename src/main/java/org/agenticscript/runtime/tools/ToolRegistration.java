package org.agenticscript.runtime.tools;

import org.agenticscript.runtime.model.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A registered tool together with its usage counters.
 */
final class ToolRegistration {

    private final String name;
    private final String description;
    private final Set<String> tags;
    private final Tool handler;
    private final ReentrantLock exclusiveGuard;
    private volatile boolean enabled = true;
    private long callCount;
    private long failureCount;
    private Instant lastUsed;

    ToolRegistration(String name, String description, Set<String> tags, Tool handler) {
        this.name = name;
        this.description = description;
        this.tags = Set.copyOf(tags);
        this.handler = handler;
        this.exclusiveGuard = handler.isReentrant() ? null : new ReentrantLock();
    }

    String name() {
        return name;
    }

    Set<String> tags() {
        return tags;
    }

    boolean isEnabled() {
        return enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    Value invoke(ToolContext context, List<Value> args) {
        if (!enabled) {
            throw new ToolExecutionException("Tool " + name + " is disabled");
        }
        recordCall();
        if (exclusiveGuard == null) {
            return handler.execute(context, args);
        }
        exclusiveGuard.lock();
        try {
            return handler.execute(context, args);
        } finally {
            exclusiveGuard.unlock();
        }
    }

    synchronized void recordCall() {
        callCount++;
        lastUsed = Instant.now();
    }

    synchronized void recordFailure() {
        failureCount++;
    }

    synchronized ToolStatistics snapshot() {
        return new ToolStatistics(name, description, tags, enabled, callCount, failureCount, lastUsed);
    }
}
