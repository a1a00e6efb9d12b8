package org.agenticscript.runtime.tools;

import java.time.Instant;
import java.util.Set;

/**
 * A snapshot of one tool's registration and usage counters.
 *
 * @param name The tool name.
 * @param description The human-readable description.
 * @param tags The registration tags.
 * @param enabled Whether the tool currently accepts calls.
 * @param callCount The number of calls, successful or not.
 * @param failureCount The number of calls that failed.
 * @param lastUsed The time of the most recent call, or null if never called.
 */
public record ToolStatistics(
        String name,
        String description,
        Set<String> tags,
        boolean enabled,
        long callCount,
        long failureCount,
        Instant lastUsed
) {
}
