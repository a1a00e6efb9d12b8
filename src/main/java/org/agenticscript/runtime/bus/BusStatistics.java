package org.agenticscript.runtime.bus;

import java.util.List;

/**
 * A snapshot of the bus counters.
 *
 * @param totalSent Messages enqueued to a registered recipient.
 * @param totalDelivered Messages taken from a mailbox by the recipient's worker.
 * @param totalFailed Messages addressed to an unknown recipient.
 * @param totalTimedOut Asks whose reply did not arrive in time.
 * @param discardedReplies Replies that arrived late or for an already answered ask.
 * @param pending Messages currently queued in any mailbox.
 * @param averageDeliveryMillis Mean time between enqueue and delivery.
 * @param activeSubscriptions Listeners currently subscribed to any agent.
 * @param flows Per sender/recipient counters, ordered by sender and recipient.
 */
public record BusStatistics(
        long totalSent,
        long totalDelivered,
        long totalFailed,
        long totalTimedOut,
        long discardedReplies,
        int pending,
        double averageDeliveryMillis,
        int activeSubscriptions,
        List<FlowStats> flows
) {
    public BusStatistics {
        flows = List.copyOf(flows);
    }
}
