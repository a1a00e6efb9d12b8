package org.agenticscript.runtime.bus;

/**
 * Message counters of one sender/recipient pair.
 *
 * @param senderId The sending agent (or {@code system} for the script itself).
 * @param recipientId The receiving agent.
 * @param sent Messages enqueued for the pair.
 * @param delivered Messages the recipient took from its mailbox.
 */
public record FlowStats(String senderId, String recipientId, long sent, long delivered) {
}
