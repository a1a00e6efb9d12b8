package org.agenticscript.runtime.bus;

/**
 * The two communication styles between agents.
 */
public enum MessageKind {
    /** Synchronous request; the sender blocks until the correlated reply arrives. */
    ASK,
    /** Fire-and-forget notification. */
    TELL
}
