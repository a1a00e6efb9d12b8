package org.agenticscript.runtime.model;

import java.util.Locale;

/**
 * Lifecycle status of an agent. Scripts read it as the lowercase label, e.g. {@code "idle"}.
 */
public enum AgentStatus {
    IDLE,
    ACTIVE,
    BUSY,
    ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
