package org.agenticscript.runtime.agent;

import org.agenticscript.runtime.model.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A spawnable kind of agent, e.g. the built-in {@code Agent} or an imported {@code SupervisorAgent}.
 *
 * @param name The kind name used after {@code spawn}.
 * @param defaultProperties Properties every agent of this kind starts with; constructor
 *                          configuration overrides them.
 */
public record AgentKind(String name, Map<String, Value> defaultProperties) {

    /** The kind that is always spawnable without an import. */
    public static final AgentKind BASIC = new AgentKind("Agent", Map.of());

    public AgentKind {
        defaultProperties = Collections.unmodifiableMap(new LinkedHashMap<>(defaultProperties));
    }
}
