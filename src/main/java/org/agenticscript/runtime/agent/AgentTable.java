package org.agenticscript.runtime.agent;

import org.agenticscript.runtime.api.UnknownAgentException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * All agents of a session, keyed by id in spawn order. Agents stay in the table until the
 * session ends.
 */
public class AgentTable {

    private final Map<String, Agent> agents = Collections.synchronizedMap(new LinkedHashMap<>());
    private final AtomicInteger sequence = new AtomicInteger();

    /**
     * Allocates the next id for an agent of the given name, e.g. {@code researcher_001}.
     */
    public String nextId(String name) {
        return String.format("%s_%03d", name, sequence.incrementAndGet());
    }

    /**
     * @throws IllegalStateException if an agent with the same id is already present.
     */
    public void add(Agent agent) {
        if (agents.putIfAbsent(agent.getId(), agent) != null) {
            throw new IllegalStateException("Agent id already in use: " + agent.getId());
        }
    }

    public Optional<Agent> get(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /**
     * @throws UnknownAgentException if no agent has the id.
     */
    public Agent require(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw new UnknownAgentException(agentId);
        }
        return agent;
    }

    /**
     * Finds an agent by id or, failing that, by its script-level name.
     */
    public Optional<Agent> find(String idOrName) {
        Agent byId = agents.get(idOrName);
        if (byId != null) {
            return Optional.of(byId);
        }
        return all().stream().filter(a -> a.getName().equals(idOrName)).findFirst();
    }

    public boolean contains(String agentId) {
        return agents.containsKey(agentId);
    }

    /**
     * @return All agents in spawn order.
     */
    public List<Agent> all() {
        synchronized (agents) {
            return new ArrayList<>(agents.values());
        }
    }

    public int size() {
        return agents.size();
    }
}
