package org.agenticscript.runtime;

import org.agenticscript.runtime.agent.Agent;
import org.agenticscript.runtime.agent.AgentBehavior;
import org.agenticscript.runtime.agent.AgentKind;
import org.agenticscript.runtime.agent.AgentTable;
import org.agenticscript.runtime.agent.AgentWorker;
import org.agenticscript.runtime.agent.ScriptedAgentBehavior;
import org.agenticscript.runtime.bus.MessageBus;
import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.modules.ModuleSystem;
import org.agenticscript.runtime.stdlib.StandardLibrary;
import org.agenticscript.runtime.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Everything one script session shares: the agent table, message bus, tool registry, module
 * system, options and output sink.
 * <p>
 * The standard library is installed on creation and its tools are registered right away.
 * Closing the context stops every agent worker.
 */
public class RuntimeContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuntimeContext.class);

    private final RuntimeOptions options;
    private final Consumer<String> output;
    private final AgentBehavior behavior;
    private final AgentTable agents = new AgentTable();
    private final MessageBus bus;
    private final ToolRegistry registry = new ToolRegistry();
    private final ModuleSystem modules;
    private final Map<String, AgentWorker> workers = new ConcurrentHashMap<>();

    public RuntimeContext(RuntimeOptions options) {
        this(options, System.out::println);
    }

    public RuntimeContext(RuntimeOptions options, Consumer<String> output) {
        this(options, output, new ScriptedAgentBehavior());
    }

    /**
     * @param options The session options.
     * @param output Receives every line the script prints.
     * @param behavior Decides how agents answer messages.
     */
    public RuntimeContext(RuntimeOptions options, Consumer<String> output, AgentBehavior behavior) {
        this.options = options;
        this.output = output;
        this.behavior = behavior;
        this.bus = new MessageBus(options.historyLimit());
        this.modules = new ModuleSystem(registry);
        modules.install(StandardLibrary.toolsModule());
        modules.install(StandardLibrary.agentsModule());
        modules.load(StandardLibrary.TOOLS_MODULE);
    }

    /**
     * Creates an agent, registers it with the table and the bus and starts its worker.
     *
     * @param name The script-level name.
     * @param kind The agent kind.
     * @param model The model descriptor.
     * @param config Constructor configuration, stored as properties.
     * @return The new, idle agent.
     */
    public Agent spawnAgent(String name, AgentKind kind, String model, Map<String, Value> config) {
        Agent agent = new Agent(agents.nextId(name), name, kind, model, options.receivedLimit());
        config.forEach(agent::setProperty);
        agents.add(agent);
        bus.register(agent.getId(), agent.getMailbox());
        AgentWorker worker = new AgentWorker(agent, bus, behavior, options.processingDelay());
        workers.put(agent.getId(), worker);
        worker.start();
        log.info("Spawned {} {} with model {}", kind.name(), agent.getId(), model);
        return agent;
    }

    /**
     * Writes one line to the output sink.
     */
    public void print(String line) {
        output.accept(line);
    }

    public RuntimeOptions getOptions() {
        return options;
    }

    public AgentTable getAgents() {
        return agents;
    }

    public MessageBus getBus() {
        return bus;
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    public ModuleSystem getModules() {
        return modules;
    }

    /**
     * Stops all agent workers and removes the agents from the bus.
     */
    @Override
    public void close() {
        List<AgentWorker> running = new ArrayList<>(workers.values());
        running.forEach(AgentWorker::stop);
        running.forEach(w -> bus.unregister(w.getAgent().getId()));
        workers.clear();
        log.debug("Runtime closed, {} workers stopped", running.size());
    }
}
