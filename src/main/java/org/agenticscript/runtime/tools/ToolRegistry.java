package org.agenticscript.runtime.tools;

import org.agenticscript.runtime.api.DuplicateToolException;
import org.agenticscript.runtime.api.ScriptError;
import org.agenticscript.runtime.api.UnknownToolException;
import org.agenticscript.runtime.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Thread-safe, name-keyed table of tools. Tools are registered once and never removed during a
 * session; every call to an enabled tool is counted before the handler runs. A disabled tool
 * stays registered but refuses calls until it is enabled again.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolRegistration> tools = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> plugins = new ConcurrentHashMap<>();

    /**
     * Registers a tool.
     * @throws DuplicateToolException if a tool of that name already exists.
     */
    public synchronized void register(String name, Tool handler, String description, Set<String> tags) {
        ToolRegistration registration = new ToolRegistration(name, description, tags, handler);
        if (tools.putIfAbsent(name, registration) != null) {
            throw new DuplicateToolException(name);
        }
        log.debug("Registered tool {} {}", name, tags);
    }

    /**
     * Registers a group of tools under a plugin name. Each tool is tagged with the plugin name.
     * Either all tools are registered or, if one name is taken, none is.
     * @throws DuplicateToolException if any of the names is already registered.
     */
    public synchronized void registerPlugin(String pluginName, Map<String, Tool> plugin) {
        for (String name : plugin.keySet()) {
            if (tools.containsKey(name)) {
                throw new DuplicateToolException(name);
            }
        }
        plugin.forEach((name, handler) -> register(name, handler, pluginName + " plugin tool", Set.of(pluginName)));
        plugins.merge(pluginName, Set.copyOf(plugin.keySet()), (known, added) -> {
            Set<String> all = new TreeSet<>(known);
            all.addAll(added);
            return Set.copyOf(all);
        });
        log.info("Registered plugin {} with tools {}", pluginName, plugin.keySet());
    }

    /**
     * Invokes a tool.
     *
     * @throws UnknownToolException if no tool of that name is registered.
     * @throws ToolExecutionException if the tool is disabled or the handler fails; other handler
     *         exceptions are wrapped.
     */
    public Value execute(String name, ToolContext context, List<Value> args) {
        ToolRegistration registration = tools.get(name);
        if (registration == null) {
            throw new UnknownToolException(name);
        }
        try {
            return registration.invoke(context, args);
        } catch (ScriptError e) {
            registration.recordFailure();
            throw e;
        } catch (RuntimeException e) {
            registration.recordFailure();
            throw new ToolExecutionException("Tool " + name + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Lets a disabled tool accept calls again.
     * @return {@code false} if no tool of that name is registered.
     */
    public boolean enable(String name) {
        return setEnabled(name, true);
    }

    /**
     * Makes a tool refuse calls. Calls already running are not interrupted.
     * @return {@code false} if no tool of that name is registered.
     */
    public boolean disable(String name) {
        return setEnabled(name, false);
    }

    private boolean setEnabled(String name, boolean enabled) {
        ToolRegistration registration = tools.get(name);
        if (registration == null) {
            return false;
        }
        registration.setEnabled(enabled);
        log.debug("Tool {} {}", name, enabled ? "enabled" : "disabled");
        return true;
    }

    /**
     * @return {@code true} if the tool is registered and accepts calls.
     */
    public boolean isEnabled(String name) {
        ToolRegistration registration = tools.get(name);
        return registration != null && registration.isEnabled();
    }

    public boolean isRegistered(String name) {
        return tools.containsKey(name);
    }

    public SortedSet<String> names() {
        return new TreeSet<>(tools.keySet());
    }

    /**
     * @return The names of the tools carrying the given tag.
     */
    public SortedSet<String> names(String tag) {
        return tools.values().stream()
                .filter(r -> r.tags().contains(tag))
                .map(ToolRegistration::name)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * @return The names of the registered plugins.
     */
    public SortedSet<String> listPlugins() {
        return new TreeSet<>(plugins.keySet());
    }

    /**
     * @return The tools registered by a plugin, empty if there is no such plugin.
     */
    public SortedSet<String> pluginTools(String pluginName) {
        return new TreeSet<>(plugins.getOrDefault(pluginName, Set.of()));
    }

    /**
     * @return The usage counters of one tool.
     * @throws UnknownToolException if no tool of that name is registered.
     */
    public ToolStatistics statistics(String name) {
        ToolRegistration registration = tools.get(name);
        if (registration == null) {
            throw new UnknownToolException(name);
        }
        return registration.snapshot();
    }

    /**
     * @return The usage counters of all tools, ordered by name.
     */
    public List<ToolStatistics> statistics() {
        return names().stream().map(n -> tools.get(n).snapshot()).toList();
    }
}
