package org.agenticscript.runtime.modules;

import org.agenticscript.runtime.agent.AgentKind;
import org.agenticscript.runtime.api.ImportException;
import org.agenticscript.runtime.tools.ToolDefinition;
import org.agenticscript.runtime.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves {@code import} statements against the installed modules.
 * <p>
 * A module's tools are registered with the {@link ToolRegistry} the first time the module is
 * loaded; its agent kinds become spawnable once imported.
 */
public class ModuleSystem {

    private static final Logger log = LoggerFactory.getLogger(ModuleSystem.class);

    private final ToolRegistry registry;
    private final Map<String, ScriptModule> installed = new ConcurrentHashMap<>();
    private final Set<String> loaded = ConcurrentHashMap.newKeySet();
    private final Map<String, List<String>> imports = new LinkedHashMap<>();
    private final Map<String, AgentKind> availableKinds = new ConcurrentHashMap<>();

    public ModuleSystem(ToolRegistry registry) {
        this.registry = registry;
        availableKinds.put(AgentKind.BASIC.name(), AgentKind.BASIC);
    }

    /**
     * Makes a module importable.
     * @throws IllegalStateException if a module of that name is already installed.
     */
    public void install(ScriptModule module) {
        if (installed.putIfAbsent(module.name(), module) != null) {
            throw new IllegalStateException("Module already installed: " + module.name());
        }
        log.debug("Installed module {} exporting {}", module.name(), module.exports());
    }

    /**
     * Registers the module's tools with the registry unless that already happened.
     * @throws ImportException if the module is not installed.
     */
    public synchronized void load(String moduleName) {
        ScriptModule module = installed.get(moduleName);
        if (module == null) {
            throw new ImportException("Module not found: " + moduleName);
        }
        if (!loaded.add(moduleName)) {
            return;
        }
        for (ToolDefinition tool : module.tools()) {
            if (!registry.isRegistered(tool.name())) {
                tool.registerWith(registry);
            }
        }
        log.debug("Loaded module {}", moduleName);
    }

    /**
     * Imports names from a module. All names are validated before anything is loaded.
     *
     * @param moduleName The dotted module path.
     * @param names The names to import.
     * @return The imported names.
     * @throws ImportException if the module or any of the names is unknown.
     */
    public synchronized List<String> importNames(String moduleName, List<String> names) {
        ScriptModule module = installed.get(moduleName);
        if (module == null) {
            throw new ImportException("Module not found: " + moduleName);
        }
        Set<String> exports = module.exports();
        for (String name : names) {
            if (!exports.contains(name)) {
                throw new ImportException("Cannot import " + name + " from " + moduleName + " (exports: " + exports + ")");
            }
        }

        load(moduleName);
        for (AgentKind kind : module.agentKinds()) {
            if (names.contains(kind.name())) {
                availableKinds.put(kind.name(), kind);
            }
        }
        Set<String> merged = new LinkedHashSet<>(imports.getOrDefault(moduleName, List.of()));
        merged.addAll(names);
        imports.put(moduleName, List.copyOf(merged));
        log.info("Imported {} from {}", names, moduleName);
        return List.copyOf(names);
    }

    public Optional<AgentKind> agentKind(String name) {
        return Optional.ofNullable(availableKinds.get(name));
    }

    public boolean isAgentKindAvailable(String name) {
        return availableKinds.containsKey(name);
    }

    /**
     * @return The imported module names in import order.
     */
    public synchronized List<String> importedModules() {
        return new ArrayList<>(imports.keySet());
    }

    public synchronized List<String> importedNames(String moduleName) {
        return imports.getOrDefault(moduleName, List.of());
    }

    public Set<String> installedModules() {
        return Set.copyOf(installed.keySet());
    }
}
