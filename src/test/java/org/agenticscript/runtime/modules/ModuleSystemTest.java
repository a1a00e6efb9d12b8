package org.agenticscript.runtime.modules;

import org.agenticscript.runtime.api.ErrorCode;
import org.agenticscript.runtime.api.ImportException;
import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.stdlib.StandardLibrary;
import org.agenticscript.runtime.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModuleSystemTest {

    private ToolRegistry registry;
    private ModuleSystem modules;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        modules = new ModuleSystem(registry);
        modules.install(StandardLibrary.toolsModule());
        modules.install(StandardLibrary.agentsModule());
    }

    @Test
    void onlyBasicKindIsAvailableBeforeImports() {
        assertThat(modules.isAgentKindAvailable("Agent")).isTrue();
        assertThat(modules.isAgentKindAvailable("SupervisorAgent")).isFalse();
        assertThat(registry.names()).isEmpty();
    }

    @Test
    void importingToolsLoadsTheWholeModule() {
        List<String> imported = modules.importNames(StandardLibrary.TOOLS_MODULE, List.of("Calculator"));

        assertThat(imported).containsExactly("Calculator");
        assertThat(registry.names()).containsExactly("AgentRouting", "Calculator", "FileManager", "WebSearch");
        assertThat(registry.names("math")).containsExactly("Calculator");
        assertThat(modules.importedModules()).containsExactly(StandardLibrary.TOOLS_MODULE);
    }

    @Test
    void repeatedImportsMergeNames() {
        modules.importNames(StandardLibrary.TOOLS_MODULE, List.of("WebSearch"));
        modules.importNames(StandardLibrary.TOOLS_MODULE, List.of("Calculator", "WebSearch"));

        assertThat(modules.importedNames(StandardLibrary.TOOLS_MODULE)).containsExactly("WebSearch", "Calculator");
        assertThat(registry.statistics()).hasSize(4);
    }

    @Test
    void importingSupervisorMakesKindSpawnable() {
        modules.importNames(StandardLibrary.AGENTS_MODULE, List.of("SupervisorAgent"));

        assertThat(modules.agentKind("SupervisorAgent")).hasValueSatisfying(kind ->
                assertThat(kind.defaultProperties()).containsEntry("restart_policy", Value.of("one_for_one")));
    }

    @Test
    void unknownModuleIsRejected() {
        assertThatThrownBy(() -> modules.importNames("agenticscript.stdlib.nope", List.of("X")))
                .isInstanceOf(ImportException.class)
                .hasMessage("Module not found: agenticscript.stdlib.nope")
                .extracting(e -> ((ImportException) e).getCode())
                .isEqualTo(ErrorCode.IMPORT_ERROR);
    }

    @Test
    void unknownNameRejectsWholeImport() {
        assertThatThrownBy(() -> modules.importNames(StandardLibrary.TOOLS_MODULE, List.of("Calculator", "Teleporter")))
                .isInstanceOf(ImportException.class)
                .hasMessageStartingWith("Cannot import Teleporter from agenticscript.stdlib.tools");

        assertThat(registry.names()).isEmpty();
        assertThat(modules.importedModules()).isEmpty();
    }

    @Test
    void installingTwiceFails() {
        assertThatThrownBy(() -> modules.install(StandardLibrary.toolsModule()))
                .isInstanceOf(IllegalStateException.class);
    }
}
