package org.agenticscript.runtime.interpreter;

import org.agenticscript.runtime.api.DuplicateNameException;
import org.agenticscript.runtime.api.UndefinedVariableException;
import org.agenticscript.runtime.model.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EnvironmentTest {

    private final Environment globals = new Environment();

    @Test
    void innerFrameShadowsAndFallsBack() {
        globals.declare("x", Value.of(1));
        Environment inner = globals.child();
        inner.declare("x", Value.of(2));

        assertThat(inner.get("x")).isEqualTo(Value.of(2));
        assertThat(globals.get("x")).isEqualTo(Value.of(1));
        assertThat(inner.isDefinedLocally("x")).isTrue();
        assertThat(inner.child().get("x")).isEqualTo(Value.of(2));
    }

    @Test
    void assignmentRebindsNearestBinding() {
        globals.declare("count", Value.of(1));
        Environment inner = globals.child();

        inner.assign("count", Value.of(5));

        assertThat(globals.get("count")).isEqualTo(Value.of(5));
        assertThat(inner.isDefinedLocally("count")).isFalse();
    }

    @Test
    void globalAssignmentDefinesButInnerAssignmentDoesNot() {
        globals.assign("fresh", Value.TRUE);

        assertThat(globals.get("fresh")).isEqualTo(Value.TRUE);
        assertThatThrownBy(() -> globals.child().assign("missing", Value.NULL))
                .isInstanceOf(UndefinedVariableException.class)
                .hasMessage("Undefined variable: missing");
    }

    @Test
    void redeclaringInSameFrameFails() {
        globals.declare("x", Value.of(1));

        assertThatThrownBy(() -> globals.declare("x", Value.of(2)))
                .isInstanceOf(DuplicateNameException.class);
        assertThat(globals.localBindings()).containsEntry("x", Value.of(1));
    }

    @Test
    void nullValuesAreStillBound() {
        globals.declare("nothing", Value.NULL);

        assertThat(globals.lookup("nothing")).contains(Value.NULL);
        assertThat(globals.isGlobal()).isTrue();
        assertThat(globals.child().isGlobal()).isFalse();
    }
}
