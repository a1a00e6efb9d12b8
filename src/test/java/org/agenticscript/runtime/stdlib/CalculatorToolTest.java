package org.agenticscript.runtime.stdlib;

import org.agenticscript.runtime.bus.MessageBus;
import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.tools.ToolContext;
import org.agenticscript.runtime.tools.ToolExecutionException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CalculatorToolTest {

    private final CalculatorTool calculator = new CalculatorTool();
    private final ToolContext context = new ToolContext("math_001", List.of(), new MessageBus(10));

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2 + 2 * 3       | 8",
            "(2 + 2) * 3     | 12",
            "10 / 4          | 2.5",
            "-3 + 5          | 2",
            "7 % 4           | 3",
            "  1.5*2         | 3"
    })
    void evaluatesExpressions(String expression, String expected) {
        Value result = calculator.execute(context, List.of(Value.of(expression)));

        assertThat(result.display()).isEqualTo(expected);
    }

    @Test
    void numberArgumentIsReturnedUnchanged() {
        assertThat(calculator.execute(context, List.of(Value.of(42)))).isEqualTo(Value.of(42));
    }

    @Test
    void divisionByZeroFails() {
        assertThatThrownBy(() -> calculator.execute(context, List.of(Value.of("1 / 0"))))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Division by zero in expression: 1 / 0");
    }

    @Test
    void malformedExpressionsFail() {
        assertThatThrownBy(() -> calculator.execute(context, List.of(Value.of("2 +"))))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("Unexpected end of expression");
        assertThatThrownBy(() -> calculator.execute(context, List.of(Value.of("(1 + 2"))))
                .hasMessageContaining("Missing ')'");
        assertThatThrownBy(() -> calculator.execute(context, List.of(Value.of("2 x 3"))))
                .hasMessageContaining("Unexpected 'x'");
    }

    @Test
    void deepNestingFailsInsteadOfOverflowingTheStack() {
        String deep = "(".repeat(50_000) + "1" + ")".repeat(50_000);
        String signs = "-".repeat(50_000) + "1";

        assertThatThrownBy(() -> calculator.execute(context, List.of(Value.of(deep))))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageStartingWith("Expression nested deeper than 256 levels");
        assertThatThrownBy(() -> calculator.execute(context, List.of(Value.of(signs))))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageStartingWith("Expression nested deeper than 256 levels");
    }

    @Test
    void nestingUpToTheLimitIsAccepted() {
        String nested = "(".repeat(200) + "2 * 3" + ")".repeat(200);

        assertThat(calculator.execute(context, List.of(Value.of(nested)))).isEqualTo(Value.of(6));
    }

    @Test
    void rejectsWrongArguments() {
        assertThatThrownBy(() -> calculator.execute(context, List.of()))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Calculator expects 1 argument (expression) but got 0");
        assertThatThrownBy(() -> calculator.execute(context, List.of(Value.TRUE)))
                .hasMessage("Calculator expects a string expression but got boolean");
    }
}
