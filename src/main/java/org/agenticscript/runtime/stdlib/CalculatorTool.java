package org.agenticscript.runtime.stdlib;

import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.tools.Tool;
import org.agenticscript.runtime.tools.ToolContext;
import org.agenticscript.runtime.tools.ToolExecutionException;

import java.util.List;
import java.util.function.DoubleSupplier;

/**
 * Evaluates an arithmetic expression given as a string, e.g. {@code "2 + 2 * 3"}.
 * <p>
 * Supports {@code + - * / %}, unary minus and parentheses with the usual precedence.
 * A number argument is returned unchanged.
 */
public class CalculatorTool implements Tool {

    @Override
    public Value execute(ToolContext context, List<Value> args) {
        if (args.size() != 1) {
            throw new ToolExecutionException("Calculator expects 1 argument (expression) but got " + args.size());
        }
        Value argument = args.get(0);
        if (argument instanceof Value.Num number) {
            return number;
        }
        if (!(argument instanceof Value.Str expression)) {
            throw new ToolExecutionException("Calculator expects a string expression but got " + argument.typeName());
        }
        return Value.of(new Evaluator(expression.value()).evaluate());
    }

    /**
     * Recursive-descent evaluator over the characters of one expression.
     */
    static final class Evaluator {

        /** Deepest nesting of parentheses and unary signs accepted in one expression. */
        static final int MAX_DEPTH = 256;

        private final String source;
        private int pos;
        private int depth;

        Evaluator(String source) {
            this.source = source;
        }

        double evaluate() {
            double result = additive();
            skipWhitespace();
            if (pos < source.length()) {
                throw error("Unexpected '" + source.charAt(pos) + "'");
            }
            return result;
        }

        private double additive() {
            double value = multiplicative();
            while (true) {
                if (accept('+')) {
                    value += multiplicative();
                } else if (accept('-')) {
                    value -= multiplicative();
                } else {
                    return value;
                }
            }
        }

        private double multiplicative() {
            double value = unary();
            while (true) {
                if (accept('*')) {
                    value *= unary();
                } else if (accept('/')) {
                    double divisor = unary();
                    if (divisor == 0) throw error("Division by zero");
                    value /= divisor;
                } else if (accept('%')) {
                    double divisor = unary();
                    if (divisor == 0) throw error("Division by zero");
                    value %= divisor;
                } else {
                    return value;
                }
            }
        }

        private double unary() {
            if (accept('-')) return -nested(this::unary);
            if (accept('+')) return nested(this::unary);
            return primary();
        }

        private double primary() {
            if (accept('(')) {
                double value = nested(this::additive);
                if (!accept(')')) throw error("Missing ')'");
                return value;
            }
            skipWhitespace();
            int start = pos;
            while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
                pos++;
            }
            if (start == pos) {
                throw error(pos < source.length() ? "Unexpected '" + source.charAt(pos) + "'" : "Unexpected end of expression");
            }
            try {
                return Double.parseDouble(source.substring(start, pos));
            } catch (NumberFormatException e) {
                throw new ToolExecutionException("Invalid number '" + source.substring(start, pos) + "' in: " + source, e);
            }
        }

        private double nested(DoubleSupplier rule) {
            if (++depth > MAX_DEPTH) {
                throw error("Expression nested deeper than " + MAX_DEPTH + " levels");
            }
            try {
                return rule.getAsDouble();
            } finally {
                depth--;
            }
        }

        private boolean accept(char c) {
            skipWhitespace();
            if (pos < source.length() && source.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        private void skipWhitespace() {
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) pos++;
        }

        private ToolExecutionException error(String message) {
            return new ToolExecutionException(message + " in expression: " + source);
        }
    }
}
