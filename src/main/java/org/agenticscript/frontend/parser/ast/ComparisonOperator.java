package org.agenticscript.frontend.parser.ast;

/**
 * The comparison operators, with the symbol they are written as.
 */
public enum ComparisonOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} for the equality operators, which accept operands of any type.
     */
    public boolean isEquality() {
        return this == EQUAL || this == NOT_EQUAL;
    }

    /**
     * Finds the operator written as the given symbol.
     * @param symbol The operator text.
     * @return The matching operator.
     * @throws IllegalArgumentException if no operator uses the symbol.
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }
}
