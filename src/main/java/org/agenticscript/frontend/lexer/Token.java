package org.agenticscript.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., keyword, identifier, string).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (e.g., the unescaped content of a string).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Returns the column directly after the last character of this token.
     * Only meaningful for tokens that do not span multiple lines.
     * @return The end column (exclusive).
     */
    public int endColumn() {
        return column + text.length();
    }
}
