package org.kaleido.compiler.frontend.lexer;

import org.kaleido.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the input by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the input.
 * @param value The processed value of the token: a {@link Double} for numbers,
 *              a {@link Character} for single characters, otherwise {@code null}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical name of the input this token originates from.
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
     * Checks whether this is a single-character token carrying the given character.
     * @param c The character to compare against.
     * @return true if this token is {@link TokenType#CHAR} with value {@code c}.
     */
    public boolean isChar(char c) {
        return type == TokenType.CHAR && value instanceof Character ch && ch == c;
    }

    /**
     * @return The numeric value of a {@link TokenType#NUMBER} token.
     */
    public double numberValue() {
        return (Double) value;
    }

    /**
     * @return The character of a {@link TokenType#CHAR} token.
     */
    public char charValue() {
        return (Character) value;
    }

    /**
     * @return The position of this token as API source information.
     */
    public SourceInfo source() {
        return new SourceInfo(fileName, line, column);
    }
}
