package org.kaleido.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Keywords.
    /** The 'def' keyword, starting a function definition. */
    DEF,
    /** The 'extern' keyword, starting an external function declaration. */
    EXTERN,

    // Primaries.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER,
    /** A numeric literal. */
    NUMBER,

    // Miscellaneous.
    /** Any other single character, such as an operator or a parenthesis. */
    CHAR,
    /** Represents the end of the input. */
    END_OF_FILE
}
