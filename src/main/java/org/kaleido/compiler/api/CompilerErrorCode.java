package org.kaleido.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the human-readable error messages.
 */
public enum CompilerErrorCode {
    // region Parser Errors
    /** A token that cannot start an expression was found where an expression is required. */
    UNEXPECTED_TOKEN_IN_EXPRESSION,
    /** A parenthesized expression was not closed with ')'. */
    EXPECTED_CLOSING_PAREN,
    /** A call argument was followed by something other than ',' or ')'. */
    EXPECTED_ARGUMENT_SEPARATOR,
    /** A prototype did not start with the function name. */
    EXPECTED_FUNCTION_NAME,
    /** The function name of a prototype was not followed by '('. */
    EXPECTED_OPEN_PAREN_IN_PROTOTYPE,
    /** The parameter list of a prototype was not closed with ')'. */
    EXPECTED_CLOSE_PAREN_IN_PROTOTYPE,
    /** The same parameter name occurs twice in one prototype. */
    DUPLICATE_PARAMETER,
    // endregion

    // region Emission Errors
    /** A variable reference does not name a parameter of the enclosing function. */
    UNKNOWN_VARIABLE,
    /** A call names a function that is not declared in the module. */
    UNKNOWN_FUNCTION,
    /** A call passes a different number of arguments than the callee declares. */
    ARGUMENT_COUNT_MISMATCH,
    /** A binary operator has no IR lowering. */
    INVALID_BINARY_OPERATOR,
    /** A function is redeclared with a different number of parameters. */
    PROTOTYPE_ARITY_MISMATCH,
    /** A function that already has a body is defined again. */
    FUNCTION_REDEFINITION,
    /** The IR of a completed function failed verification. */
    IR_VERIFICATION_FAILED
    // endregion
}
