package org.kaleido.compiler.frontend.parser.ast;

import org.kaleido.compiler.api.SourceInfo;

import java.util.List;

/**
 * The signature of a function: its name and the names of its parameters.
 * Every parameter has the language's single numeric type, as does the result.
 *
 * @param name The function name; {@link #ANONYMOUS_NAME} for a top-level expression.
 * @param parameters The parameter names, pairwise distinct.
 * @param source The position of the function name.
 */
public record PrototypeNode(
        String name,
        List<String> parameters,
        SourceInfo source
) implements AstNode {

    /** The reserved name of the function wrapping a top-level expression. */
    public static final String ANONYMOUS_NAME = "";

    public PrototypeNode {
        parameters = List.copyOf(parameters);
    }

    /**
     * Creates the zero-argument prototype that wraps a top-level expression.
     * @param source The position of the expression.
     * @return The anonymous prototype.
     */
    public static PrototypeNode anonymous(SourceInfo source) {
        return new PrototypeNode(ANONYMOUS_NAME, List.of(), source);
    }

    public boolean isAnonymous() {
        return ANONYMOUS_NAME.equals(name);
    }

    public int arity() {
        return parameters.size();
    }
}
