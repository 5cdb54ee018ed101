package org.kaleido.compiler.frontend.parser.ast;

import org.kaleido.compiler.api.SourceInfo;

/**
 * An AST node that references a variable by name, e.g. a function parameter.
 *
 * @param name The referenced name.
 * @param source The position of the reference.
 */
public record VariableRefNode(
        String name,
        SourceInfo source
) implements ExprNode {
}
