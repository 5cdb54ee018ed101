package org.kaleido.compiler.frontend.parser.ast;

import org.kaleido.compiler.api.SourceInfo;

/**
 * An AST node that represents a numeric literal.
 *
 * @param value The value of the literal.
 * @param source The position of the literal.
 */
public record NumberLiteralNode(
        double value,
        SourceInfo source
) implements ExprNode {
    // This node has no children and inherits the empty list from getChildren().
}
