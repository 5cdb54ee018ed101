package org.kaleido.compiler.frontend.parser.ast;

import org.kaleido.compiler.api.SourceInfo;

import java.util.List;

/**
 * An AST node for a binary operator applied to two operands.
 *
 * @param operator The operator character, e.g. '+'.
 * @param left The left operand, evaluated first.
 * @param right The right operand.
 * @param source The position of the operator.
 */
public record BinaryOpNode(
        char operator,
        ExprNode left,
        ExprNode right,
        SourceInfo source
) implements ExprNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
