package org.kaleido.compiler.frontend.parser.ast;

/**
 * The closed set of expression nodes. Consumers dispatch over the permitted variants
 * instead of relying on behavior attached to the nodes.
 */
public sealed interface ExprNode extends AstNode
        permits NumberLiteralNode, VariableRefNode, BinaryOpNode, CallNode {
}
