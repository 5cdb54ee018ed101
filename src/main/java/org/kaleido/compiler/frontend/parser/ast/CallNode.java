package org.kaleido.compiler.frontend.parser.ast;

import org.kaleido.compiler.api.SourceInfo;

import java.util.List;

/**
 * An AST node for a function call.
 *
 * @param callee The name of the called function.
 * @param arguments The argument expressions, in evaluation order. May be empty.
 * @param source The position of the callee name.
 */
public record CallNode(
        String callee,
        List<ExprNode> arguments,
        SourceInfo source
) implements ExprNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }
}
