package org.kaleido.compiler.frontend.parser.ast;

import org.kaleido.compiler.api.SourceInfo;

import java.util.List;
import java.util.Optional;

/**
 * A function: a prototype and, unless it is a pure external declaration, a body expression.
 * This is the root of every top-level unit and owns the whole tree below it.
 *
 * @param prototype The signature.
 * @param body The body expression, or {@code null} for an external declaration.
 */
public record FunctionNode(
        PrototypeNode prototype,
        ExprNode body
) implements AstNode {

    /**
     * Creates a function without a body.
     * @param prototype The signature.
     * @return The external declaration.
     */
    public static FunctionNode declaration(PrototypeNode prototype) {
        return new FunctionNode(prototype, null);
    }

    public Optional<ExprNode> bodyOptional() {
        return Optional.ofNullable(body);
    }

    @Override
    public SourceInfo source() {
        return prototype.source();
    }

    @Override
    public List<AstNode> getChildren() {
        return body == null ? List.of(prototype) : List.of(prototype, body);
    }
}
