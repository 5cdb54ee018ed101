package org.kaleido.compiler.frontend.parser.ast;

import java.util.stream.Collectors;

/**
 * Renders AST nodes as fully parenthesized text, e.g. {@code (1 + (2 * 3))}.
 * Used for debug logging and to compare parse trees by shape.
 */
public final class AstFormatter {

    private AstFormatter() {}

    /**
     * Formats any AST node.
     * @param node The node to format.
     * @return The textual form.
     */
    public static String format(AstNode node) {
        if (node instanceof ExprNode expr) {
            return formatExpr(expr);
        }
        if (node instanceof PrototypeNode proto) {
            return formatPrototype(proto);
        }
        if (node instanceof FunctionNode fn) {
            if (fn.body() == null) {
                return "extern " + formatPrototype(fn.prototype());
            }
            return "def " + formatPrototype(fn.prototype()) + " " + formatExpr(fn.body());
        }
        throw new IllegalArgumentException("Unsupported AST node: " + node.getClass().getName());
    }

    private static String formatExpr(ExprNode node) {
        if (node instanceof NumberLiteralNode n) {
            return formatNumber(n.value());
        }
        if (node instanceof VariableRefNode v) {
            return v.name();
        }
        if (node instanceof BinaryOpNode b) {
            return "(" + formatExpr(b.left()) + " " + b.operator() + " " + formatExpr(b.right()) + ")";
        }
        CallNode c = (CallNode) node;
        return c.callee() + c.arguments().stream()
                .map(AstFormatter::formatExpr)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    private static String formatPrototype(PrototypeNode proto) {
        return proto.name() + "(" + String.join(" ", proto.parameters()) + ")";
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
