package org.kaleido.compiler.frontend.parser.ast;

import org.kaleido.compiler.api.SourceInfo;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable and own their children exclusively, so the tree never shares subtrees.
 */
public interface AstNode {

    /**
     * @return Where in the input this node starts.
     */
    SourceInfo source();

    /**
     * Returns a list of the direct child nodes, in evaluation order.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
