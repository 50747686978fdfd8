package org.lunaform.compiler.nodes;

import java.util.List;
import java.util.function.Consumer;

/**
 * A node of the mutable syntax tree.
 * <p>
 * Every node owns its children and its tokens exclusively. The tree is a strict tree: a node is
 * never shared between two parents.
 */
public interface Node {

    /**
     * @return the direct child nodes in source order. The returned list is a snapshot.
     */
    List<Node> children();

    /**
     * Visits the tokens held by this node itself, not the tokens of its children.
     * @param action Called once per token.
     */
    void forEachOwnToken(Consumer<Token> action);

    <R> R accept(NodeVisitor<R> visitor);
}
