package org.lunaform.compiler.process;

import org.lunaform.compiler.nodes.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Traverses a node tree in pre-order.
 * Instead of a visitor, this walker uses handlers keyed by node class, so a pass only
 * registers the node kinds it cares about.
 * <p>
 * The traversal keeps its own stack and never recurses, so deeply nested trees are walked in
 * bounded Java stack space.
 */
public class TreeWalker {

    private final Map<Class<? extends Node>, Consumer<Node>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends Node>, Consumer<Node>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a node and all of its descendants, running the handler registered for each node class.
     * @param root The node to walk.
     */
    public void walk(Node root) {
        walk(root, node -> handlers.getOrDefault(node.getClass(), n -> {}).accept(node));
    }

    /**
     * Walks a node and all of its descendants, applying the same action to every node.
     * @param root The node to walk.
     * @param action Called once per node, parents before children, children in source order.
     */
    public static void walk(Node root, Consumer<Node> action) {
        if (root == null) {
            return;
        }
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            action.accept(node);
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }
}
