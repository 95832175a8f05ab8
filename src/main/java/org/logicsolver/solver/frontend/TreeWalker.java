package org.logicsolver.solver.frontend;

import org.logicsolver.solver.frontend.parser.ast.ExpressionNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an expression tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between the phases and the tree structure.
 */
public class TreeWalker {

    private final Map<Class<? extends ExpressionNode>, Consumer<ExpressionNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends ExpressionNode>, Consumer<ExpressionNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a node and all of its descendants, parents before children and left before right.
     * An explicit stack is used, so the depth of the tree is not limited by the call stack.
     * @param root The node to walk.
     */
    public void walk(ExpressionNode root) {
        if (root == null) {
            return;
        }

        Deque<ExpressionNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ExpressionNode node = pending.pop();
            handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

            List<ExpressionNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }
}
