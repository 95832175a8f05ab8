package org.logicsolver.solver.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of an expression tree.
 * A node owns its children exclusively; trees never share nodes.
 */
public interface ExpressionNode {
    /**
     * Returns a list of the direct child nodes.
     * This allows a generic {@link org.logicsolver.solver.frontend.TreeWalker} to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<ExpressionNode> getChildren() {
        return Collections.emptyList();
    }
}
