package org.logicsolver.solver.util;

import org.logicsolver.solver.frontend.parser.ast.ExpressionNode;
import org.logicsolver.solver.frontend.parser.ast.LiteralNode;
import org.logicsolver.solver.frontend.parser.ast.OperatorNode;
import org.logicsolver.solver.frontend.parser.ast.VariableNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders expression trees in the Graphviz DOT language.
 * See https://graphviz.org/pdf/dotguide.pdf
 * <p>
 * Vertices are numbered in breadth-first order starting at the root. Operators are drawn as
 * boxes, literals and variables as plain labels.
 */
public final class GraphvizExporter {

    private GraphvizExporter() {}

    /**
     * Renders a tree.
     * @param root The root of the tree.
     * @return The DOT source.
     */
    public static String render(ExpressionNode root) {
        StringBuilder vertices = new StringBuilder();
        StringBuilder edges = new StringBuilder();

        record Pending(int parentId, ExpressionNode node) {}
        Deque<Pending> queue = new ArrayDeque<>();
        queue.add(new Pending(-1, root));
        int nextId = 0;
        while (!queue.isEmpty()) {
            Pending pending = queue.poll();
            int id = nextId++;
            vertices.append("    ").append(id).append(" [").append(attributes(pending.node())).append("]\n");
            if (pending.parentId() >= 0) {
                edges.append("    ").append(pending.parentId()).append(" -> ").append(id).append('\n');
            }
            for (ExpressionNode child : pending.node().getChildren()) {
                queue.add(new Pending(id, child));
            }
        }
        return "digraph G {\n" + vertices + edges + "}\n";
    }

    /**
     * Renders a tree into a file, replacing its contents.
     * @param root The root of the tree.
     * @param outPath The file to write.
     * @throws IOException if the file cannot be written.
     */
    public static void write(ExpressionNode root, Path outPath) throws IOException {
        Path parent = outPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outPath, render(root));
    }

    private static String attributes(ExpressionNode node) {
        if (node instanceof OperatorNode operator) {
            return "label=\"" + operator.operator().displayName() + "\" shape=\"box\"";
        }
        if (node instanceof LiteralNode literal) {
            return "label=\"" + literal.value() + "\"";
        }
        if (node instanceof VariableNode variable) {
            return "label=\"" + variable.name() + "\"";
        }
        throw new IllegalArgumentException("Unsupported node type " + node.getClass().getName());
    }
}
