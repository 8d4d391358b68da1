package com.rdparser.playground.parser;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes drawing coordinates for a parse tree.
 *
 * <p>Leaves are placed left to right in visitation order at a fixed stride.
 * Every internal node sits at the midpoint of its first and last child, not at
 * the mean of all its children.
 */
public final class TreeLayout {

    public static final double NODE_WIDTH = 60;
    public static final double NODE_HEIGHT = 50;
    public static final double LEVEL_HEIGHT = 80;
    public static final double MIN_SIBLING_SEP = 20;
    public static final double TOP_PADDING = 20;
    public static final double EDGE_OFFSET = 18;
    public static final double WIDTH_MARGIN = 40;
    public static final double HEIGHT_MARGIN = 60;

    private static final Set<String> OPERATORS = Set.of("+", "-", "*", "/", "(", ")");
    private static final Set<String> NON_TERMINALS = Set.of("E", "E'", "T", "T'", "F");

    private TreeLayout() {
    }

    public static TreeLayoutResult computeTreeLayout(ParseTreeNode root) {
        if (root == null) {
            return TreeLayoutResult.empty();
        }

        Map<ParseTreeNode, Integer> depths = new IdentityHashMap<>();
        assignDepth(root, 0, depths);

        Map<ParseTreeNode, Double> offsets = new IdentityHashMap<>();
        assignX(root, offsets, new double[] {0});

        List<LayoutNode> nodes = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();
        double[] extent = {0, 0};
        collect(root, depths, offsets, nodes, edges, extent);

        return new TreeLayoutResult(
                nodes,
                edges,
                extent[0] + NODE_WIDTH + WIDTH_MARGIN,
                (extent[1] + 1) * LEVEL_HEIGHT + HEIGHT_MARGIN);
    }

    /**
     * Kind of a node by label alone: an unknown label is a terminal whether or
     * not it has children.
     */
    public static NodeKind classify(ParseTreeNode node) {
        if (Parser.EPSILON.equals(node.label())) {
            return NodeKind.EPSILON;
        }
        if (OPERATORS.contains(node.label())) {
            return NodeKind.OPERATOR;
        }
        if (NON_TERMINALS.contains(node.label())) {
            return NodeKind.NONTERMINAL;
        }
        return NodeKind.TERMINAL;
    }

    private static void assignDepth(ParseTreeNode node, int depth, Map<ParseTreeNode, Integer> depths) {
        depths.put(node, depth);
        for (ParseTreeNode child : node.children()) {
            assignDepth(child, depth + 1, depths);
        }
    }

    private static void assignX(ParseTreeNode node, Map<ParseTreeNode, Double> offsets, double[] nextX) {
        if (node.isLeaf()) {
            offsets.put(node, nextX[0]);
            nextX[0] += NODE_WIDTH + MIN_SIBLING_SEP;
            return;
        }

        for (ParseTreeNode child : node.children()) {
            assignX(child, offsets, nextX);
        }

        ParseTreeNode first = node.children().get(0);
        ParseTreeNode last = node.children().get(node.children().size() - 1);
        offsets.put(node, (offsets.get(first) + offsets.get(last)) / 2);
    }

    private static void collect(ParseTreeNode node, Map<ParseTreeNode, Integer> depths,
            Map<ParseTreeNode, Double> offsets, List<LayoutNode> nodes, List<Edge> edges, double[] extent) {
        int depth = depths.get(node);
        double x = centerX(node, offsets);
        double y = centerY(depth);

        nodes.add(new LayoutNode(
                node.id(),
                node.label(),
                x,
                y,
                depth,
                node.isLeaf(),
                Parser.EPSILON.equals(node.label()),
                OPERATORS.contains(node.label()),
                NON_TERMINALS.contains(node.label()),
                classify(node)));

        extent[0] = Math.max(extent[0], x);
        extent[1] = Math.max(extent[1], depth);

        for (ParseTreeNode child : node.children()) {
            Point from = new Point(x, y + EDGE_OFFSET);
            Point to = new Point(centerX(child, offsets), centerY(depths.get(child)) - EDGE_OFFSET);
            edges.add(new Edge(node.id(), child.id(), from, to));

            collect(child, depths, offsets, nodes, edges, extent);
        }
    }

    private static double centerX(ParseTreeNode node, Map<ParseTreeNode, Double> offsets) {
        return offsets.get(node) + NODE_WIDTH / 2;
    }

    private static double centerY(int depth) {
        return depth * LEVEL_HEIGHT + NODE_HEIGHT / 2 + TOP_PADDING;
    }
}
