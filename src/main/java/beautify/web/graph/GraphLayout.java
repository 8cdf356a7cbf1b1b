package beautify.web.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Left-to-right tree layout. Each node gets a vertical band as tall as its visible subtree and is
 * centred in it; children sit one level gap to the right of their parent's box.
 */
public class GraphLayout {

    public static final double NODE_PADDING = 10;
    public static final double LEVEL_GAP = 80;
    public static final double ORIGIN_X = 50;
    public static final double ORIGIN_Y = 50;

    static final double FIT_MARGIN = 100;
    static final double FALLBACK_EXTENT = 100;

    /**
     * Lays out the whole tree and returns the visible nodes in pre-order. Descendants of a node in
     * {@code collapsed} keep whatever position they had before.
     */
    public static List<GraphNode> layout(GraphNode root, Set<String> collapsed) {
        List<GraphNode> visible = new ArrayList<>();
        if (root == null) return visible;

        Set<String> hidden = collapsed != null ? collapsed : Set.of();
        measure(root, hidden);
        place(root, ORIGIN_X, ORIGIN_Y, hidden, visible);
        return visible;
    }

    private static double measure(GraphNode node, Set<String> collapsed) {
        double height = 0;
        if (collapsed.contains(node.getId()) || !node.hasChildren()) {
            height = GraphNode.ROW_HEIGHT + NODE_PADDING;
        } else {
            for (GraphNode child : node.getChildren()) {
                height += measure(child, collapsed);
            }
        }
        node.setSubtreeHeight(height);
        return height;
    }

    private static void place(GraphNode node, double x, double bandTop, Set<String> collapsed, List<GraphNode> visible) {
        node.setX(x);
        node.setY(bandTop + node.getSubtreeHeight() / 2 - GraphNode.ROW_HEIGHT / 2);
        node.setBandTop(bandTop);
        visible.add(node);

        if (collapsed.contains(node.getId())) return;

        double childTop = bandTop;
        double childX = x + node.getWidth() + LEVEL_GAP;
        for (GraphNode child : node.getChildren()) {
            place(child, childX, childTop, collapsed, visible);
            childTop += child.getSubtreeHeight();
        }
    }

    /**
     * Parent/child connections between visible nodes.
     */
    public static List<GraphEdge> edges(Collection<GraphNode> visible, Set<String> collapsed) {
        Map<String, GraphNode> byId = new HashMap<>();
        for (GraphNode node : visible) {
            byId.put(node.getId(), node);
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (GraphNode parent : visible) {
            if (collapsed != null && collapsed.contains(parent.getId())) continue;
            for (GraphNode child : parent.getChildren()) {
                GraphNode shown = byId.get(child.getId());
                if (shown != null) {
                    edges.add(new GraphEdge(parent, shown));
                }
            }
        }
        return edges;
    }

    /**
     * Transform that fits every visible node into a viewport, never scaling above 1.
     */
    public static ViewTransform fit(Collection<GraphNode> visible, double viewportWidth, double viewportHeight) {
        if (visible == null || visible.isEmpty()) {
            return ViewTransform.initial();
        }

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (GraphNode n : visible) {
            minX = Math.min(minX, n.getX());
            minY = Math.min(minY, n.getY());
            maxX = Math.max(maxX, n.getX() + n.getWidth());
            maxY = Math.max(maxY, n.getY() + n.getHeight());
        }

        double contentWidth = maxX - minX;
        double contentHeight = maxY - minY;
        if (contentWidth == 0) contentWidth = FALLBACK_EXTENT;
        if (contentHeight == 0) contentHeight = FALLBACK_EXTENT;

        double scale = Math.min(Math.min((viewportWidth - FIT_MARGIN) / contentWidth,
                (viewportHeight - FIT_MARGIN) / contentHeight), 1);

        return new ViewTransform(
                (viewportWidth - contentWidth * scale) / 2 - minX * scale,
                (viewportHeight - contentHeight * scale) / 2 - minY * scale,
                scale);
    }

    /**
     * Keeps the scale of {@code current} and moves {@code node} to the viewport centre.
     */
    public static ViewTransform centerOn(GraphNode node, ViewTransform current, double viewportWidth, double viewportHeight) {
        double k = current.getScale();
        double cx = node.getX() + node.getWidth() / 2;
        double cy = node.getY() + GraphNode.ROW_HEIGHT / 2;
        return new ViewTransform(viewportWidth / 2 - cx * k, viewportHeight / 2 - cy * k, k);
    }
}
