package beautify.web.graph;

import java.util.List;
import java.util.Set;

public class GraphStatistics {

    public int totalNodes;
    public int visibleNodes;
    public int leafNodes;
    public int containerNodes;
    public int maxDepth;
    public int collapsedNodes;

    public static GraphStatistics compute(GraphNode root, List<GraphNode> visible, Set<String> collapsed) {
        GraphStatistics stats = new GraphStatistics();
        if (root == null) return stats;

        walk(root, 0, stats);
        stats.visibleNodes = visible != null ? visible.size() : 0;
        if (collapsed != null) {
            for (String id : collapsed) {
                if (root.find(id) != null) stats.collapsedNodes++;
            }
        }
        return stats;
    }

    private static void walk(GraphNode node, int depth, GraphStatistics stats) {
        stats.totalNodes++;
        stats.maxDepth = Math.max(stats.maxDepth, depth);
        if (node.hasChildren()) {
            stats.containerNodes++;
            for (GraphNode child : node.getChildren()) {
                walk(child, depth + 1, stats);
            }
        } else {
            stats.leafNodes++;
        }
    }

    @Override
    public String toString() {
        return String.format(
                "=== Graph Statistics ===\n" +
                "Total nodes:     %d\n" +
                "Visible nodes:   %d\n" +
                "Containers:      %d\n" +
                "Leaves:          %d\n" +
                "Max depth:       %d\n" +
                "Collapsed:       %d\n",
                totalNodes, visibleNodes, containerNodes, leafNodes, maxDepth, collapsedNodes
        );
    }
}
