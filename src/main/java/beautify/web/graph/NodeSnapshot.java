package beautify.web.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Flat, serializable copy of a placed node.
 */
public class NodeSnapshot {
    public String id;
    public String label;
    public String value;
    public String kind;
    public double x;
    public double y;
    public double width;
    public double height;
    public boolean collapsed;
    public List<String> children;

    public static NodeSnapshot of(GraphNode node, boolean collapsed) {
        NodeSnapshot s = new NodeSnapshot();
        s.id = node.getId();
        s.label = node.getLabel();
        s.value = node.getValue();
        s.kind = node.getKind().name().toLowerCase();
        s.x = node.getX();
        s.y = node.getY();
        s.width = node.getWidth();
        s.height = node.getHeight();
        s.collapsed = collapsed;
        s.children = new ArrayList<>();
        for (GraphNode child : node.getChildren()) {
            s.children.add(child.getId());
        }
        return s;
    }

    @Override
    public String toString() {
        return "NodeSnapshot{" +
                "id='" + id + '\'' +
                ", x=" + x +
                ", y=" + y +
                '}';
    }
}
