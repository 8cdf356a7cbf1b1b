package beautify.web.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node of the positional graph. Identity is the structural path in {@code id}; every descendant id
 * starts with its ancestor's id followed by {@link #ID_SEP}. Position fields are written by
 * {@link GraphLayout} and by manual moves.
 */
public class GraphNode {

    public static final String ID_SEP = "|";
    public static final String ROOT_ID = "ROOT";

    public static final double ROW_HEIGHT = 30;
    static final int CHAR_WIDTH = 8;
    static final int PAD_X = 20;
    static final int MIN_WIDTH = 80;

    private final String id;
    private final String label;
    private final String value;
    private final NodeKind kind;
    private final List<GraphNode> children = new ArrayList<>();

    private double x;
    private double y;
    private double width;
    private double height = ROW_HEIGHT;

    // written by the size pass
    private double subtreeHeight;
    private double bandTop;

    public GraphNode(String id, String label, String value, NodeKind kind) {
        this.id = id;
        this.label = label;
        this.value = value;
        this.kind = kind;
    }

    public static double measureText(String text) {
        int length = text != null ? text.length() : 0;
        return Math.max(MIN_WIDTH, length * CHAR_WIDTH + PAD_X * 2);
    }

    public String getId() { return id; }
    public String getLabel() { return label; }
    public String getValue() { return value; }
    public NodeKind getKind() { return kind; }
    public List<GraphNode> getChildren() { return children; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }
    public double getSubtreeHeight() { return subtreeHeight; }
    public double getBandTop() { return bandTop; }

    public void setX(double x) { this.x = x; }
    public void setY(double y) { this.y = y; }
    public void setWidth(double width) { this.width = width; }
    public void setHeight(double height) { this.height = height; }
    void setSubtreeHeight(double subtreeHeight) { this.subtreeHeight = subtreeHeight; }
    void setBandTop(double bandTop) { this.bandTop = bandTop; }

    public boolean hasValue() {
        return value != null;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public GraphNode addChild(GraphNode child) {
        children.add(child);
        return this;
    }

    /**
     * True when {@code otherId} lies strictly below this node.
     */
    public boolean isAncestorOf(String otherId) {
        return otherId != null && otherId.startsWith(id + ID_SEP);
    }

    public String childId(String segment) {
        return id + ID_SEP + escapeSegment(segment);
    }

    /**
     * Escapes backslashes and separators inside one path segment so that distinct paths always
     * yield distinct ids.
     */
    public static String escapeSegment(String segment) {
        if (segment == null) return "";
        return segment.replace("\\", "\\\\").replace(ID_SEP, "\\" + ID_SEP);
    }

    public GraphNode find(String targetId) {
        if (id.equals(targetId)) return this;
        if (!isAncestorOf(targetId)) return null;
        for (GraphNode child : children) {
            GraphNode found = child.find(targetId);
            if (found != null) return found;
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphNode)) return false;
        GraphNode other = (GraphNode) o;
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "GraphNode{" +
                "id='" + id + '\'' +
                ", label='" + label + '\'' +
                (value != null ? ", value='" + value + '\'' : "") +
                ", kind=" + kind +
                ", x=" + x +
                ", y=" + y +
                ", width=" + width +
                '}';
    }
}
