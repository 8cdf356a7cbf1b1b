package beautify.web.graph;

/**
 * Connection from the right middle of a parent box to the left middle of a child box.
 */
public class GraphEdge {

    private final GraphNode from;
    private final GraphNode to;

    public GraphEdge(GraphNode from, GraphNode to) {
        this.from = from;
        this.to = to;
    }

    public GraphNode getFrom() { return from; }
    public GraphNode getTo() { return to; }

    public double getSourceX() { return from.getX() + from.getWidth(); }
    public double getSourceY() { return from.getY() + GraphNode.ROW_HEIGHT / 2; }
    public double getTargetX() { return to.getX(); }
    public double getTargetY() { return to.getY() + GraphNode.ROW_HEIGHT / 2; }

    @Override
    public String toString() {
        return "GraphEdge{" + from.getId() + " -> " + to.getId() + '}';
    }
}
