package beautify.web.search;

import java.util.Objects;

/**
 * Either a structural node id (JSON) or a half-open character range in formatted text.
 */
public class SearchMatch {

    public enum Type {
        NODE,
        TEXT
    }

    private final Type type;
    private final String nodeId;
    private final int start;
    private final int end;

    private SearchMatch(Type type, String nodeId, int start, int end) {
        this.type = type;
        this.nodeId = nodeId;
        this.start = start;
        this.end = end;
    }

    public static SearchMatch node(String nodeId) {
        return new SearchMatch(Type.NODE, nodeId, -1, -1);
    }

    public static SearchMatch text(int start, int end) {
        return new SearchMatch(Type.TEXT, null, start, end);
    }

    public Type getType() { return type; }
    public String getNodeId() { return nodeId; }
    public int getStart() { return start; }
    public int getEnd() { return end; }

    public boolean isNode() {
        return type == Type.NODE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchMatch)) return false;
        SearchMatch m = (SearchMatch) o;
        return type == m.type && start == m.start && end == m.end && Objects.equals(nodeId, m.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, nodeId, start, end);
    }

    @Override
    public String toString() {
        return type == Type.NODE
                ? "SearchMatch{node='" + nodeId + "'}"
                : "SearchMatch{text=[" + start + ", " + end + ")}";
    }
}
