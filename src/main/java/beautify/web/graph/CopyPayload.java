package beautify.web.graph;

import beautify.web.config.CopyMode;

/**
 * Text handed to the clipboard for a node, and whether it is the node's key or its value.
 */
public class CopyPayload {

    private final String text;
    private final CopyMode kind;

    public CopyPayload(String text, CopyMode kind) {
        this.text = text;
        this.kind = kind;
    }

    /**
     * In value mode a node without a value falls back to its label, reported as a key copy.
     */
    public static CopyPayload of(GraphNode node, CopyMode mode) {
        if (mode == CopyMode.KEY || !node.hasValue()) {
            return new CopyPayload(node.getLabel(), CopyMode.KEY);
        }
        return new CopyPayload(node.getValue(), CopyMode.VALUE);
    }

    public String getText() { return text; }
    public CopyMode getKind() { return kind; }

    public boolean isEmpty() {
        return text == null || text.isEmpty();
    }

    @Override
    public String toString() {
        return "CopyPayload{text='" + text + "', kind=" + kind + '}';
    }
}
