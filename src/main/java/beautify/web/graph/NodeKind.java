package beautify.web.graph;

public enum NodeKind {
    OBJECT,
    ARRAY,
    VALUE
}
