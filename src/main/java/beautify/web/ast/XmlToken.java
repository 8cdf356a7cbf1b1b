package beautify.web.ast;

/**
 * One lexical unit of an XML/HTML document. Offsets delimit the source span the token was read
 * from; for text tokens {@code content} is the trimmed span.
 */
public class XmlToken {

    public enum Type {
        OPEN,
        CLOSE,
        SELF_CLOSING,
        TEXT,
        COMMENT,
        CDATA,
        PROCESSING_INSTRUCTION,
        DOCTYPE
    }

    private final Type type;
    private final String content;
    private final String name;
    private final String attrs;
    private final int start;
    private final int end;

    public XmlToken(Type type, String content, String name, String attrs, int start, int end) {
        this.type = type;
        this.content = content;
        this.name = name;
        this.attrs = attrs;
        this.start = start;
        this.end = end;
    }

    public static XmlToken of(Type type, String content, int start, int end) {
        return new XmlToken(type, content, null, null, start, end);
    }

    public Type getType() { return type; }
    public String getContent() { return content; }
    public String getName() { return name; }
    public String getAttrs() { return attrs; }
    public int getStart() { return start; }
    public int getEnd() { return end; }

    public boolean is(Type other) {
        return type == other;
    }

    @Override
    public String toString() {
        return "XmlToken{" +
                "type=" + type +
                ", content='" + content + '\'' +
                (name != null ? ", name='" + name + '\'' : "") +
                '}';
    }
}
