package beautify.web.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class XmlTreeNode {

    public enum Type {
        ROOT,
        ELEMENT,
        TEXT,
        CSS_RULE,
        CSS_PROP
    }

    private final Type type;
    private final String tag;
    private final Map<String, String> attrs;
    private final String text;      // TEXT payload
    private final String cssValue;  // CSS_PROP declared value
    private List<XmlTreeNode> children = new ArrayList<>();

    private XmlTreeNode(Type type, String tag, Map<String, String> attrs, String text, String cssValue) {
        this.type = type;
        this.tag = tag;
        this.attrs = attrs != null ? attrs : new LinkedHashMap<>();
        this.text = text;
        this.cssValue = cssValue;
    }

    public static XmlTreeNode root() {
        return new XmlTreeNode(Type.ROOT, "ROOT", null, null, null);
    }

    public static XmlTreeNode element(String tag, Map<String, String> attrs) {
        return new XmlTreeNode(Type.ELEMENT, tag != null ? tag : "unknown", attrs, null, null);
    }

    public static XmlTreeNode text(String text) {
        return new XmlTreeNode(Type.TEXT, null, null, text, null);
    }

    public static XmlTreeNode cssRule(String selector) {
        return new XmlTreeNode(Type.CSS_RULE, selector, null, null, null);
    }

    public static XmlTreeNode cssProp(String prop, String value) {
        return new XmlTreeNode(Type.CSS_PROP, prop, null, null, value);
    }

    public Type getType() { return type; }
    public String getTag() { return tag; }
    public Map<String, String> getAttrs() { return Collections.unmodifiableMap(attrs); }
    public String getText() { return text; }
    public String getCssValue() { return cssValue; }
    public List<XmlTreeNode> getChildren() { return Collections.unmodifiableList(children); }

    public boolean isText() {
        return type == Type.TEXT;
    }

    void addChild(XmlTreeNode child) {
        children.add(child);
    }

    void replaceChildren(List<XmlTreeNode> replacement) {
        children = new ArrayList<>(replacement);
    }

    @Override
    public String toString() {
        if (type == Type.TEXT) {
            return "XmlTreeNode{TEXT '" + text + "'}";
        }
        return "XmlTreeNode{" +
                "type=" + type +
                ", tag='" + tag + '\'' +
                ", attrs=" + attrs +
                (cssValue != null ? ", cssValue='" + cssValue + '\'' : "") +
                ", children=" + children.size() +
                '}';
    }
}
