package beautify.web.graph;

import beautify.web.ast.XmlTreeNode;

import java.util.List;
import java.util.Map;

/**
 * Attributes become {@code @name} leaves, text runs become {@code #text} leaves, and rewritten
 * style rules keep their declarations as leaves.
 */
public class XmlGraphBuilder {

    public static GraphNode build(XmlTreeNode tree) {
        return build(tree, GraphNode.ROOT_ID);
    }

    private static GraphNode build(XmlTreeNode tree, String path) {
        GraphNode node = new GraphNode(path, tree.getTag(), null, NodeKind.OBJECT);
        node.setWidth(GraphNode.measureText(tree.getTag()));

        if (tree.getType() == XmlTreeNode.Type.CSS_RULE) {
            List<XmlTreeNode> props = tree.getChildren();
            for (int i = 0; i < props.size(); i++) {
                XmlTreeNode prop = props.get(i);
                if (prop.getType() == XmlTreeNode.Type.CSS_PROP) {
                    node.addChild(leaf(node.childId("prop-" + i), prop.getTag(), prop.getCssValue(),
                            prop.getTag() + ": " + prop.getCssValue()));
                }
            }
            return node;
        }

        for (Map.Entry<String, String> attr : tree.getAttrs().entrySet()) {
            String label = "@" + attr.getKey();
            node.addChild(leaf(node.childId(label), label, attr.getValue(), label + ": " + attr.getValue()));
        }

        List<XmlTreeNode> children = tree.getChildren();
        for (int i = 0; i < children.size(); i++) {
            XmlTreeNode child = children.get(i);
            if (child.isText()) {
                String text = child.getText().trim();
                if (!text.isEmpty()) {
                    node.addChild(leaf(node.childId("txt" + i), "#text", JsonGraphBuilder.truncate(text),
                            "#text: " + text));
                }
            } else {
                node.addChild(build(child, node.childId(child.getTag() + i)));
            }
        }
        return node;
    }

    private static GraphNode leaf(String id, String label, String value, String measured) {
        GraphNode leaf = new GraphNode(id, label, value, NodeKind.VALUE);
        leaf.setWidth(GraphNode.measureText(measured));
        return leaf;
    }
}
