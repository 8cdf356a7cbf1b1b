package beautify.web.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reduces a token stream to a tree with a single stack of open ancestors. A close tag that does
 * not name the current top of the stack is ignored, so overlapping tags leave later content nested
 * under the unclosed element.
 */
public class XmlTreeBuilder {

    public static XmlTreeNode build(String xml) {
        return build(XmlTokenizer.tokenize(xml));
    }

    public static XmlTreeNode build(List<XmlToken> tokens) {
        XmlTreeNode root = XmlTreeNode.root();
        Deque<XmlTreeNode> stack = new ArrayDeque<>();
        stack.push(root);

        for (XmlToken token : tokens) {
            XmlTreeNode parent = stack.peek();

            switch (token.getType()) {
                case OPEN: {
                    XmlTreeNode node = XmlTreeNode.element(token.getName(), AttributeParser.parse(token.getAttrs()));
                    parent.addChild(node);
                    if (!XmlTokenizer.isVoidTag(token.getName())) {
                        stack.push(node);
                    }
                    break;
                }
                case SELF_CLOSING:
                    parent.addChild(XmlTreeNode.element(token.getName(), AttributeParser.parse(token.getAttrs())));
                    break;
                case CLOSE:
                    if (stack.size() > 1 && parent.getTag().equals(token.getName())) {
                        if ("style".equalsIgnoreCase(parent.getTag())) {
                            rewriteStyle(parent);
                        }
                        stack.pop();
                    }
                    break;
                case TEXT:
                case CDATA:
                    if (!token.getContent().trim().isEmpty()) {
                        parent.addChild(XmlTreeNode.text(token.getContent()));
                    }
                    break;
                default:
                    // comments, processing instructions and doctypes are not part of the tree
                    break;
            }
        }
        return root;
    }

    private static void rewriteStyle(XmlTreeNode style) {
        StringBuilder css = new StringBuilder();
        for (XmlTreeNode child : style.getChildren()) {
            if (child.isText()) {
                css.append(child.getText());
            }
        }

        List<XmlTreeNode> rules = new ArrayList<>();
        for (CssRule rule : CssParser.parse(css.toString()).getRules()) {
            XmlTreeNode ruleNode = XmlTreeNode.cssRule(rule.getSelector());
            for (CssRule.Declaration declaration : rule.getProperties()) {
                ruleNode.addChild(XmlTreeNode.cssProp(declaration.prop, declaration.val));
            }
            rules.add(ruleNode);
        }
        style.replaceChildren(rules);
    }
}
