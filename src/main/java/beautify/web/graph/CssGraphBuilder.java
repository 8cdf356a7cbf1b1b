package beautify.web.graph;

import beautify.web.ast.CssRoot;
import beautify.web.ast.CssRule;

import java.util.List;

public class CssGraphBuilder {

    static final String ROOT_LABEL = "StyleSheet";
    static final double ROOT_WIDTH = 100;

    public static GraphNode build(CssRoot css) {
        GraphNode root = new GraphNode(GraphNode.ROOT_ID, ROOT_LABEL, null, NodeKind.OBJECT);
        root.setWidth(ROOT_WIDTH);

        List<CssRule> rules = css.getRules();
        for (int i = 0; i < rules.size(); i++) {
            CssRule rule = rules.get(i);
            GraphNode ruleNode = new GraphNode(root.childId("rule" + i), rule.getSelector(), null, NodeKind.OBJECT);
            ruleNode.setWidth(GraphNode.measureText(rule.getSelector()));

            List<CssRule.Declaration> declarations = rule.getProperties();
            for (int j = 0; j < declarations.size(); j++) {
                CssRule.Declaration declaration = declarations.get(j);
                // repeated properties (vendor fallbacks) need distinct ids
                GraphNode prop = new GraphNode(ruleNode.childId("prop-" + j), declaration.prop,
                        declaration.val, NodeKind.VALUE);
                prop.setWidth(GraphNode.measureText(declaration.prop + ": " + declaration.val));
                ruleNode.addChild(prop);
            }
            root.addChild(ruleNode);
        }
        return root;
    }
}
