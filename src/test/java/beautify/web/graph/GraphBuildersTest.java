package beautify.web.graph;

import beautify.web.ast.CssParser;
import beautify.web.ast.XmlTreeBuilder;
import beautify.web.config.Language;
import beautify.web.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphBuildersTest {

    // ========== Helper Methods ==========

    private static List<String> ids(GraphNode root) {
        List<String> ids = new ArrayList<>();
        collect(root, ids);
        return ids;
    }

    private static void collect(GraphNode node, List<String> ids) {
        ids.add(node.getId());
        for (GraphNode child : node.getChildren()) {
            collect(child, ids);
        }
    }

    private static void assertPrefixInvariant(GraphNode node) {
        for (GraphNode child : node.getChildren()) {
            assertTrue(child.getId().startsWith(node.getId() + GraphNode.ID_SEP), child.getId());
            assertPrefixInvariant(child);
        }
    }

    // ========== JSON ==========

    @Test
    void testJsonIdsLabelsAndValues() {
        GraphNode root = JsonGraphBuilder.build(JsonUtil.parseOrNull("{\"a\":{\"b\":1,\"c\":\"abc\"},\"arr\":[true,null]}"));
        assertEquals(List.of("ROOT", "ROOT|a", "ROOT|a|b", "ROOT|a|c", "ROOT|arr", "ROOT|arr|0", "ROOT|arr|1"), ids(root));
        assertPrefixInvariant(root);

        assertEquals("ROOT", root.getLabel());
        assertEquals(NodeKind.OBJECT, root.getKind());
        assertFalse(root.hasValue());

        GraphNode b = root.find("ROOT|a|b");
        assertEquals("b", b.getLabel());
        assertEquals("1", b.getValue());
        assertEquals(NodeKind.VALUE, b.getKind());

        GraphNode arr = root.find("ROOT|arr");
        assertEquals(NodeKind.ARRAY, arr.getKind());
        assertEquals("true", root.find("ROOT|arr|0").getValue());

        GraphNode nullLeaf = root.find("ROOT|arr|1");
        assertEquals(NodeKind.VALUE, nullLeaf.getKind());
        assertFalse(nullLeaf.hasValue());
    }

    @Test
    void testJsonWidthUsesTruncatedValue() {
        GraphNode root = JsonGraphBuilder.build(JsonUtil.parseOrNull("{\"k\":\"abcdefghijklmnopqrstuvwxyz\"}"));
        GraphNode k = root.find("ROOT|k");
        assertEquals("abcdefghijklmnopqrstuvwxyz", k.getValue());
        // "k: " + 20 chars + "..."
        assertEquals(26 * 8 + 40, k.getWidth());
        assertEquals(80, root.getWidth());
    }

    @Test
    void testScalarDocumentIsSingleNode() {
        GraphNode root = JsonGraphBuilder.build(JsonUtil.parseOrNull("\"hi\""));
        assertEquals("hi", root.getValue());
        assertFalse(root.hasChildren());
    }

    @Test
    void testSeparatorInsideJsonKeyIsEscaped() {
        GraphNode root = JsonGraphBuilder.build(JsonUtil.parseOrNull("{\"a|b\":1,\"a\":{\"b\":2}}"));
        assertEquals(List.of("ROOT", "ROOT|a\\|b", "ROOT|a", "ROOT|a|b"), ids(root));
        assertEquals("1", root.find("ROOT|a\\|b").getValue());
        assertEquals("2", root.find("ROOT|a|b").getValue());
        assertEquals("a|b", root.find("ROOT|a\\|b").getLabel());
        assertPrefixInvariant(root);
    }

    @Test
    void testBackslashInsideJsonKeyIsEscaped() {
        // a key ending in a backslash must not collide with a key holding the separator
        GraphNode root = JsonGraphBuilder.build(JsonUtil.parseOrNull("{\"a\\\\\":{\"b\":1},\"a|b\":2}"));
        List<String> ids = ids(root);
        assertEquals(ids.size(), new HashSet<>(ids).size(), ids.toString());
        assertEquals("1", root.find("ROOT|a\\\\|b").getValue());
        assertEquals("2", root.find("ROOT|a\\|b").getValue());
        assertPrefixInvariant(root);
    }

    // ========== XML ==========

    @Test
    void testXmlAttributesTextAndElements() {
        GraphNode root = XmlGraphBuilder.build(XmlTreeBuilder.build("<a x=\"1\">hello<b/></a>"));
        assertEquals(List.of("ROOT", "ROOT|a0", "ROOT|a0|@x", "ROOT|a0|txt0", "ROOT|a0|b1"), ids(root));
        assertPrefixInvariant(root);

        GraphNode attr = root.find("ROOT|a0|@x");
        assertEquals("@x", attr.getLabel());
        assertEquals("1", attr.getValue());

        GraphNode text = root.find("ROOT|a0|txt0");
        assertEquals("#text", text.getLabel());
        assertEquals("hello", text.getValue());
        assertEquals("#text: hello".length() * 8 + 40, text.getWidth());

        assertEquals("b", root.find("ROOT|a0|b1").getLabel());
    }

    @Test
    void testXmlLongTextIsTruncated() {
        String text = "t".repeat(30);
        GraphNode root = XmlGraphBuilder.build(XmlTreeBuilder.build("<p>" + text + "</p>"));
        assertEquals("t".repeat(20) + "...", root.find("ROOT|p0|txt0").getValue());
    }

    @Test
    void testXmlStyleRulesBecomeSubtrees() {
        GraphNode root = XmlGraphBuilder.build(XmlTreeBuilder.build("<style>.a{color:red;}</style>"));
        GraphNode rule = root.find("ROOT|style0|.a0");
        assertNotNull(rule);
        assertEquals(".a", rule.getLabel());

        GraphNode prop = rule.find("ROOT|style0|.a0|prop-0");
        assertEquals("color", prop.getLabel());
        assertEquals("red", prop.getValue());
    }

    // ========== CSS ==========

    @Test
    void testCssRulesAndProperties() {
        GraphNode root = CssGraphBuilder.build(CssParser.parse(".a{color:red;margin:0}"));
        assertEquals(List.of("ROOT", "ROOT|rule0", "ROOT|rule0|prop-0", "ROOT|rule0|prop-1"), ids(root));
        assertEquals("StyleSheet", root.getLabel());
        assertEquals(100, root.getWidth());
        assertEquals(".a", root.find("ROOT|rule0").getLabel());
        GraphNode margin = root.find("ROOT|rule0|prop-1");
        assertEquals("margin", margin.getLabel());
        assertEquals("0", margin.getValue());
    }

    @Test
    void testRepeatedCssPropertiesGetDistinctIds() {
        GraphNode root = CssGraphBuilder.build(CssParser.parse(".a{display:-webkit-box;display:flex;}"));
        List<String> ids = ids(root);
        assertEquals(ids.size(), new HashSet<>(ids).size(), ids.toString());
        assertEquals("-webkit-box", root.find("ROOT|rule0|prop-0").getValue());
        assertEquals("flex", root.find("ROOT|rule0|prop-1").getValue());
    }

    // ========== Dispatch ==========

    @Test
    void testUnsupportedOrUnparsableContent() {
        assertTrue(GraphBuilders.build("{a", Language.JSON).isEmpty());
        assertTrue(GraphBuilders.build("var a = 1;", Language.JAVASCRIPT).isEmpty());
        assertTrue(GraphBuilders.build("plain", Language.TEXT).isEmpty());
        assertTrue(GraphBuilders.build(null, Language.JSON).isEmpty());
    }

    @Test
    void testSupportedContent() {
        assertTrue(GraphBuilders.build("{\"a\":1}", Language.JSON).isPresent());
        assertTrue(GraphBuilders.build("<a/>", Language.XML).isPresent());
        assertTrue(GraphBuilders.build("a{b:c}", Language.CSS).isPresent());
    }
}
