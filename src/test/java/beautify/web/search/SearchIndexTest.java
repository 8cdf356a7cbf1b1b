package beautify.web.search;

import beautify.web.config.Language;
import beautify.web.graph.GraphNode;
import beautify.web.graph.JsonGraphBuilder;
import beautify.web.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SearchIndexTest {

    private static final String DOC = "{\"a\": {\"b\": 1, \"c\": \"abc\"}}";

    // ========== JSON ==========

    @Test
    void testKeyAndValueMatches() {
        assertEquals(List.of("ROOT|a|b", "ROOT|a|c"), SearchIndex.searchJson(JsonUtil.parseOrNull(DOC), "b"));
    }

    @Test
    void testValueOnlyMatch() {
        assertEquals(List.of("ROOT|a|c"), SearchIndex.searchJson(JsonUtil.parseOrNull(DOC), "abc"));
    }

    @Test
    void testCaseInsensitive() {
        assertEquals(List.of("ROOT|a|c"), SearchIndex.searchJson(JsonUtil.parseOrNull(DOC), "ABC"));
    }

    @Test
    void testArrayIndicesAndNull() {
        assertEquals(List.of("ROOT|list|1"),
                SearchIndex.searchJson(JsonUtil.parseOrNull("{\"list\":[\"x\",\"Y\"]}"), "y"));
        assertEquals(List.of("ROOT|k"),
                SearchIndex.searchJson(JsonUtil.parseOrNull("{\"k\":null}"), "nul"));
    }

    @Test
    void testContainersMatchOnKeyOnly() {
        assertTrue(SearchIndex.searchJson(JsonUtil.parseOrNull("{\"o\":{\"p\":[]}}"), "[").isEmpty());
        assertEquals(List.of("ROOT|o"), SearchIndex.searchJson(JsonUtil.parseOrNull("{\"o\":{\"p\":[]}}"), "o"));
    }

    @Test
    void testPathsUseEscapedKeysLikeTheGraph() {
        String doc = "{\"a|b\":1,\"a\":{\"b\":2}}";
        assertEquals(List.of("ROOT|a\\|b"), SearchIndex.searchJson(JsonUtil.parseOrNull(doc), "a|b"));

        GraphNode root = JsonGraphBuilder.build(JsonUtil.parseOrNull(doc));
        for (String path : SearchIndex.searchJson(JsonUtil.parseOrNull(doc), "b")) {
            assertNotNull(root.find(path), path);
        }
    }

    @Test
    void testJsonSearchReturnsNodeMatches() {
        List<SearchMatch> matches = SearchIndex.search(DOC, Language.JSON, "abc");
        assertEquals(List.of(SearchMatch.node("ROOT|a|c")), matches);
        assertTrue(matches.get(0).isNode());
    }

    @Test
    void testUnparsableJsonFallsBackToText() {
        List<SearchMatch> matches = SearchIndex.search("{\"a\": oops", Language.JSON, "oops");
        assertEquals(List.of(SearchMatch.text(6, 10)), matches);
    }

    // ========== Text ==========

    @Test
    void testTextRanges() {
        List<SearchMatch> matches = SearchIndex.searchText("Hello hello HELLO", "hello");
        assertEquals(List.of(SearchMatch.text(0, 5), SearchMatch.text(6, 11), SearchMatch.text(12, 17)), matches);
    }

    @Test
    void testNonAsciiRangesFollowTheMatch() {
        assertEquals(List.of(SearchMatch.text(4, 9)), SearchIndex.searchText("Une ÉCOLE", "école"));
    }

    @Test
    void testTermIsLiteral() {
        assertEquals(List.of(SearchMatch.text(4, 7)), SearchIndex.searchText("a.b a*b", "a*b"));
        assertEquals(List.of(SearchMatch.text(0, 3)), SearchIndex.searchText("a.b a*b", "a.b"));
    }

    @Test
    void testEmptyTermMatchesNothing() {
        assertTrue(SearchIndex.search("anything", Language.CSS, "").isEmpty());
        assertTrue(SearchIndex.search("anything", Language.CSS, null).isEmpty());
        assertTrue(SearchIndex.searchText("", "x").isEmpty());
    }
}
