package beautify.web.ast;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttributeParserTest {

    @Test
    void testQuotedSingleQuotedBareAndEmpty() {
        Map<String, String> attrs = AttributeParser.parse(" a=\"1\" b='2' c=3 d");
        assertEquals(Map.of("a", "1", "b", "2", "c", "3", "d", ""), attrs);
    }

    @Test
    void testLaterDuplicateWins() {
        Map<String, String> attrs = AttributeParser.parse("a=\"1\" a=\"2\"");
        assertEquals(1, attrs.size());
        assertEquals("2", attrs.get("a"));
    }

    @Test
    void testNamespacedAndDottedNames() {
        Map<String, String> attrs = AttributeParser.parse("xlink:href=\"#x\" data-v.1=ok");
        assertEquals("#x", attrs.get("xlink:href"));
        assertEquals("ok", attrs.get("data-v.1"));
    }

    @Test
    void testGarbageIsSkipped() {
        Map<String, String> attrs = AttributeParser.parse("@@@ x=\"1\" !!");
        assertEquals(Map.of("x", "1"), attrs);
    }

    @Test
    void testEmptyInput() {
        assertTrue(AttributeParser.parse("").isEmpty());
        assertTrue(AttributeParser.parse(null).isEmpty());
    }

    @Test
    void testScanKeepsSourceSpelling() {
        List<AttributeParser.Attribute> attrs = AttributeParser.scan("a = \"1\"  b='x y'");
        assertEquals(2, attrs.size());
        assertEquals("a = \"1\"", attrs.get(0).source);
        assertEquals("b='x y'", attrs.get(1).source);
        assertEquals("x y", attrs.get(1).value);
    }
}
