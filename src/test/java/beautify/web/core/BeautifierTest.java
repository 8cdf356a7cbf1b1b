package beautify.web.core;

import beautify.web.config.BeautifyOptions;
import beautify.web.config.Language;
import beautify.web.format.Formatter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BeautifierTest {

    private final BeautifyOptions options = BeautifyOptions.defaults();

    @Test
    void testBlankInputFormatsToEmpty() {
        assertEquals("", Beautifier.format("", Language.JSON, options));
        assertEquals("", Beautifier.format("   \n", Language.XML, options));
        assertEquals("", Beautifier.format(null, options));
    }

    @Test
    void testTextIsReturnedAsIs() {
        assertEquals("just words", Beautifier.format("just words", Language.TEXT, options));
    }

    @Test
    void testMissingOptionsMeanDefaults() {
        assertEquals("{\n    \"a\": 1\n}", Beautifier.format("{\"a\":1}", Language.JSON, null));
    }

    @Test
    void testFailingFormatterKeepsInput() {
        Formatter broken = (content, opts) -> {
            throw new IllegalStateException("boom");
        };
        assertEquals("<a><b></a>", Beautifier.format("<a><b></a>", Language.XML, broken, options));
    }

    @Test
    void testDetectsBeforeFormatting() {
        assertEquals("{\n    \"a\": 1\n}", Beautifier.format("{\"a\":1}", options));
        assertEquals(".a {\n    color:red;\n}", Beautifier.format(".a{color:red;}", options));
    }

    @Test
    void testGraphOnlyForStructuredLanguages() {
        assertNotNull(Beautifier.buildGraph("{\"a\":1}", Language.JSON));
        assertNull(Beautifier.buildGraph("var a;", Language.JAVASCRIPT));
    }
}
