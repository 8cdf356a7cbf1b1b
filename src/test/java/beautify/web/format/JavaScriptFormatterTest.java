package beautify.web.format;

import beautify.web.config.BeautifyOptions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JavaScriptFormatterTest {

    private final JavaScriptFormatter formatter = new JavaScriptFormatter();

    private String format(String content) {
        return formatter.format(content, BeautifyOptions.defaults());
    }

    @Test
    void testFunctionBody() {
        assertEquals("function f(){\n    return 1;\n}", format("function f(){return 1;}"));
    }

    @Test
    void testArrayLiteral() {
        assertEquals("var a=[\n    1,\n    2\n];\n", format("var a=[1,2];"));
    }

    @Test
    void testStringContentsAreNotRestructured() {
        assertEquals("var s=\"a{b;c\";\n", format("var s=\"a{b;c\";"));
        assertEquals("var s='x,\\'y';\n", format("var s='x,\\'y';"));
    }

    @Test
    void testSpaceBeforeAnonymousFunction() {
        BeautifyOptions spaced = BeautifyOptions.defaults().withSpaceBeforeAnonFunc(true);
        assertEquals("var f=function (){\n}", formatter.format("var f=function(){}", spaced));
        assertEquals("var f=function(){\n}", format("var f=function  (){}"));
    }

    @Test
    void testUnbalancedClosersDoNotGoNegative() {
        assertEquals("}\n}", format("}}"));
    }

    @Test
    void testIdempotentOnSimpleCode() {
        String once = format("function f(){if(a){b();}return [1,2];}");
        assertEquals(once, format(once));
    }
}
