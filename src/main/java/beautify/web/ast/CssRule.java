package beautify.web.ast;

import java.util.ArrayList;
import java.util.List;

public class CssRule {

    public static class Declaration {
        public final String prop;
        public final String val;

        public Declaration(String prop, String val) {
            this.prop = prop;
            this.val = val;
        }

        @Override
        public String toString() {
            return prop + ": " + val;
        }
    }

    private final String selector;
    private final List<Declaration> properties = new ArrayList<>();

    public CssRule(String selector) {
        this.selector = selector;
    }

    public String getSelector() { return selector; }
    public List<Declaration> getProperties() { return properties; }

    public void addProperty(String prop, String val) {
        properties.add(new Declaration(prop, val));
    }

    @Override
    public String toString() {
        return "CssRule{" +
                "selector='" + selector + '\'' +
                ", properties=" + properties +
                '}';
    }
}
