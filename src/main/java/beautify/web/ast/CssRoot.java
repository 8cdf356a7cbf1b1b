package beautify.web.ast;

import java.util.ArrayList;
import java.util.List;

public class CssRoot {

    private final List<CssRule> rules = new ArrayList<>();

    public List<CssRule> getRules() { return rules; }

    public void addRule(CssRule rule) {
        if (rule != null) {
            rules.add(rule);
        }
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "CssRoot{rules=" + rules + '}';
    }
}
