package beautify.web.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class AttributeParser {

    private static final Pattern ATTRIBUTE = Pattern.compile(
            "([a-zA-Z0-9_\\-:.]+)(?:\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+)))?");

    /**
     * A single attribute occurrence together with the exact source text it was read from.
     */
    public static class Attribute {
        public final String name;
        public final String value;
        public final String source;

        public Attribute(String name, String value, String source) {
            this.name = name;
            this.value = value;
            this.source = source;
        }

        @Override
        public String toString() {
            return source;
        }
    }

    public static List<Attribute> scan(String attrStr) {
        List<Attribute> result = new ArrayList<>();
        if (attrStr == null || attrStr.isEmpty()) return result;

        Matcher m = ATTRIBUTE.matcher(attrStr);
        while (m.find()) {
            result.add(new Attribute(m.group(1), firstNonNull(m.group(2), m.group(3), m.group(4)), m.group()));
        }
        return result;
    }

    /**
     * Name to value, in first-seen order; a repeated name keeps its position but takes the later value.
     */
    public static Map<String, String> parse(String attrStr) {
        Map<String, String> attrs = new LinkedHashMap<>();
        for (Attribute attribute : scan(attrStr)) {
            attrs.put(attribute.name, attribute.value);
        }
        return attrs;
    }

    private static String firstNonNull(String... candidates) {
        for (String c : candidates) {
            if (c != null) return c;
        }
        return "";
    }
}
