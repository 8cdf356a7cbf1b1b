package beautify.web.ast;

import java.util.regex.Pattern;

/**
 * Best-effort stylesheet splitter. A {@code ;} inside {@code url(...)} or a data URI still ends
 * the declaration, so such values come out split.
 */
public class CssParser {

    private static final Pattern COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

    public static CssRoot parse(String css) {
        CssRoot root = new CssRoot();
        if (css == null || css.isEmpty()) return root;

        String clean = COMMENT.matcher(css).replaceAll("");

        int from = 0;
        int close;
        // the segment after the last '}' is never a rule
        while ((close = clean.indexOf('}', from)) != -1) {
            String block = clean.substring(from, close);
            from = close + 1;
            if (block.isBlank()) continue;

            int open = block.indexOf('{');
            if (open == -1) continue;

            String selector = block.substring(0, open).trim();
            String body = block.substring(open + 1);
            int nested = body.indexOf('{');
            if (nested != -1) {
                body = body.substring(0, nested);
            }
            if (selector.isEmpty()) continue;

            CssRule rule = new CssRule(selector);
            parseDeclarations(body.trim(), rule);
            root.addRule(rule);
        }
        return root;
    }

    private static void parseDeclarations(String body, CssRule rule) {
        StringBuilder buffer = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == ';') {
                flush(buffer, rule);
                buffer.setLength(0);
            } else {
                buffer.append(c);
            }
        }
        flush(buffer, rule);
    }

    private static void flush(StringBuilder buffer, CssRule rule) {
        String declaration = buffer.toString();
        if (declaration.isBlank()) return;

        int colon = declaration.indexOf(':');
        if (colon == -1) return;

        String prop = declaration.substring(0, colon).trim();
        if (!prop.isEmpty()) {
            rule.addProperty(prop, declaration.substring(colon + 1).trim());
        }
    }
}
