package beautify.web.format;

import beautify.web.ast.AttributeParser;
import beautify.web.ast.XmlToken;
import beautify.web.ast.XmlTokenizer;
import beautify.web.config.BeautifyOptions;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Replays the token stream one construct per line. An element whose only content is a short text
 * run, or nothing, stays on a single line.
 */
public class XmlFormatter implements Formatter {

    static final int INLINE_TEXT_LIMIT = 60;

    @Override
    public String format(String content, BeautifyOptions options) {
        List<XmlToken> tokens = XmlTokenizer.tokenize(content);
        String indent = options.indentUnit();
        StringBuilder result = new StringBuilder();
        int depth = 0;

        for (int i = 0; i < tokens.size(); i++) {
            XmlToken t = tokens.get(i);
            XmlToken next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            XmlToken next2 = i + 2 < tokens.size() ? tokens.get(i + 2) : null;

            switch (t.getType()) {
                case OPEN: {
                    String openTag = "<" + t.getName() + attributes(t.getAttrs(), options.xmlSortAttributes) + ">";
                    if (XmlTokenizer.isVoidTag(t.getName())) {
                        addLine(result, indent, depth, openTag);
                    } else if (next != null && next.is(XmlToken.Type.TEXT)
                            && next2 != null && closes(next2, t)
                            && next.getContent().length() < INLINE_TEXT_LIMIT) {
                        addLine(result, indent, depth, openTag + next.getContent() + next2.getContent());
                        i += 2;
                    } else if (next != null && closes(next, t)) {
                        addLine(result, indent, depth, openTag + next.getContent());
                        i += 1;
                    } else {
                        addLine(result, indent, depth, openTag);
                        depth++;
                    }
                    break;
                }
                case CLOSE:
                    if (!XmlTokenizer.isVoidTag(t.getName())) {
                        depth = Math.max(0, depth - 1);
                        addLine(result, indent, depth, t.getContent());
                    }
                    break;
                case SELF_CLOSING: {
                    String suffix = options.xmlSpaceBeforeSlash ? " />" : "/>";
                    addLine(result, indent, depth,
                            "<" + t.getName() + attributes(t.getAttrs(), options.xmlSortAttributes) + suffix);
                    break;
                }
                default:
                    addLine(result, indent, depth, t.getContent());
                    break;
            }
        }
        return result.toString().trim();
    }

    private static boolean closes(XmlToken candidate, XmlToken open) {
        return candidate.is(XmlToken.Type.CLOSE) && candidate.getName().equals(open.getName());
    }

    private static void addLine(StringBuilder result, String indent, int depth, String line) {
        result.append('\n').append(indent.repeat(depth)).append(line);
    }

    /**
     * Attributes in their original source spelling, space separated, with a leading space.
     */
    static String attributes(String attrStr, boolean sort) {
        if (attrStr == null || attrStr.isBlank()) return "";

        List<AttributeParser.Attribute> attrs = AttributeParser.scan(attrStr);
        if (sort) {
            attrs.sort(Comparator.comparing(a -> a.name.toLowerCase(Locale.ROOT)));
        }
        return " " + attrs.stream().map(a -> a.source).collect(Collectors.joining(" "));
    }
}
