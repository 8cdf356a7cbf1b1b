package beautify.web.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Permissive single-pass XML/HTML scanner. Unterminated constructs run to end of input; no input
 * makes it throw.
 */
public class XmlTokenizer {

    public static final Set<String> VOID_TAGS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img",
            "input", "link", "meta", "param", "source", "track", "wbr"
    );

    private static final Pattern CLOSE_NAME = Pattern.compile("^</\\s*([^\\s>]+)");
    private static final Pattern OPEN_NAME = Pattern.compile("^<\\s*([^\\s/>]+)");
    private static final Pattern SELF_CLOSING_END = Pattern.compile("/\\s*>$");

    public static boolean isVoidTag(String name) {
        return name != null && VOID_TAGS.contains(name.toLowerCase(Locale.ROOT));
    }

    public static List<XmlToken> tokenize(String source) {
        List<XmlToken> tokens = new ArrayList<>();
        if (source == null) return tokens;

        int pos = 0;
        int len = source.length();

        while (pos < len) {
            int lt = source.indexOf('<', pos);
            if (lt == -1) {
                addText(tokens, source, pos, len);
                break;
            }
            if (lt > pos) {
                addText(tokens, source, pos, lt);
            }

            if (source.startsWith("<!--", lt)) {
                pos = addDelimited(tokens, XmlToken.Type.COMMENT, source, lt, "-->");
            } else if (source.startsWith("<![CDATA[", lt)) {
                pos = addDelimited(tokens, XmlToken.Type.CDATA, source, lt, "]]>");
            } else if (source.startsWith("<?", lt)) {
                pos = addDelimited(tokens, XmlToken.Type.PROCESSING_INSTRUCTION, source, lt, "?>");
            } else if (source.startsWith("<!", lt)) {
                pos = addDelimited(tokens, XmlToken.Type.DOCTYPE, source, lt, ">");
            } else if (source.startsWith("</", lt)) {
                pos = addClose(tokens, source, lt);
            } else {
                pos = addOpen(tokens, source, lt);
            }
        }
        return tokens;
    }

    private static void addText(List<XmlToken> tokens, String source, int from, int to) {
        String text = source.substring(from, to).trim();
        if (!text.isEmpty()) {
            tokens.add(XmlToken.of(XmlToken.Type.TEXT, text, from, to));
        }
    }

    private static int addDelimited(List<XmlToken> tokens, XmlToken.Type type, String source, int lt, String terminator) {
        int found = source.indexOf(terminator, lt + 1);
        int end = found != -1 ? found + terminator.length() : source.length();
        tokens.add(XmlToken.of(type, source.substring(lt, end), lt, end));
        return end;
    }

    private static int addClose(List<XmlToken> tokens, String source, int lt) {
        int found = source.indexOf('>', lt);
        int end = found != -1 ? found + 1 : source.length();
        String content = source.substring(lt, end);
        Matcher m = CLOSE_NAME.matcher(content);
        String name = m.find() ? m.group(1) : "";
        tokens.add(new XmlToken(XmlToken.Type.CLOSE, content, name, null, lt, end));
        return end;
    }

    private static int addOpen(List<XmlToken> tokens, String source, int lt) {
        int len = source.length();
        int gt = -1;
        char quote = 0;
        for (int i = lt + 1; i < len; i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                gt = i;
                break;
            }
        }

        // a lone '<' without a terminating '>' is plain text
        if (gt == -1) {
            tokens.add(XmlToken.of(XmlToken.Type.TEXT, source.substring(lt), lt, len));
            return len;
        }

        String raw = source.substring(lt, gt + 1);
        boolean selfClosing = SELF_CLOSING_END.matcher(raw).find();
        Matcher m = OPEN_NAME.matcher(raw);
        String name = "unknown";
        String attrs = "";
        if (m.find()) {
            name = m.group(1);
            int contentStart = m.end();
            int contentEnd = selfClosing ? raw.lastIndexOf('/') : raw.length() - 1;
            if (contentEnd > contentStart) {
                attrs = raw.substring(contentStart, contentEnd);
            }
        }
        XmlToken.Type type = selfClosing ? XmlToken.Type.SELF_CLOSING : XmlToken.Type.OPEN;
        tokens.add(new XmlToken(type, raw, name, attrs, lt, gt + 1));
        return gt + 1;
    }
}
