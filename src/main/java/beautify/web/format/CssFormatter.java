package beautify.web.format;

import beautify.web.config.BeautifyOptions;

/**
 * Character-stream re-indenter. Whitespace runs collapse to one space; whitespace at the start of
 * an emitted line is dropped so formatted output formats to itself.
 */
public class CssFormatter implements Formatter {

    @Override
    public String format(String content, BeautifyOptions options) {
        String indent = options.indentUnit();
        String clean = content.replaceAll("\\s+", " ").trim();

        StringBuilder out = new StringBuilder(clean.length() + 64);
        int depth = 0;
        boolean lineStart = true;

        for (int i = 0; i < clean.length(); i++) {
            char c = clean.charAt(i);
            switch (c) {
                case '{':
                    trimTrailing(out);
                    if (out.length() > 0) out.append(' ');
                    out.append("{\n").append(indent.repeat(++depth));
                    lineStart = true;
                    break;
                case '}':
                    trimTrailing(out);
                    depth = Math.max(0, depth - 1);
                    if (out.length() > 0) out.append('\n');
                    out.append(indent.repeat(depth)).append('}');
                    out.append('\n').append(indent.repeat(depth));
                    lineStart = true;
                    break;
                case ';':
                    out.append(";\n").append(indent.repeat(depth));
                    lineStart = true;
                    break;
                case ' ':
                    if (!lineStart) out.append(c);
                    break;
                default:
                    out.append(c);
                    lineStart = false;
                    break;
            }
        }
        trimTrailing(out);
        return out.toString();
    }

    private static void trimTrailing(StringBuilder out) {
        int end = out.length();
        while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) {
            end--;
        }
        out.setLength(end);
    }
}
