package beautify.web.format;

import beautify.web.config.BeautifyOptions;

import java.util.regex.Pattern;

/**
 * Brace and separator driven re-indenter. Only simple quote state is tracked, so brackets inside
 * regex literals or template strings are treated as structure.
 */
public class JavaScriptFormatter implements Formatter {

    private static final Pattern ANON_FUNCTION_ANY = Pattern.compile("function\\s*\\(");
    private static final Pattern ANON_FUNCTION_SPACED = Pattern.compile("function\\s+\\(");
    private static final Pattern BLANK_LINES = Pattern.compile("^\\s*\\n", Pattern.MULTILINE);

    @Override
    public String format(String content, BeautifyOptions options) {
        String indent = options.indentUnit();
        String source = options.spaceBeforeAnonFunc
                ? ANON_FUNCTION_ANY.matcher(content).replaceAll("function (")
                : ANON_FUNCTION_SPACED.matcher(content).replaceAll("function(");

        StringBuilder result = new StringBuilder(source.length() + 64);
        int depth = 0;
        boolean inString = false;
        char strChar = 0;

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);

            if ((c == '"' || c == '\'') && (i == 0 || source.charAt(i - 1) != '\\')) {
                if (!inString) {
                    inString = true;
                    strChar = c;
                } else if (c == strChar) {
                    inString = false;
                }
            }

            if (!inString) {
                if (c == '{' || c == '[') {
                    result.append(c).append('\n').append(indent.repeat(++depth));
                    continue;
                } else if (c == '}' || c == ']') {
                    depth = Math.max(0, depth - 1);
                    result.append('\n').append(indent.repeat(depth)).append(c);
                    continue;
                } else if (c == ';' || c == ',') {
                    result.append(c).append('\n').append(indent.repeat(depth));
                    continue;
                }
            }
            result.append(c);
        }
        return BLANK_LINES.matcher(result).replaceAll("");
    }
}
