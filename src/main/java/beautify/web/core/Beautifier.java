package beautify.web.core;

import beautify.web.config.BeautifyOptions;
import beautify.web.config.Language;
import beautify.web.format.CssFormatter;
import beautify.web.format.Formatter;
import beautify.web.format.JavaScriptFormatter;
import beautify.web.format.JsonFormatter;
import beautify.web.format.XmlFormatter;
import beautify.web.graph.GraphBuilders;
import beautify.web.graph.GraphNode;
import beautify.web.search.SearchIndex;
import beautify.web.search.SearchMatch;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry points for detection, formatting, graph building and search. None of them throws on
 * malformed content.
 */
public class Beautifier {

    private static final Map<Language, Formatter> FORMATTERS = new EnumMap<>(Language.class);

    static {
        FORMATTERS.put(Language.JSON, new JsonFormatter());
        FORMATTERS.put(Language.XML, new XmlFormatter());
        FORMATTERS.put(Language.CSS, new CssFormatter());
        FORMATTERS.put(Language.JAVASCRIPT, new JavaScriptFormatter());
    }

    public static Language detect(String content) {
        return LanguageDetector.detect(content);
    }

    /**
     * Absent options mean the defaults.
     */
    public static String format(String content, Language language, BeautifyOptions options) {
        return format(content, language, FORMATTERS.get(language), options);
    }

    static String format(String content, Language language, Formatter formatter, BeautifyOptions options) {
        if (content == null || content.isBlank()) return "";
        if (formatter == null) return content;
        if (options == null) {
            options = BeautifyOptions.defaults();
        }

        try {
            return formatter.format(content, options);
        } catch (RuntimeException e) {
            System.err.println("[Beautifier] " + language + " formatting failed, keeping input: " + e);
            return content;
        }
    }

    public static String format(String content, BeautifyOptions options) {
        return format(content, detect(content), options);
    }

    public static GraphNode buildGraph(String formatted, Language language) {
        return GraphBuilders.build(formatted, language).orElse(null);
    }

    public static List<SearchMatch> search(String formatted, Language language, String term) {
        return SearchIndex.search(formatted, language, term);
    }
}
