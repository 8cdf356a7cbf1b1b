package beautify.web.search;

import beautify.web.config.Language;
import beautify.web.graph.GraphNode;
import beautify.web.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class SearchIndex {

    /**
     * JSON is searched structurally, falling back to text when it does not parse; everything else
     * is searched as text.
     */
    public static List<SearchMatch> search(String formatted, Language language, String term) {
        List<SearchMatch> matches = new ArrayList<>();
        if (term == null || term.isEmpty() || formatted == null) return matches;

        if (language == Language.JSON) {
            JsonNode data = JsonUtil.parseOrNull(formatted);
            if (data != null) {
                for (String path : searchJson(data, term)) {
                    matches.add(SearchMatch.node(path));
                }
                return matches;
            }
        }
        return searchText(formatted, term);
    }

    /**
     * Paths whose last key contains {@code term}, or whose scalar value does, case-insensitively.
     */
    public static List<String> searchJson(JsonNode data, String term) {
        List<String> matches = new ArrayList<>();
        if (data == null || term == null || term.isEmpty()) return matches;
        walk(data, term.toLowerCase(Locale.ROOT), GraphNode.ROOT_ID, null, matches);
        return matches;
    }

    private static void walk(JsonNode data, String term, String path, String key, List<String> matches) {
        if (key != null && key.toLowerCase(Locale.ROOT).contains(term)) {
            matches.add(path);
        } else if (!data.isContainerNode()) {
            if (JsonUtil.scalarText(data).toLowerCase(Locale.ROOT).contains(term)) {
                matches.add(path);
            }
        }

        if (data.isArray()) {
            for (int i = 0; i < data.size(); i++) {
                String index = Integer.toString(i);
                walk(data.get(i), term, path + GraphNode.ID_SEP + index, index, matches);
            }
        } else if (data.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                walk(field.getValue(), term, path + GraphNode.ID_SEP + GraphNode.escapeSegment(field.getKey()),
                        field.getKey(), matches);
            }
        }
    }

    public static List<SearchMatch> searchText(String content, String term) {
        List<SearchMatch> matches = new ArrayList<>();
        if (term == null || term.isEmpty() || content == null || content.isEmpty()) return matches;

        Matcher m = Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                .matcher(content);
        while (m.find()) {
            matches.add(SearchMatch.text(m.start(), m.end()));
        }
        return matches;
    }
}
