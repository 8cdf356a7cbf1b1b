package beautify.web.graph;

import beautify.web.ast.CssParser;
import beautify.web.ast.XmlTreeBuilder;
import beautify.web.config.Language;
import beautify.web.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

public class GraphBuilders {

    /**
     * Empty when the language has no graph form or the content does not parse.
     */
    public static Optional<GraphNode> build(String content, Language language) {
        if (content == null || language == null || !language.isGraphCapable()) {
            return Optional.empty();
        }
        try {
            switch (language) {
                case JSON: {
                    JsonNode data = JsonUtil.parseOrNull(content);
                    return data == null ? Optional.empty() : Optional.of(JsonGraphBuilder.build(data));
                }
                case XML:
                    return Optional.of(XmlGraphBuilder.build(XmlTreeBuilder.build(content)));
                case CSS:
                    return Optional.of(CssGraphBuilder.build(CssParser.parse(content)));
                default:
                    return Optional.empty();
            }
        } catch (RuntimeException e) {
            System.err.println("[GraphBuilders] " + language + " graph not representable: " + e);
            return Optional.empty();
        }
    }
}
