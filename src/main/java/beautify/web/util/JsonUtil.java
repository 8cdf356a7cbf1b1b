package beautify.web.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class JsonUtil {
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new RuntimeException("JSON parse error: " + json, e);
        }
    }

    /**
     * Strict parse of a whole document. Empty input and trailing garbage are rejected.
     */
    public static JsonNode readTree(String json) throws JsonProcessingException {
        JsonNode node = mapper.readTree(json);
        if (node == null || node.isMissingNode()) {
            throw new JsonProcessingException("No JSON content") {};
        }
        return node;
    }

    public static JsonNode parseOrNull(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public static String pretty(JsonNode node, int indentSize) {
        try {
            return mapper.writer(new StandardPrettyPrinter(indentSize)).writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON write error", e);
        }
    }

    /**
     * String form of a scalar as it appears in graph labels and search. Null yields {@code "null"}.
     */
    public static String scalarText(JsonNode node) {
        if (node == null || node.isNull()) return "null";
        if (node.isTextual()) return node.textValue();
        return node.asText();
    }
}
