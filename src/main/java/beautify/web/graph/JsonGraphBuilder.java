package beautify.web.graph;

import beautify.web.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

public class JsonGraphBuilder {

    static final int LABEL_VALUE_LIMIT = 20;

    public static GraphNode build(JsonNode data) {
        return build(data, GraphNode.ROOT_ID, GraphNode.ROOT_ID);
    }

    private static GraphNode build(JsonNode data, String key, String id) {
        NodeKind kind = data.isArray() ? NodeKind.ARRAY
                : data.isObject() ? NodeKind.OBJECT
                : NodeKind.VALUE;
        String value = kind == NodeKind.VALUE && !data.isNull() ? JsonUtil.scalarText(data) : null;

        GraphNode node = new GraphNode(id, key, value, kind);
        node.setWidth(GraphNode.measureText(displayLabel(key, value)));

        if (data.isArray()) {
            for (int i = 0; i < data.size(); i++) {
                String index = Integer.toString(i);
                node.addChild(build(data.get(i), index, node.childId(index)));
            }
        } else if (data.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                node.addChild(build(field.getValue(), field.getKey(), node.childId(field.getKey())));
            }
        }
        return node;
    }

    static String displayLabel(String key, String value) {
        if (value == null) return key;
        return key + ": " + truncate(value);
    }

    static String truncate(String text) {
        return text.length() > LABEL_VALUE_LIMIT ? text.substring(0, LABEL_VALUE_LIMIT) + "..." : text;
    }
}
