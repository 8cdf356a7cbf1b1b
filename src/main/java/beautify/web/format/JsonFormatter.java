package beautify.web.format;

import beautify.web.config.BeautifyOptions;
import beautify.web.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;

public class JsonFormatter implements Formatter {

    @Override
    public String format(String content, BeautifyOptions options) {
        JsonNode parsed = JsonUtil.parseOrNull(content);
        if (parsed == null) {
            return content;
        }
        return JsonUtil.pretty(parsed, options.indentSize);
    }
}
