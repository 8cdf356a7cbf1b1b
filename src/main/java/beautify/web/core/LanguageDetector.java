package beautify.web.core;

import beautify.web.config.Language;

/**
 * Structural guess from the first and last characters; the order of checks decides ties.
 */
public class LanguageDetector {

    public static Language detect(String content) {
        if (content == null) return Language.TEXT;
        String trimmed = content.trim();
        if (trimmed.isEmpty()) return Language.TEXT;

        if ((trimmed.startsWith("{") || trimmed.startsWith("["))
                && (trimmed.endsWith("}") || trimmed.endsWith("]"))) {
            return Language.JSON;
        }
        if (trimmed.startsWith("<")) {
            return Language.XML;
        }
        if (trimmed.contains("{") && trimmed.contains(":") && trimmed.contains(";")) {
            return Language.CSS;
        }
        return Language.JAVASCRIPT;
    }
}
