package beautify.web.format;

import beautify.web.config.BeautifyOptions;

public interface Formatter {

    /**
     * Re-indents {@code content}. Implementations may throw on internal failure; callers go
     * through {@link beautify.web.core.Beautifier}, which falls back to the original text.
     */
    String format(String content, BeautifyOptions options);
}
