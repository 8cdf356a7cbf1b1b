package beautify.web.config;

import beautify.web.util.JsonUtil;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class BeautifyOptions {

    public static final int DEFAULT_INDENT = 4;

    public final int indentSize;
    public final boolean preserveNewlines;
    public final boolean spaceBeforeAnonFunc;
    public final boolean keepArrayIndentation;
    public final boolean xmlSortAttributes;
    public final boolean xmlSpaceBeforeSlash;
    public final CopyMode graphCopyMode;

    public BeautifyOptions(int indentSize,
                           boolean preserveNewlines,
                           boolean spaceBeforeAnonFunc,
                           boolean keepArrayIndentation,
                           boolean xmlSortAttributes,
                           boolean xmlSpaceBeforeSlash,
                           CopyMode graphCopyMode) {
        this.indentSize = normalizeIndent(indentSize);
        this.preserveNewlines = preserveNewlines;
        this.spaceBeforeAnonFunc = spaceBeforeAnonFunc;
        this.keepArrayIndentation = keepArrayIndentation;
        this.xmlSortAttributes = xmlSortAttributes;
        this.xmlSpaceBeforeSlash = xmlSpaceBeforeSlash;
        this.graphCopyMode = graphCopyMode != null ? graphCopyMode : CopyMode.VALUE;
    }

    public static BeautifyOptions defaults() {
        return new BeautifyOptions(DEFAULT_INDENT, true, false, false, false, true, CopyMode.VALUE);
    }

    public String indentUnit() {
        return " ".repeat(indentSize);
    }

    public BeautifyOptions withIndentSize(int size) {
        return new BeautifyOptions(size, preserveNewlines, spaceBeforeAnonFunc, keepArrayIndentation,
                xmlSortAttributes, xmlSpaceBeforeSlash, graphCopyMode);
    }

    public BeautifyOptions withXmlSortAttributes(boolean sort) {
        return new BeautifyOptions(indentSize, preserveNewlines, spaceBeforeAnonFunc, keepArrayIndentation,
                sort, xmlSpaceBeforeSlash, graphCopyMode);
    }

    public BeautifyOptions withXmlSpaceBeforeSlash(boolean space) {
        return new BeautifyOptions(indentSize, preserveNewlines, spaceBeforeAnonFunc, keepArrayIndentation,
                xmlSortAttributes, space, graphCopyMode);
    }

    public BeautifyOptions withSpaceBeforeAnonFunc(boolean space) {
        return new BeautifyOptions(indentSize, preserveNewlines, space, keepArrayIndentation,
                xmlSortAttributes, xmlSpaceBeforeSlash, graphCopyMode);
    }

    public BeautifyOptions withGraphCopyMode(CopyMode mode) {
        return new BeautifyOptions(indentSize, preserveNewlines, spaceBeforeAnonFunc, keepArrayIndentation,
                xmlSortAttributes, xmlSpaceBeforeSlash, mode);
    }

    private static int normalizeIndent(int size) {
        return (size == 2 || size == 4 || size == 8) ? size : DEFAULT_INDENT;
    }

    public static class OptionsDTO {
        @JsonProperty("indent_size") public Integer indentSize;
        @JsonProperty("preserve_newlines") public Boolean preserveNewlines;
        @JsonProperty("space_before_anon_func") public Boolean spaceBeforeAnonFunc;
        @JsonProperty("keep_array_indentation") public Boolean keepArrayIndentation;
        @JsonProperty("xml_sort_attributes") public Boolean xmlSortAttributes;
        @JsonProperty("xml_space_before_slash") public Boolean xmlSpaceBeforeSlash;
        @JsonProperty("graph_copy_mode") public String graphCopyMode;
    }

    /**
     * Reads snake_case options; absent or unrecognized entries keep their defaults.
     */
    public static BeautifyOptions fromJson(String json) {
        BeautifyOptions base = defaults();
        if (json == null || json.isBlank()) return base;

        OptionsDTO dto;
        try {
            dto = JsonUtil.fromJson(json, OptionsDTO.class);
        } catch (RuntimeException e) {
            System.err.println("[BeautifyOptions] Invalid options, using defaults: " + e.getMessage());
            return base;
        }
        if (dto == null) return base;

        return new BeautifyOptions(
                dto.indentSize != null ? dto.indentSize : base.indentSize,
                dto.preserveNewlines != null ? dto.preserveNewlines : base.preserveNewlines,
                dto.spaceBeforeAnonFunc != null ? dto.spaceBeforeAnonFunc : base.spaceBeforeAnonFunc,
                dto.keepArrayIndentation != null ? dto.keepArrayIndentation : base.keepArrayIndentation,
                dto.xmlSortAttributes != null ? dto.xmlSortAttributes : base.xmlSortAttributes,
                dto.xmlSpaceBeforeSlash != null ? dto.xmlSpaceBeforeSlash : base.xmlSpaceBeforeSlash,
                CopyMode.fromName(dto.graphCopyMode)
        );
    }

    public static BeautifyOptions load(Path file) throws IOException {
        return fromJson(Files.readString(file));
    }

    public static final Map<String, BeautifyOptions> PRESETS = Map.of(
            "default", defaults(),
            "compact", defaults().withIndentSize(2),
            "wide", defaults().withIndentSize(8),
            "sorted", defaults().withXmlSortAttributes(true)
    );

    @Override
    public String toString() {
        return "BeautifyOptions{" +
                "indentSize=" + indentSize +
                ", preserveNewlines=" + preserveNewlines +
                ", spaceBeforeAnonFunc=" + spaceBeforeAnonFunc +
                ", keepArrayIndentation=" + keepArrayIndentation +
                ", xmlSortAttributes=" + xmlSortAttributes +
                ", xmlSpaceBeforeSlash=" + xmlSpaceBeforeSlash +
                ", graphCopyMode=" + graphCopyMode +
                '}';
    }
}
