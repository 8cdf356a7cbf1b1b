package beautify.web.config;

public enum Language {
    JSON("json"),
    XML("xml"),
    CSS("css"),
    JAVASCRIPT("javascript"),
    TEXT("text");

    private final String tag;

    Language(String tag) {
        this.tag = tag;
    }

    public String getTag() { return tag; }

    /**
     * Graph views exist only for the three structured languages.
     */
    public boolean isGraphCapable() {
        return this == JSON || this == XML || this == CSS;
    }

    public static Language fromTag(String tag) {
        if (tag == null) return TEXT;
        for (Language language : values()) {
            if (language.tag.equalsIgnoreCase(tag.trim())) {
                return language;
            }
        }
        return TEXT;
    }

    @Override
    public String toString() {
        return tag;
    }
}
