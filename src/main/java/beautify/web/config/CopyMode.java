package beautify.web.config;

public enum CopyMode {
    VALUE,
    KEY;

    public static CopyMode fromName(String name) {
        if (name != null && name.trim().equalsIgnoreCase("key")) {
            return KEY;
        }
        return VALUE;
    }
}
