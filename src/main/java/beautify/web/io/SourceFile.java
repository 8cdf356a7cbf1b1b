package beautify.web.io;


public class SourceFile {
    private final String path;
    private final String content;

    public SourceFile(String path, String content) {
        this.path = path;
        this.content = content;
    }

    public String getPath() { return path; }
    public String getContent() { return content; }

    public String getFileName() {
        int idx = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return idx >= 0 ? path.substring(idx + 1) : path;
    }

    @Override
    public String toString() {
        return "SourceFile{" +
                "path='" + path + '\'' +
                '}';
    }
}
