package beautify.web.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileCollectorTest {

    @TempDir
    Path dir;

    private void write(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void testCollectsSupportedFilesInOrder() throws IOException {
        write("b.json", "{}");
        write("a/page.HTML", "<p/>");
        write("a/style.css", "a{b:c}");
        write("notes.txt", "skip me");
        write("node_modules/lib/x.js", "var a;");
        write("build/out.json", "[]");

        List<String> paths = SourceFileCollector.collect(dir).stream()
                .map(f -> f.getPath().replace('\\', '/'))
                .collect(Collectors.toList());
        assertEquals(List.of("a/page.HTML", "a/style.css", "b.json"), paths);
    }

    @Test
    void testSingleFile() throws IOException {
        write("one.xml", "<r/>");
        List<SourceFile> files = SourceFileCollector.collect(dir.resolve("one.xml"));
        assertEquals(1, files.size());
        assertEquals("one.xml", files.get(0).getFileName());
        assertEquals("<r/>", files.get(0).getContent());
    }
}
