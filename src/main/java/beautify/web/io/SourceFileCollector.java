package beautify.web.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;


public class SourceFileCollector {

    public static final Set<String> EXTENSIONS = Set.of(".json", ".xml", ".html", ".htm", ".svg", ".css", ".js");
    private static final Set<String> SKIPPED_DIRS = Set.of("node_modules", ".git", "dist", "build");

    public static List<SourceFile> collect(Path root) throws IOException {
        List<SourceFile> files = new ArrayList<>();
        if (Files.isRegularFile(root)) {
            files.add(new SourceFile(root.getFileName().toString(), Files.readString(root)));
            return files;
        }

        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.filter(Files::isRegularFile)
                    .filter(path -> !isSkipped(root.relativize(path)))
                    .filter(SourceFileCollector::isSupported)
                    .sorted()
                    .collect(Collectors.toList());
        }

        for (Path path : paths) {
            try {
                files.add(new SourceFile(root.relativize(path).toString(), Files.readString(path)));
            } catch (IOException e) {
                System.err.println("[SourceFileCollector] Skipping unreadable file " + path + ": " + e.getMessage());
            }
        }
        return files;
    }

    static boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : EXTENSIONS) {
            if (name.endsWith(ext)) return true;
        }
        return false;
    }

    private static boolean isSkipped(Path relative) {
        for (Path part : relative) {
            if (SKIPPED_DIRS.contains(part.toString())) return true;
        }
        return false;
    }
}
