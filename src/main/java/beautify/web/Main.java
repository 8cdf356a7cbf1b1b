package beautify.web;

import beautify.web.config.BeautifyOptions;
import beautify.web.config.Language;
import beautify.web.core.Beautifier;
import beautify.web.core.DocumentSession;
import beautify.web.core.LanguageDetector;
import beautify.web.graph.GraphExporter;
import beautify.web.graph.GraphNode;
import beautify.web.graph.GraphStatistics;
import beautify.web.graph.NodeSnapshot;
import beautify.web.io.SourceFile;
import beautify.web.io.SourceFileCollector;
import beautify.web.search.SearchMatch;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "beautify",
        mixinStandardHelpOptions = true,
        description = "Format JSON, XML/HTML, CSS and JavaScript and lay out their structure graphs",
        subcommands = {
                Main.FormatCommand.class,
                Main.GraphCommand.class,
                Main.SearchCommand.class,
                Main.DetectCommand.class
        }
)
public class Main implements Callable<Integer> {

    public static void main(String[] args) {
        int exit = new CommandLine(new Main())
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    System.err.println("[Main] Error: " + ex.getMessage());
                    return 1;
                })
                .execute(args);
        System.exit(exit);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    static class OptionsMixin {
        @Option(names = {"--preset", "-p"}, description = "Options preset: default, compact, wide, sorted",
                paramLabel = "<name>", defaultValue = "default")
        String preset;

        @Option(names = {"--options"}, description = "JSON file with snake_case options", paramLabel = "<file>")
        Path optionsFile;

        BeautifyOptions resolve() throws IOException {
            if (optionsFile != null) {
                return BeautifyOptions.load(optionsFile);
            }
            BeautifyOptions options = BeautifyOptions.PRESETS.get(preset);
            if (options == null) {
                throw new IllegalArgumentException("Unknown preset: " + preset);
            }
            return options;
        }
    }

    @Command(name = "format", mixinStandardHelpOptions = true,
            description = "Format a file, or every supported file under a directory")
    static class FormatCommand implements Callable<Integer> {

        @Parameters(paramLabel = "<path>", description = "File or directory")
        Path input;

        @Option(names = {"--out", "-o"}, description = "Output directory; prints to stdout when absent",
                paramLabel = "<dir>")
        Path outDir;

        @Mixin
        OptionsMixin optionsMixin;

        @Override
        public Integer call() throws IOException {
            if (!Files.exists(input)) {
                System.err.println("[Main] Path not found: " + input);
                return 2;
            }
            BeautifyOptions options = optionsMixin.resolve();
            List<SourceFile> files = SourceFileCollector.collect(input);

            if (outDir == null) {
                for (SourceFile file : files) {
                    if (files.size() > 1) System.out.println("// " + file.getPath());
                    System.out.println(Beautifier.format(file.getContent(), options));
                }
                return 0;
            }

            Files.createDirectories(outDir);
            int reformatted = 0;
            for (SourceFile file : files) {
                Language language = LanguageDetector.detect(file.getContent());
                String formatted = Beautifier.format(file.getContent(), language, options);
                Path target = outDir.resolve(file.getPath());
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                write(target, formatted);

                boolean changed = !formatted.equals(file.getContent());
                if (changed) reformatted++;
                System.out.println("[Output] " + file.getPath() + " (" + language.getTag() + ", "
                        + (changed ? "reformatted" : "unchanged") + ")");
            }
            System.out.println("[Output] " + files.size() + " file(s) written to " + outDir
                    + ", " + reformatted + " reformatted");
            return 0;
        }
    }

    @Command(name = "graph", mixinStandardHelpOptions = true,
            description = "Lay out the structure graph of a file and export it as DOT and JSON")
    static class GraphCommand implements Callable<Integer> {

        @Parameters(paramLabel = "<file>", description = "JSON, XML/HTML or CSS file")
        Path input;

        @Option(names = {"--out", "-o"}, description = "Output directory (default: out)",
                paramLabel = "<dir>", defaultValue = "out")
        Path outDir;

        @Option(names = {"--collapse", "-c"}, description = "Node id to collapse; repeatable",
                paramLabel = "<id>")
        List<String> collapse = new ArrayList<>();

        @Mixin
        OptionsMixin optionsMixin;

        @Override
        public Integer call() throws IOException {
            DocumentSession session = new DocumentSession(optionsMixin.resolve());
            session.setContent(Files.readString(input));

            if (!session.graphSupported()) {
                System.err.println("[Main] Graph view not supported for " + input + " (" + session.getLanguage() + ")");
                return 1;
            }
            for (String id : collapse) {
                if (!session.toggleCollapse(id)) {
                    System.err.println("[Main] WARNING: no node with id " + id);
                }
            }

            List<GraphNode> visible = session.getVisibleNodes();
            List<NodeSnapshot> snapshots = new ArrayList<>();
            for (GraphNode node : visible) {
                snapshots.add(NodeSnapshot.of(node, session.isCollapsed(node.getId())));
            }
            GraphStatistics stats = GraphStatistics.compute(session.getRoot(), visible, session.getCollapsed());

            Files.createDirectories(outDir);
            write(outDir.resolve("graph.dot"), GraphExporter.toDot(visible, session.edges()));
            write(outDir.resolve("layout.json"), JSON.toJSONString(snapshots, JSONWriter.Feature.PrettyFormat));
            write(outDir.resolve("statistics.json"), JSON.toJSONString(stats));
            write(outDir.resolve("show.html"), GraphExporter.SHOW_HTML);

            System.out.println(stats);
            System.out.println("[Output] Graph saved to " + outDir);
            return 0;
        }
    }

    @Command(name = "search", mixinStandardHelpOptions = true,
            description = "Search the formatted form of a file")
    static class SearchCommand implements Callable<Integer> {

        @Parameters(index = "0", paramLabel = "<file>")
        Path input;

        @Parameters(index = "1", paramLabel = "<term>")
        String term;

        @Mixin
        OptionsMixin optionsMixin;

        @Override
        public Integer call() throws IOException {
            DocumentSession session = new DocumentSession(optionsMixin.resolve());
            session.setContent(Files.readString(input));
            List<SearchMatch> matches = session.search(term);

            for (SearchMatch match : matches) {
                if (match.isNode()) {
                    System.out.println(match.getNodeId());
                } else {
                    String formatted = session.getFormatted();
                    System.out.println(match.getStart() + "-" + match.getEnd() + "\t"
                            + formatted.substring(match.getStart(), match.getEnd()));
                }
            }
            System.out.println("[Search] " + matches.size() + " match(es)");
            return matches.isEmpty() ? 1 : 0;
        }
    }

    @Command(name = "detect", mixinStandardHelpOptions = true, description = "Print the detected language")
    static class DetectCommand implements Callable<Integer> {

        @Parameters(paramLabel = "<file>")
        Path input;

        @Override
        public Integer call() throws IOException {
            System.out.println(LanguageDetector.detect(Files.readString(input)).getTag());
            return 0;
        }
    }

    private static void write(Path target, String text) throws IOException {
        Files.writeString(target, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }
}
