package beautify.web.graph;

import java.util.List;

public class GraphExporter {

    public static String toDot(List<GraphNode> visible, List<GraphEdge> edges) {
        StringBuilder sb = new StringBuilder();

        sb.append("digraph Structure {\n");
        sb.append("  graph [inputscale=72, overlap=true, splines=true];\n");
        sb.append("  node [shape=rect, style=\"rounded,filled\", fontname=\"monospace\", fontsize=12];\n\n");

        for (GraphNode node : visible) {
            String label = node.hasValue()
                    ? node.getLabel() + ": \"" + node.getValue() + "\""
                    : node.getLabel();

            String fillColor = node.getKind() == NodeKind.VALUE ? "#2D2D2D" : "#0D1117";
            String borderColor = node.getKind() == NodeKind.VALUE ? "#A6E22E" : "#58A6FF";

            // positions are in points and pinned with '!'; y grows upwards in Graphviz
            sb.append("  \"").append(escape(node.getId())).append("\" ")
                    .append("[label=\"").append(escape(label))
                    .append("\", pos=\"").append(format(node.getX())).append(',').append(format(-node.getY()))
                    .append("!\", fillcolor=\"").append(fillColor)
                    .append("\", color=\"").append(borderColor)
                    .append("\", fontcolor=\"#C9D1D9\"];\n");
        }

        sb.append("\n");

        for (GraphEdge edge : edges) {
            sb.append("  \"").append(escape(edge.getFrom().getId())).append("\" -> \"")
                    .append(escape(edge.getTo().getId())).append("\" ")
                    .append("[color=\"#555555\", arrowhead=none];\n");
        }

        sb.append("}\n");
        return sb.toString();
    }

    private static String format(double v) {
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }

    private static String escape(String s) {
        return s == null ? "" : s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    public static final String SHOW_HTML = """
        <!DOCTYPE html>
        <html lang="en">
        <head>
            <meta charset="UTF-8">
            <title>Structure Graph</title>
            <script src="https://d3js.org/d3.v7.min.js"></script>
            <script src="https://unpkg.com/d3-graphviz@5.0.0/build/d3-graphviz.js"></script>
            <style>body { margin: 0; background: #0d1117; color: #c9d1d9; font-family: monospace; }</style>
        </head>
        <body>
            <div id="graph"></div>
            <script>
                fetch("graph.dot")
                    .then(resp => resp.text())
                    .then(dot => d3.select("#graph").graphviz()
                        .engine("neato")
                        .fit(true)
                        .renderDot(dot))
                    .catch(err => { document.body.textContent = "Render failed: " + err.message; });
            </script>
        </body>
        </html>
        """;
}
