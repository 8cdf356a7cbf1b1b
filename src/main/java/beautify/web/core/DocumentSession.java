package beautify.web.core;

import beautify.web.config.BeautifyOptions;
import beautify.web.config.Language;
import beautify.web.graph.CopyPayload;
import beautify.web.graph.GraphBuilders;
import beautify.web.graph.GraphEdge;
import beautify.web.graph.GraphLayout;
import beautify.web.graph.GraphNode;
import beautify.web.graph.ViewTransform;
import beautify.web.search.SearchMatch;
import beautify.web.search.SearchIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State of one open document: content, formatted output, graph, collapse set, selection, search
 * results and viewer transform. Not thread-safe; callers serialize access per session.
 */
public class DocumentSession {

    private String content = "";
    private Language language = Language.TEXT;
    private BeautifyOptions options;
    private String formatted = "";

    private GraphNode root;
    private final Set<String> collapsed = new LinkedHashSet<>();
    private List<GraphNode> visible = new ArrayList<>();
    private ViewTransform transform = ViewTransform.initial();

    private String selectedId;
    private List<SearchMatch> matches = new ArrayList<>();
    private int matchIndex = 0;

    public DocumentSession() {
        this(BeautifyOptions.defaults());
    }

    public DocumentSession(BeautifyOptions options) {
        this.options = options != null ? options : BeautifyOptions.defaults();
    }

    /**
     * Replaces the document. Prior ids lose their meaning, so collapse state, selection and search
     * results are reset.
     */
    public void setContent(String newContent) {
        this.content = newContent != null ? newContent : "";
        this.language = LanguageDetector.detect(content);
        this.formatted = Beautifier.format(content, language, options);
        this.root = GraphBuilders.build(formatted, language).orElse(null);
        collapsed.clear();
        selectedId = null;
        matches = new ArrayList<>();
        matchIndex = 0;
        relayout();
    }

    /**
     * Re-formats with new options. Collapse state survives when the structure is unchanged.
     */
    public void setOptions(BeautifyOptions newOptions) {
        this.options = newOptions != null ? newOptions : BeautifyOptions.defaults();
        if (content.isBlank()) return;

        Set<String> before = idsOf(root);
        this.formatted = Beautifier.format(content, language, options);
        this.root = GraphBuilders.build(formatted, language).orElse(null);
        if (!before.equals(idsOf(root))) {
            collapsed.clear();
            selectedId = null;
        }
        relayout();
    }

    private void relayout() {
        visible = GraphLayout.layout(root, collapsed);
    }

    private static Set<String> idsOf(GraphNode node) {
        Set<String> ids = new HashSet<>();
        collectIds(node, ids);
        return ids;
    }

    private static void collectIds(GraphNode node, Set<String> ids) {
        if (node == null) return;
        ids.add(node.getId());
        for (GraphNode child : node.getChildren()) {
            collectIds(child, ids);
        }
    }

    public boolean graphSupported() {
        return root != null;
    }

    public boolean toggleCollapse(String id) {
        if (root == null || root.find(id) == null) return false;
        if (!collapsed.remove(id)) {
            collapsed.add(id);
        }
        relayout();
        return collapsed.contains(id);
    }

    public boolean isCollapsed(String id) {
        return collapsed.contains(id);
    }

    /**
     * Selects a node and expands every collapsed ancestor so it becomes visible.
     */
    public void select(String id) {
        this.selectedId = id;
        if (id == null) return;

        boolean changed = collapsed.removeIf(candidate -> id.startsWith(candidate + GraphNode.ID_SEP));
        if (changed) {
            relayout();
        }
    }

    public List<SearchMatch> search(String term) {
        matches = SearchIndex.search(formatted, language, term);
        matchIndex = 0;
        if (!matches.isEmpty()) {
            apply(matches.get(0));
        }
        return Collections.unmodifiableList(matches);
    }

    public SearchMatch nextMatch() {
        if (matches.isEmpty()) return null;
        matchIndex = (matchIndex + 1) % matches.size();
        return apply(matches.get(matchIndex));
    }

    public SearchMatch previousMatch() {
        if (matches.isEmpty()) return null;
        matchIndex = (matchIndex - 1 + matches.size()) % matches.size();
        return apply(matches.get(matchIndex));
    }

    private SearchMatch apply(SearchMatch match) {
        if (match.isNode()) {
            select(match.getNodeId());
        }
        return match;
    }

    public CopyPayload copyText(String id) {
        GraphNode node = root != null ? root.find(id) : null;
        if (node == null) return null;
        return CopyPayload.of(node, options.graphCopyMode);
    }

    /**
     * Manual drag; screen deltas are converted to logical units with the current scale.
     */
    public void moveNode(String id, double dx, double dy) {
        GraphNode node = root != null ? root.find(id) : null;
        if (node == null) return;
        node.setX(node.getX() + dx / transform.getScale());
        node.setY(node.getY() + dy / transform.getScale());
    }

    public ViewTransform fitView(double viewportWidth, double viewportHeight) {
        transform = GraphLayout.fit(visible, viewportWidth, viewportHeight);
        return transform;
    }

    public ViewTransform centerOn(String id, double viewportWidth, double viewportHeight) {
        GraphNode node = root != null ? root.find(id) : null;
        if (node != null && visible.contains(node)) {
            transform = GraphLayout.centerOn(node, transform, viewportWidth, viewportHeight);
        }
        return transform;
    }

    public ViewTransform zoom(double factor) {
        transform = transform.zoomBy(factor);
        return transform;
    }

    public ViewTransform pan(double dx, double dy) {
        transform = transform.panBy(dx, dy);
        return transform;
    }

    public List<GraphEdge> edges() {
        return GraphLayout.edges(visible, collapsed);
    }

    public String getContent() { return content; }
    public Language getLanguage() { return language; }
    public BeautifyOptions getOptions() { return options; }
    public String getFormatted() { return formatted; }
    public GraphNode getRoot() { return root; }
    public List<GraphNode> getVisibleNodes() { return Collections.unmodifiableList(visible); }
    public Set<String> getCollapsed() { return Collections.unmodifiableSet(collapsed); }
    public ViewTransform getTransform() { return transform; }
    public String getSelectedId() { return selectedId; }
    public List<SearchMatch> getMatches() { return Collections.unmodifiableList(matches); }
    public int getMatchIndex() { return matchIndex; }
}
