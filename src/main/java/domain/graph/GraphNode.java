package domain.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A data source on the query canvas.
 *
 * <p>Column lists may start empty (placeholder) while schema discovery runs elsewhere.
 * Selection is kept as a set but always reported in column order.</p>
 */
public final class GraphNode {

    private final String id;
    private final NodeKind kind;
    private final List<String> columns = new ArrayList<>();
    private final Set<String> selected = new LinkedHashSet<>();

    /**
     * SUBQUERY body text (null for TABLE/CTE nodes).
     */
    private final String subqueryBody;

    GraphNode(String id, NodeKind kind, List<String> columns, String subqueryBody) {
        this.id = id;
        this.kind = kind == null ? NodeKind.TABLE : kind;
        this.subqueryBody = (subqueryBody == null || subqueryBody.isBlank()) ? null : subqueryBody.trim();
        setColumns(columns);
    }

    GraphNode renamedTo(String newId) {
        GraphNode copy = new GraphNode(newId, kind, columns, subqueryBody);
        copy.selected.addAll(selected);
        return copy;
    }

    void setColumns(List<String> newColumns) {
        columns.clear();
        if (newColumns != null) {
            for (String c : newColumns) {
                if (c == null || c.isBlank()) continue;
                String t = c.trim();
                if (!columns.contains(t)) columns.add(t);
            }
        }
        selected.retainAll(columns);
    }

    void select(String column) {
        if (columns.isEmpty()) {
            // placeholder: real column list is not known yet
            columns.add(column);
        } else if (!columns.contains(column)) {
            throw new IllegalArgumentException("column not found on " + id + ": " + column);
        }
        selected.add(column);
    }

    void deselect(String column) {
        selected.remove(column);
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public boolean isPlaceholder() {
        return columns.isEmpty();
    }

    /** Selected columns in column order. */
    public List<String> getSelectedColumns() {
        List<String> out = new ArrayList<>(selected.size());
        for (String c : columns) {
            if (selected.contains(c)) out.add(c);
        }
        return out;
    }

    public String getSubqueryBody() {
        return subqueryBody;
    }

    /** How the node appears after FROM / JOIN. */
    public String fromReference() {
        if (kind == NodeKind.SUBQUERY && subqueryBody != null) {
            return "(" + subqueryBody + ") AS " + id;
        }
        return id;
    }

    @Override
    public String toString() {
        return kind + ":" + id + columns;
    }
}
