package domain.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owns every node and edge of one query graph.
 *
 * <p>Nodes are kept in an id-keyed, insertion-ordered map; edges store ids only, so
 * removing a node is a filter over the edge lists. The DML target is a single optional
 * id, which makes "at most one target" hold by construction.</p>
 *
 * <p>Every mutator validates first and mutates last: a call that throws leaves the
 * graph exactly as it was.</p>
 */
public final class GraphModel {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<JoinEdge> joinEdges = new ArrayList<>();
    private final List<MappingEdge> mappingEdges = new ArrayList<>();
    private String targetNodeId;

    // ------------------------------------------------------------
    // nodes
    // ------------------------------------------------------------

    public GraphNode addNode(String id, List<String> columns) {
        return addNode(id, NodeKind.TABLE, columns);
    }

    public GraphNode addNode(String id, NodeKind kind, List<String> columns) {
        return putNode(new GraphNode(requireId(id), kind, columns, null));
    }

    public GraphNode addSubqueryNode(String id, String body, List<String> columns) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("subquery body is blank: " + id);
        }
        return putNode(new GraphNode(requireId(id), NodeKind.SUBQUERY, columns, body));
    }

    private GraphNode putNode(GraphNode node) {
        if (nodes.containsKey(node.getId())) {
            throw new DuplicateNodeException(node.getId());
        }
        nodes.put(node.getId(), node);
        return node;
    }

    /**
     * Removes the node and every join/mapping edge that references it.
     */
    public void removeNode(String nodeId) {
        String id = requireNode(nodeId).getId();
        nodes.remove(id);
        joinEdges.removeIf(e -> e.touches(id));
        mappingEdges.removeIf(e -> e.touches(id));
        if (id.equals(targetNodeId)) {
            targetNodeId = null;
        }
    }

    /**
     * Alias management: gives a node a new id and re-points every edge.
     * Join conditions and mapping refs that start with {@code oldId.} are rewritten too.
     */
    public void renameNode(String currentId, String newId) {
        GraphNode node = requireNode(currentId);
        String oldId = node.getId();
        String nid = requireId(newId);
        if (nid.equals(oldId)) return;
        if (nodes.containsKey(nid)) throw new DuplicateNodeException(nid);

        Map<String, GraphNode> reordered = new LinkedHashMap<>();
        for (Map.Entry<String, GraphNode> e : nodes.entrySet()) {
            if (e.getKey().equals(oldId)) reordered.put(nid, node.renamedTo(nid));
            else reordered.put(e.getKey(), e.getValue());
        }
        nodes.clear();
        nodes.putAll(reordered);

        Pattern qualified = qualifiedPrefix(oldId);
        for (int i = 0; i < joinEdges.size(); i++) {
            JoinEdge e = joinEdges.get(i);
            if (!e.touches(oldId)) continue;
            joinEdges.set(i, new JoinEdge(
                    e.getNodeA().equals(oldId) ? nid : e.getNodeA(),
                    e.getNodeB().equals(oldId) ? nid : e.getNodeB(),
                    e.getJoinType(),
                    replacePrefix(qualified, e.getCondition(), nid)));
        }
        for (int i = 0; i < mappingEdges.size(); i++) {
            MappingEdge m = mappingEdges.get(i);
            if (!m.touches(oldId)) continue;
            boolean src = m.getSourceNodeId().equals(oldId);
            boolean tgt = m.getTargetNodeId().equals(oldId);
            mappingEdges.set(i, new MappingEdge(
                    src ? nid + "." + m.getSourceColumn() : m.getSourceColumnRef(),
                    tgt ? nid + "." + m.getTargetColumn() : m.getTargetColumnRef(),
                    src ? nid : m.getSourceNodeId(),
                    tgt ? nid : m.getTargetNodeId()));
        }
        if (oldId.equals(targetNodeId)) targetNodeId = nid;
    }

    /** Fills in (or replaces) the column list once schema discovery has finished. */
    public void replaceColumns(String id, List<String> columns) {
        requireNode(id).setColumns(columns);
    }

    public void selectColumn(String id, String column) {
        requireNode(id).select(requireColumnName(column));
    }

    public void deselectColumn(String id, String column) {
        requireNode(id).deselect(requireColumnName(column));
    }

    // ------------------------------------------------------------
    // joins
    // ------------------------------------------------------------

    public JoinEdge addJoinEdge(String nodeA, String nodeB, JoinType type, String condition) {
        String a = requireNode(nodeA).getId();
        String b = requireNode(nodeB).getId();
        if (a.equals(b)) {
            throw new IllegalArgumentException("self join needs two nodes with different aliases: " + a);
        }
        JoinEdge edge = new JoinEdge(a, b, type, condition);
        joinEdges.add(edge);
        return edge;
    }

    public void removeJoinEdge(int index) {
        checkIndex(index, joinEdges.size(), "join edge");
        joinEdges.remove(index);
    }

    // ------------------------------------------------------------
    // DML target / mappings
    // ------------------------------------------------------------

    /**
     * Marks {@code id} as the only DML target. A previous target is cleared in the
     * same step, together with its mapping edges.
     */
    public void setDmlTarget(String nodeId) {
        String id = requireNode(nodeId).getId();
        if (id.equals(targetNodeId)) return;
        if (targetNodeId != null) {
            String previous = targetNodeId;
            mappingEdges.removeIf(m -> m.getTargetNodeId().equals(previous));
        }
        targetNodeId = id;
    }

    public void clearDmlTarget() {
        targetNodeId = null;
        mappingEdges.clear();
    }

    public MappingEdge addMappingEdge(String sourceColumnRef, String targetColumnRef) {
        if (targetNodeId == null) {
            throw new InvalidMappingException("no DML target is set; mark a target before mapping columns");
        }
        String tgtRef = requireRef(targetColumnRef, "target");
        String srcRef = requireRef(sourceColumnRef, "source");

        String prefix = targetNodeId + ".";
        if (!tgtRef.startsWith(prefix) || tgtRef.length() == prefix.length()) {
            throw new InvalidMappingException("mapping target must be a column of " + targetNodeId + ": " + tgtRef);
        }
        GraphNode target = nodes.get(targetNodeId);
        String tgtCol = tgtRef.substring(prefix.length());
        if (!target.isPlaceholder() && !target.hasColumn(tgtCol)) {
            throw new InvalidMappingException("column not found on target " + targetNodeId + ": " + tgtCol);
        }

        String srcNode = resolveNodeOf(srcRef)
                .orElseThrow(() -> new NodeNotFoundException(ownerGuess(srcRef)));
        if (srcNode.equals(targetNodeId)) {
            throw new InvalidMappingException("mapping source must not be the target itself: " + srcRef);
        }

        MappingEdge edge = new MappingEdge(srcRef, tgtRef, srcNode, targetNodeId);
        mappingEdges.add(edge);
        return edge;
    }

    public void removeMappingEdge(int index) {
        checkIndex(index, mappingEdges.size(), "mapping edge");
        mappingEdges.remove(index);
    }

    // ------------------------------------------------------------
    // queries
    // ------------------------------------------------------------

    public boolean hasNode(String id) {
        return id != null && nodes.containsKey(id.trim());
    }

    public GraphNode getNode(String id) {
        return requireNode(id);
    }

    public Collection<GraphNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<JoinEdge> getJoinEdges() {
        return Collections.unmodifiableList(joinEdges);
    }

    public List<MappingEdge> getMappingEdges() {
        return Collections.unmodifiableList(mappingEdges);
    }

    public Optional<String> getDmlTargetId() {
        return Optional.ofNullable(targetNodeId);
    }

    public boolean isDmlTarget(String id) {
        return id != null && id.trim().equals(targetNodeId);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Finds the node that owns a {@code <nodeId>.<column>} ref. Node ids may contain dots,
     * so the longest matching id wins.
     */
    public Optional<String> resolveNodeOf(String columnRef) {
        if (columnRef == null) return Optional.empty();
        String best = null;
        for (String id : nodes.keySet()) {
            if (columnRef.length() > id.length() + 1
                    && columnRef.startsWith(id)
                    && columnRef.charAt(id.length()) == '.') {
                if (best == null || id.length() > best.length()) best = id;
            }
        }
        return Optional.ofNullable(best);
    }

    /** Drops every node, edge and the target. */
    public void clear() {
        nodes.clear();
        joinEdges.clear();
        mappingEdges.clear();
        targetNodeId = null;
    }

    // ------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------

    private GraphNode requireNode(String id) {
        GraphNode n = (id == null) ? null : nodes.get(id.trim());
        if (n == null) throw new NodeNotFoundException(id);
        return n;
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("node id is blank");
        return id.trim();
    }

    private static String requireColumnName(String column) {
        if (column == null || column.isBlank()) throw new IllegalArgumentException("column is blank");
        return column.trim();
    }

    private static String requireRef(String ref, String side) {
        if (ref == null || ref.isBlank()) throw new InvalidMappingException(side + " column ref is blank");
        return ref.trim();
    }

    private static String ownerGuess(String ref) {
        int p = ref.lastIndexOf('.');
        return p > 0 ? ref.substring(0, p) : ref;
    }

    private static void checkIndex(int index, int size, String label) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException(label + " index out of range: " + index + " (size=" + size + ")");
        }
    }

    private static Pattern qualifiedPrefix(String id) {
        return Pattern.compile("(?<![A-Za-z0-9_$.\\[])" + Pattern.quote(id) + "(?=\\.)");
    }

    private static String replacePrefix(Pattern p, String text, String replacement) {
        if (text == null || text.isEmpty()) return text;
        Matcher m = p.matcher(text);
        return m.replaceAll(Matcher.quoteReplacement(replacement));
    }
}
