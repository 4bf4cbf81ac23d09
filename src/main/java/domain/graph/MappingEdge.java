package domain.graph;

/**
 * Source column to target column mapping used by INSERT/UPDATE.
 *
 * <p>Refs are {@code <nodeId>.<column>}. The owning node ids are resolved once by
 * {@link GraphModel} so that cascading removal is a plain filter.</p>
 */
public final class MappingEdge {

    private final String sourceColumnRef;
    private final String targetColumnRef;
    private final String sourceNodeId;
    private final String targetNodeId;

    MappingEdge(String sourceColumnRef, String targetColumnRef, String sourceNodeId, String targetNodeId) {
        this.sourceColumnRef = sourceColumnRef;
        this.targetColumnRef = targetColumnRef;
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
    }

    public String getSourceColumnRef() {
        return sourceColumnRef;
    }

    public String getTargetColumnRef() {
        return targetColumnRef;
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public String getTargetNodeId() {
        return targetNodeId;
    }

    public String getSourceColumn() {
        return sourceColumnRef.substring(sourceNodeId.length() + 1);
    }

    public String getTargetColumn() {
        return targetColumnRef.substring(targetNodeId.length() + 1);
    }

    public boolean touches(String nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }

    @Override
    public String toString() {
        return sourceColumnRef + " -> " + targetColumnRef;
    }
}
