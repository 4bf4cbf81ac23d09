package domain.graph;

/** A node with the same id already exists. */
public class DuplicateNodeException extends QueryGraphException {

    private final String nodeId;

    public DuplicateNodeException(String nodeId) {
        super("node already exists: " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
