package domain.graph;

/** An edge or operation referenced a node id that is not in the graph. */
public class NodeNotFoundException extends QueryGraphException {

    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("node not found: " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
