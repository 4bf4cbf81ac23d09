package domain.graph;

import java.util.Objects;

/** Undirected join between two nodes. Endpoints are node ids, never node objects. */
public final class JoinEdge {

    private final String nodeA;
    private final String nodeB;
    private final JoinType joinType;
    private final String condition;

    public JoinEdge(String nodeA, String nodeB, JoinType joinType, String condition) {
        this.nodeA = Objects.requireNonNull(nodeA, "nodeA");
        this.nodeB = Objects.requireNonNull(nodeB, "nodeB");
        this.joinType = joinType == null ? JoinType.INNER : joinType;
        this.condition = condition == null ? "" : condition.trim();
    }

    public String getNodeA() {
        return nodeA;
    }

    public String getNodeB() {
        return nodeB;
    }

    public JoinType getJoinType() {
        return joinType;
    }

    public String getCondition() {
        return condition;
    }

    public boolean touches(String nodeId) {
        return nodeA.equals(nodeId) || nodeB.equals(nodeId);
    }

    /** The endpoint across from {@code nodeId}. */
    public String other(String nodeId) {
        return nodeA.equals(nodeId) ? nodeB : nodeA;
    }

    @Override
    public String toString() {
        return nodeA + " " + joinType.keyword() + " " + nodeB + " ON " + condition;
    }
}
