package domain.graph;

/** What a graph node stands for in the FROM clause. */
public enum NodeKind {
    TABLE,
    CTE,
    SUBQUERY
}
