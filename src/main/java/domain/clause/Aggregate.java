package domain.clause;

/** {@code FUNC(col) AS alias} entry of the SELECT list. */
public final class Aggregate {

    private final AggregateFunction function;
    private final String column;
    private final String alias;

    public Aggregate(AggregateFunction function, String column, String alias) {
        if (function == null) throw new IllegalArgumentException("aggregate function is null");
        if (column == null || column.isBlank()) throw new IllegalArgumentException("aggregate column is blank");
        this.function = function;
        this.column = column.trim();
        this.alias = alias == null ? "" : alias.trim();
    }

    public AggregateFunction getFunction() {
        return function;
    }

    public String getColumn() {
        return column;
    }

    public String getAlias() {
        return alias;
    }

    public String render() {
        String expr = function.name() + "(" + column + ")";
        return alias.isEmpty() ? expr : expr + " AS " + alias;
    }
}
