package domain.clause;

/**
 * One {@code (column, operator, value)} filter.
 *
 * <p>No type-aware quoting: comparison values are always wrapped in single quotes, list values
 * are inserted verbatim between parentheses.</p>
 */
public final class Predicate {

    private final String column;
    private final PredicateOperator operator;
    private final String value;

    public Predicate(String column, PredicateOperator operator, String value) {
        if (column == null || column.isBlank()) throw new IllegalArgumentException("predicate column is blank");
        if (operator == null) throw new IllegalArgumentException("predicate operator is null");
        this.column = column.trim();
        this.operator = operator;
        this.value = value == null ? "" : value;
    }

    public String getColumn() {
        return column;
    }

    public PredicateOperator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    public String render() {
        switch (operator.family()) {
            case UNARY:
                return column + " " + operator.symbol();
            case LIST:
                return column + " " + operator.symbol() + " (" + value + ")";
            case QUOTED:
            default:
                return column + " " + operator.symbol() + " '" + value + "'";
        }
    }

    @Override
    public String toString() {
        return render();
    }
}
