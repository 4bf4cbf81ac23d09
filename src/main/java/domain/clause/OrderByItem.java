package domain.clause;

public final class OrderByItem {

    private final String column;
    private final SortDirection direction;

    public OrderByItem(String column, SortDirection direction) {
        if (column == null || column.isBlank()) throw new IllegalArgumentException("order by column is blank");
        this.column = column.trim();
        this.direction = direction == null ? SortDirection.ASC : direction;
    }

    public String getColumn() {
        return column;
    }

    public SortDirection getDirection() {
        return direction;
    }

    /** {@code "col dir"} */
    public String render() {
        return column + " " + direction.name();
    }
}
