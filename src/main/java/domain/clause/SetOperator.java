package domain.clause;

import java.util.Locale;

/** Operator of a combine query. */
public enum SetOperator {
    UNION("UNION"),
    UNION_ALL("UNION ALL"),
    INTERSECT("INTERSECT"),
    EXCEPT("EXCEPT");

    private final String keyword;

    SetOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static SetOperator parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("set operator is blank");
        String u = raw.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s_]+", " ");
        for (SetOperator op : values()) {
            if (op.keyword.equals(u)) return op;
        }
        throw new IllegalArgumentException("unknown set operator: " + raw);
    }
}
