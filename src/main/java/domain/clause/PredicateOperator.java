package domain.clause;

import java.util.Locale;

/**
 * Filter operators, grouped by how their value is rendered.
 */
public enum PredicateOperator {
    EQ("=", Family.QUOTED),
    LT("<", Family.QUOTED),
    GT(">", Family.QUOTED),
    LE("<=", Family.QUOTED),
    GE(">=", Family.QUOTED),
    NE("<>", Family.QUOTED),
    IN("IN", Family.LIST),
    NOT_IN("NOT IN", Family.LIST),
    IS_NULL("IS NULL", Family.UNARY),
    IS_NOT_NULL("IS NOT NULL", Family.UNARY),
    EXISTS("EXISTS", Family.UNARY);

    /**
     * QUOTED: {@code col op 'value'}; LIST: {@code col op (value)}; UNARY: {@code col op}.
     */
    public enum Family {
        QUOTED,
        LIST,
        UNARY
    }

    private final String symbol;
    private final Family family;

    PredicateOperator(String symbol, Family family) {
        this.symbol = symbol;
        this.family = family;
    }

    public String symbol() {
        return symbol;
    }

    public Family family() {
        return family;
    }

    /**
     * Accepts the SQL symbol ("&lt;&gt;", "NOT IN", "is null") or the enum name ("NOT_IN").
     */
    public static PredicateOperator parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("predicate operator is blank");
        }
        String u = raw.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        for (PredicateOperator op : values()) {
            if (op.symbol.equals(u) || op.name().equals(u)) return op;
        }
        throw new IllegalArgumentException("unknown predicate operator: " + raw);
    }
}
