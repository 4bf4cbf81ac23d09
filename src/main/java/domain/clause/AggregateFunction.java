package domain.clause;

import java.util.Locale;

public enum AggregateFunction {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX;

    public static AggregateFunction parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("aggregate function is blank");
        try {
            return AggregateFunction.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown aggregate function: " + raw, e);
        }
    }
}
