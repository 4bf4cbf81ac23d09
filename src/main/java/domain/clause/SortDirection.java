package domain.clause;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    public static SortDirection parse(String raw) {
        if (raw == null || raw.isBlank()) return ASC;
        String u = raw.trim().toUpperCase(Locale.ROOT);
        if (u.startsWith("DESC")) return DESC;
        if (u.startsWith("ASC")) return ASC;
        throw new IllegalArgumentException("unknown sort direction: " + raw);
    }
}
