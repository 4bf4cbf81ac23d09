package domain.clause;

import java.util.Locale;

/** Which filter list a predicate belongs to. */
public enum ClauseKind {
    WHERE,
    HAVING;

    public static ClauseKind parse(String raw) {
        if (raw == null || raw.isBlank()) return WHERE;
        try {
            return ClauseKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown clause: " + raw + " (expected WHERE or HAVING)", e);
        }
    }
}
