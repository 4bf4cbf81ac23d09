package domain.graph;

import java.util.Locale;

/**
 * Join type of a {@link JoinEdge}.
 *
 * <p>{@link #parse(String)} accepts both the bare keyword ("LEFT") and the
 * keyword with the JOIN suffix ("LEFT JOIN", "left outer join").</p>
 */
public enum JoinType {
    INNER,
    LEFT,
    RIGHT,
    FULL;

    public String keyword() {
        return name() + " JOIN";
    }

    public static JoinType parse(String raw) {
        if (raw == null || raw.isBlank()) return INNER;
        String u = raw.trim()
                .toUpperCase(Locale.ROOT)
                .replaceAll("\\s+", " ");
        if (u.endsWith(" JOIN")) u = u.substring(0, u.length() - " JOIN".length()).trim();
        if (u.endsWith(" OUTER")) u = u.substring(0, u.length() - " OUTER".length()).trim();
        if (u.equals("JOIN")) return INNER;
        try {
            return JoinType.valueOf(u);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown join type: " + raw, e);
        }
    }
}
