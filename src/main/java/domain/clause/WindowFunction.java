package domain.clause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Ranking / offset window function, rendered as {@code FN() OVER (PARTITION BY .. ORDER BY .. [DESC])}.
 *
 * <p>The descending flag applies to the whole ORDER BY list. With neither partition nor order
 * columns the window is {@code OVER ()}.</p>
 */
public final class WindowFunction {

    public enum Kind {
        ROW_NUMBER,
        RANK,
        DENSE_RANK,
        NTILE,
        LAG,
        LEAD;

        public static Kind parse(String raw) {
            if (raw == null || raw.isBlank()) throw new IllegalArgumentException("window function is blank");
            String u = raw.trim().toUpperCase(Locale.ROOT);
            if (u.endsWith("()")) u = u.substring(0, u.length() - 2);
            try {
                return Kind.valueOf(u);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown window function: " + raw, e);
            }
        }
    }

    private final Kind kind;
    private final String alias;
    private final List<String> partitionBy;
    private final List<String> orderBy;
    private final boolean descending;

    public WindowFunction(Kind kind, String alias, List<String> partitionBy, List<String> orderBy, boolean descending) {
        if (kind == null) throw new IllegalArgumentException("window function is null");
        if (alias == null || alias.isBlank()) throw new IllegalArgumentException("window function alias is required");
        this.kind = kind;
        this.alias = alias.trim();
        this.partitionBy = cleaned(partitionBy);
        this.orderBy = cleaned(orderBy);
        this.descending = descending;
    }

    private static List<String> cleaned(List<String> in) {
        List<String> out = new ArrayList<>();
        if (in == null) return out;
        for (String s : in) {
            if (s != null && !s.isBlank()) out.add(s.trim());
        }
        return out;
    }

    public Kind getKind() {
        return kind;
    }

    public String getAlias() {
        return alias;
    }

    public List<String> getPartitionBy() {
        return Collections.unmodifiableList(partitionBy);
    }

    public List<String> getOrderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    public boolean isDescending() {
        return descending;
    }

    public String expression() {
        List<String> parts = new ArrayList<>(2);
        if (!partitionBy.isEmpty()) parts.add("PARTITION BY " + String.join(", ", partitionBy));
        if (!orderBy.isEmpty()) {
            parts.add("ORDER BY " + String.join(", ", orderBy) + (descending ? " DESC" : ""));
        }
        String over = parts.isEmpty() ? " OVER ()" : " OVER (" + String.join(" ", parts) + ")";
        return kind.name() + "()" + over;
    }

    public DerivedColumn toDerivedColumn() {
        return new DerivedColumn(alias, expression());
    }
}
