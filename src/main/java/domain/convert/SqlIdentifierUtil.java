package domain.convert;

/**
 * Small identifier helpers shared by the generators.
 */
final class SqlIdentifierUtil {
    private SqlIdentifierUtil() {
    }

    static boolean isIdentStart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    /**
     * {@code alias.db.table -> db.table}; ids with fewer than two segments are returned as-is.
     */
    static String lastTwoParts(String ident) {
        if (ident == null) return "";
        String t = ident.trim();
        int last = t.lastIndexOf('.');
        if (last <= 0) return t;
        int prev = t.lastIndexOf('.', last - 1);
        return (prev >= 0) ? t.substring(prev + 1) : t;
    }
}
