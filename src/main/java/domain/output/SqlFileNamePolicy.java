package domain.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * File naming policy for generated SQL.
 * <p>
 * {@code <design group dirs>/<design name>.sql}
 * e.g. sales/monthly/top_customers.sql
 * <p>
 * NOTE:
 * - group은 '/' 또는 '\' 기준으로 폴더를 나눠 그대로 유지함
 * - 파일/폴더명에 쓸 수 없는 문자는 '_'로 치환
 */
public final class SqlFileNamePolicy {

    private SqlFileNamePolicy() {
    }

    /**
     * Build output filename: <designName>.sql
     */
    public static String build(String designName) {
        String id = safePart(designName, "unnamed");
        id = limit(id, 180);
        return id + ".sql";
    }

    /**
     * Group folder segments, e.g. {@code "sales\\monthly" -> [sales, monthly]}.
     * Empty / "." / ".." segments are dropped so output never escapes the root.
     */
    public static List<String> groupDirs(String group) {
        List<String> out = new ArrayList<>();
        String g = group == null ? "" : group.trim();
        if (g.isEmpty()) return out;
        for (String seg : g.split("[\\\\/]+")) {
            String t = seg.trim();
            if (t.isEmpty() || t.equals(".") || t.equals("..")) continue;
            out.add(limit(safePart(t, "_"), 80));
        }
        return out;
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        // avoid hidden/odd files on Windows
        if (s.startsWith(".")) s = "_" + s.substring(1);

        // windows reserved names protection (optional)
        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
