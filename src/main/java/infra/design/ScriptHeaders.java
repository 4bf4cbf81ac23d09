package infra.design;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header normalisation shared by the CSV and XLSX script loaders.
 * Headers may be English ("command", "arg1") or Korean ("명령", "인자1").
 */
final class ScriptHeaders {

    static final String[] COMMAND_KEYS = {"command", "cmd", "명령"};

    private ScriptHeaders() {
    }

    static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    static String norm(String s) {
        if (s == null) return "";
        return stripBom(s).trim()
                .toLowerCase(Locale.ROOT)
                .replace(" ", "")
                .replace("_", "")
                .replace("-", "");
    }

    /** normalized header -> index (first wins) */
    static Map<String, Integer> index(List<String> headers) {
        Map<String, Integer> m = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            m.putIfAbsent(norm(headers.get(i)), i);
        }
        return m;
    }

    static int find(Map<String, Integer> idx, int fallback, String... keys) {
        for (String k : keys) {
            Integer i = idx.get(norm(k));
            if (i != null) return i;
        }
        return fallback;
    }

    /**
     * Column positions: [command, arg1, arg2, arg3, arg4]. Unknown headers fall back to
     * the positional layout.
     */
    static int[] scriptColumns(Map<String, Integer> idx) {
        int[] cols = new int[5];
        cols[0] = find(idx, 0, COMMAND_KEYS);
        for (int a = 1; a <= 4; a++) {
            cols[a] = find(idx, a, "arg" + a, "인자" + a);
        }
        return cols;
    }
}
