package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>We deduplicate by (code|group|name|message|detail) so that a session regenerating
 * many times does not report the same issue over and over.</p>
 */
public final class ListCompileWarningSink implements CompileWarningSink {

    private final List<CompileWarning> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListCompileWarningSink(List<CompileWarning> target) {
        this.target = target;
    }

    private static String key(CompileWarning w) {
        return safe(w.getCode() == null ? "" : w.getCode()
                .name()) + "|"
                + safe(w.getDesignGroup()) + "|"
                + safe(w.getDesignName()) + "|"
                + safe(w.getMessage()) + "|"
                + safe(w.getDetail());
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    @Override
    public void warn(CompileWarning warning) {
        if (warning == null || target == null) return;
        String k = key(warning);
        if (seen.add(k)) {
            target.add(warning);
        }
    }
}
