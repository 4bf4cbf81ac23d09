package domain.model;

/**
 * Per-design compile context used for warning attribution.
 *
 * <p>Keep this immutable and very small (KISS). Warnings carry a stable key:
 * designGroup + designName.</p>
 */
public final class CompileContext {

    private static final CompileContext NONE = new CompileContext("", "");

    private final String designGroup;
    private final String designName;

    public CompileContext(String designGroup, String designName) {
        this.designGroup = safe(designGroup);
        this.designName = safe(designName);
    }

    public static CompileContext none() {
        return NONE;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    public String getDesignGroup() {
        return designGroup;
    }

    public String getDesignName() {
        return designName;
    }
}
