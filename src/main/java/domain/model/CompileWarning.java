package domain.model;

/**
 * A single warning emitted during compilation.
 *
 * <p>Warnings are not fatal; they indicate a risk or missing information that
 * operators should review.</p>
 */
public final class CompileWarning {

    private final WarningCode code;
    private final String designGroup;
    private final String designName;
    private final String message;
    private final String detail;

    public CompileWarning(
            WarningCode code,
            String designGroup,
            String designName,
            String message,
            String detail
    ) {
        this.code = code == null ? WarningCode.DESIGN_REPLAY_ERROR : code;
        this.designGroup = nullToEmpty(designGroup);
        this.designName = nullToEmpty(designName);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static CompileWarning of(WarningCode code, CompileContext ctx, String message, String detail) {
        CompileContext c = ctx == null ? CompileContext.none() : ctx;
        return new CompileWarning(code, c.getDesignGroup(), c.getDesignName(), message, detail);
    }

    public static CompileWarning of(WarningCode code, CompileContext ctx, String message) {
        return of(code, ctx, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getDesignGroup() {
        return designGroup;
    }

    public String getDesignName() {
        return designName;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }
}
