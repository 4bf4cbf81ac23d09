package domain.model;

/**
 * A single compile outcome row for reporting.
 *
 * <p>Kept as a simple value object (no behavior). It is not tied to any
 * external library so it can be reused by CLI/API layers.</p>
 */
public final class CompileResult {

    /**
     * e.g. SUCCESS / SKIP
     */
    private final String status;
    private final String designGroup;
    private final String designName;

    /**
     * optional reason message for SKIP
     */
    private final String message;

    /**
     * SELECT / INSERT / UPDATE / DELETE
     */
    private final String operationMode;

    /**
     * advisory syntax check outcome (null when validation was disabled)
     */
    private final Boolean syntaxValid;

    private final String validationMessage;

    /**
     * design script location
     */
    private final String source;

    public CompileResult(String status, String designGroup, String designName, String message) {
        this(status, designGroup, designName, message, "", null, null, null);
    }

    public CompileResult(
            String status,
            String designGroup,
            String designName,
            String message,
            String operationMode,
            Boolean syntaxValid,
            String validationMessage,
            String source
    ) {
        this.status = nullToEmpty(status);
        this.designGroup = nullToEmpty(designGroup);
        this.designName = nullToEmpty(designName);
        this.message = nullToEmpty(message);
        this.operationMode = nullToEmpty(operationMode);
        this.syntaxValid = syntaxValid;
        this.validationMessage = nullToNullIfBlank(validationMessage);
        this.source = nullToNullIfBlank(source);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String nullToNullIfBlank(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public String getStatus() {
        return status;
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

    public String getOperationMode() {
        return operationMode;
    }

    public Boolean getSyntaxValid() {
        return syntaxValid;
    }

    public String getValidationMessage() {
        return validationMessage;
    }

    public String getSource() {
        return source;
    }
}
