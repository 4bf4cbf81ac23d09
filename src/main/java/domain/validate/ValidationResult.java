package domain.validate;

/**
 * Advisory outcome of a syntax check: a flag plus a human readable status line.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(Status.VALID, "Valid.");
    private static final ValidationResult EMPTY = new ValidationResult(Status.EMPTY, "No SQL to validate.");

    public enum Status {
        VALID,
        INVALID,
        EMPTY,
        INCOMPLETE
    }

    private final Status status;
    private final String message;

    private ValidationResult(Status status, String message) {
        this.status = status;
        this.message = message;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult empty() {
        return EMPTY;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(Status.INVALID, "Invalid - " + (reason == null ? "" : reason));
    }

    public static ValidationResult incomplete(String comment) {
        return new ValidationResult(Status.INCOMPLETE, "Incomplete - " + (comment == null ? "" : comment));
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return message;
    }
}
