package domain.model;

import java.util.Locale;

/** What the session generates: a plain SELECT or one of the DML statements. */
public enum OperationMode {
    SELECT,
    INSERT,
    UPDATE,
    DELETE;

    public boolean isDml() {
        return this != SELECT;
    }

    public static OperationMode parse(String raw) {
        if (raw == null || raw.isBlank()) return SELECT;
        try {
            return OperationMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown operation mode: " + raw, e);
        }
    }
}
