package domain.session;

import domain.model.OperationMode;

/**
 * Text produced by one {@code regenerate()} call.
 */
public final class GenerationResult {

    private final String sql;
    private final OperationMode mode;
    private final boolean incomplete;

    public GenerationResult(String sql, OperationMode mode, boolean incomplete) {
        this.sql = sql == null ? "" : sql;
        this.mode = mode == null ? OperationMode.SELECT : mode;
        this.incomplete = incomplete;
    }

    public String getSql() {
        return sql;
    }

    public OperationMode getMode() {
        return mode;
    }

    /**
     * true when the text is a single {@code --} comment describing why nothing could be generated
     */
    public boolean isIncomplete() {
        return incomplete;
    }

    @Override
    public String toString() {
        return sql;
    }
}
