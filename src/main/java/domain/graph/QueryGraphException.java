package domain.graph;

/**
 * Structural error raised by {@link GraphModel}.
 *
 * <p>Always thrown before any state is touched, so the caller keeps the prior graph.</p>
 */
public class QueryGraphException extends RuntimeException {

    public QueryGraphException(String message) {
        super(message);
    }
}
