package domain.session;

/**
 * Runs generated SQL somewhere else (an ODBC/JDBC connection owned by the caller).
 * The compiler hands the text over verbatim and does not look at the response.
 */
@FunctionalInterface
public interface SqlExecutor {

    void execute(String sql) throws Exception;
}
