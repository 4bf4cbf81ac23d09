package cli;

import app.QueryCompileCliApp;


/**
 * CLI entrypoint facade.
 *
 * <p>Option parsing, path resolution and the replay loop live in
 * {@link QueryCompileCliApp}; this class stays small so run scripts only need
 * to know its name.</p>
 */
public class QueryCompileCli {

    public static void main(String[] args) throws Exception {
        QueryCompileCliApp.main(args);
    }
}
