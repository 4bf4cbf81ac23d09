package app;

import domain.design.DesignScriptReplayer;
import domain.model.CompileContext;
import domain.model.CompileWarningSink;
import domain.model.LinkedServerMap;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.session.QuerySession;
import domain.validate.SyntaxValidator;
import infra.design.DesignScriptCsvLoader;
import infra.design.DesignScriptLoader;
import infra.design.DesignScriptXlsxLoader;
import infra.linked.LinkedServerCsvLoader;
import infra.output.*;

import java.nio.file.Path;

/**
 * Object-assembly factory for {@link QueryCompileCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging and moves object
 * creation ("new") concerns here.
 */
final class QueryCompileComponentsFactory {

    DesignScriptLoader createScriptLoader() {
        return new DesignScriptLoader(new DesignScriptCsvLoader(), new DesignScriptXlsxLoader());
    }

    LinkedServerMap loadLinkedServers(Path linkedCsv) {
        if (linkedCsv == null) return LinkedServerMap.empty();
        return new LinkedServerCsvLoader().load(linkedCsv);
    }

    DesignScriptReplayer createReplayer() {
        return new DesignScriptReplayer();
    }

    /**
     * Batch sessions never debounce: the CLI validates synchronously after replay.
     */
    QuerySession createSession(CompileContext ctx, CompileWarningSink sink, LinkedServerMap linked) {
        QuerySession session = new QuerySession(ctx, sink, null);
        session.setAutoGenerate(false);
        session.setLinkedServerMap(linked);
        return session;
    }

    SyntaxValidator createValidator(boolean enable) {
        if (!enable) return null;
        return new SyntaxValidator();
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter(new SqlFileWriter());
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter(new CompileResultXlsxWriter());
    }
}
