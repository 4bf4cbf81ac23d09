package domain.session;

import domain.clause.ClauseKind;
import domain.clause.ClauseState;
import domain.clause.CombineQuery;
import domain.clause.CteDefinition;
import domain.clause.SetOperator;
import domain.clause.WindowFunction;
import domain.convert.ClauseAssembler;
import domain.convert.CteInliner;
import domain.convert.DmlTranslator;
import domain.convert.FromClauseBuilder;
import domain.convert.IdentifierRewriter;
import domain.convert.SqlImporter;
import domain.graph.GraphModel;
import domain.graph.JoinType;
import domain.graph.NodeKind;
import domain.model.CompileContext;
import domain.model.CompileWarningSink;
import domain.model.LinkedServerMap;
import domain.model.OperationMode;
import domain.validate.DebouncedValidator;
import domain.validate.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * One editing session: graph, clause state, CTEs, linked-server map and operation mode,
 * plus the text of the last generation.
 *
 * <p>Every mutating call regenerates the full text synchronously when auto-generate is on
 * (the default). Generation is never incremental and is idempotent. Structural errors
 * throw from the mutating call and leave the session unchanged.</p>
 */
public final class QuerySession implements AutoCloseable {

    static final String NO_TABLES = "-- No tables selected on canvas => no SELECT.";

    private final GraphModel graph = new GraphModel();
    private final ClauseState clauses = new ClauseState();

    private final FromClauseBuilder fromBuilder = new FromClauseBuilder();
    private final ClauseAssembler assembler = new ClauseAssembler(fromBuilder);
    private final DmlTranslator dmlTranslator = new DmlTranslator(assembler);
    private final CteInliner cteInliner = new CteInliner();
    private final SqlImporter importer = new SqlImporter();

    private final CompileContext ctx;
    private final CompileWarningSink sink;
    private final DebouncedValidator validator;

    private LinkedServerMap linkedServers = LinkedServerMap.empty();
    private IdentifierRewriter rewriter = new IdentifierRewriter(linkedServers);
    private OperationMode mode = OperationMode.SELECT;
    private boolean autoGenerate = true;
    private String importedBody;
    private GenerationResult last;

    public QuerySession() {
        this(CompileContext.none(), CompileWarningSink.none(), null);
    }

    /**
     * @param validator optional; null disables background validation
     */
    public QuerySession(CompileContext ctx, CompileWarningSink sink, DebouncedValidator validator) {
        this.ctx = (ctx == null) ? CompileContext.none() : ctx;
        this.sink = (sink == null) ? CompileWarningSink.none() : sink;
        this.validator = validator;
    }

    // ------------------------------------------------------------
    // generation
    // ------------------------------------------------------------

    public GenerationResult regenerate() {
        String main;
        boolean incomplete;

        if (mode.isDml()) {
            main = dmlTranslator.translate(mode, graph, clauses, ctx, sink);
            incomplete = main.startsWith("--");
        } else if (graph.isEmpty()) {
            main = (importedBody != null) ? importedBody : NO_TABLES;
            incomplete = (importedBody == null);
        } else {
            main = assembler.assembleSelect(graph, clauses, ctx, sink);
            incomplete = false;
        }

        String sql = main;
        if (!incomplete) {
            sql = rewriter.rewrite(sql, ctx, sink);
            sql = cteInliner.inline(clauses.getCtes(), sql);
        }

        last = new GenerationResult(sql, mode, incomplete);
        if (validator != null) validator.schedule(sql);
        return last;
    }

    /** Last generated result, generating once if nothing has been generated yet. */
    public GenerationResult current() {
        return (last == null) ? regenerate() : last;
    }

    public String getSql() {
        return current().getSql();
    }

    /** @return latest background validation result, or null when none has completed */
    public ValidationResult getValidation() {
        return (validator == null) ? null : validator.getLastResult();
    }

    /** Hands the current text verbatim to an external executor. */
    public void run(SqlExecutor executor) throws Exception {
        if (executor == null) throw new IllegalArgumentException("executor is null");
        executor.execute(current().getSql());
    }

    private void changed() {
        if (autoGenerate) regenerate();
    }

    // ------------------------------------------------------------
    // graph calls
    // ------------------------------------------------------------

    public void addNode(String id, List<String> columns) {
        graph.addNode(id, columns);
        changed();
    }

    public void addNode(String id, NodeKind kind, List<String> columns) {
        graph.addNode(id, kind, columns);
        changed();
    }

    public void addSubqueryNode(String id, String body, List<String> columns) {
        graph.addSubqueryNode(id, body, columns);
        changed();
    }

    public void removeNode(String id) {
        graph.removeNode(id);
        changed();
    }

    public void renameNode(String oldId, String newId) {
        graph.renameNode(oldId, newId);
        changed();
    }

    public void replaceColumns(String id, List<String> columns) {
        graph.replaceColumns(id, columns);
        changed();
    }

    public void selectColumn(String id, String column) {
        graph.selectColumn(id, column);
        changed();
    }

    public void deselectColumn(String id, String column) {
        graph.deselectColumn(id, column);
        changed();
    }

    public void addJoinEdge(String a, String b, String joinType, String condition) {
        graph.addJoinEdge(a, b, JoinType.parse(joinType), condition);
        changed();
    }

    public void removeJoinEdge(int index) {
        graph.removeJoinEdge(index);
        changed();
    }

    public void markDmlTarget(String id) {
        graph.setDmlTarget(id);
        changed();
    }

    public void clearDmlTarget() {
        graph.clearDmlTarget();
        changed();
    }

    public void addMappingEdge(String sourceRef, String targetRef) {
        graph.addMappingEdge(sourceRef, targetRef);
        changed();
    }

    public void removeMappingEdge(int index) {
        graph.removeMappingEdge(index);
        changed();
    }

    // ------------------------------------------------------------
    // clause calls
    // ------------------------------------------------------------

    public void addPredicate(String clause, String column, String operator, String value) {
        clauses.addPredicate(ClauseKind.parse(clause), column, operator, value);
        changed();
    }

    public void removePredicate(String clause, int index) {
        clauses.removePredicate(ClauseKind.parse(clause), index);
        changed();
    }

    public void addGroupBy(String column) {
        clauses.addGroupBy(column);
        changed();
    }

    public void removeGroupBy(String column) {
        clauses.removeGroupBy(column);
        changed();
    }

    public void addAggregate(String function, String column, String alias) {
        clauses.addAggregate(function, column, alias);
        changed();
    }

    public void removeAggregate(int index) {
        clauses.removeAggregate(index);
        changed();
    }

    public void addOrderBy(String column, String direction) {
        clauses.addOrderBy(column, direction);
        changed();
    }

    public void removeOrderBy(int index) {
        clauses.removeOrderBy(index);
        changed();
    }

    public void setLimit(int limit) {
        clauses.setLimit(limit);
        changed();
    }

    public void setOffset(int offset) {
        clauses.setOffset(offset);
        changed();
    }

    public void addDerivedColumn(String alias, String expression) {
        clauses.addDerivedColumn(alias, expression);
        changed();
    }

    public void removeDerivedColumn(String alias) {
        clauses.removeDerivedColumn(alias);
        changed();
    }

    public void addWindowFunction(WindowFunction fn) {
        clauses.addWindowFunction(fn);
        changed();
    }

    public void setCombineQuery(String operator, String secondSql) {
        clauses.setCombineQuery(new CombineQuery(SetOperator.parse(operator), secondSql));
        changed();
    }

    public void clearCombineQuery() {
        clauses.setCombineQuery(null);
        changed();
    }

    public void addCte(String name, String body) {
        clauses.addCte(name, body);
        changed();
    }

    public void removeCte(String name) {
        clauses.removeCte(name);
        changed();
    }

    public void setOperationMode(OperationMode mode) {
        this.mode = (mode == null) ? OperationMode.SELECT : mode;
        changed();
    }

    public void setLinkedServerMap(Map<String, String> map) {
        setLinkedServerMap(LinkedServerMap.of(map));
    }

    public void setLinkedServerMap(LinkedServerMap map) {
        this.linkedServers = (map == null) ? LinkedServerMap.empty() : map;
        this.rewriter = new IdentifierRewriter(linkedServers);
        changed();
    }

    public void setAutoGenerate(boolean autoGenerate) {
        this.autoGenerate = autoGenerate;
        if (autoGenerate) regenerate();
    }

    // ------------------------------------------------------------
    // import / reset
    // ------------------------------------------------------------

    /**
     * Replaces the session content with an imported statement: its leading CTEs are registered
     * and the rest is kept as literal text. A malformed WITH block throws before anything is cleared.
     */
    public void importSql(String sql) {
        SqlImporter.ImportedSql imported = importer.split(sql);
        clearContent();
        for (CteDefinition cte : imported.getCtes()) {
            clauses.addCte(cte.getName(), cte.getBody());
        }
        importedBody = imported.getBody();
        changed();
    }

    /** Clears nodes, edges, clause state and CTEs. Linked-server map and mode are kept. */
    public void reset() {
        clearContent();
        changed();
    }

    private void clearContent() {
        graph.clear();
        clauses.clear();
        importedBody = null;
    }

    // ------------------------------------------------------------
    // state
    // ------------------------------------------------------------

    public GraphModel getGraph() {
        return graph;
    }

    public ClauseState getClauses() {
        return clauses;
    }

    public LinkedServerMap getLinkedServers() {
        return linkedServers;
    }

    public OperationMode getOperationMode() {
        return mode;
    }

    public boolean isAutoGenerate() {
        return autoGenerate;
    }

    public String getImportedBody() {
        return importedBody;
    }

    @Override
    public void close() {
        if (validator != null) validator.close();
    }
}
