package domain.convert;

import domain.clause.ClauseState;
import domain.graph.GraphModel;
import domain.graph.MappingEdge;
import domain.model.CompileContext;
import domain.model.CompileWarning;
import domain.model.CompileWarningSink;
import domain.model.OperationMode;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * INSERT / UPDATE / DELETE generation.
 *
 * <p>Never throws for an incomplete graph: a missing target or missing mappings produce a single
 * {@code -- ...} comment line (plus a warning) so the caller always has text to show.</p>
 *
 * <p>The value sub-select is the regular SELECT over every node except the target. UPDATE and
 * DELETE join on the literal column {@code id}.</p>
 */
public final class DmlTranslator {

    static final String KEY_COLUMN = "id";

    private final ClauseAssembler assembler;

    public DmlTranslator(ClauseAssembler assembler) {
        this.assembler = assembler;
    }

    public String translate(
            OperationMode mode,
            GraphModel graph,
            ClauseState clauses,
            CompileContext ctx,
            CompileWarningSink sink
    ) {
        if (mode == null || !mode.isDml()) {
            throw new IllegalArgumentException("not a DML mode: " + mode);
        }
        CompileWarningSink warnSink = (sink == null) ? CompileWarningSink.none() : sink;

        Optional<String> target = graph.getDmlTargetId();
        if (target.isEmpty()) {
            warnSink.warn(CompileWarning.of(WarningCode.DML_TARGET_MISSING, ctx,
                    "no DML target selected", mode.name()));
            return "-- No target table marked for " + mode.name() + " => no " + mode.name() + ".";
        }
        String targetId = target.get();

        List<MappingEdge> mappings = mappingsOf(graph, targetId);
        if (mappings.isEmpty()) {
            warnSink.warn(CompileWarning.of(WarningCode.DML_MAPPING_MISSING, ctx,
                    "no column mappings to target", targetId));
            return "-- No column mappings to " + targetId + " => no " + mode.name() + ".";
        }

        String table = SqlIdentifierUtil.lastTwoParts(targetId);
        String subSelect = assembler.assembleSelect(graph, clauses, Collections.singleton(targetId), ctx, warnSink);

        switch (mode) {
            case INSERT:
                return insert(table, mappings, subSelect);
            case UPDATE:
                return update(table, targetId, mappings, subSelect, ctx, warnSink);
            case DELETE:
            default:
                return delete(table, subSelect);
        }
    }

    private static List<MappingEdge> mappingsOf(GraphModel graph, String targetId) {
        List<MappingEdge> out = new ArrayList<>();
        for (MappingEdge m : graph.getMappingEdges()) {
            if (m.getTargetNodeId().equals(targetId)) out.add(m);
        }
        return out;
    }

    private static String insert(String table, List<MappingEdge> mappings, String subSelect) {
        List<String> cols = new ArrayList<>(mappings.size());
        for (MappingEdge m : mappings) cols.add(m.getTargetColumn());
        return "INSERT INTO " + table + " (" + String.join(", ", cols) + ")\n" + subSelect;
    }

    private static String update(
            String table,
            String targetId,
            List<MappingEdge> mappings,
            String subSelect,
            CompileContext ctx,
            CompileWarningSink sink
    ) {
        List<String> sets = new ArrayList<>(mappings.size());
        for (MappingEdge m : mappings) {
            if (KEY_COLUMN.equals(m.getTargetColumn())) continue;
            sets.add(m.getTargetColumn() + "=src." + m.getSourceColumn());
        }
        if (sets.isEmpty()) {
            sink.warn(CompileWarning.of(WarningCode.DML_SET_EMPTY, ctx,
                    "only key column mappings; nothing to SET", targetId));
            return "-- Only " + KEY_COLUMN + " is mapped to " + targetId + " => nothing to SET.";
        }
        return "UPDATE " + table + "\n"
                + "SET " + String.join(", ", sets) + "\n"
                + "FROM (\n"
                + subSelect + "\n"
                + ") AS src\n"
                + "WHERE " + table + "." + KEY_COLUMN + "=src." + KEY_COLUMN;
    }

    private static String delete(String table, String subSelect) {
        return "DELETE FROM " + table + "\n"
                + "WHERE " + KEY_COLUMN + " IN (\n"
                + subSelect + "\n"
                + ")";
    }
}
