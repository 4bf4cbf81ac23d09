package domain.convert;

import domain.clause.Aggregate;
import domain.clause.ClauseState;
import domain.clause.DerivedColumn;
import domain.clause.OrderByItem;
import domain.clause.Predicate;
import domain.graph.GraphModel;
import domain.graph.GraphNode;
import domain.model.CompileContext;
import domain.model.CompileWarningSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Renders a full SELECT statement, one clause per line:
 * SELECT, FROM block(s), WHERE, GROUP BY, HAVING, ORDER BY, LIMIT, OFFSET.
 *
 * <p>The SELECT list is the selected columns qualified as {@code <nodeId>.<col>} (node order,
 * then column order), then derived columns, then aggregates, or {@code *} when empty.
 * LIMIT/OFFSET are emitted only when positive.</p>
 */
public final class ClauseAssembler {

    private final FromClauseBuilder fromBuilder;

    public ClauseAssembler(FromClauseBuilder fromBuilder) {
        this.fromBuilder = fromBuilder;
    }

    public String assembleSelect(GraphModel graph, ClauseState clauses, CompileContext ctx, CompileWarningSink sink) {
        return assembleSelect(graph, clauses, Collections.emptySet(), ctx, sink);
    }

    /**
     * @param excluded node ids that take no part in the SELECT (neither columns nor joins)
     */
    public String assembleSelect(
            GraphModel graph,
            ClauseState clauses,
            Set<String> excluded,
            CompileContext ctx,
            CompileWarningSink sink
    ) {
        ClauseState cs = (clauses == null) ? new ClauseState() : clauses;
        Set<String> skip = (excluded == null) ? Collections.emptySet() : excluded;

        List<String> lines = new ArrayList<>();
        lines.add("SELECT " + String.join(", ", selectList(graph, cs, skip)));
        lines.addAll(fromBuilder.buildLines(graph, skip, ctx, sink));

        if (!cs.getWhere().isEmpty()) lines.add("WHERE " + renderPredicates(cs.getWhere()));
        if (!cs.getGroupBy().isEmpty()) lines.add("GROUP BY " + String.join(", ", cs.getGroupBy()));
        if (!cs.getHaving().isEmpty()) lines.add("HAVING " + renderPredicates(cs.getHaving()));
        if (!cs.getOrderBy().isEmpty()) {
            List<String> parts = new ArrayList<>();
            for (OrderByItem o : cs.getOrderBy()) parts.add(o.render());
            lines.add("ORDER BY " + String.join(", ", parts));
        }
        if (cs.getLimit() > 0) lines.add("LIMIT " + cs.getLimit());
        if (cs.getOffset() > 0) lines.add("OFFSET " + cs.getOffset());

        String sql = String.join("\n", lines);
        if (cs.getCombineQuery() != null) {
            sql = cs.getCombineQuery().appendTo(sql);
        }
        return sql;
    }

    List<String> selectList(GraphModel graph, ClauseState cs, Set<String> skip) {
        List<String> parts = new ArrayList<>();
        if (graph != null) {
            for (GraphNode n : graph.getNodes()) {
                if (skip.contains(n.getId())) continue;
                for (String col : n.getSelectedColumns()) {
                    parts.add(n.getId() + "." + col);
                }
            }
        }
        for (DerivedColumn d : cs.getDerivedColumns()) parts.add(d.render());
        for (Aggregate a : cs.getAggregates()) parts.add(a.render());
        if (parts.isEmpty()) parts.add("*");
        return parts;
    }

    static String renderPredicates(List<Predicate> predicates) {
        List<String> parts = new ArrayList<>(predicates.size());
        for (Predicate p : predicates) parts.add(p.render());
        return String.join(" AND ", parts);
    }
}
