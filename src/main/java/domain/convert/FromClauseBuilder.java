package domain.convert;

import domain.graph.GraphModel;
import domain.graph.GraphNode;
import domain.graph.JoinEdge;
import domain.model.CompileContext;
import domain.model.CompileWarning;
import domain.model.CompileWarningSink;
import domain.model.WarningCode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Linearises the join graph into FROM / JOIN lines.
 *
 * <p>Nodes are visited in insertion order; every unvisited node roots a FIFO breadth-first
 * walk. The edge that first reaches a node produces its {@code <TYPE> JOIN <node> ON <cond>}
 * line. Neighbours are taken in edge-insertion order, and edges between already-visited nodes
 * add nothing.</p>
 *
 * <p>Each connected component yields its own {@code FROM} block and the blocks are simply
 * concatenated. That output is not executable SQL when there is more than one block, so a
 * {@link WarningCode#DISCONNECTED_JOIN_GRAPH} warning is raised.</p>
 */
public final class FromClauseBuilder {

    /**
     * @param excluded node ids left out of the walk (the DML target); may be empty
     * @return FROM/JOIN lines in output order, empty when no node remains
     */
    public List<String> buildLines(GraphModel graph, Set<String> excluded, CompileContext ctx, CompileWarningSink sink) {
        if (graph == null || graph.isEmpty()) return Collections.emptyList();
        Set<String> skip = (excluded == null) ? Collections.emptySet() : excluded;
        CompileWarningSink warnSink = (sink == null) ? CompileWarningSink.none() : sink;

        Map<String, List<JoinEdge>> adjacency = adjacency(graph, skip);

        List<String> lines = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        List<String> roots = new ArrayList<>();

        for (GraphNode root : graph.getNodes()) {
            String rootId = root.getId();
            if (skip.contains(rootId) || visited.contains(rootId)) continue;

            roots.add(rootId);
            visited.add(rootId);
            lines.add("FROM " + root.fromReference());

            Deque<String> queue = new ArrayDeque<>();
            queue.add(rootId);
            while (!queue.isEmpty()) {
                String u = queue.poll();
                for (JoinEdge e : adjacency.getOrDefault(u, Collections.emptyList())) {
                    String v = e.other(u);
                    if (!visited.add(v)) continue;
                    queue.add(v);
                    lines.add(joinLine(e, graph.getNode(v)));
                }
            }
        }

        if (roots.size() > 1) {
            warnSink.warn(CompileWarning.of(
                    WarningCode.DISCONNECTED_JOIN_GRAPH,
                    ctx,
                    "join graph has " + roots.size() + " components; FROM blocks are concatenated",
                    String.join(",", roots)
            ));
        }
        return lines;
    }

    public String build(GraphModel graph, Set<String> excluded, CompileContext ctx, CompileWarningSink sink) {
        return String.join("\n", buildLines(graph, excluded, ctx, sink));
    }

    private static Map<String, List<JoinEdge>> adjacency(GraphModel graph, Set<String> skip) {
        Map<String, List<JoinEdge>> adj = new LinkedHashMap<>();
        for (JoinEdge e : graph.getJoinEdges()) {
            if (skip.contains(e.getNodeA()) || skip.contains(e.getNodeB())) continue;
            adj.computeIfAbsent(e.getNodeA(), k -> new ArrayList<>()).add(e);
            adj.computeIfAbsent(e.getNodeB(), k -> new ArrayList<>()).add(e);
        }
        return adj;
    }

    // condition is emitted verbatim, whichever endpoint discovered the other
    private static String joinLine(JoinEdge e, GraphNode discovered) {
        String head = e.getJoinType().keyword() + " " + discovered.fromReference();
        return e.getCondition().isEmpty() ? head : head + " ON " + e.getCondition();
    }
}
