package domain.design;

import domain.clause.WindowFunction;
import domain.graph.NodeKind;
import domain.model.LinkedServerMap;
import domain.model.OperationMode;
import domain.session.QuerySession;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies a {@link DesignScript} to a {@link QuerySession}, one inbound call per row.
 *
 * <p>Command names are case-insensitive and ignore {@code _} / {@code -}. The first failing row
 * stops the replay with a {@link DesignReplayException}; rows already applied stay applied.</p>
 */
public final class DesignScriptReplayer {

    public void replay(DesignScript script, QuerySession session) {
        if (script == null || session == null) throw new IllegalArgumentException("script/session is null");
        for (DesignCommand c : script.getCommands()) {
            try {
                apply(c, session);
            } catch (DesignReplayException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new DesignReplayException(c, e);
            }
        }
    }

    void apply(DesignCommand c, QuerySession s) {
        switch (c.key()) {
            // ---------------- graph ----------------
            case "addnode":
            case "addtable":
                s.addNode(c.requiredArg(0, "node id"), nodeKind(c.arg(2)), c.listArg(1));
                break;
            case "addsubquery":
            case "addsubquerynode":
                s.addSubqueryNode(c.requiredArg(0, "node id"), c.rawArg(1), c.listArg(2));
                break;
            case "removenode":
                s.removeNode(c.requiredArg(0, "node id"));
                break;
            case "renamenode":
            case "renamealias":
                s.renameNode(c.requiredArg(0, "old id"), c.requiredArg(1, "new id"));
                break;
            case "replacecolumns":
            case "setcolumns":
                s.replaceColumns(c.requiredArg(0, "node id"), c.listArg(1));
                break;
            case "selectcolumn":
            case "selectcolumns":
                for (String col : requiredList(c, 1, "column")) s.selectColumn(c.requiredArg(0, "node id"), col);
                break;
            case "deselectcolumn":
                for (String col : requiredList(c, 1, "column")) s.deselectColumn(c.requiredArg(0, "node id"), col);
                break;
            case "addjoin":
            case "addjoinedge":
                s.addJoinEdge(c.requiredArg(0, "node a"), c.requiredArg(1, "node b"), c.arg(2), c.rawArg(3));
                break;
            case "removejoin":
            case "removejoinedge":
                s.removeJoinEdge(c.intArg(0, "index"));
                break;
            case "markdmltarget":
            case "setdmltarget":
                s.markDmlTarget(c.requiredArg(0, "node id"));
                break;
            case "cleardmltarget":
                s.clearDmlTarget();
                break;
            case "addmapping":
            case "addmappingedge":
                s.addMappingEdge(c.requiredArg(0, "source ref"), c.requiredArg(1, "target ref"));
                break;
            case "removemapping":
            case "removemappingedge":
                s.removeMappingEdge(c.intArg(0, "index"));
                break;

            // ---------------- clauses ----------------
            case "addpredicate":
                s.addPredicate(c.arg(0), c.requiredArg(1, "column"), c.requiredArg(2, "operator"), c.rawArg(3));
                break;
            case "addwhere":
                s.addPredicate("WHERE", c.requiredArg(0, "column"), c.requiredArg(1, "operator"), c.rawArg(2));
                break;
            case "addhaving":
                s.addPredicate("HAVING", c.requiredArg(0, "column"), c.requiredArg(1, "operator"), c.rawArg(2));
                break;
            case "removepredicate":
                s.removePredicate(c.arg(0), c.intArg(1, "index"));
                break;
            case "addgroupby":
                for (String col : requiredList(c, 0, "column")) s.addGroupBy(col);
                break;
            case "removegroupby":
                s.removeGroupBy(c.requiredArg(0, "column"));
                break;
            case "addaggregate":
                s.addAggregate(c.requiredArg(0, "function"), c.requiredArg(1, "column"), c.arg(2));
                break;
            case "removeaggregate":
                s.removeAggregate(c.intArg(0, "index"));
                break;
            case "addorderby":
                s.addOrderBy(c.requiredArg(0, "column"), c.arg(1));
                break;
            case "removeorderby":
                s.removeOrderBy(c.intArg(0, "index"));
                break;
            case "setlimit":
                s.setLimit(c.intArg(0, "limit"));
                break;
            case "setoffset":
                s.setOffset(c.intArg(0, "offset"));
                break;
            case "addderivedcolumn":
            case "addderived":
                s.addDerivedColumn(c.requiredArg(0, "alias"), c.requiredArg(1, "expression"));
                break;
            case "removederivedcolumn":
                s.removeDerivedColumn(c.requiredArg(0, "alias"));
                break;
            case "addwindowfunction":
                s.addWindowFunction(windowFunction(c));
                break;
            case "setcombinequery":
            case "combinequery":
                s.setCombineQuery(c.requiredArg(0, "operator"), c.rawArg(1));
                break;
            case "clearcombinequery":
                s.clearCombineQuery();
                break;
            case "addcte":
                s.addCte(c.requiredArg(0, "name"), c.rawArg(1));
                break;
            case "removecte":
                s.removeCte(c.requiredArg(0, "name"));
                break;

            // ---------------- session ----------------
            case "setoperationmode":
            case "setmode":
                s.setOperationMode(OperationMode.parse(c.requiredArg(0, "mode")));
                break;
            case "setlinkedserver":
            case "addlinkedserver":
                s.setLinkedServerMap(withEntry(s.getLinkedServers(), c.requiredArg(0, "alias"), c.requiredArg(1, "linked server")));
                break;
            case "clearlinkedservers":
                s.setLinkedServerMap(LinkedServerMap.empty());
                break;
            case "importsql":
                s.importSql(c.rawArg(0));
                break;
            case "reset":
                s.reset();
                break;
            case "setautogenerate":
                s.setAutoGenerate(parseBoolean(c.requiredArg(0, "flag")));
                break;
            default:
                throw new DesignReplayException(c, "unknown command");
        }
    }

    private static NodeKind nodeKind(String raw) {
        if (raw == null || raw.isBlank()) return NodeKind.TABLE;
        try {
            return NodeKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown node kind: " + raw, e);
        }
    }

    private static List<String> requiredList(DesignCommand c, int i, String label) {
        List<String> v = c.listArg(i);
        if (v.isEmpty()) throw new IllegalArgumentException(c.getName() + ": missing " + label + " (arg" + (i + 1) + ")");
        return v;
    }

    /**
     * {@code addWindowFunction, FN, alias, partitionCols, orderCols[ DESC]}
     */
    private static WindowFunction windowFunction(DesignCommand c) {
        WindowFunction.Kind kind = WindowFunction.Kind.parse(c.requiredArg(0, "function"));
        String alias = c.requiredArg(1, "alias");
        List<String> order = c.listArg(3);
        boolean desc = false;
        if (!order.isEmpty()) {
            int lastIdx = order.size() - 1;
            String lastCol = order.get(lastIdx);
            if (lastCol.toUpperCase(Locale.ROOT).endsWith(" DESC")) {
                desc = true;
                order.set(lastIdx, lastCol.substring(0, lastCol.length() - " DESC".length()).trim());
            }
        }
        return new WindowFunction(kind, alias, c.listArg(2), order, desc);
    }

    private static LinkedServerMap withEntry(LinkedServerMap current, String alias, String linked) {
        Map<String, String> m = new LinkedHashMap<>(current.asMap());
        m.put(alias, linked);
        return LinkedServerMap.of(m);
    }

    private static boolean parseBoolean(String v) {
        String t = v.trim().toLowerCase(Locale.ROOT);
        if (t.equals("true") || t.equals("y") || t.equals("yes") || t.equals("1") || t.equals("on")) return true;
        if (t.equals("false") || t.equals("n") || t.equals("no") || t.equals("0") || t.equals("off")) return false;
        throw new IllegalArgumentException("not a boolean: " + v);
    }
}
