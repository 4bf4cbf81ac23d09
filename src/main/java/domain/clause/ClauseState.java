package domain.clause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything besides the graph that shapes a SELECT: filters, grouping, aggregates,
 * ordering, paging, derived columns, a combine query and the CTE list.
 *
 * <p>Lists keep insertion order. {@code limit}/{@code offset} use 0 as "unset".</p>
 */
public final class ClauseState {

    private final List<Predicate> where = new ArrayList<>();
    private final List<Predicate> having = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<Aggregate> aggregates = new ArrayList<>();
    private final List<OrderByItem> orderBy = new ArrayList<>();
    private final List<DerivedColumn> derivedColumns = new ArrayList<>();
    private final Map<String, CteDefinition> ctes = new LinkedHashMap<>();

    private int limit;
    private int offset;
    private CombineQuery combineQuery;

    // ---------------- predicates ----------------

    public Predicate addPredicate(ClauseKind clause, String column, String operator, String value) {
        Predicate p = new Predicate(column, PredicateOperator.parse(operator), value);
        listOf(clause).add(p);
        return p;
    }

    public void removePredicate(ClauseKind clause, int index) {
        List<Predicate> list = listOf(clause);
        checkIndex(index, list.size(), clause + " predicate");
        list.remove(index);
    }

    private List<Predicate> listOf(ClauseKind clause) {
        return clause == ClauseKind.HAVING ? having : where;
    }

    // ---------------- group by / aggregates ----------------

    /** Ordered-unique: a column already present is ignored. */
    public void addGroupBy(String column) {
        if (column == null || column.isBlank()) throw new IllegalArgumentException("group by column is blank");
        String c = column.trim();
        if (!groupBy.contains(c)) groupBy.add(c);
    }

    public void removeGroupBy(String column) {
        if (column == null) return;
        groupBy.remove(column.trim());
    }

    public Aggregate addAggregate(String function, String column, String alias) {
        Aggregate a = new Aggregate(AggregateFunction.parse(function), column, alias);
        aggregates.add(a);
        return a;
    }

    public void removeAggregate(int index) {
        checkIndex(index, aggregates.size(), "aggregate");
        aggregates.remove(index);
    }

    // ---------------- order by / paging ----------------

    public OrderByItem addOrderBy(String column, String direction) {
        OrderByItem o = new OrderByItem(column, SortDirection.parse(direction));
        orderBy.add(o);
        return o;
    }

    public void removeOrderBy(int index) {
        checkIndex(index, orderBy.size(), "order by");
        orderBy.remove(index);
    }

    public void setLimit(int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
        this.limit = limit;
    }

    public void setOffset(int offset) {
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0: " + offset);
        this.offset = offset;
    }

    // ---------------- derived / window / combine ----------------

    public DerivedColumn addDerivedColumn(String alias, String expression) {
        DerivedColumn d = new DerivedColumn(alias, expression);
        derivedColumns.add(d);
        return d;
    }

    public DerivedColumn addWindowFunction(WindowFunction fn) {
        if (fn == null) throw new IllegalArgumentException("window function is null");
        DerivedColumn d = fn.toDerivedColumn();
        derivedColumns.add(d);
        return d;
    }

    public void removeDerivedColumn(String alias) {
        if (alias == null) return;
        String a = alias.trim();
        derivedColumns.removeIf(d -> d.getAlias().equals(a));
    }

    public void setCombineQuery(CombineQuery combineQuery) {
        this.combineQuery = combineQuery;
    }

    // ---------------- CTEs ----------------

    /** Adds a CTE, or replaces the body in place when the name already exists. */
    public CteDefinition addCte(String name, String body) {
        CteDefinition cte = new CteDefinition(name, body);
        ctes.put(cte.getName(), cte);
        return cte;
    }

    public boolean removeCte(String name) {
        if (name == null) return false;
        return ctes.remove(name.trim()) != null;
    }

    // ---------------- reset ----------------

    public void clear() {
        where.clear();
        having.clear();
        groupBy.clear();
        aggregates.clear();
        orderBy.clear();
        derivedColumns.clear();
        ctes.clear();
        limit = 0;
        offset = 0;
        combineQuery = null;
    }

    // ---------------- getters ----------------

    public List<Predicate> getWhere() {
        return Collections.unmodifiableList(where);
    }

    public List<Predicate> getHaving() {
        return Collections.unmodifiableList(having);
    }

    public List<String> getGroupBy() {
        return Collections.unmodifiableList(groupBy);
    }

    public List<Aggregate> getAggregates() {
        return Collections.unmodifiableList(aggregates);
    }

    public List<OrderByItem> getOrderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    public List<DerivedColumn> getDerivedColumns() {
        return Collections.unmodifiableList(derivedColumns);
    }

    public List<CteDefinition> getCtes() {
        return Collections.unmodifiableList(new ArrayList<>(ctes.values()));
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public CombineQuery getCombineQuery() {
        return combineQuery;
    }

    private static void checkIndex(int index, int size, String label) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException(label + " index out of range: " + index + " (size=" + size + ")");
        }
    }
}
