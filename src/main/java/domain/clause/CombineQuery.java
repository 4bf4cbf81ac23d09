package domain.clause;

import java.util.Locale;

/**
 * Second SELECT appended to the main one as {@code \n<OP>\n(\n<second>\n)}.
 */
public final class CombineQuery {

    private final SetOperator operator;
    private final String secondSql;

    public CombineQuery(SetOperator operator, String secondSql) {
        if (operator == null) throw new IllegalArgumentException("set operator is null");
        if (secondSql == null || secondSql.isBlank()) throw new IllegalArgumentException("second query is blank");
        String t = secondSql.trim();
        if (!t.toUpperCase(Locale.ROOT).startsWith("SELECT")) {
            throw new IllegalArgumentException("the second query must begin with SELECT");
        }
        this.operator = operator;
        this.secondSql = t;
    }

    public SetOperator getOperator() {
        return operator;
    }

    public String getSecondSql() {
        return secondSql;
    }

    public String appendTo(String mainSql) {
        return mainSql + "\n" + operator.keyword() + "\n(\n" + secondSql + "\n)";
    }
}
