package domain.clause;

/**
 * A computed SELECT-list entry, rendered as {@code <expression> AS <alias>}.
 */
public final class DerivedColumn {

    private final String alias;
    private final String expression;

    public DerivedColumn(String alias, String expression) {
        if (alias == null || alias.isBlank()) throw new IllegalArgumentException("derived column alias is blank");
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("derived column expression is blank: " + alias);
        }
        String e = expression.trim();
        if (!parenthesesBalanced(e)) {
            throw new IllegalArgumentException("unbalanced parentheses in expression: " + e);
        }
        this.alias = alias.trim();
        this.expression = e;
    }

    static boolean parenthesesBalanced(String s) {
        int depth = 0;
        boolean inQuote = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\'') {
                inQuote = !inQuote;
                continue;
            }
            if (inQuote) continue;
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth < 0) return false;
            }
        }
        return depth == 0;
    }

    public String getAlias() {
        return alias;
    }

    public String getExpression() {
        return expression;
    }

    public String render() {
        return expression + " AS " + alias;
    }
}
