package domain.convert;

import domain.model.CompileContext;
import domain.model.CompileWarning;
import domain.model.CompileWarningSink;
import domain.model.LinkedServerMap;
import domain.model.WarningCode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Linked-server rewrite: {@code alias.db.table -> [linked].[db].dbo.[table]}.
 *
 * <p>Only replaces tokens in positions where a table identifier is expected:
 * FROM/JOIN &lt;table&gt; (and comma-separated FROM lists), UPDATE &lt;table&gt;,
 * DELETE FROM &lt;table&gt;, INSERT INTO &lt;table&gt;. Comments, string literals and
 * bracketed identifiers pass through unchanged; a parenthesised block in table position
 * is rewritten recursively.</p>
 */
public final class IdentifierRewriter {

    private final LinkedServerMap linkedServers;

    public IdentifierRewriter(LinkedServerMap linkedServers) {
        this.linkedServers = (linkedServers == null) ? LinkedServerMap.empty() : linkedServers;
    }

    public String rewrite(String sql) {
        return rewrite(sql, CompileContext.none(), CompileWarningSink.none());
    }

    public String rewrite(String sql, CompileContext ctx, CompileWarningSink sink) {
        if (sql == null || sql.isEmpty()) return sql;
        CompileWarningSink warnSink = (sink == null) ? CompileWarningSink.none() : sink;

        StringBuilder out = new StringBuilder(sql.length() + 64);
        SqlScan st = new SqlScan(sql);

        boolean expectTable = false;
        int depth = 0;
        // paren depth of every FROM clause still open, innermost first
        Deque<Integer> fromDepths = new ArrayDeque<>();

        boolean seenDelete = false;
        boolean seenInsert = false;

        while (st.hasNext()) {
            if (st.peekIsLineComment()) {
                out.append(st.readLineComment());
                continue;
            }
            if (st.peekIsBlockComment()) {
                out.append(st.readBlockComment());
                continue;
            }
            if (st.peekIsSingleQuotedString()) {
                out.append(st.readSingleQuotedString());
                continue;
            }
            if (st.peekIsDoubleQuotedString()) {
                out.append(st.readDoubleQuotedString());
                continue;
            }
            if (st.peekIsBracketIdentifier()) {
                // 이미 대괄호로 감싼 이름은 건드리지 않는다
                out.append(st.readBracketIdentifier());
                expectTable = false;
                continue;
            }

            // DELETE FROM
            if (st.peekWord("DELETE")) {
                out.append(st.readWord());
                seenDelete = true;
                expectTable = false;
                closeFromClauses(fromDepths, depth);
                continue;
            }
            if (seenDelete && st.peekWord("FROM")) {
                out.append(st.readWord());
                seenDelete = false;
                expectTable = true;
                closeFromClauses(fromDepths, depth);
                continue;
            }

            // INSERT INTO
            if (st.peekWord("INSERT")) {
                out.append(st.readWord());
                seenInsert = true;
                expectTable = false;
                closeFromClauses(fromDepths, depth);
                continue;
            }
            if (seenInsert && st.peekWord("INTO")) {
                out.append(st.readWord());
                seenInsert = false;
                expectTable = true;
                closeFromClauses(fromDepths, depth);
                continue;
            }

            // UPDATE
            if (st.peekWord("UPDATE")) {
                out.append(st.readWord());
                expectTable = true;
                closeFromClauses(fromDepths, depth);
                continue;
            }

            // FROM / JOIN
            if (st.peekWord("FROM") || st.peekWord("JOIN")) {
                out.append(st.readWord());
                expectTable = true;
                if (!inFromClause(fromDepths, depth)) fromDepths.push(depth);
                continue;
            }
            if (st.peekWord("LEFT") || st.peekWord("RIGHT") || st.peekWord("FULL") || st.peekWord("INNER")
                    || st.peekWord("OUTER") || st.peekWord("CROSS")) {
                out.append(st.readWord());
                continue;
            }

            // FROM clause terminator keywords
            if (inFromClause(fromDepths, depth) && (st.peekWord("WHERE") || st.peekWord("GROUP") || st.peekWord("ORDER")
                    || st.peekWord("HAVING") || st.peekWord("UNION") || st.peekWord("INTERSECT")
                    || st.peekWord("EXCEPT") || st.peekWord("LIMIT") || st.peekWord("OFFSET")
                    || st.peekWord("SET"))) {
                closeFromClauses(fromDepths, depth);
                expectTable = false;
                out.append(st.readWord());
                continue;
            }

            if (expectTable) {
                if (st.peek() == '(') {
                    out.append(rewriteParenBlock(st.readParenBlock(), ctx, warnSink));
                    expectTable = false;
                    continue;
                }

                if (SqlIdentifierUtil.isIdentStart(st.peek())) {
                    String tableToken = st.readIdentifier();
                    out.append(rewriteToken(tableToken, ctx, warnSink));
                    expectTable = false;
                    continue;
                }

                char c = st.peek();
                if (!Character.isWhitespace(c)) expectTable = false;
                if (c == '(') depth++;
                else if (c == ')') depth--;
                out.append(st.read());
                continue;
            }

            char c = st.read();
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                // 하위 쿼리가 닫히면 바깥 FROM 상태로 돌아간다
                while (!fromDepths.isEmpty() && fromDepths.peek() > depth) fromDepths.pop();
            } else if (c == ',' && inFromClause(fromDepths, depth)) {
                expectTable = true;
            }
            out.append(c);
        }

        return out.toString();
    }

    private static boolean inFromClause(Deque<Integer> fromDepths, int depth) {
        return !fromDepths.isEmpty() && fromDepths.peek() == depth;
    }

    /** Ends the FROM clause open at {@code depth} (and any deeper one left open). */
    private static void closeFromClauses(Deque<Integer> fromDepths, int depth) {
        while (!fromDepths.isEmpty() && fromDepths.peek() >= depth) fromDepths.pop();
    }

    private String rewriteParenBlock(String block, CompileContext ctx, CompileWarningSink sink) {
        if (block.length() < 2 || block.charAt(block.length() - 1) != ')') return block;
        String inner = block.substring(1, block.length() - 1);
        return "(" + rewrite(inner, ctx, sink) + ")";
    }

    /**
     * Rewrites a single table reference. Anything other than a three-part
     * {@code alias.db.table} with a mapped alias is returned unchanged.
     */
    public String rewriteToken(String token) {
        return rewriteToken(token, CompileContext.none(), CompileWarningSink.none());
    }

    String rewriteToken(String token, CompileContext ctx, CompileWarningSink sink) {
        if (token == null || token.isBlank()) return token;

        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) return token;
        for (String p : parts) {
            if (p.isEmpty()) return token;
        }

        String linked = linkedServers.find(parts[0]);
        if (linked == null) {
            if (!linkedServers.isEmpty()) {
                sink.warn(CompileWarning.of(
                        WarningCode.UNMAPPED_LINKED_ALIAS,
                        ctx,
                        "linked-server alias not mapped",
                        token
                ));
            }
            return token;
        }
        return "[" + linked + "].[" + parts[1] + "].dbo.[" + parts[2] + "]";
    }
}
