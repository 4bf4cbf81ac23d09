package domain.convert;

import domain.clause.CteDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partial re-import of a hand-written statement.
 *
 * <p>Leading {@code WITH name AS ( ... )} definitions are split off as CTEs; the remaining body
 * is kept as literal text and never decomposed into nodes or edges.</p>
 */
public final class SqlImporter {

    public static final class ImportedSql {
        private final List<CteDefinition> ctes;
        private final String body;

        ImportedSql(List<CteDefinition> ctes, String body) {
            this.ctes = Collections.unmodifiableList(ctes);
            this.body = body;
        }

        public List<CteDefinition> getCtes() {
            return ctes;
        }

        public String getBody() {
            return body;
        }
    }

    /**
     * @throws IllegalArgumentException when the text is blank or the WITH block is malformed
     */
    public ImportedSql split(String sql) {
        if (sql == null || sql.isBlank()) throw new IllegalArgumentException("imported SQL is blank");

        SqlScan st = new SqlScan(sql.trim());
        st.readSpacesAndComments();
        if (!st.peekWord("WITH")) {
            return new ImportedSql(new ArrayList<>(), sql.trim());
        }
        st.readWord(); // WITH
        st.readSpacesAndComments();
        if (st.peekWord("RECURSIVE")) {
            st.readWord();
            st.readSpacesAndComments();
        }

        List<CteDefinition> ctes = new ArrayList<>();
        while (true) {
            String name = readCteName(st);
            if (name.isEmpty()) {
                throw new IllegalArgumentException("CTE name expected at offset " + st.pos);
            }
            st.readSpacesAndComments();

            // optional column list: name (a, b) AS (...)
            if (st.peek() == '(') {
                name = name + " " + st.readParenBlock();
                st.readSpacesAndComments();
            }
            if (!st.peekWord("AS")) {
                throw new IllegalArgumentException("AS expected after CTE " + name);
            }
            st.readWord();
            st.readSpacesAndComments();
            if (st.peek() != '(') {
                throw new IllegalArgumentException("( expected for body of CTE " + name);
            }
            String block = st.readParenBlock();
            if (!block.endsWith(")")) {
                throw new IllegalArgumentException("unterminated body of CTE " + name);
            }
            ctes.add(new CteDefinition(name, block.substring(1, block.length() - 1).trim()));

            st.readSpacesAndComments();
            if (st.peek() == ',') {
                st.read();
                st.readSpacesAndComments();
                continue;
            }
            break;
        }

        String body = st.rest().trim();
        if (body.isEmpty()) throw new IllegalArgumentException("statement after WITH block is missing");
        return new ImportedSql(ctes, body);
    }

    private static String readCteName(SqlScan st) {
        if (st.peekIsBracketIdentifier()) return st.readBracketIdentifier();
        if (st.peekIsDoubleQuotedString()) return st.readDoubleQuotedString();
        if (SqlIdentifierUtil.isIdentStart(st.peek())) return st.readIdentifier();
        return "";
    }
}
