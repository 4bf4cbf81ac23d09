package domain.convert;

import domain.clause.CteDefinition;

import java.util.List;

/**
 * Prefixes the main statement with a WITH block. Bodies are opaque text.
 */
public final class CteInliner {

    public String inline(List<CteDefinition> ctes, String mainSql) {
        if (ctes == null || ctes.isEmpty()) return mainSql;

        StringBuilder sb = new StringBuilder(256);
        for (int i = 0; i < ctes.size(); i++) {
            CteDefinition cte = ctes.get(i);
            sb.append(i == 0 ? "WITH " : ",\n  ")
                    .append(cte.getName())
                    .append(" AS (\n")
                    .append(cte.getBody())
                    .append("\n)");
        }
        sb.append('\n').append(mainSql == null ? "" : mainSql);
        return sb.toString();
    }
}
