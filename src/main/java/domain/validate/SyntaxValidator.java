package domain.validate;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;

/**
 * Syntax-only check of generated text. No semantic validation: table and column names
 * are never resolved.
 *
 * <p>Text made only of {@code --} comment lines is what the generators emit for an incomplete
 * graph; it is reported as INCOMPLETE rather than invalid.</p>
 */
public final class SyntaxValidator {

    public ValidationResult validate(String sql) {
        if (sql == null || sql.isBlank()) return ValidationResult.empty();

        String trimmed = sql.trim();
        if (isCommentOnly(trimmed)) {
            return ValidationResult.incomplete(firstCommentText(trimmed));
        }

        try {
            CCJSqlParserUtil.parse(trimmed, parser -> parser.withSquareBracketQuotation(true));
            return ValidationResult.valid();
        } catch (JSQLParserException e) {
            return ValidationResult.invalid(firstLine(rootMessage(e)));
        } catch (RuntimeException e) {
            // token manager errors surface as unchecked exceptions
            return ValidationResult.invalid(firstLine(rootMessage(e)));
        }
    }

    static boolean isCommentOnly(String sql) {
        for (String line : sql.split("\\R")) {
            String t = line.trim();
            if (t.isEmpty()) continue;
            if (!t.startsWith("--")) return false;
        }
        return true;
    }

    private static String firstCommentText(String sql) {
        for (String line : sql.split("\\R")) {
            String t = line.trim();
            if (t.startsWith("--")) return t.substring(2).trim();
        }
        return "";
    }

    private static String rootMessage(Throwable t) {
        Throwable cur = t;
        String msg = t.getMessage();
        while (cur.getCause() != null && cur.getCause() != cur) {
            cur = cur.getCause();
            if (cur.getMessage() != null && !cur.getMessage().isBlank()) msg = cur.getMessage();
        }
        return msg == null ? t.getClass().getSimpleName() : msg;
    }

    private static String firstLine(String s) {
        if (s == null) return "";
        String t = s.trim();
        int nl = t.indexOf('\n');
        return (nl >= 0) ? t.substring(0, nl).trim() : t;
    }
}
