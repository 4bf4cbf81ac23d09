package domain.convert;

/**
 * Cursor over SQL text. Knows just enough lexical structure (words, comments, quoted
 * strings, bracketed identifiers, parenthesised blocks) to let the rewriters leave
 * everything they do not own untouched.
 */
final class SqlScan {
    final String s;
    int pos = 0;

    SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    boolean peekWord(String kw) {
        int n = kw.length();
        if (pos + n > s.length()) return false;
        if (pos > 0 && isWordChar(s.charAt(pos - 1))) return false;

        for (int i = 0; i < n; i++) {
            if (Character.toUpperCase(s.charAt(pos + i)) != Character.toUpperCase(kw.charAt(i))) return false;
        }
        return pos + n >= s.length() || !isWordChar(s.charAt(pos + n));
    }

    String readWord() {
        int start = pos;
        while (pos < s.length() && isWordChar(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    /** Skips whitespace and comments; returns what was skipped. */
    String readSpacesAndComments() {
        int start = pos;
        while (pos < s.length()) {
            if (Character.isWhitespace(s.charAt(pos))) { pos++; continue; }
            if (peekIsLineComment()) { readLineComment(); continue; }
            if (peekIsBlockComment()) { readBlockComment(); continue; }
            break;
        }
        return s.substring(start, pos);
    }

    boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*';
    }

    boolean peekIsSingleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '\'';
    }

    boolean peekIsDoubleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '"';
    }

    boolean peekIsBracketIdentifier() {
        return pos < s.length() && s.charAt(pos) == '[';
    }

    String readDoubleQuotedString() {
        int start = pos;
        pos++; // "
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '"') break;
        }
        return s.substring(start, pos);
    }

    String readBracketIdentifier() {
        int start = pos;
        pos++; // [
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == ']') {
                // escaped ]]
                if (pos < s.length() && s.charAt(pos) == ']') {
                    pos++;
                    continue;
                }
                break;
            }
        }
        return s.substring(start, pos);
    }

    String readLineComment() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\n') break;
        }
        return s.substring(start, pos);
    }

    String readBlockComment() {
        int start = pos;
        pos += 2; // /*
        while (pos + 1 < s.length()) {
            if (s.charAt(pos) == '*' && s.charAt(pos + 1) == '/') {
                pos += 2;
                return s.substring(start, pos);
            }
            pos++;
        }
        pos = s.length();
        return s.substring(start, pos);
    }

    String readSingleQuotedString() {
        int start = pos;
        pos++; // '
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\'') {
                // escaped ''
                if (pos < s.length() && s.charAt(pos) == '\'') {
                    pos++;
                    continue;
                }
                break;
            }
        }
        return s.substring(start, pos);
    }

    /** Dotted identifier such as {@code alias.db.table}. */
    String readIdentifier() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$' || c == '#') {
                pos++;
                continue;
            }
            break;
        }
        return s.substring(start, pos);
    }

    /** Reads a balanced {@code ( ... )} block including the outer parentheses. */
    String readParenBlock() {
        if (peek() != '(') return "";
        int start = pos;
        int depth = 0;

        while (pos < s.length()) {
            if (peekIsLineComment()) { readLineComment(); continue; }
            if (peekIsBlockComment()) { readBlockComment(); continue; }
            if (peekIsSingleQuotedString()) { readSingleQuotedString(); continue; }
            if (peekIsBracketIdentifier()) { readBracketIdentifier(); continue; }

            char c = read();
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) break;
            }
        }

        return s.substring(start, pos);
    }

    String rest() {
        String r = s.substring(Math.min(pos, s.length()));
        pos = s.length();
        return r;
    }
}
