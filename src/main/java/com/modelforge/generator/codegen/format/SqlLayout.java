package com.modelforge.generator.codegen.format;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword casing and clause indentation for SQL table definitions.
 *
 * Statement starters sit at column 0, column lines are indented by parenthesis depth, other clause lines by one
 * unit and AND/OR lines by two. Quoted literals, comments and dollar-quoted function bodies are left untouched.
 */
class SqlLayout {

    static final Set<String> KEYWORDS = Set.of(
            "create", "table", "index", "unique", "if", "not", "exists", "null", "primary", "key", "default",
            "references", "cascade", "insert", "into", "values", "select", "from", "where", "and", "or",
            "order", "by", "group", "having", "limit", "offset", "update", "set", "delete", "drop", "alter",
            "trigger", "function", "returns", "before", "after", "each", "row", "execute", "on", "replace",
            "language", "as", "for", "begin", "end", "return");

    static final Pattern STATEMENT_START = Pattern.compile(
            "^(CREATE|INSERT|SELECT|UPDATE|DELETE|DROP|ALTER|GRANT|REVOKE|WITH)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern LOGICAL = Pattern.compile("^(AND|OR)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String indentUnit;

    SqlLayout(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    String format(String content) {
        String[] lines = content.split("\n", -1);
        StringBuilder out = new StringBuilder(content.length());
        int depth = 0;
        boolean inBody = false;
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            String line = lines[i];
            int dollars = countDollarQuotes(line);
            if (inBody) {
                out.append(line);
                if (dollars % 2 == 1) {
                    inBody = false;
                }
                continue;
            }
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String cased = upperCaseKeywords(trimmed);
            out.append(indentUnit.repeat(levelFor(cased, depth))).append(cased);
            depth = Math.max(0, depth + parenBalance(cased));
            if (dollars % 2 == 1) {
                inBody = true;
            }
        }
        return out.toString();
    }

    private int levelFor(String line, int depth) {
        int leadingClosers = 0;
        while (leadingClosers < line.length() && line.charAt(leadingClosers) == ')') {
            leadingClosers++;
        }
        int level = Math.max(0, depth - leadingClosers);
        if (level > 0) {
            return level;
        }
        if (leadingClosers > 0 || STATEMENT_START.matcher(line).find()) {
            return 0;
        }
        if (LOGICAL.matcher(line).find()) {
            return 2;
        }
        return 1;
    }

    /**
     * Upper-cases keywords outside quoted literals and trailing comments.
     */
    static String upperCaseKeywords(String line) {
        StringBuilder out = new StringBuilder(line.length());
        Matcher word = WORD.matcher(line);
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\'' || c == '"') {
                int end = closingQuote(line, i);
                out.append(line, i, end);
                i = end;
            } else if (c == '-' && line.startsWith("--", i)) {
                out.append(line.substring(i));
                break;
            } else if (c == '$' && line.startsWith("$$", i)) {
                out.append("$$");
                i += 2;
            } else {
                word.region(i, line.length());
                if (word.lookingAt()) {
                    String token = word.group();
                    boolean keyword = KEYWORDS.contains(token.toLowerCase(Locale.ROOT))
                            && !isIdentifierContext(line, i);
                    out.append(keyword ? token.toUpperCase(Locale.ROOT) : token);
                    i = word.end();
                } else {
                    out.append(c);
                    i++;
                }
            }
        }
        return out.toString();
    }

    // Part of a dotted or called name, e.g. NEW.updated_at or now().
    private static boolean isIdentifierContext(String line, int start) {
        return start > 0 && (line.charAt(start - 1) == '.' || Character.isDigit(line.charAt(start - 1)));
    }

    private static int closingQuote(String line, int start) {
        char quote = line.charAt(start);
        int i = start + 1;
        while (i < line.length()) {
            if (line.charAt(i) == quote) {
                if (i + 1 < line.length() && line.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return line.length();
    }

    static int parenBalance(String line) {
        int balance = 0;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\'' || c == '"') {
                i = closingQuote(line, i);
                continue;
            }
            if (c == '-' && line.startsWith("--", i)) {
                break;
            }
            if (c == '(') {
                balance++;
            } else if (c == ')') {
                balance--;
            }
            i++;
        }
        return balance;
    }

    static int countDollarQuotes(String line) {
        int count = 0;
        int index = line.indexOf("$$");
        while (index >= 0) {
            count++;
            index = line.indexOf("$$", index + 2);
        }
        return count;
    }
}
