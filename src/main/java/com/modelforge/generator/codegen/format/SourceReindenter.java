package com.modelforge.generator.codegen.format;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Re-indents TypeScript/JavaScript by bracket depth.
 *
 * The level of a line is the number of distinct lines holding a still-open bracket, so {@code foo({} on one line
 * opens a single level. String, template and comment contents never count as brackets. Lines that start inside a
 * template literal or block comment are left as they are. Lines starting with a member access or ternary/logical
 * operator are continuations and get one extra level.
 */
class SourceReindenter {

    private enum State { CODE, SINGLE, DOUBLE, TEMPLATE, BLOCK_COMMENT }

    private record Open(char bracket, int line) {
    }

    private final String indentUnit;

    private final Deque<Open> open = new ArrayDeque<>();
    private State state = State.CODE;

    SourceReindenter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    String reindent(String content) {
        String[] lines = content.split("\n", -1);
        StringBuilder out = new StringBuilder(content.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            String line = lines[i];
            if (state == State.TEMPLATE || state == State.BLOCK_COMMENT) {
                out.append(line);
            } else {
                String trimmed = line.strip();
                if (!trimmed.isEmpty()) {
                    int level = levelFor(trimmed);
                    out.append(indentUnit.repeat(level)).append(trimmed);
                }
            }
            scan(line, i);
        }
        return out.toString();
    }

    private int levelFor(String trimmed) {
        int leadingClosers = 0;
        while (leadingClosers < trimmed.length() && isCloser(trimmed.charAt(leadingClosers))) {
            leadingClosers++;
        }
        int remaining = Math.max(0, open.size() - leadingClosers);
        // Deque iterates from the innermost entry; skip the ones this line closes.
        Set<Integer> lines = new HashSet<>();
        int skip = open.size() - remaining;
        Iterator<Open> it = open.iterator();
        while (it.hasNext()) {
            Open entry = it.next();
            if (skip > 0) {
                skip--;
                continue;
            }
            lines.add(entry.line());
        }
        int level = lines.size();
        if (leadingClosers == 0 && isContinuation(trimmed)) {
            level++;
        }
        return level;
    }

    private static boolean isContinuation(String trimmed) {
        if (trimmed.startsWith("...")) {
            return false;
        }
        return trimmed.startsWith(".") || trimmed.startsWith("?") || trimmed.startsWith(":")
                || trimmed.startsWith("&&") || trimmed.startsWith("||");
    }

    private static boolean isCloser(char c) {
        return c == '}' || c == ')' || c == ']';
    }

    private void scan(String line, int lineIndex) {
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            char next = i + 1 < line.length() ? line.charAt(i + 1) : '\0';
            switch (state) {
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        state = State.CODE;
                        i++;
                    }
                }
                case SINGLE, DOUBLE -> {
                    if (c == '\\') {
                        i++;
                    } else if ((state == State.SINGLE && c == '\'') || (state == State.DOUBLE && c == '"')) {
                        state = State.CODE;
                    }
                }
                case TEMPLATE -> {
                    if (c == '\\') {
                        i++;
                    } else if (c == '`') {
                        state = State.CODE;
                    } else if (c == '$' && next == '{') {
                        open.push(new Open('$', lineIndex));
                        state = State.CODE;
                        i++;
                    }
                }
                case CODE -> {
                    if (c == '/' && next == '/') {
                        return;
                    }
                    if (c == '/' && next == '*') {
                        state = State.BLOCK_COMMENT;
                        i++;
                    } else if (c == '\'') {
                        state = State.SINGLE;
                    } else if (c == '"') {
                        state = State.DOUBLE;
                    } else if (c == '`') {
                        state = State.TEMPLATE;
                    } else if (c == '{' || c == '(' || c == '[') {
                        open.push(new Open(c, lineIndex));
                    } else if (isCloser(c) && !open.isEmpty()) {
                        Open closed = open.pop();
                        if (closed.bracket() == '$') {
                            state = State.TEMPLATE;
                        }
                    }
                }
            }
            i++;
        }
        // Unterminated quotes do not span lines.
        if (state == State.SINGLE || state == State.DOUBLE) {
            state = State.CODE;
        }
    }
}
