package io.devguard.extract;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits Python source into logical lines.
 * <p>
 * Physical lines are joined across open brackets, backslash continuations and
 * triple-quoted strings. Comments are dropped. Each logical line is available twice:
 * as written, and masked, with string literal contents blanked so that structural
 * patterns never match inside strings. Both renditions have the same length, so
 * offsets found in one apply to the other.
 */
final class PythonLineReader {

    /**
     * @param indent    indentation width of the first physical line (tabs advance to multiples of 8)
     * @param startLine first physical line
     * @param endLine   last physical line
     * @param text      the line as written, comments removed, continuations joined with spaces
     * @param masked    the same line with string contents replaced by spaces
     */
    record LogicalLine(int indent, int startLine, int endLine, String text, String masked) {

        boolean opensBlock() {
            return masked.stripTrailing().endsWith(":");
        }
    }

    private PythonLineReader() {
    }

    static List<LogicalLine> read(String source) throws ParseException {
        String content = source.replace("\r\n", "\n").replace('\r', '\n');
        List<LogicalLine> lines = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        StringBuilder masked = new StringBuilder();
        Deque<Character> brackets = new ArrayDeque<>();
        Deque<Integer> bracketLines = new ArrayDeque<>();

        int line = 1;
        int startLine = 1;
        int indent = 0;
        boolean atLineStart = true;
        char quote = 0;
        boolean triple = false;
        int stringLine = 0;
        int n = content.length();

        for (int i = 0; i < n; i++) {
            char c = content.charAt(i);

            if (quote != 0) {
                if (c == '\\' && i + 1 < n) {
                    char next = content.charAt(i + 1);
                    if (next == '\n') {
                        line++;
                    }
                    text.append(c).append(next == '\n' ? ' ' : next);
                    masked.append("  ");
                    i++;
                } else if (c == quote && !triple) {
                    text.append(c);
                    masked.append(c);
                    quote = 0;
                } else if (c == quote && content.startsWith(tripleOf(quote), i)) {
                    text.append(tripleOf(quote));
                    masked.append(tripleOf(quote));
                    i += 2;
                    quote = 0;
                } else if (c == '\n') {
                    if (!triple) {
                        throw new ParseException("unterminated string literal", stringLine);
                    }
                    line++;
                    text.append(' ');
                    masked.append(' ');
                } else {
                    text.append(c);
                    masked.append(' ');
                }
                continue;
            }

            if (atLineStart) {
                if (c == ' ') {
                    indent++;
                    continue;
                }
                if (c == '\t') {
                    indent = (indent / 8 + 1) * 8;
                    continue;
                }
                if (c == '\f') {
                    continue;
                }
                if (c == '\n') {
                    line++;
                    indent = 0;
                    continue;
                }
                if (c != '#') {
                    atLineStart = false;
                    startLine = line;
                }
            }

            switch (c) {
                case '#' -> {
                    int newline = content.indexOf('\n', i);
                    i = (newline < 0 ? n : newline) - 1;
                }
                case '\'', '"' -> {
                    quote = c;
                    stringLine = line;
                    triple = content.startsWith(tripleOf(c), i);
                    if (triple) {
                        text.append(tripleOf(c));
                        masked.append(tripleOf(c));
                        i += 2;
                    } else {
                        text.append(c);
                        masked.append(c);
                    }
                }
                case '(', '[', '{' -> {
                    brackets.push(c);
                    bracketLines.push(line);
                    text.append(c);
                    masked.append(c);
                }
                case ')', ']', '}' -> {
                    if (brackets.isEmpty()) {
                        throw new ParseException("unmatched '" + c + "'", line);
                    }
                    char open = brackets.pop();
                    bracketLines.pop();
                    if (closerOf(open) != c) {
                        throw new ParseException("closing '" + c + "' does not match '" + open + "'", line);
                    }
                    text.append(c);
                    masked.append(c);
                }
                case '\\' -> {
                    if (i + 1 < n && content.charAt(i + 1) == '\n') {
                        i++;
                        line++;
                        text.append(' ');
                        masked.append(' ');
                    } else {
                        text.append(c);
                        masked.append(c);
                    }
                }
                case '\n' -> {
                    line++;
                    if (!brackets.isEmpty()) {
                        text.append(' ');
                        masked.append(' ');
                    } else {
                        emit(lines, indent, startLine, line - 1, text, masked);
                        atLineStart = true;
                        indent = 0;
                    }
                }
                default -> {
                    text.append(c);
                    masked.append(c);
                }
            }
        }

        if (quote != 0) {
            throw new ParseException(triple ? "unterminated triple-quoted string" : "unterminated string literal",
                    stringLine);
        }
        if (!brackets.isEmpty()) {
            throw new ParseException("'" + brackets.peek() + "' was never closed", bracketLines.peek());
        }
        emit(lines, indent, startLine, line, text, masked);
        return lines;
    }

    private static void emit(List<LogicalLine> lines, int indent, int startLine, int endLine,
                             StringBuilder text, StringBuilder masked) {
        if (!masked.toString().isBlank()) {
            lines.add(new LogicalLine(indent, startLine, endLine, text.toString().stripTrailing(),
                    masked.toString().stripTrailing()));
        }
        text.setLength(0);
        masked.setLength(0);
    }

    private static String tripleOf(char quote) {
        return String.valueOf(quote).repeat(3);
    }

    private static char closerOf(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }
}
