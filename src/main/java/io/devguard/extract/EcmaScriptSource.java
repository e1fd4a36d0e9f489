package io.devguard.extract;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Set;

/**
 * JavaScript/TypeScript source with comments, string, template and regex literal
 * contents masked out.
 * <p>
 * The masked text has the same length and line structure as the original, so a
 * match found in the masked text can be read back from the original at the same
 * offsets. Quotes and template {@code ${...}} expressions stay visible. Construction
 * fails with a {@link ParseException} on unbalanced brackets or unterminated literals.
 */
final class EcmaScriptSource {

    private static final String REGEX_PRECEDERS = "(,=:[!&|?{};+-*%~^";
    private static final Set<String> REGEX_KEYWORDS = Set.of(
            "return", "typeof", "case", "do", "else", "in", "of", "new", "delete", "void", "throw", "yield", "await");

    private final String text;
    private final String masked;
    private final int[] lineStarts;
    private final int[] braceDepth;

    private EcmaScriptSource(String text, String masked) {
        this.text = text;
        this.masked = masked;
        this.lineStarts = lineStarts(text);
        this.braceDepth = braceDepths(masked);
    }

    /**
     * Masks the source.
     *
     * @param lenientQuotes treat an unterminated single-line quote as plain text,
     *                      which is how an apostrophe in JSX text reads
     */
    static EcmaScriptSource parse(String source, boolean lenientQuotes) throws ParseException {
        String text = source.replace("\r\n", "\n").replace('\r', '\n');
        return new Masker(text, lenientQuotes).run();
    }

    String text() {
        return text;
    }

    String masked() {
        return masked;
    }

    int length() {
        return text.length();
    }

    /**
     * 1-based line of an offset.
     */
    int lineAt(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * Number of unclosed curly braces before the offset.
     */
    int braceDepthAt(int offset) {
        return braceDepth[Math.min(offset, braceDepth.length - 1)];
    }

    int matchingClose(int open) {
        return Brackets.matchingClose(masked, open);
    }

    int indexOfTopLevel(char target, int from, int to) {
        return Brackets.indexOfTopLevel(masked, target, from, to);
    }

    /**
     * End of the expression starting at {@code from}: the first ';' or newline at depth zero,
     * or the bracket closing an enclosing construct.
     */
    int statementEnd(int from) {
        int depth = 0;
        for (int i = from; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (Brackets.isOpen(c)) {
                depth++;
            } else if (Brackets.isClose(c)) {
                depth--;
                if (depth < 0) {
                    return i;
                }
            } else if (depth == 0 && (c == ';' || c == '\n')) {
                return i;
            }
        }
        return masked.length();
    }

    int skipWhitespace(int from) {
        int i = from;
        while (i < masked.length() && Character.isWhitespace(masked.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Reads the string or template literal whose opening quote is at {@code quote}.
     * Template expressions are rendered as {@code {param}}.
     *
     * @return the literal value, or null if no literal starts there
     */
    String literalAt(int quote) {
        if (quote >= masked.length()) {
            return null;
        }
        char q = masked.charAt(quote);
        if (q != '\'' && q != '"' && q != '`') {
            return null;
        }
        int close = literalEnd(quote);
        if (close < 0) {
            return null;
        }
        String value = text.substring(quote + 1, close);
        return q == '`' ? value.replaceAll("\\$\\{[^}]*}", "{param}") : value;
    }

    /**
     * Index of the quote closing the literal opened at {@code quote}, or -1.
     */
    int literalEnd(int quote) {
        char q = masked.charAt(quote);
        int depth = 0;
        for (int i = quote + 1; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (q == '`' && c == '{') {
                depth++;
            } else if (q == '`' && c == '}') {
                depth--;
            } else if (c == q && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static int[] lineStarts(String text) {
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        int[] starts = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }

    private static int[] braceDepths(String masked) {
        int[] depths = new int[masked.length() + 1];
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            depths[i] = depth;
            char c = masked.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }
        depths[masked.length()] = depth;
        return depths;
    }

    /**
     * Single-pass masking state machine.
     */
    private static final class Masker {

        private final String text;
        private final char[] out;
        private final boolean lenientQuotes;
        private final Deque<Character> brackets = new ArrayDeque<>();
        private final Deque<Integer> bracketOffsets = new ArrayDeque<>();
        private int lastSignificant = -1;

        Masker(String text, boolean lenientQuotes) {
            this.text = text;
            this.out = text.toCharArray();
            this.lenientQuotes = lenientQuotes;
        }

        EcmaScriptSource run() throws ParseException {
            int n = text.length();
            int i = 0;
            while (i < n) {
                char c = text.charAt(i);
                char next = i + 1 < n ? text.charAt(i + 1) : 0;
                if (c == '/' && next == '/') {
                    int end = text.indexOf('\n', i);
                    i = blank(i, end < 0 ? n : end);
                } else if (c == '/' && next == '*') {
                    int end = text.indexOf("*/", i + 2);
                    if (end < 0) {
                        throw error("unterminated comment", i);
                    }
                    i = blank(i, end + 2);
                } else if (c == '\'' || c == '"') {
                    i = quoted(i, c);
                } else if (c == '`') {
                    i = template(i + 1);
                } else if (c == '/' && regexAllowed()) {
                    i = regex(i);
                } else if (c == '(' || c == '[' || c == '{') {
                    brackets.push(c);
                    bracketOffsets.push(i);
                    lastSignificant = i;
                    i++;
                } else if (c == ')' || c == ']' || c == '}') {
                    i = close(i, c);
                } else {
                    if (!Character.isWhitespace(c)) {
                        lastSignificant = i;
                    }
                    i++;
                }
            }
            if (!brackets.isEmpty()) {
                char open = brackets.peek();
                throw error("'" + (open == '$' ? "${" : String.valueOf(open)) + "' was never closed",
                        bracketOffsets.peek());
            }
            return new EcmaScriptSource(text, new String(out));
        }

        private int close(int i, char c) throws ParseException {
            if (brackets.isEmpty()) {
                throw error("unmatched '" + c + "'", i);
            }
            char open = brackets.pop();
            bracketOffsets.pop();
            if (open == '$') {
                if (c != '}') {
                    throw error("closing '" + c + "' inside template expression", i);
                }
                return template(i + 1);
            }
            if (closerOf(open) != c) {
                throw error("closing '" + c + "' does not match '" + open + "'", i);
            }
            lastSignificant = i;
            return i + 1;
        }

        private int quoted(int start, char quote) throws ParseException {
            int j = start + 1;
            while (j < text.length()) {
                char ch = text.charAt(j);
                if (ch == '\\') {
                    j += 2;
                    continue;
                }
                if (ch == quote || ch == '\n') {
                    break;
                }
                j++;
            }
            if (j < text.length() && text.charAt(j) == quote) {
                blank(start + 1, j);
                lastSignificant = j;
                return j + 1;
            }
            if (lenientQuotes) {
                lastSignificant = start;
                return start + 1;
            }
            throw error("unterminated string literal", start);
        }

        /**
         * Masks template text from {@code from} up to the closing backtick or the next {@code ${}.
         */
        private int template(int from) throws ParseException {
            int j = from;
            while (j < text.length()) {
                char ch = text.charAt(j);
                if (ch == '\\') {
                    blank(j, Math.min(j + 2, text.length()));
                    j += 2;
                    continue;
                }
                if (ch == '`') {
                    lastSignificant = j;
                    return j + 1;
                }
                if (ch == '$' && j + 1 < text.length() && text.charAt(j + 1) == '{') {
                    brackets.push('$');
                    bracketOffsets.push(j);
                    lastSignificant = j + 1;
                    return j + 2;
                }
                if (ch != '\n') {
                    out[j] = ' ';
                }
                j++;
            }
            throw error("unterminated template literal", from - 1);
        }

        private int regex(int start) {
            boolean inClass = false;
            int j = start + 1;
            while (j < text.length()) {
                char ch = text.charAt(j);
                if (ch == '\n') {
                    lastSignificant = start;
                    return start + 1;
                }
                if (ch == '\\') {
                    j += 2;
                    continue;
                }
                if (ch == '[') {
                    inClass = true;
                } else if (ch == ']') {
                    inClass = false;
                } else if (ch == '/' && !inClass) {
                    break;
                }
                j++;
            }
            if (j >= text.length()) {
                lastSignificant = start;
                return start + 1;
            }
            blank(start + 1, j);
            int end = j + 1;
            while (end < text.length() && Character.isLetter(text.charAt(end))) {
                end++;
            }
            lastSignificant = end - 1;
            return end;
        }

        private boolean regexAllowed() {
            if (lastSignificant < 0) {
                return true;
            }
            char prev = out[lastSignificant];
            if (REGEX_PRECEDERS.indexOf(prev) >= 0) {
                return true;
            }
            if (!Character.isJavaIdentifierPart(prev)) {
                return false;
            }
            int start = lastSignificant;
            while (start > 0 && Character.isJavaIdentifierPart(out[start - 1])) {
                start--;
            }
            return REGEX_KEYWORDS.contains(new String(out, start, lastSignificant - start + 1));
        }

        private int blank(int from, int to) {
            for (int k = from; k < to && k < out.length; k++) {
                if (out[k] != '\n') {
                    out[k] = ' ';
                }
            }
            return to;
        }

        private ParseException error(String message, int offset) {
            int line = 1;
            for (int k = 0; k < offset && k < text.length(); k++) {
                if (text.charAt(k) == '\n') {
                    line++;
                }
            }
            return new ParseException(message, line);
        }

        private static char closerOf(char open) {
            return switch (open) {
                case '(' -> ')';
                case '[' -> ']';
                default -> '}';
            };
        }
    }
}
