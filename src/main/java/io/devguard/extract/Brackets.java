package io.devguard.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Bracket-aware scanning over masked source text, where string contents are already blanked.
 */
final class Brackets {

    private Brackets() {
    }

    static boolean isOpen(char c) {
        return c == '(' || c == '[' || c == '{';
    }

    static boolean isClose(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    /**
     * Returns the index of the bracket closing the one at {@code open}, or -1.
     */
    static int matchingClose(String masked, int open) {
        if (open < 0 || open >= masked.length()) {
            return -1;
        }
        int depth = 0;
        for (int i = open; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (isOpen(c)) {
                depth++;
            } else if (isClose(c)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Returns the first index of {@code target} at bracket depth zero within [from, to),
     * or -1 if there is none or a bracket opened before {@code from} closes first.
     */
    static int indexOfTopLevel(String masked, char target, int from, int to) {
        int depth = 0;
        int end = Math.min(to, masked.length());
        for (int i = from; i < end; i++) {
            char c = masked.charAt(i);
            if (depth == 0 && c == target) {
                return i;
            }
            if (isOpen(c)) {
                depth++;
            } else if (isClose(c)) {
                depth--;
                if (depth < 0) {
                    return -1;
                }
            }
        }
        return -1;
    }

    /**
     * Splits [from, to) at top-level occurrences of any separator, returning non-blank
     * start/end offset pairs.
     */
    static List<int[]> splitTopLevel(String masked, int from, int to, String separators) {
        List<int[]> parts = new ArrayList<>();
        int depth = 0;
        int start = from;
        int end = Math.min(to, masked.length());
        for (int i = from; i <= end; i++) {
            char c = i < end ? masked.charAt(i) : 0;
            if (i == end || (depth == 0 && separators.indexOf(c) >= 0)) {
                if (!masked.substring(start, i).isBlank()) {
                    parts.add(new int[]{start, i});
                }
                start = i + 1;
            } else if (isOpen(c)) {
                depth++;
            } else if (isClose(c)) {
                depth--;
            }
        }
        return parts;
    }
}
