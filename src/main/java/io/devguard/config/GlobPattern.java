package io.devguard.config;

import java.util.regex.Pattern;

/**
 * Minimal glob matcher for paths and dotted names.
 * {@code **} matches anything, {@code *} matches within one path segment,
 * {@code ?} matches one character other than '/'.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    i++;
                    // "**/" also matches zero directories
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '/') {
                        sb.append("(?:.*/)?");
                        i++;
                    } else {
                        sb.append(".*");
                    }
                } else {
                    sb.append("[^/]*");
                }
            } else if (c == '?') {
                sb.append("[^/]");
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return new GlobPattern(glob, Pattern.compile(sb.toString()));
    }

    public boolean matches(String value) {
        return value != null && regex.matcher(value).matches();
    }

    public String glob() {
        return glob;
    }

    @Override
    public String toString() {
        return glob;
    }
}
