package alpha.nomagicrouter.util;

import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * String utilities.
 */
public final class Strings
{
    private static final char ESCAPE = '\\';

    private Strings() {
        // Empty
    }

    /**
     * Splits a string on a delimiter, unless the delimiter is quoted.<p>
     *
     * A quote opens a zone that the next unescaped quote closes. Inside the
     * zone, the delimiter is part of the token, and a backslash escapes the
     * character after it. Quotes and backslashes stay in the token. Empty
     * tokens are dropped.
     *
     * <pre>
     *   split("a;b", ';', '"')           returns "a", "b"
     *   split("a;\"b;c\"", ';', '"')     returns "a", "\"b;c\""
     *   split(";;", ';', '"')            returns nothing
     * </pre>
     *
     * @param str to split
     * @param delimiter to split on
     * @param quote opens and closes a zone where the delimiter has no effect
     *
     * @return the tokens
     *
     * @throws NullPointerException
     *             if {@code str} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code delimiter} is the backslash character, or
     *             if {@code delimiter} and {@code quote} are the same
     *
     * @see #unquote(String)
     */
    public static Stream<String> split(CharSequence str, char delimiter, char quote) {
        requireNonNull(str);
        if (delimiter == ESCAPE) {
            throw new IllegalArgumentException(
                    "Delimiter char can not be the escape char.");
        }
        if (delimiter == quote) {
            throw new IllegalArgumentException(
                    "Delimiter char can not be the same as exclude char.");
        }
        var tokens = Stream.<String>builder();
        var token = new StringBuilder();
        boolean quoted = false, escaped = false;
        for (int i = 0; i < str.length(); ++i) {
            final char c = str.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (quoted && c == ESCAPE) {
                escaped = true;
            } else if (c == quote) {
                quoted = !quoted;
            } else if (c == delimiter && !quoted) {
                flush(token, tokens);
                continue;
            }
            token.append(c);
        }
        flush(token, tokens);
        return tokens.build();
    }

    private static void flush(StringBuilder token, Stream.Builder<String> into) {
        if (token.length() > 0) {
            into.add(token.toString());
            token.setLength(0);
        }
    }

    /**
     * Removes surrounding double quotes and translates escape sequences.<p>
     *
     * A string that is not quoted, or is nothing but two quotes, is returned
     * as-is.
     *
     * <pre>
     *   no\"effect       no\"effect
     *   "one"            one
     *   "one\"two\""     one"two"
     * </pre>
     *
     * @param str to unquote
     * @return the unquoted string
     *
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc9110#section-5.6.4">RFC 9110 §5.6.4</a>
     */
    public static String unquote(String str) {
        final int n = str.length();
        if (n <= 2 || str.charAt(0) != '"' || str.charAt(n - 1) != '"') {
            return str;
        }
        return str.substring(1, n - 1).translateEscapes().strip();
    }

    /**
     * Removes one trailing occurrence of the given character, if present.
     *
     * <pre>
     *   trimTrailing("/a/", '/')  returns "/a"
     *   trimTrailing("/a//", '/') returns "/a/"
     *   trimTrailing("/", '/')    returns ""
     * </pre>
     *
     * @param str to trim
     * @param c character to remove
     * @return the trimmed string
     */
    public static String trimTrailing(String str, char c) {
        final int n = str.length();
        return n > 0 && str.charAt(n - 1) == c ? str.substring(0, n - 1) : str;
    }
}
