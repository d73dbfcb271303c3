package alpha.nomagicrouter.util;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-readable byte sizes.<p>
 * 
 * A size is a non-negative number, optionally with a fraction, optionally
 * followed by a unit. Units are case-insensitive and base 1024:
 * 
 * <pre>
 *   "1"      1
 *   "10b"    10
 *   "1kb"    1024
 *   "1.5kb"  1536
 *   "1 MB"   1048576
 *   "100mb"  104857600
 * </pre>
 */
public final class ByteSizes
{
    private static final Pattern SIZE = Pattern.compile(
            "^((?:-?\\d+)?(?:\\.\\d+)?) *(b|kb|mb|gb|tb|pb)?$");
    
    private static final Map<String, Long> UNITS = Map.of(
            "b",  1L,
            "kb", 1L << 10,
            "mb", 1L << 20,
            "gb", 1L << 30,
            "tb", 1L << 40,
            "pb", 1L << 50);
    
    private ByteSizes() {
        // Empty
    }
    
    /**
     * Parses the given size.
     * 
     * @param size to parse
     * @return number of bytes
     * 
     * @throws NullPointerException
     *             if {@code size} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code size} can not be parsed, or is negative
     */
    public static long parse(String size) {
        final String s = size.strip().toLowerCase(Locale.ROOT);
        final Matcher m = SIZE.matcher(s);
        if (s.isEmpty() || !m.matches() || m.group(1).isEmpty()) {
            throw new IllegalArgumentException("Unparsable size: \"" + size + "\"");
        }
        final double num = Double.parseDouble(m.group(1));
        if (num < 0) {
            throw new IllegalArgumentException("Negative size: \"" + size + "\"");
        }
        final String unit = m.group(2);
        return (long) Math.floor(num * (unit == null ? 1L : UNITS.get(unit)));
    }
}
