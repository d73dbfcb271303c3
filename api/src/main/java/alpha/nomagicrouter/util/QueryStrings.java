package alpha.nomagicrouter.util;

import alpha.nomagicrouter.message.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses query strings.
 */
public final class QueryStrings
{
    private QueryStrings() {
        // Empty
    }
    
    /**
     * Parses a raw query string.<p>
     * 
     * The query is split on '&amp;' into pairs, and each pair on the first
     * '=' into a key and a value. Both are percent-decoded leniently, '+'
     * being a space (see {@link PercentDecoder#decodeLenient(String)}). A key
     * without '=' has the empty string as value. A key occurring more than
     * once is repeated, its values in the order of occurrence. Empty pairs
     * and pairs with an empty key are ignored. The keys of the returned
     * parameters are sorted.
     * 
     * <pre>
     *   parse("b=2&amp;a=1&amp;a=3") returns {a=[1, 3], b=2}
     *   parse("q=hello+world")   returns {q=hello world}
     *   parse("flag")            returns {flag=}
     * </pre>
     * 
     * @param rawQuery without a leading '?'
     * @return the parameters (never {@code null})
     * @throws NullPointerException if {@code rawQuery} is {@code null}
     */
    public static Parameters parse(String rawQuery) {
        if (rawQuery.isEmpty()) {
            return Parameters.empty();
        }
        final Map<String, List<String>> acc = new TreeMap<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            final int eq = pair.indexOf('=');
            final String k = PercentDecoder.decodeLenient(eq == -1 ? pair : pair.substring(0, eq)),
                         v = eq == -1 ? "" : PercentDecoder.decodeLenient(pair.substring(eq + 1));
            if (!k.isEmpty()) {
                acc.computeIfAbsent(k, x -> new ArrayList<>()).add(v);
            }
        }
        final var b = Parameters.builder();
        acc.forEach((k, vals) -> vals.forEach(v -> b.add(k, v)));
        return b.build();
    }
}
