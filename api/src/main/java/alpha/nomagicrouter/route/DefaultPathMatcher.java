package alpha.nomagicrouter.route;

import alpha.nomagicrouter.message.Parameters;
import alpha.nomagicrouter.util.PercentDecoder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.util.Objects.requireNonNull;
import static java.util.regex.Pattern.CASE_INSENSITIVE;
import static java.util.regex.Pattern.UNICODE_CASE;

/**
 * Default implementation of {@link PathMatcher}.<p>
 * 
 * The pattern is tokenized into literal text and parameter keys, and the
 * tokens are then compiled into one regular expression with one capturing
 * group per key.
 */
final class DefaultPathMatcher implements PathMatcher
{
    // Groups: 1 = escaped char, 2 = name, 3 = custom pattern, 4 = unnamed group, 5 = modifier
    private static final Pattern TOKEN = Pattern.compile(
            "(\\\\.)|(?::(\\w+)(?:\\(((?:\\\\.|[^\\\\()])+)\\))?|\\(((?:\\\\.|[^\\\\()])+)\\))([+*?])?");
    
    private static final Pattern GROUP_SPECIAL = Pattern.compile("([=!:$/()])");
    
    private static final Pattern LITERAL_SPECIAL = Pattern.compile("([.+*?=^!:${}()\\[\\]|/\\\\])");
    
    // Characters that act as a parameter prefix
    private static final String PREFIXES = "./";
    
    private final String pattern;
    private final Options options;
    private final List<Key> keys;
    private final Pattern regex;
    
    DefaultPathMatcher(String pattern, Options options) {
        this.pattern = requireNonNull(pattern);
        this.options = requireNonNull(options);
        List<Object> tokens = parse(pattern, options.delimiter());
        List<Key> keys = new ArrayList<>();
        String re = toRegex(tokens, keys, options);
        try {
            this.regex = options.caseSensitive() ?
                    Pattern.compile(re) : Pattern.compile(re, CASE_INSENSITIVE | UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new RoutePatternInvalidException(pattern, e);
        }
        this.keys = List.copyOf(keys);
    }
    
    @Override
    public Optional<Parameters> match(String pathname) {
        final Matcher m = regex.matcher(pathname);
        if (!m.find()) {
            return Optional.empty();
        }
        // Later keys of the same name overwrite earlier
        final Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); ++i) {
            final String raw = m.group(i + 1);
            if (raw == null || raw.isEmpty()) {
                continue;
            }
            final Key k = keys.get(i);
            final String val = PercentDecoder.decode(raw);
            values.put(k.name, k.repeat ?
                    List.of(val.split(Pattern.quote(k.delimiter), -1)) : val);
        }
        if (values.isEmpty()) {
            return Optional.of(Parameters.empty());
        }
        final var b = Parameters.builder();
        values.forEach((name, v) -> {
            if (v instanceof String s) {
                b.add(name, s);
            } else {
                @SuppressWarnings("unchecked")
                List<String> l = (List<String>) v;
                b.setAll(name, l);
            }
        });
        return Optional.of(b.build());
    }
    
    @Override
    public String pattern() {
        return pattern;
    }
    
    @Override
    public Options options() {
        return options;
    }
    
    @Override
    public String toString() {
        return DefaultPathMatcher.class.getSimpleName() + "{pattern=\"" + pattern +
               "\", regex=" + regex + ", options=" + options + '}';
    }
    
    /**
     * Tokenizes the pattern into a list of {@code String} literals and
     * {@code Key}s.
     */
    private static List<Object> parse(String str, char defaultDelimiter) {
        final List<Object> tokens = new ArrayList<>();
        final Matcher res = TOKEN.matcher(str);
        var path = new StringBuilder();
        int index = 0,
            unnamed = 0;
        boolean pathEscaped = false;
        
        while (res.find()) {
            final int offset = res.start();
            path.append(str, index, offset);
            index = res.end();
            
            final String escaped = res.group(1);
            if (escaped != null) {
                path.append(escaped.charAt(1));
                pathEscaped = true;
                continue;
            }
            
            String prev = "";
            final String next = index < str.length() ? String.valueOf(str.charAt(index)) : null;
            final String name = res.group(2),
                      capture = res.group(3),
                        group = res.group(4),
                     modifier = res.group(5);
            
            if (!pathEscaped && path.length() > 0) {
                final int k = path.length() - 1;
                final char c = path.charAt(k);
                if (PREFIXES.indexOf(c) != -1) {
                    prev = String.valueOf(c);
                    path.setLength(k);
                }
            }
            
            if (path.length() > 0) {
                tokens.add(path.toString());
                path = new StringBuilder();
                pathEscaped = false;
            }
            
            final boolean partial = !prev.isEmpty() && next != null && !next.equals(prev),
                           repeat = "+".equals(modifier) || "*".equals(modifier),
                         optional = "?".equals(modifier) || "*".equals(modifier);
            final String delimiter = prev.isEmpty() ? String.valueOf(defaultDelimiter) : prev;
            final String custom = capture != null ? capture : group;
            
            tokens.add(new Key(
                    name != null ? name : String.valueOf(unnamed++),
                    prev, delimiter, optional, repeat, partial,
                    custom != null ?
                            GROUP_SPECIAL.matcher(custom).replaceAll("\\\\$1") :
                            "[^" + escape(delimiter) + "]+?"));
        }
        
        if (path.length() > 0 || index < str.length()) {
            tokens.add(path + str.substring(index));
        }
        return tokens;
    }
    
    private static String toRegex(List<Object> tokens, List<Key> keys, Options opts) {
        final String delimiter = escape(String.valueOf(opts.delimiter()));
        final var route = new StringBuilder("^");
        boolean endDelimited = tokens.isEmpty();
        
        for (int i = 0; i < tokens.size(); ++i) {
            final Object t = tokens.get(i);
            if (t instanceof String lit) {
                route.append(escape(lit));
                endDelimited = i == tokens.size() - 1 &&
                        PREFIXES.indexOf(lit.charAt(lit.length() - 1)) != -1;
            } else {
                final Key k = (Key) t;
                final String capture = k.repeat ?
                        "(?:" + k.pattern + ")(?:" + escape(k.delimiter) + "(?:" + k.pattern + "))*" :
                        k.pattern;
                keys.add(k);
                if (k.optional) {
                    if (k.partial) {
                        route.append(escape(k.prefix)).append('(').append(capture).append(")?");
                    } else {
                        route.append("(?:").append(escape(k.prefix))
                             .append('(').append(capture).append("))?");
                    }
                } else {
                    route.append(escape(k.prefix)).append('(').append(capture).append(')');
                }
            }
        }
        
        if (opts.anchored()) {
            if (!opts.strictTrailingSlash()) {
                route.append("(?:").append(delimiter).append(")?");
            }
            route.append('$');
        } else {
            if (!opts.strictTrailingSlash()) {
                route.append("(?:").append(delimiter).append("(?=$))?");
            }
            if (!endDelimited) {
                route.append("(?=").append(delimiter).append("|$)");
            }
        }
        return route.toString();
    }
    
    private static String escape(String literal) {
        return LITERAL_SPECIAL.matcher(literal).replaceAll("\\\\$1");
    }
    
    private static final class Key {
        final String name, prefix, delimiter, pattern;
        final boolean optional, repeat, partial;
        
        Key(String name, String prefix, String delimiter,
            boolean optional, boolean repeat, boolean partial, String pattern) {
            this.name      = name;
            this.prefix    = prefix;
            this.delimiter = delimiter;
            this.optional  = optional;
            this.repeat    = repeat;
            this.partial   = partial;
            this.pattern   = pattern;
        }
    }
}
