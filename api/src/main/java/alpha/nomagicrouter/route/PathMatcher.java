package alpha.nomagicrouter.route;

import alpha.nomagicrouter.message.DecodeException;
import alpha.nomagicrouter.message.Parameters;

import java.util.Objects;
import java.util.Optional;

/**
 * A compiled path pattern.<p>
 * 
 * A pattern is literal text mixed with parameters:
 * 
 * <pre>
 *   Pattern                  Path                 Parameters
 *   /user/:id                /user/123            {id=123}
 *   /user/:id?               /user                {}
 *   /file/:path+             /file/a/b/c          {path=[a, b, c]}
 *   /file/:path*             /file                {}
 *   /:file.:ext              /report.pdf          {file=report, ext=pdf}
 *   /order/:id(\d+)          /order/42            {id=42}
 *   /(\d+)                   /42                  {0=42}
 *   /a\:b                    /a:b                 {}
 * </pre>
 * 
 * A parameter is named by ':' followed by word characters. A parameter may
 * be given a custom regular expression in parentheses, replacing the default
 * which matches one or more characters up until the next delimiter. A group
 * in parentheses without a name is an unnamed parameter, keyed by a
 * zero-based index.<p>
 * 
 * A parameter may be followed by a modifier; '?' for optional, '*' for zero
 * or more and '+' for one or more. A '/' or '.' immediately preceding a
 * parameter is the parameter's prefix; it is optional together with an
 * optional parameter, and it separates the values of a repeated parameter.
 * A backslash escapes the next character.<p>
 * 
 * Captured values are percent-decoded, strictly. A repeated parameter is
 * split into a list of values. An optional parameter that matched nothing is
 * not present in the result.<p>
 * 
 * Implementations are immutable and thread-safe.
 */
public interface PathMatcher
{
    /**
     * Compiles a pattern.
     * 
     * @param pattern to compile
     * @param options of matching
     * @return a matcher
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RoutePatternInvalidException
     *             if a custom parameter pattern is not a valid regex
     */
    static PathMatcher compile(String pattern, Options options) {
        return new DefaultPathMatcher(pattern, options);
    }
    
    /**
     * Matches the given path.
     * 
     * @param pathname the path component of a request-target
     * 
     * @return the parameters if the path matched, otherwise empty
     * 
     * @throws NullPointerException
     *             if {@code pathname} is {@code null}
     * @throws DecodeException
     *             if a captured value can not be percent-decoded
     */
    Optional<Parameters> match(String pathname);
    
    /**
     * {@return the pattern this matcher was compiled from}
     */
    String pattern();
    
    /**
     * {@return the options this matcher was compiled with}
     */
    Options options();
    
    /**
     * Options of matching.<p>
     * 
     * The implementation is immutable.
     */
    final class Options {
        /**
         * Anchored, case-insensitive, and the trailing slash is optional.
         */
        public static final Options ROUTE = new Options(true, false, false, '/');
        
        /**
         * Prefix-only, case-insensitive, and strict trailing slash.
         */
        public static final Options MOUNT = new Options(false, false, true, '/');
        
        private final boolean anchored, caseSensitive, strictTrailingSlash;
        private final char delimiter;
        
        private Options(
                boolean anchored, boolean caseSensitive,
                boolean strictTrailingSlash, char delimiter) {
            this.anchored = anchored;
            this.caseSensitive = caseSensitive;
            this.strictTrailingSlash = strictTrailingSlash;
            this.delimiter = delimiter;
        }
        
        /**
         * Returns whether the whole path must match.<p>
         * 
         * If {@code false}, the pattern needs only match a prefix of the path
         * that ends at a delimiter, or at the end of the path.
         * 
         * @return whether the whole path must match
         */
        public boolean anchored() {
            return anchored;
        }
        
        /**
         * {@return whether matching is case-sensitive}
         */
        public boolean caseSensitive() {
            return caseSensitive;
        }
        
        /**
         * Returns whether the trailing slash is strict.<p>
         * 
         * If {@code false}, a trailing delimiter in the path is accepted even if
         * the pattern has none.
         * 
         * @return whether the trailing slash is strict
         */
        public boolean strictTrailingSlash() {
            return strictTrailingSlash;
        }
        
        /**
         * {@return the default delimiter of segments}
         */
        public char delimiter() {
            return delimiter;
        }
        
        /**
         * {@return a copy of these options with the given value}
         * @param anchored see {@link #anchored()}
         */
        public Options withAnchored(boolean anchored) {
            return new Options(anchored, caseSensitive, strictTrailingSlash, delimiter);
        }
        
        /**
         * {@return a copy of these options with the given value}
         * @param caseSensitive see {@link #caseSensitive()}
         */
        public Options withCaseSensitive(boolean caseSensitive) {
            return new Options(anchored, caseSensitive, strictTrailingSlash, delimiter);
        }
        
        /**
         * {@return a copy of these options with the given value}
         * @param strict see {@link #strictTrailingSlash()}
         */
        public Options withStrictTrailingSlash(boolean strict) {
            return new Options(anchored, caseSensitive, strict, delimiter);
        }
        
        /**
         * {@return a copy of these options with the given value}
         * @param delimiter see {@link #delimiter()}
         */
        public Options withDelimiter(char delimiter) {
            return new Options(anchored, caseSensitive, strictTrailingSlash, delimiter);
        }
        
        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Options o)) {
                return false;
            }
            return anchored == o.anchored &&
                   caseSensitive == o.caseSensitive &&
                   strictTrailingSlash == o.strictTrailingSlash &&
                   delimiter == o.delimiter;
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(anchored, caseSensitive, strictTrailingSlash, delimiter);
        }
        
        @Override
        public String toString() {
            return "Options{anchored=" + anchored +
                   ", caseSensitive=" + caseSensitive +
                   ", strictTrailingSlash=" + strictTrailingSlash +
                   ", delimiter=" + delimiter + '}';
        }
    }
}
