package alpha.nomagicrouter.route;

import java.io.Serial;

/**
 * Thrown by {@link PathMatcher#compile(String, PathMatcher.Options)} if a
 * path pattern can not be compiled.
 */
public class RoutePatternInvalidException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final String pattern;
    
    /**
     * Constructs this object.
     * 
     * @param pattern the offending pattern
     * @param cause the regex syntax error
     */
    public RoutePatternInvalidException(String pattern, Throwable cause) {
        super("Invalid path pattern: \"" + pattern + "\"", cause);
        this.pattern = pattern;
    }
    
    /**
     * {@return the offending pattern}
     */
    public String getPattern() {
        return pattern;
    }
}
