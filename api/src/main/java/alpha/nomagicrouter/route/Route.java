package alpha.nomagicrouter.route;

import alpha.nomagicrouter.handler.Handler;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A registration in a {@link Router}'s route table.<p>
 * 
 * This is a snapshot. The matcher is the one in effect when the snapshot was
 * taken; it is replaced whenever the router's base path changes.
 * 
 * @see Router#routes()
 */
public final class Route
{
    private final String method, path;
    private final Handler handler;
    private final boolean mount;
    private final PathMatcher matcher;
    
    Route(String method, String path, Handler handler, boolean mount, PathMatcher matcher) {
        this.method  = method;
        this.path    = requireNonNull(path);
        this.handler = requireNonNull(handler);
        this.mount   = mount;
        this.matcher = requireNonNull(matcher);
    }
    
    /**
     * Returns the method filter.<p>
     * 
     * Empty for routes registered using {@code use}, which match any method.
     * 
     * @return the method filter
     */
    public Optional<String> method() {
        return Optional.ofNullable(method);
    }
    
    /**
     * {@return the path as declared, relative to the router's base path}
     */
    public String path() {
        return path;
    }
    
    /**
     * {@return the handler}
     */
    public Handler handler() {
        return handler;
    }
    
    /**
     * Returns {@code true} if the handler is {@link Mountable} and matched by
     * prefix, otherwise {@code false}.
     * 
     * @return whether this route is a mount
     */
    public boolean isMount() {
        return mount;
    }
    
    /**
     * {@return the compiled matcher}
     */
    public PathMatcher matcher() {
        return matcher;
    }
    
    @Override
    public String toString() {
        return Route.class.getSimpleName() + "{method=" + (method == null ? "*" : method) +
               ", path=\"" + path + "\", pattern=\"" + matcher.pattern() +
               "\", mount=" + mount + '}';
    }
}
