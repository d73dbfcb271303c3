package alpha.nomagicrouter.route;

/**
 * A handler that can be mounted beneath a path prefix.<p>
 * 
 * When a {@code Mountable} handler is registered with a {@link Router}, the
 * router calls {@link #setBasePath(String)} with the concatenation of its own
 * base path and the mount path. A handler that does not implement this
 * interface is a terminal handler.
 */
@FunctionalInterface
public interface Mountable
{
    /**
     * Sets the base path of this handler.<p>
     * 
     * The base path is the full prefix accumulated from all ancestor mounts.
     * May be called any number of times; each call fully replaces the effect
     * of the previous.
     * 
     * @param basePath the new base path (empty for root)
     * @throws NullPointerException if {@code basePath} is {@code null}
     */
    void setBasePath(String basePath);
}
