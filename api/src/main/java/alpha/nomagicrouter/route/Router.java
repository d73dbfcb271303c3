package alpha.nomagicrouter.route;

import alpha.nomagicrouter.handler.Handler;
import alpha.nomagicrouter.util.Getters;

import java.util.List;

import static alpha.nomagicrouter.HttpConstants.Method.DELETE;
import static alpha.nomagicrouter.HttpConstants.Method.GET;
import static alpha.nomagicrouter.HttpConstants.Method.HEAD;
import static alpha.nomagicrouter.HttpConstants.Method.OPTIONS;
import static alpha.nomagicrouter.HttpConstants.Method.PATCH;
import static alpha.nomagicrouter.HttpConstants.Method.POST;
import static alpha.nomagicrouter.HttpConstants.Method.PUT;

/**
 * An ordered table of routes, itself a handler.<p>
 * 
 * When invoked, the router scans its routes in registration order. A route
 * with a method filter is skipped if the request method is not exactly the
 * same. The first route whose matcher matches the request path is selected;
 * the matched path parameters are set as {@link Getters#URL_PARAMS}, the
 * router's base path as {@link Getters#BASE_PATH}, and the route's handler
 * is invoked, its result returned as-is. If no route matches, a 404 (Not
 * Found) response is returned.<p>
 * 
 * The query is never part of matching.
 * 
 * <pre>
 *   Router users = Router.create()
 *       .get("/:id", (req, ch) -&gt; ...)
 *       .post("/", (req, ch) -&gt; ...);
 *   
 *   Router app = Router.create()
 *       .get("/", (req, ch) -&gt; "Hello")
 *       .use("/users", users);
 * </pre>
 * 
 * A route registered with a terminal handler is matched against the whole
 * path; the pattern is the router's base path concatenated with the
 * registered path, with one trailing slash removed, and the trailing slash
 * of the request path is optional. A {@link Mountable} handler, such as
 * another router, is matched by prefix and receives the concatenated path as
 * its base path. This propagates recursively, so a route in a router nested
 * at any depth is matched against the full path from the root.<p>
 * 
 * Routes are matched case-insensitively.<p>
 * 
 * Registration is not thread-safe, and must not happen concurrently with
 * the handling of requests. Build the route table first, then serve.
 * 
 * @see PathMatcher
 */
public interface Router extends Handler, Mountable
{
    /**
     * Creates a router with an empty base path.
     * 
     * @return a new router
     */
    static Router create() {
        return new DefaultRouter();
    }
    
    /**
     * Adds a route.<p>
     * 
     * If the handler is {@link Mountable}, it is mounted at the given path
     * but is only matched for the given method.
     * 
     * @param method to match, e.g. "GET"
     * @param path pattern, relative to this router's base path
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    Router on(String method, String path, Handler handler);
    
    /**
     * Adds a "GET" route.
     * 
     * @param path pattern
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router get(String path, Handler handler) {
        return on(GET, path, handler);
    }
    
    /**
     * Adds a "HEAD" route.
     * 
     * @param path pattern
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router head(String path, Handler handler) {
        return on(HEAD, path, handler);
    }
    
    /**
     * Adds a "POST" route.
     * 
     * @param path pattern
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router post(String path, Handler handler) {
        return on(POST, path, handler);
    }
    
    /**
     * Adds a "PUT" route.
     * 
     * @param path pattern
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router put(String path, Handler handler) {
        return on(PUT, path, handler);
    }
    
    /**
     * Adds a "DELETE" route.
     * 
     * @param path pattern
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router delete(String path, Handler handler) {
        return on(DELETE, path, handler);
    }
    
    /**
     * Adds an "OPTIONS" route.
     * 
     * @param path pattern
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router options(String path, Handler handler) {
        return on(OPTIONS, path, handler);
    }
    
    /**
     * Adds a "PATCH" route.
     * 
     * @param path pattern
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router patch(String path, Handler handler) {
        return on(PATCH, path, handler);
    }
    
    /**
     * Adds a route matching any method, at this router's base path.<p>
     * 
     * Same as {@code use("", handler)}.
     * 
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    default Router use(Handler handler) {
        return use("", handler);
    }
    
    /**
     * Adds a route matching any method.<p>
     * 
     * If the handler is {@link Mountable}, its base path is immediately set
     * to this router's base path concatenated with the given path, and it is
     * matched by prefix. Otherwise, the handler is matched as a terminal
     * route.
     * 
     * @param path pattern, relative to this router's base path
     * @param handler to invoke
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    Router use(String path, Handler handler);
    
    /**
     * {@return the current base path (empty if not mounted)}
     */
    String basePath();
    
    /**
     * Returns a snapshot of the route table, in matching order.<p>
     * 
     * The returned list is unmodifiable.
     * 
     * @return a snapshot of the route table
     */
    List<Route> routes();
}
