package alpha.nomagicrouter.examples;

import alpha.nomagicrouter.HttpServer;
import alpha.nomagicrouter.route.Router;

import java.io.IOException;
import java.util.Map;

import static alpha.nomagicrouter.message.Responses.reply;
import static alpha.nomagicrouter.util.Getters.BASE_PATH;
import static alpha.nomagicrouter.util.Getters.QUERY;
import static alpha.nomagicrouter.util.Getters.URL_PARAMS;

/**
 * Composes an application from routers mounted beneath each other.
 * 
 * <pre>
 *   GET /api/v1/users/42        {"id":"42","mountedAt":"/api/v1/users"}
 *   GET /api/v1/users?sort=age  "Listing users sorted by age"
 *   GET /api/v1/files/a/b/c     ["a","b","c"]
 *   HEAD /health                204
 * </pre>
 */
public final class NestedRouters
{
    private static final int PORT = 8080;
    
    private NestedRouters() {
        // Empty
    }
    
    /**
     * Creates the application's router.
     * 
     * @return the application's router
     */
    public static Router app() {
        Router users = Router.create()
                .get("/", (req, ch) ->
                        "Listing users sorted by " + QUERY.get(req).get("sort"))
                .get("/:id", (req, ch) -> Map.of(
                        "id", URL_PARAMS.get(req).get("id"),
                        "mountedAt", BASE_PATH.get(req)));
        
        Router files = Router.create()
                .get("/:path+", (req, ch) -> URL_PARAMS.get(req).getAll("path"));
        
        // Routers may be mounted before or after their routes are added
        Router v1 = Router.create()
                .use("/users", users)
                .use("/files", files);
        
        return Router.create()
                .use("/api/v1", v1)
                .use("/health", (req, ch) -> reply(null, 204));
    }
    
    /**
     * Application's entry point.
     * 
     * @param args ignored
     * 
     * @throws IOException
     *             if an I/O error occurs
     */
    public static void main(String... args) throws IOException {
        HttpServer.create(app()).start(PORT);
        System.out.println("Listening on port " + PORT + ". Press Enter to stop.");
        System.in.read();
    }
}
