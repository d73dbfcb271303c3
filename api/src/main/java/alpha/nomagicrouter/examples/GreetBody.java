package alpha.nomagicrouter.examples;

import alpha.nomagicrouter.HttpServer;
import alpha.nomagicrouter.message.BodyOptions;
import alpha.nomagicrouter.route.Router;

import java.io.IOException;
import java.util.Map;

import static alpha.nomagicrouter.message.Responses.createError;
import static alpha.nomagicrouter.util.Getters.JSON;

/**
 * Responds a greeting using a name provided by a JSON request body.
 * 
 * <pre>
 *   curl -d '{"name":"Ryan"}' localhost:8080/greet
 *   {"greeting":"Hello Ryan!"}
 * </pre>
 */
public final class GreetBody
{
    private static final int PORT = 8080;
    
    private GreetBody() {
        // Empty
    }
    
    /**
     * Creates the application's router.
     * 
     * @return the application's router
     */
    public static Router app() {
        return Router.create().post("/greet", (req, ch) -> {
            Object body = JSON.get(req, BodyOptions.limit("10kb"));
            if (!(body instanceof Map<?, ?> map) || !(map.get("name") instanceof String name)) {
                // Status-coded exceptions are sent to the client as-is
                throw createError(400, "Expected a JSON object with a \"name\"");
            }
            // Everything except text and binary is serialized as JSON
            return Map.of("greeting", "Hello " + name + "!");
        });
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
