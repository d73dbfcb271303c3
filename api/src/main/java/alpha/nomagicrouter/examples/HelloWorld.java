package alpha.nomagicrouter.examples;

import alpha.nomagicrouter.HttpServer;
import alpha.nomagicrouter.route.Router;
import alpha.nomagicrouter.util.Getters;

import java.io.IOException;

/**
 * Responds "Hello {name}!" to the client, the name taken from the path.
 */
public final class HelloWorld
{
    private static final int PORT = 8080;
    
    private HelloWorld() {
        // Empty
    }
    
    /**
     * Creates the application's router.
     * 
     * @return the application's router
     */
    public static Router app() {
        // A route is matched in registration order. The first route that
        // matches the method and path is the only one invoked.
        return Router.create()
                .get("/", (req, ch) -> "Hello World!")
                .get("/hello/:name", (req, ch) ->
                        // Path parameters are percent-decoded
                        "Hello " + Getters.URL_PARAMS.get(req).get("name") + "!");
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
        // start() returns when listening, the server threads are daemons
        HttpServer.create(app()).start(PORT);
        System.out.println("Listening on port " + PORT + ". Press Enter to stop.");
        System.in.read();
    }
}
