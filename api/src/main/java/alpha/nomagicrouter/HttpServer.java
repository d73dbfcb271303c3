package alpha.nomagicrouter;

import alpha.nomagicrouter.handler.DiagnosticSink;
import alpha.nomagicrouter.handler.Handler;
import alpha.nomagicrouter.route.Router;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ServiceLoader;

/**
 * Listens on a port for HTTP requests, and passes each request to a
 * handler.<p>
 * 
 * The handler is typically a {@link Router}. The value returned by, or the
 * exception thrown from, the handler is turned into a response as documented
 * in {@link Handler}.
 * 
 * <pre>
 *   Router app = Router.create()
 *       .get("/hello/:name", (req, ch) -&gt;
 *           "Hello " + Getters.URL_PARAMS.get(req).get("name"));
 *   
 *   HttpServer.create(app).start(8080);
 * </pre>
 * 
 * All {@code start} methods return as soon as the server is listening. The
 * requests are handled by a pool of {@link Config#workerThreads()} daemon
 * threads. A server can be started at most once.<p>
 * 
 * An exception thrown by the handler that has no status code is reported to
 * a {@link DiagnosticSink}. Unless another one is given, the sink is
 * {@link DiagnosticSink#logger()}.
 */
public interface HttpServer
{
    /**
     * Creates a new {@code HttpServer} using the default configuration.
     * 
     * @param handler of all requests
     * @return a new {@code HttpServer}
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    static HttpServer create(Handler handler) {
        return create(Config.DEFAULT, handler);
    }
    
    /**
     * Creates a new {@code HttpServer}.
     * 
     * @param config server configuration
     * @param handler of all requests
     * @return a new {@code HttpServer}
     * @throws NullPointerException if an argument is {@code null}
     */
    static HttpServer create(Config config, Handler handler) {
        return create(config, handler, DiagnosticSink.logger());
    }
    
    /**
     * Creates a new {@code HttpServer}.
     * 
     * @param config server configuration
     * @param handler of all requests
     * @param sink of unclassified errors
     * @return a new {@code HttpServer}
     * @throws NullPointerException if an argument is {@code null}
     */
    static HttpServer create(Config config, Handler handler, DiagnosticSink sink) {
        var loader = ServiceLoader.load(HttpServerFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config, handler, sink);
    }
    
    /**
     * Listens on the given port, on the wildcard address.<p>
     * 
     * Port 0 means a system-picked port, which can then be retrieved using
     * {@link #getPort()}.
     * 
     * @param port to listen on
     * @return this (for chaining/fluency)
     * @throws IOException if the address could not be bound
     * @throws IllegalStateException if the server has already been started
     */
    default HttpServer start(int port) throws IOException {
        return start(new InetSocketAddress(port));
    }
    
    /**
     * Listens on the given host and port.
     * 
     * @param hostname to listen on
     * @param port to listen on
     * @return this (for chaining/fluency)
     * @throws IOException if the address could not be bound
     * @throws IllegalStateException if the server has already been started
     */
    default HttpServer start(String hostname, int port) throws IOException {
        return start(new InetSocketAddress(hostname, port));
    }
    
    /**
     * Listens on the given address.
     * 
     * @param address to listen on
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code address} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code address} is not an {@code InetSocketAddress}
     * @throws IOException
     *             if the address could not be bound
     * @throws IllegalStateException
     *             if the server has already been started
     */
    HttpServer start(SocketAddress address) throws IOException;
    
    /**
     * Stops the server.<p>
     * 
     * Same as {@code stop(getConfig().stopGracePeriod())}.
     * 
     * @throws IllegalStateException if the server is not running
     */
    default void stop() {
        stop(getConfig().stopGracePeriod());
    }
    
    /**
     * Stops the server.<p>
     * 
     * The server stops accepting new exchanges immediately, and waits at
     * most the given duration for active exchanges to finish.
     * 
     * @param gracePeriod max time to wait
     * 
     * @throws NullPointerException
     *             if {@code gracePeriod} is {@code null}
     * @throws IllegalStateException
     *             if the server is not running
     */
    void stop(Duration gracePeriod);
    
    /**
     * {@return whether the server is running}
     */
    boolean isRunning();
    
    /**
     * Returns the address the server is listening on.
     * 
     * @return the address the server is listening on
     * @throws IllegalStateException if the server is not running
     */
    InetSocketAddress getLocalAddress();
    
    /**
     * Returns the port the server is listening on.
     * 
     * @return the port the server is listening on
     * @throws IllegalStateException if the server is not running
     */
    default int getPort() {
        return getLocalAddress().getPort();
    }
    
    /**
     * {@return the server's configuration}
     */
    Config getConfig();
}
