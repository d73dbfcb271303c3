package alpha.nomagicrouter;

import alpha.nomagicrouter.handler.DiagnosticSink;
import alpha.nomagicrouter.handler.Handler;

/**
 * Factory of {@code HttpServer}.<p>
 * 
 * Application code should have no use of this type. It is only public
 * because it is a requirement by Java's service-provider mechanism.
 */
@FunctionalInterface
public interface HttpServerFactory {
    /**
     * Creates a new {@code HttpServer}.<p>
     * 
     * This method should only be used by the static method
     * {@link HttpServer#create(Config, Handler, DiagnosticSink)
     * HttpServer.create()}.
     * 
     * @param config of server
     * @param handler of all requests
     * @param sink of unclassified errors
     * 
     * @return a new {@code HttpServer}
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     */
    HttpServer create(Config config, Handler handler, DiagnosticSink sink);
}
