package alpha.nomagicrouter.core;

import alpha.nomagicrouter.Config;
import alpha.nomagicrouter.HttpServer;
import alpha.nomagicrouter.HttpServerFactory;
import alpha.nomagicrouter.handler.DiagnosticSink;
import alpha.nomagicrouter.handler.Handler;

/**
 * Default {@code HttpServerFactory}.<p>
 * 
 * Specified in the provider configuration file, which requires a public class
 * with a public no-arg constructor.
 */
public class DefaultServerFactory implements HttpServerFactory
{
    /**
     * Constructs this object.
     */
    public DefaultServerFactory() {
        // Empty
    }
    
    @Override
    public HttpServer create(Config config, Handler handler, DiagnosticSink sink) {
        return new DefaultServer(config, handler, sink);
    }
}
