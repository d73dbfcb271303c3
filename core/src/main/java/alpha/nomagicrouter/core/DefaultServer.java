package alpha.nomagicrouter.core;

import alpha.nomagicrouter.Config;
import alpha.nomagicrouter.HttpServer;
import alpha.nomagicrouter.handler.DiagnosticSink;
import alpha.nomagicrouter.handler.Handler;
import alpha.nomagicrouter.message.JsonCodec;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.util.Objects.requireNonNull;

/**
 * An {@code HttpServer} on top of the JDK's built-in
 * {@code com.sun.net.httpserver} server.<p>
 * 
 * All requests are served by one context at "/", which passes each exchange
 * to a {@link Dispatcher}. The exchange is closed when the dispatcher's stage
 * completes.
 */
public final class DefaultServer implements HttpServer
{
    private static final System.Logger LOG
            = System.getLogger(DefaultServer.class.getPackageName());
    
    private final Config config;
    private final Dispatcher dispatcher;
    // Guarded by this
    private com.sun.net.httpserver.HttpServer server;
    private ExecutorService workers;
    private boolean started;
    
    /**
     * Constructs a {@code DefaultServer}.
     * 
     * @param config of server
     * @param handler of all requests
     * @param sink of unclassified errors
     */
    public DefaultServer(Config config, Handler handler, DiagnosticSink sink) {
        this.config     = requireNonNull(config);
        this.dispatcher = new Dispatcher(handler, sink, JsonCodec.provider());
    }
    
    @Override
    public synchronized HttpServer start(SocketAddress address) throws IOException {
        requireNonNull(address);
        if (!(address instanceof InetSocketAddress)) {
            throw new IllegalArgumentException(
                    "Expected InetSocketAddress, got: " + address.getClass().getName());
        }
        if (started) {
            throw new IllegalStateException("Server can only be started once.");
        }
        final var srv = com.sun.net.httpserver.HttpServer.create(
                (InetSocketAddress) address, config.backlog());
        final ExecutorService exec = Executors.newFixedThreadPool(
                config.workerThreads(), new WorkerThreads());
        srv.setExecutor(exec);
        srv.createContext("/", this::handle);
        srv.start();
        started = true;
        server  = srv;
        workers = exec;
        LOG.log(INFO, () -> "Started server on " + srv.getAddress());
        return this;
    }
    
    private void handle(HttpExchange exchange) {
        final var req = DefaultRequest.of(exchange, config);
        final var ch  = new ExchangeChannelWriter(exchange);
        dispatcher.dispatch(req, ch).whenComplete((nil, t) -> {
            LOG.log(DEBUG, () -> "Completed " + req);
            exchange.close();
        });
    }
    
    @Override
    public synchronized void stop(Duration gracePeriod) {
        requireNonNull(gracePeriod);
        if (server == null) {
            throw new IllegalStateException("Server is not running.");
        }
        final InetSocketAddress addr = server.getAddress();
        // Granularity of the JDK server is seconds
        final long secs = (gracePeriod.toMillis() + 999) / 1_000;
        server.stop((int) Math.min(Integer.MAX_VALUE, secs));
        workers.shutdownNow();
        server  = null;
        workers = null;
        LOG.log(INFO, () -> "Stopped server on " + addr);
    }
    
    @Override
    public synchronized boolean isRunning() {
        return server != null;
    }
    
    @Override
    public synchronized InetSocketAddress getLocalAddress() {
        if (server == null) {
            throw new IllegalStateException("Server is not running.");
        }
        return server.getAddress();
    }
    
    @Override
    public Config getConfig() {
        return config;
    }
    
    private static final class WorkerThreads implements ThreadFactory {
        private static final AtomicInteger SERVER = new AtomicInteger();
        private final int id = SERVER.incrementAndGet();
        private final AtomicInteger n = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable r) {
            var t = new Thread(r, "nomagicrouter-" + id + "-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
