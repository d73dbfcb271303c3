package alpha.nomagicrouter.testutil.functional;

import alpha.nomagicrouter.Config;
import alpha.nomagicrouter.HttpServer;
import alpha.nomagicrouter.handler.Handler;
import alpha.nomagicrouter.testutil.LogRecorder;
import alpha.nomagicrouter.testutil.Logging;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.io.IOException;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;

import static alpha.nomagicrouter.Config.DEFAULT;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Will set up a server and a client for each test.<p>
 * 
 * The server is started by {@link #serve(Handler)}, on a system-picked port
 * of the loopback address. The client is retrieved using {@link #client()}.
 * After each test, the server is stopped.<p>
 * 
 * Errors that the server reports to its diagnostic sink are collected. Each
 * such error must be polled by the test using {@link #pollReportedError()},
 * otherwise the test fails. Log recording is active during each test, and a
 * problem-free log is asserted after each test. A test that provokes a
 * warning must remove the record using {@link #logRecorder()}.
 * 
 * <pre>
 *   class MyTest extends AbstractRealTest {
 *       &#64;Test
 *       void hello() throws Exception {
 *           serve((req, ch) -&gt; "Hello");
 *           assertThat(client().get("/").body()).isEqualTo("Hello");
 *       }
 *   }
 * </pre>
 */
public abstract class AbstractRealTest
{
    /** Graceful stop period used after each test. */
    protected static final int STOP_GRACEFUL_SECONDS = 1;
    
    private static final System.Logger LOG
            = System.getLogger(AbstractRealTest.class.getPackageName());
    
    private LogRecorder recorder;
    private HttpServer server;
    private Config config;
    private BlockingDeque<Throwable> reported;
    private TestClient client;
    
    @BeforeAll
    static void beforeAll() {
        Logging.everything();
    }
    
    @BeforeEach
    final void beforeEach(TestInfo test) {
        LOG.log(DEBUG, () -> "Executing " + test.getDisplayName());
        recorder = LogRecorder.startRecording();
        reported = new LinkedBlockingDeque<>();
    }
    
    @AfterEach
    final void afterEach(TestInfo test) {
        try {
            if (server != null) {
                server.stop(Duration.ofSeconds(STOP_GRACEFUL_SECONDS));
                assertThat(server.isRunning()).isFalse();
                server = null;
            }
            client = null;
            assertThat(reported).isEmpty();
            recorder.assertNoProblem();
        } finally {
            recorder.stopRecording();
        }
        LOG.log(DEBUG, () -> "Finished " + test.getDisplayName());
    }
    
    /**
     * Returns a proxy builder of the configuration used by the server.<p>
     * 
     * Each value set on the proxy is immediately applied. Calling
     * {@code build()} is not allowed.
     * 
     * <pre>
     *   usingConfiguration().bodyLimit(10);
     * </pre>
     * 
     * @return a config builder proxy
     * @throws IllegalStateException if the server has been started
     */
    protected final Config.Builder usingConfiguration() {
        requireServerNotStarted();
        InvocationHandler proxyImpl = (self, method, args) -> {
            if (method.getName().equals("build")) {
                throw new UnsupportedOperationException(
                        "Don't call build() explicitly. " +
                        "Config will be built and used for each new value set.");
            }
            Config.Builder b = config == null ? DEFAULT.toBuilder() : config.toBuilder();
            b = (Config.Builder) method.invoke(b, args);
            config = b.build();
            return self;
        };
        return (Config.Builder) Proxy.newProxyInstance(
                Config.Builder.class.getClassLoader(),
                new Class<?>[]{ Config.Builder.class },
                proxyImpl);
    }
    
    /**
     * Starts the server.
     * 
     * @param handler of all requests
     * @return the server
     * @throws IOException if the server could not be started
     * @throws IllegalStateException if the server has already been started
     */
    protected final HttpServer serve(Handler handler) throws IOException {
        requireNonNull(handler);
        requireServerNotStarted();
        var s = HttpServer.create(
                config != null ? config : DEFAULT,
                handler,
                (error, request) -> reported.add(error));
        s.start("127.0.0.1", 0);
        assertThat(s.isRunning()).isTrue();
        server = s;
        return s;
    }
    
    /**
     * {@return the port of the running server}
     * @throws IllegalStateException if the server has not been started
     */
    protected final int serverPort() {
        requireServerStarted();
        return server.getPort();
    }
    
    /**
     * {@return a client of the running server}
     * @throws IllegalStateException if the server has not been started
     */
    protected final TestClient client() {
        requireServerStarted();
        if (client == null) {
            client = new TestClient(server.getPort());
        }
        return client;
    }
    
    /**
     * Polls an error reported to the server's diagnostic sink.<p>
     * 
     * Waits at most 3 seconds.
     * 
     * @return the error, or {@code null} on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    protected final Throwable pollReportedError() throws InterruptedException {
        return reported.poll(3, SECONDS);
    }
    
    /**
     * {@return the log recorder of the current test}
     */
    protected final LogRecorder logRecorder() {
        return recorder;
    }
    
    private void requireServerStarted() {
        if (server == null) {
            throw new IllegalStateException("Server not started.");
        }
    }
    
    private void requireServerNotStarted() {
        if (server != null) {
            throw new IllegalStateException("Server already started.");
        }
    }
}
