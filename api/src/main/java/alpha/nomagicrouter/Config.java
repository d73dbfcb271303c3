package alpha.nomagicrouter;

import alpha.nomagicrouter.message.BodyOptions;
import alpha.nomagicrouter.message.PayloadTooLargeException;

import java.nio.charset.Charset;
import java.time.Duration;

/**
 * Server configuration.<p>
 * 
 * {@link Config#toBuilder()} allows for any configuration object to be used as
 * a template for a new instance. The static method {@link #configuration()} is
 * a shortcut for {@code Config.DEFAULT.toBuilder()}:
 * 
 * <pre>
 *   Config c = configuration()
 *           .bodyLimit(100 * 1024 * 1024)
 *           .workerThreads(8)
 *           .build();
 * </pre>
 * 
 * The implementation is immutable.
 */
public interface Config
{
    /**
     * Values used by {@link HttpServer#create(alpha.nomagicrouter.handler.Handler)}.<p>
     * 
     * Body limit = 1 048 576 (1 MiB)<br>
     * Default charset = UTF-8<br>
     * Worker threads = available processors, at least 2<br>
     * Backlog = 0 (system default)<br>
     * Stop grace period = 1 second
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns the max number of bytes a request body may have when read as
     * text without an explicit limit.<p>
     * 
     * A body exceeding the limit fails the read with a
     * {@link PayloadTooLargeException}.
     * 
     * @return max number of body bytes
     * 
     * @see BodyOptions#limit(String)
     */
    long bodyLimit();
    
    /**
     * Returns the charset used to decode a request body when neither the
     * reader nor the request's Content-Type specifies one.
     * 
     * @return a charset (never {@code null})
     */
    Charset defaultCharset();
    
    /**
     * Returns the number of threads serving requests.
     * 
     * @return the number of threads serving requests
     */
    int workerThreads();
    
    /**
     * Returns the max number of queued incoming connections.<p>
     * 
     * A value less than 1 lets the system choose.
     * 
     * @return the max number of queued incoming connections
     */
    int backlog();
    
    /**
     * Returns the max time {@link HttpServer#stop()} waits for active
     * exchanges to finish.
     * 
     * @return the stop grace period (never {@code null})
     */
    Duration stopGracePeriod();
    
    /**
     * Returns the builder instance that built this configuration.<p>
     * 
     * The builder may be used to modify configuration values.
     * 
     * @return the builder instance that built this configuration
     */
    Config.Builder toBuilder();
    
    /**
     * {@return the builder used to build the default configuration}
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * Each method returns a new builder instance representing the new state.
     * The implementation is thread-safe.
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is negative
         * @see Config#bodyLimit()
         */
        Builder bodyLimit(long newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#defaultCharset()
         */
        Builder defaultCharset(Charset newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is less than 1
         * @see Config#workerThreads()
         */
        Builder workerThreads(int newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#backlog()
         */
        Builder backlog(int newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#stopGracePeriod()
         */
        Builder stopGracePeriod(Duration newVal);
        
        /**
         * Builds a configuration.
         * 
         * @return a configuration
         */
        Config build();
    }
}
