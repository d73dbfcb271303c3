package alpha.nomagicrouter.handler;

import alpha.nomagicrouter.message.Request;

import static java.lang.System.Logger.Level.ERROR;

/**
 * Receives errors the response pipeline did not surface to the client.<p>
 * 
 * The pipeline reports an error if it has no status code and was therefore
 * replaced with a generic 500 (Internal Server Error) response, and if a
 * failure happened after the response had already been committed.<p>
 * 
 * The sink must not throw, and must be thread-safe.
 */
@FunctionalInterface
public interface DiagnosticSink
{
    /**
     * A sink that does nothing.
     */
    DiagnosticSink NOOP = (error, request) -> {
        // Empty
    };
    
    /**
     * Reports an error.
     * 
     * @param error the error (never {@code null})
     * @param request the request being processed (never {@code null})
     */
    void report(Throwable error, Request request);
    
    /**
     * Returns a sink that logs the error on level {@code ERROR} using a
     * {@code System.Logger} named after this package.
     * 
     * @return a sink that logs
     */
    static DiagnosticSink logger() {
        final System.Logger log = System.getLogger(DiagnosticSink.class.getPackageName());
        return (error, request) -> log.log(ERROR,
                () -> "Request failed: " + request.method() + " " + request.target(), error);
    }
}
