package alpha.nomagicrouter.message;

import alpha.nomagicrouter.util.Getter;
import alpha.nomagicrouter.util.Getters;

import java.io.IOException;
import java.net.http.HttpHeaders;
import java.util.concurrent.ConcurrentMap;

/**
 * An inbound HTTP request.<p>
 * 
 * Derived values such as the text body, the query parameters and the path
 * parameters are not accessed through this interface, but through
 * {@linkplain Getters getters}, which compute each value at most once per
 * request.<p>
 * 
 * The request object is the identity of the exchange. Everything memoized for
 * the request is stored in the request object itself and discarded together
 * with it.
 */
public interface Request
{
    /**
     * Returns the request method token, e.g. "GET".
     * 
     * @return the request method token (never {@code null})
     */
    String method();
    
    /**
     * Returns the raw request-target, e.g. "/path?query".
     * 
     * @return the raw request-target (never {@code null})
     */
    String target();
    
    /**
     * Returns the path component of the request-target, without the query.<p>
     * 
     * The path is not percent-decoded. Decoding happens per captured path
     * parameter.
     * 
     * @return the path (never {@code null})
     */
    String path();
    
    /**
     * Returns the query component of the request-target, without the leading
     * '?' and not percent-decoded.
     * 
     * @return the raw query (never {@code null}, may be empty)
     */
    String rawQuery();
    
    /**
     * Returns the request headers.
     * 
     * @return the request headers (never {@code null})
     */
    HttpHeaders headers();
    
    /**
     * Returns the request body.
     * 
     * @return the request body (never {@code null})
     */
    Body body();
    
    /**
     * Returns the values memoized by {@link Getter}s for this request.<p>
     * 
     * The map is created together with the request and is never shared with
     * another request. Application code should go through {@link Getter}
     * instead of using this map directly.
     * 
     * @return the values memoized by getters for this request
     */
    ConcurrentMap<Getter<?, ?>, Object> getterValues();
    
    /**
     * The body of a request.<p>
     * 
     * The body can be consumed only once. Use {@link Getters#TEXT} to
     * consume and memoize the body as text.
     */
    interface Body
    {
        /**
         * Reads the body into a string.<p>
         * 
         * The limit and the charset are taken from the options. If the options
         * do not specify a limit, the configured default is used. If the
         * options do not specify a charset, the charset of the request's
         * Content-Type is used, or the configured default.
         * 
         * @param options of reading (never {@code null})
         * 
         * @return the body as text (never {@code null}, may be empty)
         * 
         * @throws PayloadTooLargeException
         *             if the body is larger than the limit
         * @throws ApplicationException
         *             if the body's length is not the declared length (400), or
         *             if the charset is not supported (415), or
         *             if the bytes are malformed in the charset (400)
         * @throws MediaTypeParseException
         *             if the Content-Type header can not be parsed
         * @throws IllegalStateException
         *             if the body has already been consumed
         * @throws IOException
         *             on I/O error
         */
        String toText(BodyOptions options) throws IOException;
    }
}
