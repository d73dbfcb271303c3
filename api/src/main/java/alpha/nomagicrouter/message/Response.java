package alpha.nomagicrouter.message;

import alpha.nomagicrouter.handler.Handler;

import java.util.Map;

/**
 * A normalized response; a body, a status code, and headers.<p>
 * 
 * Created using {@link Responses}. A {@link Handler} may also return the body
 * alone, in which case the server wraps it into a response with status code
 * 200 and no headers.<p>
 * 
 * Headers given to the response are written as-is. The server never
 * overwrites a header that has been explicitly set, including Content-Type.<p>
 * 
 * The implementation is immutable, although the body may not be.
 */
public final class Response
{
    private final Object body;
    private final int statusCode;
    private final Map<String, String> headers;
    
    Response(Object body, int statusCode, Map<String, String> headers) {
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException("Invalid status code: " + statusCode);
        }
        this.body = body;
        this.statusCode = statusCode;
        this.headers = headers;
    }
    
    /**
     * Returns the body.<p>
     * 
     * The body is text, a byte array, a stream, or any other object to be
     * serialized as JSON.
     * 
     * @return the body (may be {@code null})
     */
    public Object body() {
        return body;
    }
    
    /**
     * {@return the status code}
     */
    public int statusCode() {
        return statusCode;
    }
    
    /**
     * Returns the headers.<p>
     * 
     * The returned map is unmodifiable and iterates in insertion order.
     * 
     * @return the headers (never {@code null})
     */
    public Map<String, String> headers() {
        return headers;
    }
    
    @Override
    public String toString() {
        return Response.class.getSimpleName() + "{" +
                "statusCode=" + statusCode +
                ", headers=" + headers +
                ", body=" + (body == null ? "null" : body.getClass().getSimpleName()) + '}';
    }
}
