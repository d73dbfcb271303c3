package alpha.nomagicrouter.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static alpha.nomagicrouter.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.nomagicrouter.HttpConstants.ReasonPhrase.NOT_FOUND;
import static alpha.nomagicrouter.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.nomagicrouter.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.nomagicrouter.HttpConstants.StatusCode.TWO_HUNDRED;
import static java.util.Objects.requireNonNull;

/**
 * Factories of {@link Response}s and client-facing errors.
 */
public final class Responses
{
    private Responses() {
        // Empty
    }
    
    private static final Response
            NOT_FOUND_RSP = reply(NOT_FOUND, FOUR_HUNDRED_FOUR),
            ISE_RSP       = reply(INTERNAL_SERVER_ERROR, FIVE_HUNDRED);
    
    /**
     * Returns a 200 (OK) response with the given body.
     * 
     * @param body of response (may be {@code null})
     * @return a response
     */
    public static Response reply(Object body) {
        return reply(body, TWO_HUNDRED);
    }
    
    /**
     * Returns a response with the given body and status code.
     * 
     * @param body of response (may be {@code null})
     * @param statusCode of response
     * @return a response
     * @throws IllegalArgumentException if the status code is not three digits
     */
    public static Response reply(Object body, int statusCode) {
        return new Response(body, statusCode, Map.of());
    }
    
    /**
     * Returns a response with the given body, status code and headers.<p>
     * 
     * The headers are copied.
     * 
     * @param body of response (may be {@code null})
     * @param statusCode of response
     * @param headers of response
     * @return a response
     * @throws NullPointerException if {@code headers} is {@code null}
     * @throws IllegalArgumentException if the status code is not three digits
     */
    public static Response reply(Object body, int statusCode, Map<String, String> headers) {
        return new Response(body, statusCode,
                Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(headers))));
    }
    
    /**
     * Returns a 404 (Not Found) response with body "Not Found".
     * 
     * @return a response
     */
    public static Response notFound() {
        return NOT_FOUND_RSP;
    }
    
    /**
     * Returns a 500 (Internal Server Error) response with body
     * "Internal Server Error".
     * 
     * @return a response
     */
    public static Response internalServerError() {
        return ISE_RSP;
    }
    
    /**
     * Creates a client-facing error, to be thrown.
     * 
     * @param statusCode of response
     * @param message of response
     * @return an exception
     * @throws IllegalArgumentException if the status code is out of range
     */
    public static ApplicationException createError(int statusCode, String message) {
        return new ApplicationException(statusCode, message);
    }
    
    /**
     * Creates a client-facing error, to be thrown.
     * 
     * @param statusCode of response
     * @param message of response
     * @param cause the original exception (may be {@code null})
     * @return an exception
     * @throws IllegalArgumentException if the status code is out of range
     */
    public static ApplicationException createError(int statusCode, String message, Throwable cause) {
        return new ApplicationException(statusCode, message, cause);
    }
}
