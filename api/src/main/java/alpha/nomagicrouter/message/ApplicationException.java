package alpha.nomagicrouter.message;

import alpha.nomagicrouter.handler.HasStatusCode;

import java.io.Serial;

/**
 * An exception carrying the status code and message of the response that the
 * client should receive.<p>
 * 
 * The message is sent to the client verbatim, so it should not contain
 * internal details.
 * 
 * <pre>
 *   router.get("/users/:id", (req, ch) -&gt; {
 *       var user = repo.find(URL_PARAMS.get(req).get("id"));
 *       if (user == null) {
 *           throw new ApplicationException(404, "No such user");
 *       }
 *       return user;
 *   });
 * </pre>
 * 
 * @see Responses#createError(int, String)
 */
public class ApplicationException extends RuntimeException implements HasStatusCode
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final int statusCode;
    
    /**
     * Constructs an {@code ApplicationException}.
     * 
     * @param statusCode of response
     * @param message of response
     * 
     * @throws IllegalArgumentException
     *             if {@code statusCode} is not in the range 100 to 599
     */
    public ApplicationException(int statusCode, String message) {
        this(statusCode, message, null);
    }
    
    /**
     * Constructs an {@code ApplicationException}.
     * 
     * @param statusCode of response
     * @param message of response
     * @param cause the original exception (may be {@code null})
     * 
     * @throws IllegalArgumentException
     *             if {@code statusCode} is not in the range 100 to 599
     */
    public ApplicationException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("Status code out of range: " + statusCode);
        }
        this.statusCode = statusCode;
    }
    
    @Override
    public final int statusCode() {
        return statusCode;
    }
}
