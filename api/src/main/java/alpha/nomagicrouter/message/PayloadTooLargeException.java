package alpha.nomagicrouter.message;

import alpha.nomagicrouter.Config;

import java.io.Serial;

import static alpha.nomagicrouter.HttpConstants.StatusCode.FOUR_HUNDRED_THIRTEEN;

/**
 * Thrown by the body reader if the request body is larger than the limit.<p>
 * 
 * The limit is enforced both on the declared Content-Length and on the number
 * of bytes actually received.
 * 
 * @see BodyOptions#limit(String)
 * @see Config#bodyLimit()
 */
public class PayloadTooLargeException extends ApplicationException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final long limit;
    
    /**
     * Constructs a {@code PayloadTooLargeException}.
     * 
     * @param limit the exceeded limit
     */
    public PayloadTooLargeException(long limit) {
        super(FOUR_HUNDRED_THIRTEEN, "request entity too large");
        this.limit = limit;
    }
    
    /**
     * {@return the exceeded limit, in bytes}
     */
    public long getLimit() {
        return limit;
    }
}
