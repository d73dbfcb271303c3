package alpha.nomagicrouter.message;

import alpha.nomagicrouter.route.PathMatcher;

import java.io.Serial;

import static alpha.nomagicrouter.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown by a {@link PathMatcher} if a captured path segment can not be
 * percent-decoded.<p>
 * 
 * This is not a "no match". The request is rejected as a whole with a
 * 400 (Bad Request).
 */
public class DecodeException extends ApplicationException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final String raw;
    
    /**
     * Constructs a {@code DecodeException}.
     * 
     * @param raw the undecodable text
     * @param cause the decoder's exception
     */
    public DecodeException(String raw, Throwable cause) {
        super(FOUR_HUNDRED, "failed to decode param \"" + raw + "\"", cause);
        this.raw = raw;
    }
    
    /**
     * {@return the undecodable text}
     */
    public String getRaw() {
        return raw;
    }
}
