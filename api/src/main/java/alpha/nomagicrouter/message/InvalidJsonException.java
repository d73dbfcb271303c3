package alpha.nomagicrouter.message;

import java.io.Serial;

import static alpha.nomagicrouter.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown by {@link JsonCodec#parse(String)} if the text is not valid JSON.<p>
 * 
 * Translates to a 400 (Bad Request) with the message "Invalid JSON". The
 * parser's exception is kept as the cause.
 */
public class InvalidJsonException extends ApplicationException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs an {@code InvalidJsonException}.
     * 
     * @param cause the parser's exception
     */
    public InvalidJsonException(Throwable cause) {
        super(FOUR_HUNDRED, "Invalid JSON", cause);
    }
}
