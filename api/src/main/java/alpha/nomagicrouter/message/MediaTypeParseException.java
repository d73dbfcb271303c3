package alpha.nomagicrouter.message;

import java.io.Serial;

import static alpha.nomagicrouter.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown by {@link MediaType#parse(String)} if the text can not be parsed.<p>
 * 
 * If the text came from a request's Content-Type header, the request is
 * rejected with a 400 (Bad Request).
 */
public class MediaTypeParseException extends ApplicationException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final String text;
    
    MediaTypeParseException(String text, String appendMsg) {
        super(FOUR_HUNDRED, "Can not parse \"" + text + "\". " + appendMsg);
        this.text = text;
    }
    
    /**
     * {@return the text that failed to parse}
     */
    public String getText() {
        return text;
    }
}
