package alpha.nomagicrouter.util;

import alpha.nomagicrouter.message.BodyOptions;
import alpha.nomagicrouter.message.JsonCodec;
import alpha.nomagicrouter.message.Parameters;
import alpha.nomagicrouter.route.Router;

/**
 * Built-in getters.
 * 
 * @see Getter
 */
public final class Getters
{
    private Getters() {
        // Empty
    }
    
    /**
     * The request body as text.<p>
     * 
     * The argument, if given, controls the limit and charset. The first call
     * for a request consumes the body, so a later call with different options
     * returns the memoized text.
     * 
     * @see alpha.nomagicrouter.message.Request.Body#toText(BodyOptions)
     */
    public static final Getter<BodyOptions, String> TEXT = Getter.createWithArg(
            (req, opts) -> req.body().toText(opts == null ? BodyOptions.DEFAULT : opts));
    
    /**
     * The request body parsed as JSON.<p>
     * 
     * The value is one of {@code Map<String, Object>}, {@code List<Object>},
     * {@code String}, {@code Number}, {@code Boolean} or {@code null}. An empty
     * body is not valid JSON.
     * 
     * @see JsonCodec#parse(String)
     */
    public static final Getter<BodyOptions, Object> JSON = Getter.createWithArg(
            (req, opts) -> JsonCodec.provider().parse(TEXT.get(req, opts)));
    
    /**
     * The query parameters.
     * 
     * @see QueryStrings#parse(String)
     */
    public static final Getter<Void, Parameters> QUERY = Getter.create(
            req -> QueryStrings.parse(req.rawQuery()));
    
    /**
     * The path parameters of the route that matched the request.<p>
     * 
     * Set by the {@link Router}. Empty if no route matched.
     */
    public static final Getter<Void, Parameters> URL_PARAMS = Getter.create(
            req -> Parameters.empty());
    
    /**
     * The base path of the router that matched the request.<p>
     * 
     * Set by the {@link Router}. The empty string if no router matched.
     */
    public static final Getter<Void, String> BASE_PATH = Getter.create(req -> "");
}
