package alpha.nomagicrouter.message;

import alpha.nomagicrouter.HttpConstants;
import alpha.nomagicrouter.util.Strings;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static alpha.nomagicrouter.HttpConstants.StatusCode.FOUR_HUNDRED_FIFTEEN;

/**
 * A media type, as found in a {@link HttpConstants.HeaderName#CONTENT_TYPE
 * Content-Type} header.<p>
 * 
 * The type, subtype and parameter names are case-insensitive and lower cased.
 * Parameter values are unquoted. The "charset" parameter value of "text/*"
 * types is lower cased too.<p>
 * 
 * As an example, all these are considered equal:
 * <pre>
 *   text/html;charset=utf-8
 *   text/html;charset=UTF-8
 *   Text/HTML;Charset="utf-8"
 *   text/html; charset="utf-8"
 * </pre>
 * 
 * @see <a href="https://tools.ietf.org/html/rfc7231#section-3.1.1.1">RFC 7231 §3.1.1.1</a>
 */
public final class MediaType
{
    /** {@code text/plain} */
    public static final MediaType TEXT_PLAIN = parse("text/plain");
    
    /** {@code application/octet-stream} */
    public static final MediaType APPLICATION_OCTET_STREAM = parse("application/octet-stream");
    
    /** {@code application/json; charset=utf-8} */
    public static final MediaType APPLICATION_JSON_UTF8 = parse("application/json; charset=utf-8");
    
    private static final String CHARSET = "charset";
    
    /**
     * Parses a media type.
     * 
     * @param text to parse
     * 
     * @return a media type (never {@code null})
     * 
     * @throws NullPointerException
     *             if {@code text} is {@code null}
     * @throws MediaTypeParseException
     *             if there's not exactly one forward slash in "type/subtype", or
     *             type or subtype is empty, or
     *             a parameter name or value is empty, or
     *             a parameter has been specified more than once
     */
    public static MediaType parse(final String text) {
        final String[] tokens = Strings.split(text, ';', '"').toArray(String[]::new);
        unacceptable(tokens.length == 0, text, "Nothing to parse.");
        
        final String[] types = tokens[0].split("/");
        unacceptable(types.length != 2, text,
                "Expected exactly one forward slash in <type/subtype>.");
        
        final String type = stripAndLowerCase(types[0]),
                  subtype = stripAndLowerCase(types[1]);
        unacceptable(type.isEmpty(), text, "Type is empty.");
        unacceptable(subtype.isEmpty(), text, "Subtype is empty.");
        
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 1; i < tokens.length; ++i) {
            final String tkn = tokens[i];
            if (tkn.isBlank()) {
                continue;
            }
            final int eq = tkn.indexOf('=');
            unacceptable(eq == -1, text, "A parameter has no assigned value.");
            
            final String name = stripAndLowerCase(tkn.substring(0, eq));
            unacceptable(name.isEmpty(), text, "Empty parameter name.");
            
            String value = Strings.unquote(tkn.substring(eq + 1).strip());
            unacceptable(value.isEmpty(), text, "Empty parameter value.");
            
            if (type.equals("text") && name.equals(CHARSET)) {
                value = value.toLowerCase(Locale.ROOT);
            }
            // "It is an error for a specific parameter to be specified more than once."
            // https://datatracker.ietf.org/doc/html/rfc6838#section-4.3
            unacceptable(params.put(name, value) != null, text, "Duplicated parameters.");
        }
        
        return new MediaType(text, type, subtype, params);
    }
    
    private static void unacceptable(boolean whatIs, String parseText, String appendMsg) {
        if (whatIs) throw new MediaTypeParseException(parseText, appendMsg);
    }
    
    private static String stripAndLowerCase(String str) {
        return str.strip().toLowerCase(Locale.ROOT);
    }
    
    private final String text, type, subtype;
    private final Map<String, String> params;
    
    private MediaType(String text, String type, String subtype, Map<String, String> params) {
        this.text    = text;
        this.type    = type;
        this.subtype = subtype;
        this.params  = Collections.unmodifiableMap(params);
    }
    
    /**
     * Returns the media type.<p>
     * 
     * For example, "text/plain; charset=utf-8" returns "text".
     * 
     * @return the media type (not {@code null})
     */
    public String type() {
        return type;
    }
    
    /**
     * Returns the media subtype.<p>
     * 
     * For example, "text/plain; charset=utf-8" returns "plain".
     * 
     * @return the media subtype (not {@code null})
     */
    public String subtype() {
        return subtype;
    }
    
    /**
     * Returns all media parameters.<p>
     * 
     * The returned map is unmodifiable.
     * 
     * @return all media parameters (not {@code null})
     */
    public Map<String, String> parameters() {
        return params;
    }
    
    /**
     * Returns the charset parameter as a {@code Charset}.
     * 
     * @return the charset, if the parameter is present
     * 
     * @throws ApplicationException
     *             with status code 415 (Unsupported Media Type),
     *             if the charset is not supported
     */
    public Optional<Charset> charset() {
        final String name = params.get(CHARSET);
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Charset.forName(name));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ApplicationException(FOUR_HUNDRED_FIFTEEN,
                    "unsupported charset \"" + name.toUpperCase(Locale.ROOT) + "\"", e);
        }
    }
    
    /**
     * Returns the text this media type was parsed from.
     * 
     * @return the text this media type was parsed from
     */
    @Override
    public String toString() {
        return text;
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MediaType other)) {
            return false;
        }
        return type.equals(other.type) &&
               subtype.equals(other.subtype) &&
               params.equals(other.params);
    }
    
    @Override
    public int hashCode() {
        return 31 * (31 * type.hashCode() + subtype.hashCode()) + params.hashCode();
    }
}
