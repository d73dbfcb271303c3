package alpha.nomagicrouter;

import alpha.nomagicrouter.message.MediaType;
import alpha.nomagicrouter.route.Router;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 * 
 * For values to use in a {@link HeaderName#CONTENT_TYPE Content-Type} header,
 * see {@link MediaType}.
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }
    
    /**
     * Request methods understood by the {@link Router}.<p>
     * 
     * A route declared with a method matches only requests having the exact
     * same method token; the comparison is case-sensitive.
     * 
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-4">RFC 7231 §4</a>
     */
    public static final class Method {
        private Method() {
            // Private
        }
        
        /**
         * Used to retrieve a server resource.<p>
         * 
         * Safe? Yes. Idempotent? Yes. Response cacheable? Yes.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.1">RFC 7231 §4.3.1</a>
         */
        public static final String GET = "GET";
        
        /**
         * Same as {@link #GET}, except the response must exclude the message
         * body.<p>
         * 
         * Safe? Yes. Idempotent? Yes. Response cacheable? Yes.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.2">RFC 7231 §4.3.2</a>
         */
        public static final String HEAD = "HEAD";
        
        /**
         * Request the server to process the enclosed representation.<p>
         * 
         * Safe? No. Idempotent? No. Response cacheable? Only with explicit
         * freshness information.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.3">RFC 7231 §4.3.3</a>
         */
        public static final String POST = "POST";
        
        /**
         * Create or replace the state of the target resource.<p>
         * 
         * Safe? No. Idempotent? Yes. Response cacheable? No.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.4">RFC 7231 §4.3.4</a>
         */
        public static final String PUT = "PUT";
        
        /**
         * Remove the target resource.<p>
         * 
         * Safe? No. Idempotent? Yes. Response cacheable? No.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.5">RFC 7231 §4.3.5</a>
         */
        public static final String DELETE = "DELETE";
        
        /**
         * Query the communication options of the target resource.<p>
         * 
         * Safe? Yes. Idempotent? Yes. Response cacheable? No.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.7">RFC 7231 §4.3.7</a>
         */
        public static final String OPTIONS = "OPTIONS";
        
        /**
         * Apply a partial modification to the target resource.<p>
         * 
         * Safe? No. Idempotent? No. Response cacheable? No.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc5789">RFC 5789</a>
         */
        public static final String PATCH = "PATCH";
    }
    
    /**
     * Status codes used by the router and the response pipeline.
     * 
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-6">RFC 7231 §6</a>
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }
        
        /** {@value} {@value ReasonPhrase#OK} */
        public static final int TWO_HUNDRED = 200;
        
        /** {@value} {@value ReasonPhrase#BAD_REQUEST} */
        public static final int FOUR_HUNDRED = 400;
        
        /** {@value} {@value ReasonPhrase#NOT_FOUND} */
        public static final int FOUR_HUNDRED_FOUR = 404;
        
        /** {@value} {@value ReasonPhrase#ENTITY_TOO_LARGE} */
        public static final int FOUR_HUNDRED_THIRTEEN = 413;
        
        /** {@value} {@value ReasonPhrase#UNSUPPORTED_MEDIA_TYPE} */
        public static final int FOUR_HUNDRED_FIFTEEN = 415;
        
        /** {@value} {@value ReasonPhrase#INTERNAL_SERVER_ERROR} */
        public static final int FIVE_HUNDRED = 500;
        
        /**
         * Returns {@code true} if the given code is a 4XX (Client Error) or
         * a 5XX (Server Error).
         * 
         * @param code to test
         * @return see JavaDoc
         */
        public static boolean isError(int code) {
            return code >= 400 && code <= 599;
        }
    }
    
    /**
     * Reason phrases of the status codes in {@link StatusCode}.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Private
        }
        
        /** {@value} */
        public static final String OK = "OK";
        /** {@value} */
        public static final String BAD_REQUEST = "Bad Request";
        /** {@value} */
        public static final String NOT_FOUND = "Not Found";
        /** {@value} */
        public static final String ENTITY_TOO_LARGE = "Entity Too Large";
        /** {@value} */
        public static final String UNSUPPORTED_MEDIA_TYPE = "Unsupported Media Type";
        /** {@value} */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
    }
    
    /**
     * Header names used by the response pipeline.<p>
     * 
     * Header names are case-insensitive. The constants in this class are
     * written in the canonical title case.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Private
        }
        
        /**
         * The length of the message body in bytes.<p>
         * 
         * Set by the response pipeline for all bodies of known length.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7230#section-3.3.2">RFC 7230 §3.3.2</a>
         */
        public static final String CONTENT_LENGTH = "Content-Length";
        
        /**
         * The media type of the message body.<p>
         * 
         * Set by the response pipeline if absent, and read by the body reader
         * to figure out which charset to decode with.
         * 
         * @see MediaType
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-3.1.1.5">RFC 7231 §3.1.1.5</a>
         */
        public static final String CONTENT_TYPE = "Content-Type";
    }
}
