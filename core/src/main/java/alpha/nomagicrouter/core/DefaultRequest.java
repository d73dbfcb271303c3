package alpha.nomagicrouter.core;

import alpha.nomagicrouter.Config;
import alpha.nomagicrouter.message.ApplicationException;
import alpha.nomagicrouter.message.BodyOptions;
import alpha.nomagicrouter.message.MediaType;
import alpha.nomagicrouter.message.PayloadTooLargeException;
import alpha.nomagicrouter.message.Request;
import alpha.nomagicrouter.util.Getter;
import com.sun.net.httpserver.HttpExchange;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static alpha.nomagicrouter.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.nomagicrouter.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicrouter.HttpConstants.StatusCode.FOUR_HUNDRED;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@code Request}.<p>
 * 
 * The body is read from an {@code InputStream} at most once.
 */
final class DefaultRequest implements Request
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRequest.class.getPackageName());
    
    private static final int BUFFER_SIZE = 8 * 1024;
    
    /**
     * Creates a request from an exchange of the JDK's built-in server.
     * 
     * @param exchange the exchange
     * @param config of server
     * @return a request
     */
    static DefaultRequest of(HttpExchange exchange, Config config) {
        final URI uri = exchange.getRequestURI();
        final String path  = uri.getRawPath(),
                     query = uri.getRawQuery();
        final String target = (path == null || path.isEmpty() ? "/" : path) +
                              (query == null ? "" : "?" + query);
        return new DefaultRequest(
                exchange.getRequestMethod(),
                target,
                HttpHeaders.of(exchange.getRequestHeaders(), (k, v) -> true),
                exchange.getRequestBody(),
                config);
    }
    
    private final String method, target, path, rawQuery;
    private final HttpHeaders headers;
    private final Body body;
    private final ConcurrentMap<Getter<?, ?>, Object> getterValues;
    
    DefaultRequest(
            String method, String target, HttpHeaders headers,
            InputStream body, Config config)
    {
        this.method  = requireNonNull(method);
        this.target  = requireNonNull(target);
        this.headers = requireNonNull(headers);
        this.body    = new DefaultBody(requireNonNull(body), requireNonNull(config));
        this.getterValues = new ConcurrentHashMap<>();
        
        final int q = target.indexOf('?');
        final String p = q == -1 ? target : target.substring(0, q);
        this.path     = p.isEmpty() ? "/" : p;
        this.rawQuery = q == -1 ? "" : target.substring(q + 1);
    }
    
    @Override
    public String method() {
        return method;
    }
    
    @Override
    public String target() {
        return target;
    }
    
    @Override
    public String path() {
        return path;
    }
    
    @Override
    public String rawQuery() {
        return rawQuery;
    }
    
    @Override
    public HttpHeaders headers() {
        return headers;
    }
    
    @Override
    public Body body() {
        return body;
    }
    
    @Override
    public ConcurrentMap<Getter<?, ?>, Object> getterValues() {
        return getterValues;
    }
    
    @Override
    public String toString() {
        return DefaultRequest.class.getSimpleName() + "{" + method + " " + target + "}";
    }
    
    private final class DefaultBody implements Body
    {
        private final InputStream in;
        private final Config config;
        private final AtomicBoolean consumed;
        
        DefaultBody(InputStream in, Config config) {
            this.in = in;
            this.config = config;
            this.consumed = new AtomicBoolean();
        }
        
        @Override
        public String toText(BodyOptions options) throws IOException {
            requireNonNull(options);
            // Content-Type is validated before anything is read
            final Charset charset = options.charset()
                    .or(this::contentTypeCharset)
                    .orElse(config.defaultCharset());
            final long limit = options.limit().orElse(config.bodyLimit());
            final OptionalLong declared = contentLength();
            if (declared.isPresent() && declared.getAsLong() > limit) {
                throw new PayloadTooLargeException(limit);
            }
            if (!consumed.compareAndSet(false, true)) {
                throw new IllegalStateException("Body already consumed.");
            }
            final byte[] bytes = read(limit);
            if (declared.isPresent() && declared.getAsLong() != bytes.length) {
                throw new ApplicationException(FOUR_HUNDRED,
                        "request size did not match content length");
            }
            LOG.log(DEBUG, () -> "Read " + bytes.length + " body bytes as " + charset);
            return decode(bytes, charset);
        }
        
        private Optional<Charset> contentTypeCharset() {
            return headers.firstValue(CONTENT_TYPE)
                    .filter(v -> !v.isBlank())
                    .flatMap(v -> MediaType.parse(v).charset());
        }
        
        private OptionalLong contentLength() {
            final var v = headers.firstValue(CONTENT_LENGTH);
            if (v.isEmpty()) {
                return OptionalLong.empty();
            }
            try {
                final long n = Long.parseLong(v.get().strip());
                if (n < 0) {
                    throw new NumberFormatException("Negative: " + n);
                }
                return OptionalLong.of(n);
            } catch (NumberFormatException e) {
                throw new ApplicationException(FOUR_HUNDRED,
                        "invalid content length \"" + v.get() + "\"", e);
            }
        }
        
        private byte[] read(long limit) throws IOException {
            final var buf = new ByteArrayOutputStream();
            final byte[] chunk = new byte[BUFFER_SIZE];
            long total = 0;
            int n;
            try (in) {
                while ((n = in.read(chunk)) != -1) {
                    total += n;
                    if (total > limit) {
                        throw new PayloadTooLargeException(limit);
                    }
                    buf.write(chunk, 0, n);
                }
            }
            return buf.toByteArray();
        }
        
        private String decode(byte[] bytes, Charset charset) {
            final String text;
            try {
                text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException e) {
                throw new ApplicationException(FOUR_HUNDRED,
                        "request body is not valid " + charset.name(), e);
            }
            // Byte order mark
            return charset.equals(UTF_8) && !text.isEmpty() && text.charAt(0) == '\uFEFF' ?
                    text.substring(1) : text;
        }
    }
}
