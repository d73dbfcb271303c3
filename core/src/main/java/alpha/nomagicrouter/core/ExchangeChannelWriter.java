package alpha.nomagicrouter.core;

import alpha.nomagicrouter.handler.ChannelWriter;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static alpha.nomagicrouter.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.nomagicrouter.HttpConstants.Method.HEAD;
import static alpha.nomagicrouter.HttpConstants.StatusCode.TWO_HUNDRED;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * A {@code ChannelWriter} writing to an exchange of the JDK's built-in
 * server.<p>
 * 
 * The status code and headers are buffered and sent together with the first
 * write. A known body length is sent as Content-Length; a piped body uses
 * chunked transfer encoding. No body is sent in response to a HEAD request.
 * Every write ends the exchange.<p>
 * 
 * The implementation is not thread-safe.
 */
final class ExchangeChannelWriter implements ChannelWriter
{
    private static final System.Logger LOG
            = System.getLogger(ExchangeChannelWriter.class.getPackageName());
    
    // Length argument of sendResponseHeaders()
    private static final long NO_BODY = -1, CHUNKED = 0;
    
    private final HttpExchange exchange;
    private final boolean head;
    private final Map<String, String> headers;
    private int statusCode;
    private boolean committed;
    
    ExchangeChannelWriter(HttpExchange exchange) {
        this.exchange   = requireNonNull(exchange);
        this.head       = HEAD.equals(exchange.getRequestMethod());
        this.headers    = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        this.statusCode = TWO_HUNDRED;
        this.committed  = false;
    }
    
    @Override
    public int statusCode() {
        return statusCode;
    }
    
    @Override
    public void statusCode(int statusCode) {
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException("Invalid status code: " + statusCode);
        }
        requireUncommitted();
        this.statusCode = statusCode;
    }
    
    @Override
    public Optional<String> getHeader(String name) {
        return Optional.ofNullable(headers.get(requireNonNull(name)));
    }
    
    @Override
    public void setHeader(String name, String value) {
        requireNonNull(name);
        requireNonNull(value);
        requireUncommitted();
        headers.put(name, value);
    }
    
    @Override
    public void end() throws IOException {
        commit(NO_BODY);
        exchange.close();
    }
    
    @Override
    public void end(byte[] body) throws IOException {
        requireNonNull(body);
        if (head || body.length == 0) {
            end();
            return;
        }
        commit(body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
    
    @Override
    public void pipe(InputStream body) throws IOException {
        requireNonNull(body);
        if (head) {
            body.close();
            end();
            return;
        }
        commit(CHUNKED);
        try (body; OutputStream out = exchange.getResponseBody()) {
            body.transferTo(out);
        }
    }
    
    @Override
    public boolean isCommitted() {
        return committed;
    }
    
    private void commit(long length) throws IOException {
        requireUncommitted();
        committed = true;
        final var out = exchange.getResponseHeaders();
        headers.forEach((k, v) -> {
            // Set by the server, unless there is no body
            if (length == NO_BODY || !k.equalsIgnoreCase(CONTENT_LENGTH)) {
                out.set(k, v);
            }
        });
        LOG.log(DEBUG, () -> "Sending " + statusCode + " " + headers);
        exchange.sendResponseHeaders(statusCode, length);
    }
    
    private void requireUncommitted() {
        if (committed) {
            LOG.log(WARNING, () -> "Response already sent for " +
                    exchange.getRequestMethod() + " " + exchange.getRequestURI());
            throw new IllegalStateException("Response already sent.");
        }
    }
}
