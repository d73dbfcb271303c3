package alpha.nomagicrouter.core;

import alpha.nomagicrouter.handler.ChannelWriter;
import alpha.nomagicrouter.handler.DiagnosticSink;
import alpha.nomagicrouter.handler.Handler;
import alpha.nomagicrouter.handler.HasStatusCode;
import alpha.nomagicrouter.message.JsonCodec;
import alpha.nomagicrouter.message.Request;
import alpha.nomagicrouter.message.Response;
import alpha.nomagicrouter.message.Responses;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

import static alpha.nomagicrouter.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.nomagicrouter.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicrouter.HttpConstants.Method.HEAD;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Invokes a handler and writes its outcome to a channel.<p>
 * 
 * The handler may return a {@link CompletionStage}, in which case the
 * dispatcher awaits its completion asynchronously and uses the result of the
 * stage. The handler may return {@link Handler#HANDLED} if it wrote the
 * response itself, and the dispatcher then does nothing more. Any other value
 * that is not a {@link Response} is the body of a 200 (OK) response.<p>
 * 
 * The status code and headers of the response are written first. Then the
 * body is classified, in this order:
 * 
 * <ul>
 *   <li>{@code null}; ends the response without a body.</li>
 *   <li>{@code byte[]} or {@code ByteBuffer}; written as-is with a
 *       Content-Type "application/octet-stream" (unless already set) and a
 *       Content-Length.</li>
 *   <li>{@code InputStream} or {@code ReadableByteChannel}; piped to the
 *       client with a Content-Type "application/octet-stream" (unless already
 *       set) and without a known length.</li>
 *   <li>{@code CharSequence}, {@code Character} or {@code Boolean}; written
 *       as UTF-8 text with a Content-Length.</li>
 *   <li>Anything else, such as a number, a map, a list or a record; written
 *       as JSON with a Content-Type "application/json; charset=utf-8" (unless
 *       already set) and a Content-Length.</li>
 * </ul>
 * 
 * The body is never written in response to a HEAD request.<p>
 * 
 * An exception that implements {@link HasStatusCode} is turned into a
 * response with the exception's status code, and the exception's message as
 * body. Any other exception, including an exception thrown while serializing
 * the body, is reported to the {@link DiagnosticSink} and turned into a 500
 * (Internal Server Error) response with the body "Internal Server Error".
 * If the response has already begun when the exception occurs, the exception
 * is only reported to the sink.<p>
 * 
 * The dispatcher is thread-safe. It holds no state per request.
 */
public final class Dispatcher
{
    private static final System.Logger LOG
            = System.getLogger(Dispatcher.class.getPackageName());
    
    private final Handler handler;
    private final DiagnosticSink sink;
    private final JsonCodec json;
    
    /**
     * Constructs this object.<p>
     * 
     * Unclassified errors are not reported anywhere, and JSON is written
     * using {@link JsonCodec#provider()}.
     * 
     * @param handler to invoke
     */
    public Dispatcher(Handler handler) {
        this(handler, DiagnosticSink.NOOP, JsonCodec.provider());
    }
    
    /**
     * Constructs this object.
     * 
     * @param handler to invoke
     * @param sink of unclassified errors
     * @param json codec of JSON bodies
     */
    public Dispatcher(Handler handler, DiagnosticSink sink, JsonCodec json) {
        this.handler = requireNonNull(handler);
        this.sink    = requireNonNull(sink);
        this.json    = requireNonNull(json);
    }
    
    /**
     * Handles the given request.<p>
     * 
     * The returned stage completes normally when the response has been
     * written, or when writing the response failed and the failure has been
     * reported.
     * 
     * @param request to handle
     * @param channel to write the response to
     * @return a stage that completes when done
     */
    public CompletionStage<Void> dispatch(Request request, ChannelWriter channel) {
        requireNonNull(request);
        requireNonNull(channel);
        final Object result;
        try {
            result = handler.apply(request, channel);
        } catch (Throwable t) {
            return fail(t, request, channel);
        }
        return settle(result, request, channel);
    }
    
    private CompletionStage<Void> settle(Object result, Request req, ChannelWriter ch) {
        if (result instanceof CompletionStage<?> stage) {
            return stage
                    .<CompletionStage<Void>>handle((v, t) ->
                            t == null ? settle(v, req, ch) : fail(unwrap(t), req, ch))
                    .thenCompose(Function.identity());
        }
        if (result == Handler.HANDLED) {
            LOG.log(DEBUG, "Handler wrote its own response.");
            return done();
        }
        if (ch.isCommitted()) {
            LOG.log(WARNING, () ->
                    "Handler wrote a response but also returned a value, ignoring: " + result);
            return done();
        }
        final Response rsp = result instanceof Response ?
                (Response) result : Responses.reply(result);
        try {
            write(rsp, req, ch);
        } catch (Throwable t) {
            return fail(t, req, ch);
        }
        return done();
    }
    
    private CompletionStage<Void> fail(Throwable error, Request req, ChannelWriter ch) {
        if (ch.isCommitted()) {
            sink.report(error, req);
            return done();
        }
        final Response rsp;
        if (error instanceof HasStatusCode hsc && isValid(hsc.statusCode())) {
            LOG.log(DEBUG, () -> "Responding " + hsc.statusCode() + " for " + error);
            final String msg = hsc.getMessage();
            rsp = Responses.reply(msg == null ? "" : msg, hsc.statusCode());
        } else {
            sink.report(error, req);
            rsp = Responses.internalServerError();
        }
        try {
            write(rsp, req, ch);
        } catch (IOException | RuntimeException e) {
            e.addSuppressed(error);
            sink.report(e, req);
        }
        return done();
    }
    
    private void write(Response rsp, Request req, ChannelWriter ch) throws IOException {
        ch.statusCode(rsp.statusCode());
        rsp.headers().forEach(ch::setHeader);
        final boolean head = HEAD.equals(req.method());
        final Object body = rsp.body();
        
        if (body == null) {
            ch.end();
            return;
        }
        
        if (body instanceof byte[] || body instanceof ByteBuffer) {
            setIfAbsent(ch, CONTENT_TYPE, "application/octet-stream");
            writeBytes(toBytes(body), head, ch);
            return;
        }
        
        if (body instanceof InputStream || body instanceof ReadableByteChannel) {
            setIfAbsent(ch, CONTENT_TYPE, "application/octet-stream");
            final InputStream in = body instanceof InputStream is ?
                    is : Channels.newInputStream((ReadableByteChannel) body);
            if (head) {
                in.close();
                ch.end();
            } else {
                ch.pipe(in);
            }
            return;
        }
        
        final String text;
        if (body instanceof CharSequence || body instanceof Character || body instanceof Boolean) {
            text = body.toString();
        } else {
            text = json.write(body);
            setIfAbsent(ch, CONTENT_TYPE, "application/json; charset=utf-8");
        }
        writeBytes(text.getBytes(UTF_8), head, ch);
    }
    
    private static void writeBytes(byte[] bytes, boolean head, ChannelWriter ch) throws IOException {
        ch.setHeader(CONTENT_LENGTH, Integer.toString(bytes.length));
        if (head) {
            ch.end();
        } else {
            ch.end(bytes);
        }
    }
    
    private static byte[] toBytes(Object body) {
        if (body instanceof byte[]) {
            return (byte[]) body;
        }
        final ByteBuffer buf = ((ByteBuffer) body).duplicate();
        final byte[] bytes = new byte[buf.remaining()];
        buf.get(bytes);
        return bytes;
    }
    
    private static void setIfAbsent(ChannelWriter ch, String name, String value) {
        if (!ch.hasHeader(name)) {
            ch.setHeader(name, value);
        }
    }
    
    private static boolean isValid(int statusCode) {
        return statusCode >= 100 && statusCode <= 599;
    }
    
    private static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof CompletionException || e instanceof ExecutionException) &&
                e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
    
    private static CompletionStage<Void> done() {
        return CompletableFuture.completedFuture(null);
    }
}
