package alpha.nomagicrouter.core.mediumtest;

import alpha.nomagicrouter.handler.Handler;
import alpha.nomagicrouter.handler.HasStatusCode;
import alpha.nomagicrouter.testutil.functional.AbstractRealTest;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static alpha.nomagicrouter.message.Responses.createError;
import static alpha.nomagicrouter.message.Responses.reply;
import static java.lang.System.Logger.Level.WARNING;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests of how the value returned from, or the exception thrown by, a handler
 * is turned into a response.
 */
class HandlerResultTest extends AbstractRealTest
{
    @Test
    void sendsStrings() throws IOException, InterruptedException {
        serve((req, ch) -> "woot");
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body()).isEqualTo("woot");
        assertThat(rsp.headers().firstValue("Content-Length")).contains("4");
    }
    
    @Test
    void sendsJson() throws IOException, InterruptedException {
        serve((req, ch) -> Map.of("a", "b"));
        var rsp = client().get("/");
        assertThat(rsp.body()).isEqualTo("{\"a\":\"b\"}");
        assertThat(rsp.headers().firstValue("Content-Type"))
                .contains("application/json; charset=utf-8");
    }
    
    @Test
    void sendsNumbers() throws IOException, InterruptedException {
        serve((req, ch) -> 1234);
        var rsp = client().get("/");
        assertThat(rsp.body()).isEqualTo("1234");
        assertThat(rsp.headers().firstValue("Content-Type"))
                .contains("application/json; charset=utf-8");
    }
    
    @Test
    void sendsBytes() throws IOException, InterruptedException {
        serve((req, ch) -> "buffer".getBytes(UTF_8));
        var rsp = client().get("/");
        assertThat(rsp.body()).isEqualTo("buffer");
        assertThat(rsp.headers().firstValue("Content-Type"))
                .contains("application/octet-stream");
    }
    
    @Test
    void sendsStream() throws IOException, InterruptedException {
        var big = new byte[100_000];
        Arrays.fill(big, (byte) 'x');
        serve((req, ch) -> new ByteArrayInputStream(big));
        var rsp = client().sendBytes("GET", "/", new byte[0]);
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body()).isEqualTo(big);
        assertThat(rsp.headers().firstValue("Transfer-Encoding")).contains("chunked");
    }
    
    @Test
    void supportsAsyncHandlers() throws IOException, InterruptedException {
        serve((req, ch) -> CompletableFuture.supplyAsync(() -> "await"));
        assertThat(client().get("/").body()).isEqualTo("await");
    }
    
    @Test
    void emptyString() throws IOException, InterruptedException {
        serve((req, ch) -> "");
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body()).isEmpty();
        assertThat(rsp.headers().firstValue("Content-Length")).contains("0");
    }
    
    @Test
    void nullEndsResponse() throws IOException, InterruptedException {
        serve((req, ch) -> null);
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body()).isEmpty();
    }
    
    @Test
    void customStatusAndHeaders() throws IOException, InterruptedException {
        var headers = new LinkedHashMap<String, String>();
        headers.put("Content-Type", "text/html; charset=utf-8");
        headers.put("X-Powered-By", "nothing");
        serve((req, ch) -> reply("<h1>Created</h1>", 201, headers));
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(201);
        assertThat(rsp.body()).isEqualTo("<h1>Created</h1>");
        assertThat(rsp.headers().firstValue("Content-Type")).contains("text/html; charset=utf-8");
        assertThat(rsp.headers().firstValue("X-Powered-By")).contains("nothing");
    }
    
    @Test
    void noContent() throws IOException, InterruptedException {
        serve((req, ch) -> reply(null, 204));
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(204);
        assertThat(rsp.body()).isEmpty();
    }
    
    @Test
    void unclassifiedError_internalServerError() throws IOException, InterruptedException {
        serve((req, ch) -> { throw new IllegalStateException("Test Error"); });
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(500);
        // Message is not leaked
        assertThat(rsp.body()).isEqualTo("Internal Server Error");
        assertThat(pollReportedError())
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Test Error");
    }
    
    @Test
    void unclassifiedError_async() throws IOException, InterruptedException {
        serve((req, ch) -> CompletableFuture.supplyAsync(() -> {
            throw new IllegalStateException("Test Error");
        }));
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(500);
        assertThat(rsp.body()).isEqualTo("Internal Server Error");
        assertThat(pollReportedError())
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Test Error");
    }
    
    @Test
    void statusCodeError() throws IOException, InterruptedException {
        serve((req, ch) -> { throw createError(400, "400 Error"); });
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(400);
        assertThat(rsp.body()).isEqualTo("400 Error");
    }
    
    @Test
    void statusCodeError_async() throws IOException, InterruptedException {
        serve((req, ch) -> CompletableFuture.failedFuture(createError(503, "Try later")));
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(503);
        assertThat(rsp.body()).isEqualTo("Try later");
    }
    
    @Test
    void statusCodeError_customType() throws IOException, InterruptedException {
        class Conflict extends Exception implements HasStatusCode {
            Conflict() { super("Already exists"); }
            @Override public int statusCode() { return 409; }
        }
        serve((req, ch) -> { throw new Conflict(); });
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(409);
        assertThat(rsp.body()).isEqualTo("Already exists");
    }
    
    @Test
    void head_noBody() throws IOException, InterruptedException {
        serve((req, ch) -> "Hello");
        var rsp = client().send("HEAD", "/", null);
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body()).isEmpty();
        assertThat(rsp.headers().firstValue("Content-Length")).contains("5");
    }
    
    @Test
    void handlerWritesItself() throws IOException, InterruptedException {
        serve((req, ch) -> {
            ch.statusCode(202);
            ch.setHeader("X-Custom", "yes");
            ch.end("by hand".getBytes(UTF_8));
            return Handler.HANDLED;
        });
        var rsp = client().get("/");
        assertThat(rsp.statusCode()).isEqualTo(202);
        assertThat(rsp.headers().firstValue("X-Custom")).contains("yes");
        assertThat(rsp.body()).isEqualTo("by hand");
    }
    
    @Test
    void handlerWritesItself_returnValueIgnored() throws IOException, InterruptedException {
        serve((req, ch) -> {
            ch.end("by hand".getBytes(UTF_8));
            return "ignored";
        });
        assertThat(client().get("/").body()).isEqualTo("by hand");
        logRecorder()
                .assertAwait(WARNING, "Handler wrote a response but also returned a value")
                .assertRemove(WARNING, "Handler wrote a response but also returned a value");
    }
}
