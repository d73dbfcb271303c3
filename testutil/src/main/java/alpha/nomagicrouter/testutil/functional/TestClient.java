package alpha.nomagicrouter.testutil.functional;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static java.net.http.HttpRequest.BodyPublishers.noBody;
import static java.net.http.HttpRequest.BodyPublishers.ofByteArray;
import static java.net.http.HttpRequest.BodyPublishers.ofString;

/**
 * A client of a server listening on the loopback address.<p>
 * 
 * Built on the JDK's {@link HttpClient}.
 */
public final class TestClient
{
    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    
    private final int port;
    private final HttpClient client;
    
    TestClient(int port) {
        this.port = port;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(TIMEOUT)
                .build();
    }
    
    /**
     * Sends a GET request.
     * 
     * @param target request-target, e.g. "/path?query"
     * @return the response
     * @throws IOException on I/O error
     * @throws InterruptedException if interrupted
     */
    public HttpResponse<String> get(String target) throws IOException, InterruptedException {
        return send("GET", target, null);
    }
    
    /**
     * Sends a POST request with a JSON body.
     * 
     * @param target request-target
     * @param json body
     * @return the response
     * @throws IOException on I/O error
     * @throws InterruptedException if interrupted
     */
    public HttpResponse<String> postJson(String target, String json)
            throws IOException, InterruptedException {
        return send("POST", target, json, "Content-Type", "application/json");
    }
    
    /**
     * Sends a request with a text body.
     * 
     * @param method of request
     * @param target request-target
     * @param body of request (may be {@code null})
     * @param headers name and value pairs
     * @return the response
     * @throws IOException on I/O error
     * @throws InterruptedException if interrupted
     */
    public HttpResponse<String> send(String method, String target, String body, String... headers)
            throws IOException, InterruptedException {
        var req = request(target, headers)
                .method(method, body == null ? noBody() : ofString(body))
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }
    
    /**
     * Sends a request with a binary body, and receives a binary body.
     * 
     * @param method of request
     * @param target request-target
     * @param body of request
     * @param headers name and value pairs
     * @return the response
     * @throws IOException on I/O error
     * @throws InterruptedException if interrupted
     */
    public HttpResponse<byte[]> sendBytes(String method, String target, byte[] body, String... headers)
            throws IOException, InterruptedException {
        var req = request(target, headers)
                .method(method, ofByteArray(body))
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }
    
    private HttpRequest.Builder request(String target, String... headers) {
        var b = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + target))
                .timeout(TIMEOUT);
        if (headers.length > 0) {
            b.headers(headers);
        }
        return b;
    }
}
