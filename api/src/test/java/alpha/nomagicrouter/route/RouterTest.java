package alpha.nomagicrouter.route;

import alpha.nomagicrouter.handler.ChannelWriter;
import alpha.nomagicrouter.handler.Handler;
import alpha.nomagicrouter.message.DecodeException;
import alpha.nomagicrouter.message.Request;
import alpha.nomagicrouter.message.Response;
import alpha.nomagicrouter.message.Responses;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static alpha.nomagicrouter.util.Getters.BASE_PATH;
import static alpha.nomagicrouter.util.Getters.URL_PARAMS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Small tests of {@link Router}.
 */
final class RouterTest
{
    private static final Handler PARAMS = (req, ch) -> URL_PARAMS.get(req).asMap();
    
    @Test
    void firstMatchWins() throws Exception {
        var app = Router.create()
                .get("/", (req, ch) -> "first")
                .get("/:any", (req, ch) -> "param")
                .get("/abc", (req, ch) -> "shadowed");
        assertThat(apply(app, "GET", "/")).isEqualTo("first");
        assertThat(apply(app, "GET", "/abc")).isEqualTo("param");
    }
    
    @Test
    void noMatch_notFound() throws Exception {
        var app = Router.create().get("/a", (req, ch) -> "a");
        var rsp = (Response) apply(app, "GET", "/b");
        assertThat(rsp.statusCode()).isEqualTo(404);
        assertThat(rsp.body()).isEqualTo("Not Found");
        assertThat(rsp).isSameAs(Responses.notFound());
    }
    
    @Test
    void methodMustMatch() throws Exception {
        var app = Router.create()
                .post("/x", (req, ch) -> "post")
                .on("PROPFIND", "/x", (req, ch) -> "propfind");
        assertThat(apply(app, "POST", "/x")).isEqualTo("post");
        assertThat(apply(app, "PROPFIND", "/x")).isEqualTo("propfind");
        assertThat(apply(app, "GET", "/x")).isSameAs(Responses.notFound());
    }
    
    @Test
    void allShortcuts() throws Exception {
        var app = Router.create()
                .get(    "/", (req, ch) -> "GET")
                .head(   "/", (req, ch) -> "HEAD")
                .post(   "/", (req, ch) -> "POST")
                .put(    "/", (req, ch) -> "PUT")
                .delete( "/", (req, ch) -> "DELETE")
                .options("/", (req, ch) -> "OPTIONS")
                .patch(  "/", (req, ch) -> "PATCH");
        for (String m : List.of("GET", "HEAD", "POST", "PUT", "DELETE", "OPTIONS", "PATCH")) {
            assertThat(apply(app, m, "/")).isEqualTo(m);
        }
    }
    
    @Test
    void urlParams() throws Exception {
        var app = Router.create().get("/user/:id", PARAMS);
        assertThat(apply(app, "GET", "/user/123")).isEqualTo(Map.of("id", "123"));
    }
    
    @Test
    void urlParams_defaultEmpty() throws Exception {
        var req = request("GET", "/");
        assertThat(URL_PARAMS.get(req).isEmpty()).isTrue();
        assertThat(BASE_PATH.get(req)).isEmpty();
    }
    
    @Test
    void trailingSlashInDeclaredPath() throws Exception {
        var app = Router.create().get("/users/", (req, ch) -> "users");
        assertThat(apply(app, "GET", "/users")).isEqualTo("users");
        assertThat(apply(app, "GET", "/users/")).isEqualTo("users");
    }
    
    @Test
    void decodeFailure_propagates() {
        var app = Router.create().get("/:name", PARAMS);
        assertThatThrownBy(() -> apply(app, "GET", "/%FF"))
                .isExactlyInstanceOf(DecodeException.class);
    }
    
    @Test
    void nested_threeLevels() throws Exception {
        var users = Router.create();
        var v1 = Router.create().use("/users", users);
        var app = Router.create().use("/api/v1", v1);
        // Added after mounting
        users.get("/:id", (req, ch) ->
                URL_PARAMS.get(req).get("id") + "@" + BASE_PATH.get(req));
        assertThat(users.basePath()).isEqualTo("/api/v1/users");
        assertThat(apply(app, "GET", "/api/v1/users/42")).isEqualTo("42@/api/v1/users");
        assertThat(apply(app, "GET", "/users/42")).isSameAs(Responses.notFound());
    }
    
    @Test
    void nested_routesAddedBeforeMounting() throws Exception {
        var sub = Router.create().get("/x", (req, ch) -> BASE_PATH.get(req));
        var app = Router.create().use("/a", sub);
        assertThat(apply(app, "GET", "/a/x")).isEqualTo("/a");
        assertThat(apply(app, "GET", "/x")).isSameAs(Responses.notFound());
    }
    
    @Test
    void nested_parentMountedLater() throws Exception {
        var sub = Router.create().get("/x", (req, ch) -> "x");
        var mid = Router.create().use("/b", sub);
        var app = Router.create().use("/a", mid);
        assertThat(apply(app, "GET", "/a/b/x")).isEqualTo("x");
        assertThat(sub.basePath()).isEqualTo("/a/b");
    }
    
    @Test
    void nested_withoutPath() throws Exception {
        var sub = Router.create().get("/x", (req, ch) -> "x");
        var app = Router.create().use(sub);
        assertThat(apply(app, "GET", "/x")).isEqualTo("x");
    }
    
    @Test
    void nested_paramsInMountPath() throws Exception {
        var posts = Router.create().get("/posts/:post", PARAMS);
        var app = Router.create().use("/users/:user", posts);
        assertThat(apply(app, "GET", "/users/7/posts/9"))
                .isEqualTo(Map.of("user", "7", "post", "9"));
    }
    
    @Test
    void nested_mountedRouterClaimsPrefix() throws Exception {
        var sub = Router.create().get("/x", (req, ch) -> "x");
        var app = Router.create()
                .use("/a", sub)
                .get("/a/y", (req, ch) -> "never");
        assertThat(apply(app, "GET", "/a/y")).isSameAs(Responses.notFound());
    }
    
    @Test
    void nested_prefixRespectsSegments() throws Exception {
        var sub = Router.create().get("/x", (req, ch) -> "x");
        var app = Router.create()
                .use("/sub", sub)
                .get("/subway/x", (req, ch) -> "subway");
        assertThat(apply(app, "GET", "/subway/x")).isEqualTo("subway");
    }
    
    @Test
    void nested_mountWithMethod() throws Exception {
        var api = Router.create()
                .post("/x", (req, ch) -> "post")
                .get("/x", (req, ch) -> "get");
        var app = Router.create().on("POST", "/api", api);
        assertThat(apply(app, "POST", "/api/x")).isEqualTo("post");
        // Filtered by the parent
        assertThat(apply(app, "GET", "/api/x")).isSameAs(Responses.notFound());
    }
    
    @Test
    void setBasePath_replacesPrevious() throws Exception {
        var sub = Router.create().get("/x", (req, ch) -> "x");
        sub.setBasePath("/one");
        sub.setBasePath("/two");
        assertThat(apply(sub, "GET", "/two/x")).isEqualTo("x");
        assertThat(apply(sub, "GET", "/one/x")).isSameAs(Responses.notFound());
        assertThat(apply(sub, "GET", "/two/two/x")).isSameAs(Responses.notFound());
    }
    
    @Test
    void setBasePath_propagates() throws Exception {
        var leaf = Router.create().get("/x", (req, ch) -> BASE_PATH.get(req));
        var app = Router.create().use("/a", leaf);
        app.setBasePath("/root");
        assertThat(leaf.basePath()).isEqualTo("/root/a");
        assertThat(apply(app, "GET", "/root/a/x")).isEqualTo("/root/a");
    }
    
    @Test
    void use_terminalHandlerIsAnchored() throws Exception {
        var app = Router.create().use("/static", (req, ch) -> "static");
        assertThat(apply(app, "GET", "/static")).isEqualTo("static");
        assertThat(apply(app, "DELETE", "/static/")).isEqualTo("static");
        assertThat(apply(app, "GET", "/static/file")).isSameAs(Responses.notFound());
    }
    
    @Test
    void routes_snapshot() {
        var sub = Router.create();
        Handler h = (req, ch) -> null;
        var app = Router.create()
                .get("/a", h)
                .use("/b", sub)
                .use("/c", h);
        var routes = app.routes();
        assertThat(routes).hasSize(3);
        
        assertThat(routes.get(0).method()).contains("GET");
        assertThat(routes.get(0).path()).isEqualTo("/a");
        assertThat(routes.get(0).isMount()).isFalse();
        assertThat(routes.get(0).handler()).isSameAs(h);
        
        assertThat(routes.get(1).method()).isEmpty();
        assertThat(routes.get(1).isMount()).isTrue();
        assertThat(routes.get(1).matcher().options()).isEqualTo(PathMatcher.Options.MOUNT);
        
        assertThat(routes.get(2).method()).isEmpty();
        assertThat(routes.get(2).isMount()).isFalse();
        assertThat(routes.get(2).matcher().options()).isEqualTo(PathMatcher.Options.ROUTE);
        
        assertThatThrownBy(() -> routes.add(routes.get(0)))
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
    
    @Test
    void invalidPattern_failsOnRegistration() {
        var app = Router.create();
        assertThatThrownBy(() -> app.get("/:id([a-)", (req, ch) -> null))
                .isInstanceOf(RoutePatternInvalidException.class);
    }
    
    private static Object apply(Handler h, String method, String path) throws Exception {
        return h.apply(request(method, path), mock(ChannelWriter.class));
    }
    
    private static Request request(String method, String path) {
        Request req = mock(Request.class);
        when(req.method()).thenReturn(method);
        when(req.path()).thenReturn(path);
        when(req.target()).thenReturn(path);
        when(req.rawQuery()).thenReturn("");
        when(req.getterValues()).thenReturn(new ConcurrentHashMap<>());
        return req;
    }
}
