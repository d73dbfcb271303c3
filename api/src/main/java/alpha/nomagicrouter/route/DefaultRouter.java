package alpha.nomagicrouter.route;

import alpha.nomagicrouter.handler.ChannelWriter;
import alpha.nomagicrouter.handler.Handler;
import alpha.nomagicrouter.message.Parameters;
import alpha.nomagicrouter.message.Request;
import alpha.nomagicrouter.message.Responses;
import alpha.nomagicrouter.util.Getters;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static alpha.nomagicrouter.util.Strings.trimTrailing;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Router}.
 */
final class DefaultRouter implements Router
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouter.class.getPackageName());
    
    private final List<Entry> routes = new ArrayList<>();
    private String basePath = "";
    
    DefaultRouter() {
        // Empty
    }
    
    @Override
    public Router on(String method, String path, Handler handler) {
        requireNonNull(method);
        requireNonNull(path);
        requireNonNull(handler);
        if (handler instanceof Mountable m) {
            return mount(method, path, handler, m);
        }
        LOG.log(DEBUG, () ->
                "Adding " + method + " \"" + path + "\" to router \"" + basePath + "\"");
        routes.add(new Entry(method, path, handler, false, terminal(basePath + path)));
        return this;
    }
    
    @Override
    public Router use(String path, Handler handler) {
        requireNonNull(path);
        requireNonNull(handler);
        if (handler instanceof Mountable m) {
            return mount(null, path, handler, m);
        }
        LOG.log(DEBUG, () ->
                "Adding * \"" + path + "\" to router \"" + basePath + "\"");
        routes.add(new Entry(null, path, handler, false, terminal(basePath + path)));
        return this;
    }
    
    private Router mount(String method, String path, Handler handler, Mountable nested) {
        final String full = basePath + path;
        LOG.log(DEBUG, () -> "Mounting " + handler + " at \"" + full + "\"");
        nested.setBasePath(full);
        routes.add(new Entry(method, path, handler, true, prefix(full)));
        return this;
    }
    
    @Override
    public void setBasePath(String basePath) {
        this.basePath = requireNonNull(basePath);
        for (Entry e : routes) {
            final String full = basePath + e.path;
            if (e.mount && e.handler instanceof Mountable nested) {
                LOG.log(DEBUG, () -> "Setting base path of sub router to \"" + full + "\"");
                e.matcher = prefix(full);
                nested.setBasePath(full);
            } else {
                LOG.log(DEBUG, () -> "Setting base path of route to \"" + full + "\"");
                e.matcher = terminal(full);
            }
        }
    }
    
    @Override
    public String basePath() {
        return basePath;
    }
    
    @Override
    public List<Route> routes() {
        List<Route> snapshot = new ArrayList<>(routes.size());
        for (Entry e : routes) {
            snapshot.add(new Route(e.method, e.path, e.handler, e.mount, e.matcher));
        }
        return List.copyOf(snapshot);
    }
    
    @Override
    public Object apply(Request request, ChannelWriter channel) throws Exception {
        final String path = request.path();
        LOG.log(DEBUG, () -> "Request received: " + request.method() + " " + request.target());
        for (Entry e : routes) {
            if (e.method != null && !e.method.equals(request.method())) {
                continue;
            }
            final Optional<Parameters> params = e.matcher.match(path);
            if (params.isEmpty()) {
                continue;
            }
            LOG.log(DEBUG, () -> "Request " + request.method() + " " + path +
                    " matches " + (e.method == null ? "*" : e.method) +
                    " \"" + e.matcher.pattern() + "\", params: " + params.get());
            Getters.URL_PARAMS.set(request, params.get());
            Getters.BASE_PATH.set(request, basePath);
            return e.handler.apply(request, channel);
        }
        LOG.log(DEBUG, () -> "No route matched " + request.method() + " " + path);
        return Responses.notFound();
    }
    
    @Override
    public String toString() {
        return DefaultRouter.class.getSimpleName() +
               "{basePath=\"" + basePath + "\", routes=" + routes.size() + '}';
    }
    
    private static PathMatcher terminal(String pattern) {
        return PathMatcher.compile(trimTrailing(pattern, '/'), PathMatcher.Options.ROUTE);
    }
    
    private static PathMatcher prefix(String pattern) {
        return PathMatcher.compile(pattern, PathMatcher.Options.MOUNT);
    }
    
    private static final class Entry {
        final String method, path;
        final Handler handler;
        final boolean mount;
        PathMatcher matcher;
        
        Entry(String method, String path, Handler handler, boolean mount, PathMatcher matcher) {
            this.method  = method;
            this.path    = path;
            this.handler = handler;
            this.mount   = mount;
            this.matcher = matcher;
        }
    }
}
