package alpha.onionhttp;

import alpha.onionhttp.context.BadRequestException;
import alpha.onionhttp.context.ContextPool;
import alpha.onionhttp.context.RawRequest;
import alpha.onionhttp.context.RawResponse;
import alpha.onionhttp.context.RequestContext;
import alpha.onionhttp.handler.ErrorHandler;
import alpha.onionhttp.handler.Handler;
import alpha.onionhttp.handler.HandlerChain;
import alpha.onionhttp.route.Params;
import alpha.onionhttp.route.Route;
import alpha.onionhttp.route.RouteTree;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static alpha.onionhttp.HttpConstants.HeaderName.ALLOW;
import static alpha.onionhttp.HttpConstants.Method.GET;
import static alpha.onionhttp.HttpConstants.StatusCode.FOUR_HUNDRED_FIVE;
import static alpha.onionhttp.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.onionhttp.HttpConstants.StatusCode.THREE_HUNDRED_ONE;
import static alpha.onionhttp.HttpConstants.StatusCode.THREE_HUNDRED_SEVEN;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * Dispatches requests to registered routes.<p>
 * 
 * The engine is the root {@link Router}; its middleware is global. Routes are
 * kept in one {@link RouteTree} per HTTP method.<p>
 * 
 * A transport calls {@link #serveOne(RawRequest, RawResponse)} once per
 * request, from any number of threads. The first call freezes registration;
 * from then on, the route trees are only read.
 * 
 * <pre>{@code
 *   Engine engine = Engine.create();
 *   engine.use(Middlewares.requestLogger());
 *   engine.get("/hello/:name", ctx -> ctx.string(200, "Hello " + ctx.param("name")));
 *   
 *   try (JdkHttpServerTransport t = JdkHttpServerTransport.start(engine, address)) {
 *       ...
 *   }
 * }</pre>
 * 
 * <h2>Requests that match no route</h2>
 * 
 * If no route of the request's method matches, and {@link
 * Config#redirectTrailingSlash()} is enabled and the path with its trailing
 * slash toggled would match, the engine redirects. Else, if {@link
 * Config#handleMethodNotAllowed()} is enabled and a route of another method
 * matches, the {@link #noMethod(Handler...) noMethod} chain runs with status
 * 405 and an {@code Allow} header. Otherwise the {@link #noRoute(Handler...)
 * noRoute} chain runs with status 404. Both chains are preceded by the global
 * middleware. If they write nothing, a default body is written.
 * 
 * <h2>Errors</h2>
 * 
 * Any {@code Throwable} escaping the chain is caught once, logged, recorded on
 * the context and given to the {@link ErrorHandler}s, provided the response
 * has not yet been committed. The context is always returned to the pool.
 */
public final class Engine implements Router
{
    private static final System.Logger LOG
            = System.getLogger(Engine.class.getPackageName());
    
    private static final String
            BODY_404 = "404 page not found",
            BODY_405 = "405 method not allowed";
    
    /**
     * Creates an engine using {@link Config#DEFAULT}.
     * 
     * @return a new engine
     */
    public static Engine create() {
        return create(Config.DEFAULT);
    }
    
    /**
     * Creates an engine.
     * 
     * @param config of engine
     * @param errorHandlers called in order, before the base handler
     * 
     * @return a new engine
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Engine create(Config config, ErrorHandler... errorHandlers) {
        return new Engine(config, errorHandlers);
    }
    
    private final Config config;
    private final ContextPool pool;
    private final RouterGroup root;
    private final Map<String, RouteTree> trees = new LinkedHashMap<>();
    private final List<ErrorHandler> errorHandlers;
    private HandlerChain noRoute = HandlerChain.EMPTY,
                         noMethod = HandlerChain.EMPTY;
    // Global middleware ++ noRoute/noMethod, set on start
    private HandlerChain allNoRoute, allNoMethod;
    private volatile boolean started;
    
    private Engine(Config config, ErrorHandler... errorHandlers) {
        this.config = requireNonNull(config);
        this.pool = new ContextPool(config);
        this.root = new RouterGroup(this, "/", HandlerChain.EMPTY);
        this.errorHandlers = new CopyOnWriteArrayList<>(List.of(errorHandlers));
    }
    
    // Registration
    // ----
    
    @Override
    public Engine use(Handler... middleware) {
        synchronized (this) {
            root.use(middleware);
        }
        return this;
    }
    
    @Override
    public RouterGroup group(String relativePath, Handler... middleware) {
        return root.group(relativePath, middleware);
    }
    
    @Override
    public Engine handle(String method, String relativePath, Handler... handlers) {
        root.handle(method, relativePath, handlers);
        return this;
    }
    
    @Override
    public String basePath() {
        return root.basePath();
    }
    
    /**
     * Sets the handlers of requests that match no route.<p>
     * 
     * The global middleware, as it is when the engine starts, precedes these
     * handlers.
     * 
     * @param handlers to set
     * 
     * @return this engine
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalStateException if the engine has started
     */
    public synchronized Engine noRoute(Handler... handlers) {
        requireNotStarted();
        noRoute = HandlerChain.of(handlers);
        return this;
    }
    
    /**
     * Sets the handlers of requests rejected with 405 (Method Not Allowed).<p>
     * 
     * Only used if {@link Config#handleMethodNotAllowed()} is enabled. The
     * global middleware, as it is when the engine starts, precedes these
     * handlers.
     * 
     * @param handlers to set
     * 
     * @return this engine
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalStateException if the engine has started
     */
    public synchronized Engine noMethod(Handler... handlers) {
        requireNotStarted();
        noMethod = HandlerChain.of(handlers);
        return this;
    }
    
    /**
     * Adds an error handler, called after those already added.
     * 
     * @param handler to add
     * 
     * @return this engine
     * 
     * @throws NullPointerException if {@code handler} is {@code null}
     * @throws IllegalStateException if the engine has started
     */
    public synchronized Engine errorHandler(ErrorHandler handler) {
        requireNotStarted();
        errorHandlers.add(requireNonNull(handler));
        return this;
    }
    
    /**
     * Returns all registered routes, grouped by method in the order the
     * methods were first registered, then in registration order.
     * 
     * @return all registered routes (unmodifiable)
     */
    public synchronized List<Route> routes() {
        List<Route> all = new ArrayList<>();
        trees.values().forEach(t -> all.addAll(t.routes()));
        return unmodifiableList(all);
    }
    
    /**
     * Returns the configuration.
     * 
     * @return the configuration
     */
    public Config config() {
        return config;
    }
    
    /**
     * Returns {@code true} if the engine has served a request.
     * 
     * @return see JavaDoc
     */
    public boolean isStarted() {
        return started;
    }
    
    synchronized void addRoute(String method, String pattern, HandlerChain chain) {
        requireNotStarted();
        trees.computeIfAbsent(method, RouteTree::new).add(pattern, chain);
    }
    
    void requireNotStarted() {
        if (started) {
            throw new IllegalStateException("Engine has started; registration is closed.");
        }
    }
    
    private void startIfNeeded() {
        if (started) {
            return;
        }
        synchronized (this) {
            if (started) {
                return;
            }
            HandlerChain global = root.middleware();
            allNoRoute = global.append(noRoute);
            allNoMethod = global.append(noMethod);
            started = true;
        }
        LOG.log(INFO, () -> "Engine started with " + routes().size() + " route(s).");
    }
    
    // Dispatch
    // ----
    
    /**
     * Serves one request.<p>
     * 
     * Exceptions of the handler chain are handled by this method. Only an I/O
     * error from committing the response to the transport propagates.
     * 
     * @param request  to serve
     * @param response channel of transport
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IOException if writing the response fails
     */
    public void serveOne(RawRequest request, RawResponse response) throws IOException {
        requireNonNull(request);
        requireNonNull(response);
        startIfNeeded();
        RequestContext ctx = pool.acquire();
        try {
            ctx.init(request, response);
            try {
                dispatch(ctx);
            } catch (Throwable t) {
                recover(ctx, t);
            }
            ctx.writer().finish();
        } finally {
            pool.release(ctx);
        }
    }
    
    private void dispatch(RequestContext ctx) throws Exception {
        final String method = ctx.method(),
                     path   = ctx.path();
        
        RouteTree t = trees.get(method);
        if (t != null) {
            Route r = t.lookup(path, ctx.params());
            if (r != null) {
                ctx.handlers(r.chain(), r.pattern());
                ctx.next();
                return;
            }
            if (config.redirectTrailingSlash() && redirectTrailingSlash(ctx, t)) {
                return;
            }
        }
        
        if (config.handleMethodNotAllowed()) {
            List<String> allowed = allowedMethods(method, path);
            if (!allowed.isEmpty()) {
                ctx.setHeader(ALLOW, String.join(", ", allowed));
                fallback(ctx, allNoMethod, FOUR_HUNDRED_FIVE, BODY_405);
                return;
            }
        }
        
        fallback(ctx, allNoRoute, FOUR_HUNDRED_FOUR, BODY_404);
    }
    
    private boolean redirectTrailingSlash(RequestContext ctx, RouteTree t) {
        final String path = ctx.path();
        if (path.equals("/")) {
            return false;
        }
        final String alt = path.endsWith("/") ?
                path.substring(0, path.length() - 1) : path + "/";
        if (t.lookup(alt, new Params(t.maxParams())) == null) {
            return false;
        }
        final String q = ctx.request().query(),
                     location = q == null ? alt : alt + "?" + q;
        final int code = GET.equals(ctx.method()) ? THREE_HUNDRED_ONE : THREE_HUNDRED_SEVEN;
        LOG.log(DEBUG, () -> "Redirecting " + path + " to " + location + " (" + code + ")");
        ctx.redirect(code, location);
        return true;
    }
    
    private List<String> allowedMethods(String method, String path) {
        List<String> allowed = new ArrayList<>();
        for (RouteTree other : trees.values()) {
            if (!other.method().equals(method) &&
                    other.lookup(path, new Params(other.maxParams())) != null) {
                allowed.add(other.method());
            }
        }
        return allowed;
    }
    
    private static void fallback(
            RequestContext ctx, HandlerChain chain, int code, String defaultBody)
            throws Exception
    {
        ctx.status(code);
        ctx.handlers(chain, null);
        ctx.next();
        if (!ctx.writer().isWritten() && ctx.writer().status() == code) {
            ctx.string(code, defaultBody);
        }
    }
    
    // Recovery
    // ----
    
    private void recover(RequestContext ctx, Throwable t) {
        final String method = ctx.method(),
                     path   = ctx.path();
        if (t instanceof BadRequestException) {
            LOG.log(DEBUG, () -> "Bad request: " + method + " " + path, t);
        } else {
            LOG.log(ERROR, () -> "Handler chain failed: " + method + " " + path, t);
        }
        ctx.addError(t);
        ctx.abort();
        
        if (ctx.writer().isCommitted()) {
            LOG.log(DEBUG, "Response already committed, error handlers not called.");
            return;
        }
        
        try {
            handleError(t, ctx, 0);
        } catch (Throwable next) {
            if (next != t) {
                t.addSuppressed(next);
            }
            LOG.log(ERROR, "Error handler failed, falling back to base handler.", next);
            if (!ctx.writer().isCommitted()) {
                try {
                    ErrorHandler.BASE.apply(t, () -> {}, ctx);
                } catch (Exception base) {
                    LOG.log(ERROR, "Base error handler failed.", base);
                }
            }
        }
    }
    
    private void handleError(Throwable t, RequestContext ctx, int index) throws Exception {
        if (index == errorHandlers.size()) {
            ErrorHandler.BASE.apply(t, () -> {}, ctx);
            return;
        }
        errorHandlers.get(index).apply(t, () -> handleError(t, ctx, index + 1), ctx);
    }
    
    @Override
    public String toString() {
        return Engine.class.getSimpleName() + "{started=" + started + ", config=" + config + "}";
    }
}
