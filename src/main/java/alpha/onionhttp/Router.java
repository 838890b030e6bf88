package alpha.onionhttp;

import alpha.onionhttp.handler.Handler;

import static alpha.onionhttp.HttpConstants.Method.DELETE;
import static alpha.onionhttp.HttpConstants.Method.GET;
import static alpha.onionhttp.HttpConstants.Method.HEAD;
import static alpha.onionhttp.HttpConstants.Method.OPTIONS;
import static alpha.onionhttp.HttpConstants.Method.PATCH;
import static alpha.onionhttp.HttpConstants.Method.POST;
import static alpha.onionhttp.HttpConstants.Method.PUT;

/**
 * Registers routes and middleware, relative to a base path.<p>
 * 
 * The chain of a registered route is the middleware of the router (including
 * that of enclosing groups and the engine's global middleware) as it is at
 * the time of registration, followed by the given handlers. The last handler
 * is the final handler of the route. Middleware added later does not apply to
 * routes already registered.
 * 
 * <pre>{@code
 *   Engine engine = Engine.create();
 *   engine.use(requestLogger());
 *   
 *   RouterGroup api = engine.group("/api", authenticate);
 *   api.get("/users/:id", ctx -> ctx.string(200, ctx.param("id")));
 * }</pre>
 * 
 * Registration must complete before the engine serves its first request; a
 * later registration throws {@link IllegalStateException}.
 * 
 * @see alpha.onionhttp.route.PathPattern
 */
public interface Router
{
    /**
     * Adds middleware, applied to routes registered afterwards through this
     * router or a group created from it afterwards.
     * 
     * @param middleware to add
     * 
     * @return this router
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalStateException if the engine has started
     */
    Router use(Handler... middleware);
    
    /**
     * Creates a group of routes sharing a path prefix and middleware.
     * 
     * @param relativePath prefix, relative to this router's base path
     * @param middleware   of the group
     * 
     * @return a new group
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    RouterGroup group(String relativePath, Handler... middleware);
    
    /**
     * Registers a route.
     * 
     * @param method       HTTP method token
     * @param relativePath route pattern, relative to this router's base path
     * @param handlers     of route (at least one)
     * 
     * @return this router
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code method} is empty or {@code handlers} is empty
     * @throws alpha.onionhttp.route.RoutePatternInvalidException
     *             if the resulting pattern is malformed
     * @throws alpha.onionhttp.route.RouteCollisionException
     *             if the route conflicts with an already registered route
     * @throws IllegalStateException
     *             if the engine has started
     */
    Router handle(String method, String relativePath, Handler... handlers);
    
    /**
     * Returns the absolute base path of this router.
     * 
     * @return the absolute base path
     */
    String basePath();
    
    /**
     * Shortcut for {@code handle("GET", relativePath, handlers)}.
     * 
     * @param relativePath route pattern
     * @param handlers of route
     * @return this router
     */
    default Router get(String relativePath, Handler... handlers) {
        return handle(GET, relativePath, handlers);
    }
    
    /**
     * Shortcut for {@code handle("POST", relativePath, handlers)}.
     * 
     * @param relativePath route pattern
     * @param handlers of route
     * @return this router
     */
    default Router post(String relativePath, Handler... handlers) {
        return handle(POST, relativePath, handlers);
    }
    
    /**
     * Shortcut for {@code handle("PUT", relativePath, handlers)}.
     * 
     * @param relativePath route pattern
     * @param handlers of route
     * @return this router
     */
    default Router put(String relativePath, Handler... handlers) {
        return handle(PUT, relativePath, handlers);
    }
    
    /**
     * Shortcut for {@code handle("DELETE", relativePath, handlers)}.
     * 
     * @param relativePath route pattern
     * @param handlers of route
     * @return this router
     */
    default Router delete(String relativePath, Handler... handlers) {
        return handle(DELETE, relativePath, handlers);
    }
    
    /**
     * Shortcut for {@code handle("PATCH", relativePath, handlers)}.
     * 
     * @param relativePath route pattern
     * @param handlers of route
     * @return this router
     */
    default Router patch(String relativePath, Handler... handlers) {
        return handle(PATCH, relativePath, handlers);
    }
    
    /**
     * Shortcut for {@code handle("HEAD", relativePath, handlers)}.
     * 
     * @param relativePath route pattern
     * @param handlers of route
     * @return this router
     */
    default Router head(String relativePath, Handler... handlers) {
        return handle(HEAD, relativePath, handlers);
    }
    
    /**
     * Shortcut for {@code handle("OPTIONS", relativePath, handlers)}.
     * 
     * @param relativePath route pattern
     * @param handlers of route
     * @return this router
     */
    default Router options(String relativePath, Handler... handlers) {
        return handle(OPTIONS, relativePath, handlers);
    }
    
    /**
     * Registers the route for all methods in {@link HttpConstants.Method#ANY}.
     * 
     * @param relativePath route pattern
     * @param handlers of route
     * @return this router
     */
    default Router any(String relativePath, Handler... handlers) {
        for (String m : HttpConstants.Method.ANY) {
            handle(m, relativePath, handlers);
        }
        return this;
    }
}
