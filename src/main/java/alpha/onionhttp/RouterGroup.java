package alpha.onionhttp;

import alpha.onionhttp.handler.Handler;
import alpha.onionhttp.handler.HandlerChain;
import alpha.onionhttp.route.PathPattern;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Router} with a path prefix and middleware of its own.<p>
 * 
 * A group is created by {@link Router#group(String, Handler...)}. It inherits
 * the middleware its parent has at the time of creation.
 */
public final class RouterGroup implements Router
{
    private final Engine engine;
    private final String basePath;
    private HandlerChain middleware;
    
    RouterGroup(Engine engine, String basePath, HandlerChain middleware) {
        this.engine = engine;
        this.basePath = basePath;
        this.middleware = middleware;
    }
    
    @Override
    public RouterGroup use(Handler... middleware) {
        engine.requireNotStarted();
        this.middleware = this.middleware.append(middleware);
        return this;
    }
    
    @Override
    public RouterGroup group(String relativePath, Handler... middleware) {
        requireNonNull(relativePath);
        return new RouterGroup(engine,
                PathPattern.join(basePath, relativePath),
                this.middleware.append(middleware));
    }
    
    @Override
    public RouterGroup handle(String method, String relativePath, Handler... handlers) {
        if (method.isEmpty()) {
            throw new IllegalArgumentException("Empty method.");
        }
        requireNonNull(relativePath);
        final String pattern = PathPattern.join(basePath, relativePath);
        if (handlers.length == 0) {
            throw new IllegalArgumentException("Route \"" + pattern + "\" has no handler.");
        }
        engine.addRoute(method, pattern, middleware.append(handlers));
        return this;
    }
    
    @Override
    public String basePath() {
        return basePath;
    }
    
    HandlerChain middleware() {
        return middleware;
    }
    
    @Override
    public String toString() {
        return RouterGroup.class.getSimpleName() + "{basePath=" + basePath + "}";
    }
}
