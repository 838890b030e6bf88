package alpha.onionhttp.route;

import alpha.onionhttp.handler.HandlerChain;

import static java.util.Objects.requireNonNull;

/**
 * A registered route; the terminal value of a {@link RouteTree} branch.<p>
 * 
 * The chain is the fully assembled chain of the route. That is, global
 * middleware followed by group middleware, route middleware and finally the
 * route's own handler.
 * 
 * @param method  HTTP method token
 * @param pattern route pattern, as registered
 * @param chain   handler chain (never empty)
 */
public record Route(String method, String pattern, HandlerChain chain)
{
    /**
     * Constructs this object.
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code chain} is empty
     */
    public Route {
        requireNonNull(method);
        requireNonNull(pattern);
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Route \"" + pattern + "\" has no handler.");
        }
    }
    
    @Override
    public String toString() {
        return method + " " + pattern;
    }
}
