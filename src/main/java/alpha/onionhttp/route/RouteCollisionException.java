package alpha.onionhttp.route;

import java.io.Serial;

/**
 * Thrown by {@link RouteTree#add(String, alpha.onionhttp.handler.HandlerChain)}
 * when an attempt is made to register a route which is equivalent to, or
 * occupies the same hierarchical position as, an already registered route in
 * an incompatible way.<p>
 * 
 * The exception is a startup error. It is thrown during registration and
 * therefore before the engine serves any request.
 * 
 * @see RouteTree
 */
public class RouteCollisionException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code RouteCollisionException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RouteCollisionException(String message) {
        super(message);
    }
}
