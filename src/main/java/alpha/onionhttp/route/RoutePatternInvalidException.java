package alpha.onionhttp.route;

import java.io.Serial;

/**
 * Thrown by {@link PathPattern#parse(String)} if a route pattern is invalid.
 */
public class RoutePatternInvalidException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final String pattern;
    
    /**
     * Constructs this object.
     * 
     * @param pattern the offending pattern
     * @param reason  what is wrong with it
     */
    public RoutePatternInvalidException(String pattern, String reason) {
        super("Invalid route pattern \"" + pattern + "\": " + reason);
        this.pattern = pattern;
    }
    
    /**
     * Returns the offending pattern.
     * 
     * @return the offending pattern (may be {@code null})
     */
    public String getPattern() {
        return pattern;
    }
}
