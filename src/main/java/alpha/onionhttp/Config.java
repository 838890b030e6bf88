package alpha.onionhttp;

import alpha.onionhttp.context.RequestContext;

/**
 * Engine configuration.<p>
 * 
 * The implementation is immutable and thread-safe.<p>
 * 
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 * 
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.
 * 
 * <pre>{@code
 *   Config cfg = Config.configuration()
 *                      .redirectTrailingSlash(true)
 *                      .build();
 *   Engine engine = Engine.create(cfg);
 * }</pre>
 */
public interface Config
{
    /**
     * Values used:<p>
     * 
     * Redirect trailing slash = false <br>
     * Handle method not allowed = false <br>
     * Max pooled contexts = 1 024 <br>
     * Trust X-Forwarded-For = false
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Redirect a request whose path did not match any route, but would have
     * matched with the trailing slash added or removed, yes or no.<p>
     * 
     * If enabled, the redirect status is 301 (Moved Permanently) for GET
     * requests and 307 (Temporary Redirect) for all other methods, so that the
     * client repeats the method and body.<p>
     * 
     * Matching is otherwise exact; {@code /users} and {@code /users/} are two
     * different routes.<p>
     * 
     * The default implementation returns {@code false}.
     * 
     * @return whether to redirect on a toggled trailing slash
     */
    boolean redirectTrailingSlash();
    
    /**
     * Respond 405 (Method Not Allowed) instead of 404 (Not Found) when no route
     * exists for the request method, but a route for the same path exists for
     * another method, yes or no.<p>
     * 
     * The response carries an {@code Allow} header listing the other methods.
     * The response is produced by the engine's {@code noMethod} chain.<p>
     * 
     * The default implementation returns {@code false}.
     * 
     * @return whether to respond 405 when applicable
     */
    boolean handleMethodNotAllowed();
    
    /**
     * Returns the max number of idle {@link RequestContext} instances kept in
     * the engine's pool.<p>
     * 
     * This is not a limit on concurrent requests. A request arriving when the
     * pool is empty gets a freshly allocated context, and a context released
     * when the pool is full is left for the garbage collector.<p>
     * 
     * The default implementation returns {@code 1_024}.
     * 
     * @return max number of idle pooled contexts
     */
    int maxPooledContexts();
    
    /**
     * Use the first address of the {@code X-Forwarded-For} request header as
     * the client address, yes or no.<p>
     * 
     * Only enable this if the engine is deployed behind a proxy that sets the
     * header; otherwise any client can spoof its address, and defeat a
     * per-client rate limiter.<p>
     * 
     * The default implementation returns {@code false}.
     * 
     * @return whether to trust {@code X-Forwarded-For}
     * @see RequestContext#clientIp()
     */
    boolean trustForwardedFor();
    
    /**
     * Returns a builder pre-populated with the values of this configuration.
     * 
     * @return a builder
     */
    Builder toBuilder();
    
    /**
     * Shortcut for {@code Config.DEFAULT.toBuilder()}.
     * 
     * @return a builder with default values
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The implementation is immutable and thread-safe. Each setter returns a
     * new builder.
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#redirectTrailingSlash()
         */
        Builder redirectTrailingSlash(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#handleMethodNotAllowed()
         */
        Builder handleMethodNotAllowed(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is negative
         * @see Config#maxPooledContexts()
         */
        Builder maxPooledContexts(int newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#trustForwardedFor()
         */
        Builder trustForwardedFor(boolean newVal);
        
        /**
         * Builds a configuration object.
         * 
         * @return a configuration object
         */
        Config build();
    }
}
