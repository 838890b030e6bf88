package alpha.onionhttp.guard;

/**
 * Admits or rejects events per key, e.g. requests per client address.<p>
 * 
 * Implementations keep state per key, created lazily on first use. The state
 * of keys no longer seen stays in memory until {@link #prune()} is called;
 * scheduling it is left to the application.<p>
 * 
 * Implementations are thread-safe.
 * 
 * @see alpha.onionhttp.handler.Middlewares#rateLimit(RateLimiter)
 */
public interface RateLimiter
{
    /**
     * Registers an event for the given key.<p>
     * 
     * Being rate limited is not an error; {@code false} is returned.
     * 
     * @param key of client
     * 
     * @return {@code true} if admitted, {@code false} if rate limited
     * 
     * @throws NullPointerException if {@code key} is {@code null}
     */
    boolean allow(String key);
    
    /**
     * Removes the state of keys whose state is equivalent to a fresh one.
     * 
     * @return the number of keys removed
     */
    int prune();
    
    /**
     * Returns the number of keys currently tracked.
     * 
     * @return the number of keys currently tracked
     */
    int size();
}
