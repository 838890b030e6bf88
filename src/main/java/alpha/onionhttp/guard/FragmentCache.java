package alpha.onionhttp.guard;

import java.time.Duration;
import java.util.Optional;

/**
 * A short-lived cache of computed values, e.g. rendered response bodies.<p>
 * 
 * Each entry has its own time-to-live. An expired entry is never returned; it
 * is removed when next looked up, or by {@link #prune()}.<p>
 * 
 * Implementations are thread-safe.
 * 
 * @param <V> value type
 * 
 * @see alpha.onionhttp.handler.Middlewares#responseCache(FragmentCache, Duration)
 */
public interface FragmentCache<V>
{
    /**
     * Returns the value of a non-expired entry.
     * 
     * @param key of entry
     * 
     * @return the value, if present and not expired
     */
    Optional<V> get(String key);
    
    /**
     * Stores an entry, replacing any previous entry of the same key.
     * 
     * @param key   of entry
     * @param value of entry
     * @param ttl   time-to-live
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code ttl} is not positive
     */
    void set(String key, V value, Duration ttl);
    
    /**
     * Removes an entry.
     * 
     * @param key of entry
     * 
     * @return {@code true} if an entry was removed
     */
    boolean invalidate(String key);
    
    /**
     * Removes all expired entries.
     * 
     * @return the number of entries removed
     */
    int prune();
    
    /**
     * Returns the number of entries, expired ones not yet removed included.
     * 
     * @return the number of entries
     */
    int size();
}
