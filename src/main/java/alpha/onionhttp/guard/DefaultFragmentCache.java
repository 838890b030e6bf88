package alpha.onionhttp.guard;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link FragmentCache}, backed by a {@link
 * ConcurrentHashMap}.
 * 
 * @param <V> value type
 */
public final class DefaultFragmentCache<V> implements FragmentCache<V>
{
    private static final System.Logger LOG
            = System.getLogger(DefaultFragmentCache.class.getPackageName());
    
    private static final Duration MAX_TTL = Duration.ofNanos(Long.MAX_VALUE / 2);
    
    private final Map<String, Entry<V>> entries = new ConcurrentHashMap<>();
    private final LongSupplier clock;
    
    /**
     * Constructs a {@code DefaultFragmentCache} using {@link System#nanoTime()}.
     */
    public DefaultFragmentCache() {
        this(System::nanoTime);
    }
    
    /**
     * Constructs a {@code DefaultFragmentCache}.
     * 
     * @param nanoClock source of time, in nanoseconds
     */
    public DefaultFragmentCache(LongSupplier nanoClock) {
        this.clock = requireNonNull(nanoClock);
    }
    
    @Override
    public Optional<V> get(String key) {
        Entry<V> e = entries.get(key);
        if (e == null) {
            return Optional.empty();
        }
        if (e.isExpired(clock.getAsLong())) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value());
    }
    
    @Override
    public void set(String key, V value, Duration ttl) {
        requireNonNull(key);
        requireNonNull(value);
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        entries.put(key, new Entry<>(value, clock.getAsLong() + toNanos(ttl)));
    }
    
    // Durations beyond the nano range are capped; expiry compares by difference
    private static long toNanos(Duration ttl) {
        return ttl.compareTo(MAX_TTL) >= 0 ? MAX_TTL.toNanos() : ttl.toNanos();
    }
    
    @Override
    public boolean invalidate(String key) {
        return entries.remove(key) != null;
    }
    
    @Override
    public int prune() {
        final long now = clock.getAsLong();
        int n = 0;
        for (Map.Entry<String, Entry<V>> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                ++n;
            }
        }
        if (n > 0) {
            final int pruned = n;
            LOG.log(DEBUG, () -> "Pruned " + pruned + " expired cache entries.");
        }
        return n;
    }
    
    @Override
    public int size() {
        return entries.size();
    }
    
    private record Entry<V>(V value, long expiresAt) {
        boolean isExpired(long now) {
            return now - expiresAt >= 0;
        }
    }
}
