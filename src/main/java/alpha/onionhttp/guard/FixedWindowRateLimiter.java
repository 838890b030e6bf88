package alpha.onionhttp.guard;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Admits at most {@code limit} events per key within a window of fixed
 * length.<p>
 * 
 * A key's window starts with its first event. An event arriving when the
 * window has elapsed ({@code now - windowStart >= window}) starts a new window.
 * Within a window, an event is rejected if {@code limit} events were already
 * admitted.
 * 
 * <pre>{@code
 *   // Two requests per second and client
 *   RateLimiter rl = new FixedWindowRateLimiter(2, Duration.ofSeconds(1));
 * }</pre>
 */
public final class FixedWindowRateLimiter implements RateLimiter
{
    private static final System.Logger LOG
            = System.getLogger(FixedWindowRateLimiter.class.getPackageName());
    
    private final int limit;
    private final long windowNanos;
    private final LongSupplier clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    
    /**
     * Constructs a {@code FixedWindowRateLimiter} using {@link
     * System#nanoTime()}.
     * 
     * @param limit  max events per window
     * @param window length of window
     * 
     * @throws IllegalArgumentException if {@code limit} or {@code window} is not positive
     */
    public FixedWindowRateLimiter(int limit, Duration window) {
        this(limit, window, System::nanoTime);
    }
    
    /**
     * Constructs a {@code FixedWindowRateLimiter}.
     * 
     * @param limit  max events per window
     * @param window length of window
     * @param nanoClock source of time, in nanoseconds
     * 
     * @throws NullPointerException if an argument is {@code null}
     * @throws IllegalArgumentException if {@code limit} or {@code window} is not positive
     */
    public FixedWindowRateLimiter(int limit, Duration window, LongSupplier nanoClock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, got: " + limit);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Window must be positive, got: " + window);
        }
        this.limit = limit;
        this.windowNanos = window.toNanos();
        this.clock = requireNonNull(nanoClock);
    }
    
    @Override
    public boolean allow(String key) {
        requireNonNull(key);
        for (;;) {
            Window w = windows.computeIfAbsent(key, k -> new Window(clock.getAsLong()));
            synchronized (w) {
                if (w.evicted) {
                    // Pruned after lookup, retry with a fresh one
                    continue;
                }
                final long now = clock.getAsLong();
                if (now - w.start >= windowNanos) {
                    w.start = now;
                    w.count = 0;
                }
                if (w.count >= limit) {
                    return false;
                }
                ++w.count;
                return true;
            }
        }
    }
    
    @Override
    public int prune() {
        int n = 0;
        for (Map.Entry<String, Window> e : windows.entrySet()) {
            Window w = e.getValue();
            synchronized (w) {
                if (clock.getAsLong() - w.start >= windowNanos &&
                        windows.remove(e.getKey(), w)) {
                    w.evicted = true;
                    ++n;
                }
            }
        }
        if (n > 0) {
            final int pruned = n;
            LOG.log(DEBUG, () -> "Pruned " + pruned + " expired window(s).");
        }
        return n;
    }
    
    @Override
    public int size() {
        return windows.size();
    }
    
    private static final class Window {
        long start;
        int count;
        boolean evicted;
        
        Window(long start) {
            this.start = start;
        }
    }
}
