package alpha.onionhttp.guard;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Admits events per key as long as the key's bucket holds a token.<p>
 * 
 * A bucket starts full. It refills continuously at {@code ratePerSecond}
 * tokens per second, up to {@code capacity}. An admitted event takes one
 * token. Bursts of up to {@code capacity} events are therefore admitted, and a
 * sustained rate of {@code ratePerSecond}.
 * 
 * <pre>{@code
 *   // Bursts of 10, then 5 per second
 *   RateLimiter rl = new TokenBucketRateLimiter(10, 5);
 * }</pre>
 */
public final class TokenBucketRateLimiter implements RateLimiter
{
    private static final System.Logger LOG
            = System.getLogger(TokenBucketRateLimiter.class.getPackageName());
    
    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    
    private final double capacity, ratePerNano;
    private final LongSupplier clock;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    
    /**
     * Constructs a {@code TokenBucketRateLimiter} using {@link
     * System#nanoTime()}.
     * 
     * @param capacity      max tokens of a bucket
     * @param ratePerSecond refill rate
     * 
     * @throws IllegalArgumentException
     *             if {@code capacity} is less than 1, or {@code ratePerSecond}
     *             is not positive
     */
    public TokenBucketRateLimiter(double capacity, double ratePerSecond) {
        this(capacity, ratePerSecond, System::nanoTime);
    }
    
    /**
     * Constructs a {@code TokenBucketRateLimiter}.
     * 
     * @param capacity      max tokens of a bucket
     * @param ratePerSecond refill rate
     * @param nanoClock     source of time, in nanoseconds
     * 
     * @throws NullPointerException
     *             if {@code nanoClock} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code capacity} is less than 1, or {@code ratePerSecond}
     *             is not positive
     */
    public TokenBucketRateLimiter(double capacity, double ratePerSecond, LongSupplier nanoClock) {
        if (!(capacity >= 1)) {
            throw new IllegalArgumentException("Capacity must be at least 1, got: " + capacity);
        }
        if (!(ratePerSecond > 0)) {
            throw new IllegalArgumentException("Rate must be positive, got: " + ratePerSecond);
        }
        this.capacity = capacity;
        this.ratePerNano = ratePerSecond / NANOS_PER_SECOND;
        this.clock = requireNonNull(nanoClock);
    }
    
    @Override
    public boolean allow(String key) {
        requireNonNull(key);
        for (;;) {
            Bucket b = buckets.computeIfAbsent(key, k -> new Bucket(capacity, clock.getAsLong()));
            synchronized (b) {
                if (b.evicted) {
                    continue;
                }
                refill(b, clock.getAsLong());
                if (b.tokens >= 1) {
                    b.tokens -= 1;
                    return true;
                }
                return false;
            }
        }
    }
    
    private void refill(Bucket b, long now) {
        long elapsed = now - b.lastRefill;
        if (elapsed > 0) {
            b.tokens = Math.min(capacity, b.tokens + elapsed * ratePerNano);
            b.lastRefill = now;
        }
    }
    
    /**
     * Removes buckets that have refilled to capacity.
     * 
     * @return the number of buckets removed
     */
    @Override
    public int prune() {
        int n = 0;
        for (Map.Entry<String, Bucket> e : buckets.entrySet()) {
            Bucket b = e.getValue();
            synchronized (b) {
                refill(b, clock.getAsLong());
                if (b.tokens >= capacity && buckets.remove(e.getKey(), b)) {
                    b.evicted = true;
                    ++n;
                }
            }
        }
        if (n > 0) {
            final int pruned = n;
            LOG.log(DEBUG, () -> "Pruned " + pruned + " full bucket(s).");
        }
        return n;
    }
    
    @Override
    public int size() {
        return buckets.size();
    }
    
    private static final class Bucket {
        double tokens;
        long lastRefill;
        boolean evicted;
        
        Bucket(double tokens, long lastRefill) {
            this.tokens = tokens;
            this.lastRefill = lastRefill;
        }
    }
}
