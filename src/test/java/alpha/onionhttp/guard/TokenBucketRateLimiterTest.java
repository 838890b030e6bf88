package alpha.onionhttp.guard;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link TokenBucketRateLimiter}.
 */
class TokenBucketRateLimiterTest
{
    private static final long SECOND = 1_000_000_000L,
                              // Margin for floating-point refill
                              EPSILON = 1_000L;
    
    private final AtomicLong now = new AtomicLong(0);
    private final RateLimiter testee = new TokenBucketRateLimiter(3, 2, now::get);
    
    @Test
    void burst_then_rate() {
        assertThat(testee.allow("k")).isTrue();
        assertThat(testee.allow("k")).isTrue();
        assertThat(testee.allow("k")).isTrue();
        assertThat(testee.allow("k")).isFalse();
        
        // Half a second gives one token at 2/s
        now.addAndGet(SECOND / 2 + EPSILON);
        assertThat(testee.allow("k")).isTrue();
        assertThat(testee.allow("k")).isFalse();
    }
    
    @Test
    void refill_is_capped() {
        for (int i = 0; i < 3; ++i) {
            testee.allow("k");
        }
        now.addAndGet(100 * SECOND);
        int admitted = 0;
        while (testee.allow("k")) {
            ++admitted;
        }
        assertThat(admitted).isEqualTo(3);
    }
    
    @Test
    void prune_removes_full_buckets() {
        testee.allow("a");
        testee.allow("b");
        testee.allow("b");
        testee.allow("b");
        
        // a needs 0.5s to be full again, b needs 1.5s
        now.addAndGet(SECOND / 2 + EPSILON);
        assertThat(testee.prune()).isOne();
        assertThat(testee.size()).isOne();
        
        now.addAndGet(SECOND);
        assertThat(testee.prune()).isOne();
        assertThat(testee.size()).isZero();
    }
    
    @Test
    void invalid_arguments() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(0.5, 1))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Capacity must be at least 1, got: 0.5");
        assertThatThrownBy(() -> new TokenBucketRateLimiter(1, 0))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Rate must be positive, got: 0.0");
    }
}
