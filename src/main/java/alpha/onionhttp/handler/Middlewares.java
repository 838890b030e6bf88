package alpha.onionhttp.handler;

import alpha.onionhttp.context.RequestContext;
import alpha.onionhttp.context.ResponseWriter;
import alpha.onionhttp.guard.FragmentCache;
import alpha.onionhttp.guard.RateLimiter;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static alpha.onionhttp.HttpConstants.HeaderName.X_CACHE;
import static alpha.onionhttp.HttpConstants.Method.GET;
import static alpha.onionhttp.HttpConstants.StatusCode.FOUR_HUNDRED_TWENTY_NINE;
import static alpha.onionhttp.HttpConstants.StatusCode.TWO_HUNDRED;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Factories of commonly used middleware.
 * 
 * <pre>{@code
 *   Engine e = Engine.create();
 *   e.use(requestLogger(),
 *         rateLimit(new FixedWindowRateLimiter(100, Duration.ofSeconds(1))));
 * }</pre>
 */
public final class Middlewares
{
    private static final System.Logger LOG
            = System.getLogger(Middlewares.class.getPackageName());
    
    private Middlewares() {
        // Empty
    }
    
    /**
     * Returns a middleware that logs each request on level INFO, after the
     * rest of the chain has finished.<p>
     * 
     * The record has the form {@code status | latency | client | method
     * path}. Errors recorded on the context are logged on level WARNING.<p>
     * 
     * Register it first, so that its latency covers all other handlers.
     * 
     * @return a request logger
     */
    public static Handler requestLogger() {
        return ctx -> {
            final long start = System.nanoTime();
            try {
                ctx.next();
            } finally {
                final long nanos = System.nanoTime() - start;
                final int status = ctx.writer().status();
                LOG.log(INFO, () -> String.format(Locale.ROOT, "%3d | %10.3fms | %15s | %-7s %s",
                        status, nanos / 1_000_000d, ctx.clientIp(), ctx.method(), ctx.path()));
                for (Throwable t : ctx.errors()) {
                    LOG.log(WARNING, "Error recorded for " + ctx.method() + " " + ctx.path(), t);
                }
            }
        };
    }
    
    /**
     * Returns a middleware that rejects rate-limited clients.<p>
     * 
     * Same as {@code rateLimit(limiter, RequestContext::clientIp)}.
     * 
     * @param limiter to consult
     * 
     * @return a rate limiting middleware
     * 
     * @see RequestContext#clientIp()
     */
    public static Handler rateLimit(RateLimiter limiter) {
        return rateLimit(limiter, RequestContext::clientIp);
    }
    
    /**
     * Returns a middleware that rejects rate-limited requests.<p>
     * 
     * The key of each request is computed by the given function. If the
     * limiter rejects the key, the response is "429 Too Many Requests" and the
     * context is aborted.
     * 
     * @param limiter to consult
     * @param keyFunction computes the key of a request
     * 
     * @return a rate limiting middleware
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Handler rateLimit(RateLimiter limiter, Function<RequestContext, String> keyFunction) {
        requireNonNull(limiter);
        requireNonNull(keyFunction);
        return ctx -> {
            final String key = keyFunction.apply(ctx);
            if (limiter.allow(key)) {
                ctx.next();
            } else {
                LOG.log(DEBUG, () -> "Rate limited: " + key);
                ctx.string(FOUR_HUNDRED_TWENTY_NINE, "429 too many requests");
                ctx.abort();
            }
        };
    }
    
    /**
     * Returns a middleware that caches successful GET responses.<p>
     * 
     * The cache key is the raw path and query of the request. On a hit, the
     * cached response is written, with header {@code X-Cache: HIT}, and the
     * context is aborted. On a miss, the response gets {@code X-Cache: MISS},
     * and if the downstream chain produces a 200 response without recording
     * an error, the response is stored. Only body bytes written after this
     * middleware was entered are stored.<p>
     * 
     * Other methods pass through untouched.
     * 
     * @param cache to use
     * @param ttl   time-to-live of stored responses
     * 
     * @return a caching middleware
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code ttl} is not positive
     */
    public static Handler responseCache(FragmentCache<CachedResponse> cache, Duration ttl) {
        requireNonNull(cache);
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        return ctx -> {
            if (!GET.equals(ctx.method())) {
                ctx.next();
                return;
            }
            
            final String q = ctx.request().query(),
                         key = q == null ? ctx.path() : ctx.path() + "?" + q;
            
            Optional<CachedResponse> hit = cache.get(key);
            final ResponseWriter w = ctx.writer();
            if (hit.isPresent()) {
                CachedResponse r = hit.get();
                w.status(r.status());
                // Replace, outer middleware may have set some of these already
                r.headers().forEach((name, values) -> {
                    w.removeHeader(name);
                    values.forEach(v -> w.addHeader(name, v));
                });
                w.setHeader(X_CACHE, "HIT");
                w.write(r.body());
                ctx.abort();
                return;
            }
            
            w.setHeader(X_CACHE, "MISS");
            w.capture();
            ctx.next();
            
            if (w.status() == TWO_HUNDRED && ctx.errors().isEmpty()) {
                Map<String, List<String>> h = new LinkedHashMap<>(w.headers());
                h.remove(X_CACHE);
                cache.set(key, new CachedResponse(w.status(), h, w.captured()), ttl);
                LOG.log(DEBUG, () -> "Cached response of " + key);
            }
        };
    }
    
    /**
     * Returns a middleware that sets the given response headers before the
     * rest of the chain runs.
     * 
     * <pre>{@code
     *   headers("X-Frame-Options", "DENY",
     *           "X-Content-Type-Options", "nosniff");
     * }</pre>
     * 
     * @param name  of first header
     * @param value of first header
     * @param more  alternating names and values of more headers
     * 
     * @return a middleware
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code more} has an odd length
     */
    public static Handler headers(String name, String value, String... more) {
        if (more.length % 2 != 0) {
            throw new IllegalArgumentException("Header name without a value: " + more[more.length - 1]);
        }
        final Map<String, String> all = new LinkedHashMap<>();
        all.put(requireNonNull(name), requireNonNull(value));
        for (int i = 0; i < more.length; i += 2) {
            all.put(requireNonNull(more[i]), requireNonNull(more[i + 1]));
        }
        return ctx -> {
            all.forEach(ctx::setHeader);
            ctx.next();
        };
    }
}
