package alpha.onionhttp.context;

import alpha.onionhttp.Config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * A bounded free-list of {@link RequestContext}s.<p>
 * 
 * {@link #acquire()} takes an idle context or allocates a new one if none is
 * idle; a request never waits for a context. {@link #release(RequestContext)}
 * returns the context, which is dropped if the pool already holds {@link
 * Config#maxPooledContexts()} idle contexts.<p>
 * 
 * The pool is thread-safe. A context moves between threads only through the
 * pool's queue, which establishes happens-before between the releasing and
 * the acquiring thread.
 */
public final class ContextPool
{
    private static final System.Logger LOG
            = System.getLogger(ContextPool.class.getPackageName());
    
    private final Config config;
    private final BlockingQueue<RequestContext> idle;
    private final AtomicLong allocated = new AtomicLong();
    
    /**
     * Constructs a {@code ContextPool}.
     * 
     * @param config of engine
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public ContextPool(Config config) {
        this.config = requireNonNull(config);
        int max = config.maxPooledContexts();
        this.idle = max == 0 ? null : new ArrayBlockingQueue<>(max);
    }
    
    /**
     * Takes an idle context, or allocates a new one.<p>
     * 
     * The context is not yet bound to a request; see {@link
     * RequestContext#init(RawRequest, RawResponse)}.
     * 
     * @return a context
     */
    public RequestContext acquire() {
        RequestContext ctx = idle == null ? null : idle.poll();
        if (ctx == null) {
            ctx = new RequestContext(config);
            long n = allocated.incrementAndGet();
            LOG.log(DEBUG, () -> "Allocated context #" + n);
        } else {
            ctx.markAcquired();
        }
        return ctx;
    }
    
    /**
     * Returns a context to the pool.<p>
     * 
     * The context must not be used again by the caller.
     * 
     * @param ctx to release
     * 
     * @throws NullPointerException if {@code ctx} is {@code null}
     * @throws IllegalStateException if {@code ctx} is already released
     */
    public void release(RequestContext ctx) {
        if (!ctx.markReleased()) {
            throw new IllegalStateException("Context already released.");
        }
        if (idle != null && !idle.offer(ctx)) {
            LOG.log(DEBUG, "Pool is full, context dropped.");
        }
    }
    
    /**
     * Returns the number of idle contexts.
     * 
     * @return the number of idle contexts
     */
    public int idle() {
        return idle == null ? 0 : idle.size();
    }
    
    /**
     * Returns the number of contexts allocated since the pool was created.
     * 
     * @return the number of contexts allocated
     */
    public long allocated() {
        return allocated.get();
    }
}
