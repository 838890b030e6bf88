package alpha.onionhttp.handler;

import alpha.onionhttp.context.RequestContext;

/**
 * A unit of request processing; middleware and final handlers alike.<p>
 * 
 * A handler receives the request-scoped context. A middleware yields control
 * to the rest of the chain by calling {@link RequestContext#next()}. Code
 * before that call runs in chain order, code after it runs in reverse order,
 * once the whole downstream chain has finished.
 * 
 * <pre>{@code
 *   Handler timer = ctx -> {
 *       long start = System.nanoTime();
 *       ctx.next();
 *       long elapsed = System.nanoTime() - start;
 *       ...
 *   };
 * }</pre>
 * 
 * A handler that returns without calling {@code next()} ends the chain. No
 * handler after it is entered. This is how a final handler works, and also how
 * a middleware may answer a request itself, although {@link
 * RequestContext#abort()} makes the intent clearer.<p>
 * 
 * Exceptions propagate through the {@code next()} calls of the outer handlers
 * and are handled by the engine's {@link ErrorHandler}s. An outer handler that
 * must run post-processing regardless uses {@code try/finally}.<p>
 * 
 * The handler instance is shared by all requests and must be thread-safe. The
 * context must not be retained after the handler returns; use {@link
 * RequestContext#copy()} for background work.
 */
@FunctionalInterface
public interface Handler
{
    /**
     * Processes the request.
     * 
     * @param ctx request-scoped context (never {@code null})
     * 
     * @throws Exception anything
     */
    void handle(RequestContext ctx) throws Exception;
}
