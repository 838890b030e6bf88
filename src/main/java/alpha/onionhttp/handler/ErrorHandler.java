package alpha.onionhttp.handler;

import alpha.onionhttp.context.BadRequestException;
import alpha.onionhttp.context.RequestContext;

import static alpha.onionhttp.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.onionhttp.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Translates a {@code Throwable} that escaped the handler chain into a
 * response.<p>
 * 
 * Error handlers are called in the same order they were registered with the
 * engine, followed by the {@link #BASE base handler}, which has a fallback
 * response for everything. An error handler either writes a response, or
 * yields to the next error handler.
 * 
 * <pre>{@code
 *   ErrorHandler forMyExpected = (thr, chain, ctx) -> {
 *       if (thr instanceof MyExpectedException) {
 *           ctx.string(409, "Conflict");
 *       } else {
 *           // Don't know what this is, so try the next error handler
 *           chain.proceed();
 *       }
 *   };
 * }</pre>
 * 
 * The engine calls error handlers only if the response has not yet been
 * committed. When called, the context is already aborted, and the error has
 * been recorded with {@link RequestContext#addError(Throwable)}. An exception
 * thrown by an error handler is logged and the base handler's response is
 * attempted.<p>
 * 
 * The error handler must be thread-safe.
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Produces a response.
     * 
     * @param thr   the error (never {@code null})
     * @param chain yielder of control (never {@code null})
     * @param ctx   request context (never {@code null})
     * 
     * @throws Exception anything
     */
    void apply(Throwable thr, Chain chain, RequestContext ctx) throws Exception;
    
    /**
     * Is the base error handler used by the engine if no other
     * application-provided handler handled the error.<p>
     * 
     * Whatever was written to the uncommitted response is discarded. A {@link
     * BadRequestException} gives "400 Bad Request", anything else "500
     * Internal Server Error". The body is fixed text and never contains the
     * exception message.<p>
     * 
     * The engine has already logged the error when this handler is called.
     */
    ErrorHandler BASE = (thr, chain, ctx) -> {
        ctx.writer().discard();
        if (thr instanceof BadRequestException) {
            ctx.string(FOUR_HUNDRED, "400 bad request");
        } else {
            ctx.string(FIVE_HUNDRED, "500 internal server error");
        }
    };
    
    /**
     * Yields control to the next error handler.
     */
    @FunctionalInterface
    interface Chain {
        /**
         * Calls the next error handler.
         * 
         * @throws Exception anything
         */
        void proceed() throws Exception;
    }
}
