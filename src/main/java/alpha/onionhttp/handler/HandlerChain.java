package alpha.onionhttp.handler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * An immutable, ordered list of {@link Handler}s.<p>
 * 
 * The chain of a route is the concatenation of the engine's global
 * middleware, the middleware of each enclosing group, and the handlers given
 * when the route was registered, in that order.
 */
public final class HandlerChain
{
    /** The empty chain. */
    public static final HandlerChain EMPTY = new HandlerChain(List.of());
    
    private final List<Handler> handlers;
    
    private HandlerChain(List<Handler> handlers) {
        this.handlers = handlers;
    }
    
    /**
     * Returns a chain of the given handlers.
     * 
     * @param handlers of chain
     * 
     * @return a chain
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static HandlerChain of(Handler... handlers) {
        return handlers.length == 0 ? EMPTY : new HandlerChain(List.of(handlers));
    }
    
    /**
     * Returns a new chain with the given handlers appended.
     * 
     * @param more handlers to append
     * 
     * @return a new chain (or this chain if {@code more} is empty)
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public HandlerChain append(Handler... more) {
        if (more.length == 0) {
            return this;
        }
        List<Handler> l = new ArrayList<>(handlers.size() + more.length);
        l.addAll(handlers);
        Arrays.stream(more).map(h -> requireNonNull(h, "handler")).forEach(l::add);
        return new HandlerChain(unmodifiableList(l));
    }
    
    /**
     * Returns a new chain with the handlers of the given chain appended.
     * 
     * @param other chain to append
     * 
     * @return a new chain
     */
    public HandlerChain append(HandlerChain other) {
        return append(other.handlers.toArray(Handler[]::new));
    }
    
    /**
     * Returns the handler at the given position.
     * 
     * @param index of handler
     * 
     * @return the handler
     * 
     * @throws IndexOutOfBoundsException if {@code index} is out of bounds
     */
    public Handler get(int index) {
        return handlers.get(index);
    }
    
    /**
     * Returns the number of handlers.
     * 
     * @return the number of handlers
     */
    public int size() {
        return handlers.size();
    }
    
    /**
     * Returns {@code true} if the chain has no handler.
     * 
     * @return see JavaDoc
     */
    public boolean isEmpty() {
        return handlers.isEmpty();
    }
    
    /**
     * Returns the handlers.
     * 
     * @return the handlers (unmodifiable)
     */
    public List<Handler> asList() {
        return handlers;
    }
    
    @Override
    public String toString() {
        return HandlerChain.class.getSimpleName() + "{size=" + size() + "}";
    }
}
