package alpha.onionhttp.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Provides a convenient baseclass for immutable builder implementations.<p>
 * 
 * Builders are backwards-linked in a chain and the only real state they each
 * store is a modifying action, which is replayed against a mutable state
 * container during {@link #constructState(Supplier) construction time}. A
 * builder can therefore be shared and forked freely; setting a value returns a
 * new builder and leaves the receiver untouched.
 * 
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S>
{
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs a root builder.
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a leaf builder.
     * 
     * @param prev previous builder
     * @param modifier action to apply on mutable state
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Constructs the mutable state container and plays all modifiers against
     * it, oldest first.
     * 
     * @param factory of state
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
