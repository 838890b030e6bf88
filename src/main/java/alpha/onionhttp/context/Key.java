package alpha.onionhttp.context;

import static java.util.Objects.requireNonNull;

/**
 * A typed key of the request-scoped key/value store.
 * 
 * <pre>{@code
 *   static final Key<User> USER = Key.of("user", User.class);
 *   ...
 *   ctx.set(USER, user);
 *   Optional<User> u = ctx.get(USER);
 * }</pre>
 * 
 * A typed key shares the namespace of string keys; {@code ctx.getAny("user")}
 * returns the same value.
 * 
 * @param <T> value type
 * @param name key name
 * @param type value type
 * 
 * @see RequestContext#get(Key)
 */
public record Key<T>(String name, Class<T> type)
{
    /**
     * Constructs a {@code Key}.
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public Key {
        requireNonNull(name);
        requireNonNull(type);
    }
    
    /**
     * Returns a new key.
     * 
     * @param name key name
     * @param type value type
     * @param <T> value type
     * 
     * @return a new key
     */
    public static <T> Key<T> of(String name, Class<T> type) {
        return new Key<>(name, type);
    }
}
