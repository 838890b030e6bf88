package alpha.onionhttp.route;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * Path parameters bound while matching a request path against a route.<p>
 * 
 * Values are held both percent-decoded and raw. For a single-segment parameter
 * the value is the segment; for a catch-all parameter it is '/' followed by
 * all remaining segments.<p>
 * 
 * The object is mutable and reused across requests by a pooled
 * {@code RequestContext}. It is not thread-safe.
 */
public final class Params
{
    private String[] names, raw, decoded;
    private int size;
    
    /**
     * Constructs an empty {@code Params}.
     * 
     * @param capacity initial capacity
     */
    public Params(int capacity) {
        int c = Math.max(capacity, 1);
        names   = new String[c];
        raw     = new String[c];
        decoded = new String[c];
    }
    
    /**
     * Returns the decoded value of the named parameter.
     * 
     * @param name of parameter
     * @return the decoded value, or {@code null} if not bound
     */
    public String get(String name) {
        int i = indexOf(name);
        return i == -1 ? null : decoded[i];
    }
    
    /**
     * Returns the raw (not percent-decoded) value of the named parameter.
     * 
     * @param name of parameter
     * @return the raw value, or {@code null} if not bound
     */
    public String getRaw(String name) {
        int i = indexOf(name);
        return i == -1 ? null : raw[i];
    }
    
    /**
     * Returns the number of bound parameters.
     * 
     * @return the number of bound parameters
     */
    public int size() {
        return size;
    }
    
    /**
     * Returns {@code true} if no parameter is bound.
     * 
     * @return see JavaDoc
     */
    public boolean isEmpty() {
        return size == 0;
    }
    
    /**
     * Returns a snapshot of name to decoded value, in binding order.
     * 
     * @return an unmodifiable map
     */
    public Map<String, String> asMap() {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < size; ++i) {
            m.put(names[i], decoded[i]);
        }
        return unmodifiableMap(m);
    }
    
    /**
     * Unbinds all parameters. The backing arrays are kept and their slots
     * nulled out.
     */
    public void clear() {
        Arrays.fill(names,   0, size, null);
        Arrays.fill(raw,     0, size, null);
        Arrays.fill(decoded, 0, size, null);
        size = 0;
    }
    
    /**
     * Replaces the contents of this object with the contents of the given.
     * 
     * @param other source
     */
    public void copyFrom(Params other) {
        clear();
        for (int i = 0; i < other.size; ++i) {
            add(other.names[i], other.raw[i], other.decoded[i]);
        }
    }
    
    void add(String name, String rawValue, String decodedValue) {
        if (size == names.length) {
            int c = size * 2;
            names   = Arrays.copyOf(names, c);
            raw     = Arrays.copyOf(raw, c);
            decoded = Arrays.copyOf(decoded, c);
        }
        names[size]   = name;
        raw[size]     = rawValue;
        decoded[size] = decodedValue;
        ++size;
    }
    
    void truncate(int newSize) {
        assert newSize <= size;
        Arrays.fill(names,   newSize, size, null);
        Arrays.fill(raw,     newSize, size, null);
        Arrays.fill(decoded, newSize, size, null);
        size = newSize;
    }
    
    private int indexOf(String name) {
        for (int i = 0; i < size; ++i) {
            if (names[i].equals(name)) {
                return i;
            }
        }
        return -1;
    }
    
    @Override
    public String toString() {
        return asMap().toString();
    }
}
