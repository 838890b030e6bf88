package alpha.onionhttp.route;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.util.Collections.unmodifiableList;

/**
 * A parsed and validated route pattern.<p>
 * 
 * A pattern is a '/'-separated sequence of segments. A segment is either a
 * literal, a single-segment path parameter denoted by the prefix ':', or a
 * catch-all path parameter denoted by the prefix '*'.
 * 
 * <pre>
 *   /users/:id              literal "users", parameter "id"
 *   /static/*filepath       literal "static", catch-all "filepath"
 *   /users/                 literal "users", trailing slash
 * </pre>
 * 
 * Rules:
 * <ul>
 *   <li>The pattern must start with '/'.</li>
 *   <li>Empty segments are not allowed, except for a trailing slash, which is
 *       kept as an empty literal segment. {@code /users} and {@code /users/}
 *       are two different patterns.</li>
 *   <li>A parameter needs a name; ":" or "*" alone is rejected.</li>
 *   <li>A catch-all parameter must be the last segment.</li>
 *   <li>A parameter name must be unique within the pattern.</li>
 * </ul>
 * 
 * Literal segments are compared to percent-decoded request path segments and
 * should therefore be written decoded.
 */
public final class PathPattern
{
    private static final char COLON = ':',
                              ASTERISK = '*';
    
    private final String pattern;
    private final List<String> segments;
    private final int params;
    
    private PathPattern(String pattern, List<String> segments, int params) {
        this.pattern = pattern;
        this.segments = segments;
        this.params = params;
    }
    
    /**
     * Parses the given pattern.
     * 
     * @param pattern to parse
     * 
     * @return a path pattern
     * 
     * @throws NullPointerException if {@code pattern} is {@code null}
     * @throws RoutePatternInvalidException if the pattern is invalid
     */
    public static PathPattern parse(String pattern) {
        if (pattern.isEmpty() || pattern.charAt(0) != '/') {
            throw new RoutePatternInvalidException(pattern, "must start with '/'.");
        }
        if (pattern.length() == 1) {
            return new PathPattern(pattern, List.of(), 0);
        }
        
        String[] tokens = pattern.substring(1).split("/", -1);
        List<String> segments = new ArrayList<>(tokens.length);
        Set<String> names = new HashSet<>();
        
        for (int i = 0; i < tokens.length; ++i) {
            final String s = tokens[i];
            final boolean last = i == tokens.length - 1;
            
            if (s.isEmpty()) {
                if (!last) {
                    throw new RoutePatternInvalidException(pattern, "empty segment.");
                }
                // Trailing slash
                segments.add(s);
                continue;
            }
            
            if (isParam(s) || isCatchAll(s)) {
                String name = s.substring(1);
                if (name.isEmpty()) {
                    throw new RoutePatternInvalidException(pattern,
                            "parameter name missing in segment \"" + s + "\".");
                }
                if (isCatchAll(s) && !last) {
                    throw new RoutePatternInvalidException(pattern,
                            "catch-all segment \"" + s + "\" must be the last segment.");
                }
                if (!names.add(name)) {
                    throw new RoutePatternInvalidException(pattern,
                            "duplicated parameter name \"" + name + "\".");
                }
            }
            
            segments.add(s);
        }
        
        return new PathPattern(pattern, unmodifiableList(segments), names.size());
    }
    
    /**
     * Joins a group's absolute path with a relative path.<p>
     * 
     * A trailing slash on the relative path is preserved.
     * 
     * <pre>
     *   join("/api", "/users")    = "/api/users"
     *   join("/api/", "users/")   = "/api/users/"
     *   join("/api", "")          = "/api"
     *   join("/", "/")            = "/"
     * </pre>
     * 
     * @param absolute base path (starting with '/')
     * @param relative path to append
     * 
     * @return the joined path
     */
    public static String join(String absolute, String relative) {
        if (relative.isEmpty()) {
            return absolute;
        }
        String a = absolute.endsWith("/") ? absolute.substring(0, absolute.length() - 1) : absolute,
               r = relative.startsWith("/") ? relative : "/" + relative;
        String joined = a + r;
        return joined.isEmpty() ? "/" : joined;
    }
    
    static boolean isParam(String segment) {
        return !segment.isEmpty() && segment.charAt(0) == COLON;
    }
    
    static boolean isCatchAll(String segment) {
        return !segment.isEmpty() && segment.charAt(0) == ASTERISK;
    }
    
    /**
     * Returns the pattern as given to {@link #parse(String)}.
     * 
     * @return the pattern
     */
    public String pattern() {
        return pattern;
    }
    
    /**
     * Returns the segments, prefixes of parameter segments included.<p>
     * 
     * The root pattern "/" has no segments.
     * 
     * @return the segments (unmodifiable)
     */
    public List<String> segments() {
        return segments;
    }
    
    /**
     * Returns the number of parameters (single-segment and catch-all)
     * declared.
     * 
     * @return the number of parameters declared
     */
    public int paramCount() {
        return params;
    }
    
    @Override
    public String toString() {
        return pattern;
    }
}
