package alpha.onionhttp.route;

import alpha.onionhttp.context.BadRequestException;
import alpha.onionhttp.handler.HandlerChain;
import alpha.onionhttp.util.PercentDecoder;

import java.util.ArrayList;
import java.util.List;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Collections.unmodifiableList;

/**
 * A prefix tree of routes registered for one HTTP method.<p>
 * 
 * Each level of the tree is one segment of the request path. When looking up a
 * path, the tree is traversed depth-first, and at each level the alternatives
 * are tried in this order:
 * 
 * <ol>
 *   <li>a static child with the same literal as the segment,</li>
 *   <li>the single-segment parameter child, which binds the segment (never an
 *       empty one),</li>
 *   <li>the catch-all child, which binds '/' followed by all remaining
 *       segments.</li>
 * </ol>
 * 
 * If a branch fails deeper down, the search backtracks and tries the next
 * alternative. This is how {@code /users/new} and {@code /users/:id} can both
 * be registered, and how a catch-all only wins if nothing more specific
 * matches.<p>
 * 
 * Trailing slash and case are significant. The pattern {@code /src/*p}
 * matches {@code /src/} with "p" bound to "/" and {@code /src/a/b} with "p"
 * bound to "/a/b", but it does not match {@code /src}.<p>
 * 
 * Registration is not thread-safe. Lookups are; the tree must not be modified
 * once it is used for lookups. The engine guarantees this by freezing
 * registration when the first request is served.
 */
public final class RouteTree
{
    private static final System.Logger LOG
            = System.getLogger(RouteTree.class.getPackageName());
    
    private final String method;
    private final RouteNode root = new RouteNode("");
    private final List<Route> routes = new ArrayList<>();
    private int maxParams;
    
    /**
     * Constructs a {@code RouteTree}.
     * 
     * @param method HTTP method of all routes in the tree
     */
    public RouteTree(String method) {
        this.method = method;
    }
    
    /**
     * Returns the HTTP method of all routes in the tree.
     * 
     * @return the HTTP method of all routes in the tree
     */
    public String method() {
        return method;
    }
    
    /**
     * Adds a route.
     * 
     * @param pattern of route
     * @param chain   of route
     * 
     * @return the added route
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code chain} is empty
     * @throws RoutePatternInvalidException
     *             if the pattern is malformed
     * @throws RouteCollisionException
     *             if the pattern is equivalent to an already added route, or a
     *             parameter name conflicts with the name already used at the
     *             same position
     */
    public Route add(String pattern, HandlerChain chain) {
        final PathPattern pp = PathPattern.parse(pattern);
        final Route r = new Route(method, pattern, chain);
        
        RouteNode n = root;
        for (String s : pp.segments()) {
            if (PathPattern.isParam(s)) {
                n = n.paramChildOrCreate(s, pattern);
            } else if (PathPattern.isCatchAll(s)) {
                n = n.catchAllChildOrCreate(s, pattern);
            } else {
                n = n.staticChildOrCreate(s);
            }
        }
        
        if (n.route() != null) {
            throw new RouteCollisionException(
                    "Route \"" + r + "\" is equivalent to an already added route \"" +
                    n.route() + "\".");
        }
        
        n.route(r);
        routes.add(r);
        maxParams = Math.max(maxParams, pp.paramCount());
        LOG.log(DEBUG, () -> "Added route: " + r);
        return r;
    }
    
    /**
     * Returns the greatest number of parameters declared by any route in the
     * tree.
     * 
     * @return see JavaDoc
     */
    public int maxParams() {
        return maxParams;
    }
    
    /**
     * Returns all routes, in registration order.
     * 
     * @return all routes (unmodifiable)
     */
    public List<Route> routes() {
        return unmodifiableList(routes);
    }
    
    /**
     * Looks up the route matching the given path.<p>
     * 
     * The given params object is cleared first. If a route matches, the
     * object contains the bound parameters when this method returns. If no
     * route matches, the object is empty.
     * 
     * @param rawPath request path, not percent-decoded and without query
     * @param into    params to bind
     * 
     * @return the matching route, or {@code null} if none matches
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws BadRequestException if a path segment can not be decoded
     */
    public Route lookup(String rawPath, Params into) {
        into.clear();
        if (rawPath.isEmpty() || rawPath.charAt(0) != '/') {
            return null;
        }
        
        final String[] raw = rawPath.length() == 1 ?
                new String[0] : rawPath.substring(1).split("/", -1);
        final String[] dec = new String[raw.length];
        for (int i = 0; i < raw.length; ++i) {
            try {
                dec[i] = PercentDecoder.decode(raw[i]);
            } catch (IllegalArgumentException e) {
                throw new BadRequestException(
                        "Failed to percent-decode path segment: " + raw[i], e);
            }
        }
        
        Route r = find(root, raw, dec, 0, into);
        if (r == null && raw.length == 0) {
            // "/" has no segments, but a root catch-all still binds "/"
            RouteNode c = root.catchAllChild();
            if (c != null && c.route() != null) {
                into.add(c.name(), "/", "/");
                r = c.route();
            }
        }
        if (r == null) {
            into.clear();
        }
        return r;
    }
    
    /**
     * Looks up the route matching the given path.
     * 
     * @param rawPath request path, not percent-decoded and without query
     * 
     * @return the match, or {@code null} if no route matches
     * 
     * @throws NullPointerException if {@code rawPath} is {@code null}
     * @throws BadRequestException if a path segment can not be decoded
     */
    public Match lookup(String rawPath) {
        Params p = new Params(maxParams);
        Route r = lookup(rawPath, p);
        return r == null ? null : new Match(r, p);
    }
    
    private static Route find(
            RouteNode n, String[] raw, String[] dec, int pos, Params into)
    {
        if (pos == raw.length) {
            return n.route();
        }
        
        final String seg = dec[pos];
        
        RouteNode s = n.staticChild(seg);
        if (s != null) {
            Route r = find(s, raw, dec, pos + 1, into);
            if (r != null) {
                return r;
            }
        }
        
        RouteNode p = n.paramChild();
        if (p != null && !seg.isEmpty()) {
            final int mark = into.size();
            into.add(p.name(), raw[pos], seg);
            Route r = find(p, raw, dec, pos + 1, into);
            if (r != null) {
                return r;
            }
            into.truncate(mark);
        }
        
        RouteNode c = n.catchAllChild();
        if (c != null && c.route() != null) {
            into.add(c.name(), rest(raw, pos), rest(dec, pos));
            return c.route();
        }
        
        return null;
    }
    
    private static String rest(String[] segments, int from) {
        StringBuilder b = new StringBuilder();
        for (int i = from; i < segments.length; ++i) {
            b.append('/').append(segments[i]);
        }
        return b.toString();
    }
    
    @Override
    public String toString() {
        return RouteTree.class.getSimpleName() + "{method=" + method + ", routes=" + routes + "}";
    }
    
    /**
     * A route matched by {@link #lookup(String)}.
     * 
     * @param route  the matched route
     * @param params the bound parameters
     */
    public record Match(Route route, Params params) {
        // Empty
    }
}
