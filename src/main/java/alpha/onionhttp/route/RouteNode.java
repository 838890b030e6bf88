package alpha.onionhttp.route;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One segment position of a {@link RouteTree}.<p>
 * 
 * A node has any number of static children keyed by their literal, at most one
 * single-segment parameter child and at most one catch-all child. Only the
 * node at the end of a registered pattern carries a {@link Route}.<p>
 * 
 * Nodes are mutated only during registration and are not thread-safe.
 */
final class RouteNode
{
    private final String segment;
    private final Map<String, RouteNode> statics = new LinkedHashMap<>();
    private RouteNode param,
                      catchAll;
    private Route route;
    
    RouteNode(String segment) {
        this.segment = segment;
    }
    
    /** Returns the parameter name (segment without prefix). */
    String name() {
        return segment.substring(1);
    }
    
    Route route() {
        return route;
    }
    
    void route(Route r) {
        assert route == null;
        route = r;
    }
    
    RouteNode staticChild(String literal) {
        return statics.get(literal);
    }
    
    RouteNode paramChild() {
        return param;
    }
    
    RouteNode catchAllChild() {
        return catchAll;
    }
    
    RouteNode staticChildOrCreate(String literal) {
        return statics.computeIfAbsent(literal, RouteNode::new);
    }
    
    /**
     * Returns the parameter child, creating it if absent.
     * 
     * @throws RouteCollisionException
     *             if a parameter child with a different name exists
     */
    RouteNode paramChildOrCreate(String segment, String pattern) {
        if (param == null) {
            param = new RouteNode(segment);
        } else if (!param.segment.equals(segment)) {
            throw exclusiveChildTaken(param, segment, pattern);
        }
        return param;
    }
    
    /**
     * Returns the catch-all child, creating it if absent.
     * 
     * @throws RouteCollisionException
     *             if a catch-all child with a different name exists
     */
    RouteNode catchAllChildOrCreate(String segment, String pattern) {
        if (catchAll == null) {
            catchAll = new RouteNode(segment);
        } else if (!catchAll.segment.equals(segment)) {
            throw exclusiveChildTaken(catchAll, segment, pattern);
        }
        return catchAll;
    }
    
    private static RouteCollisionException exclusiveChildTaken(
            RouteNode existing, String segment, String pattern)
    {
        return new RouteCollisionException(
                "Segment \"" + segment + "\" of route \"" + pattern +
                "\" conflicts with \"" + existing.segment +
                "\" already registered at the same position.");
    }
    
    @Override
    public String toString() {
        return segment.isEmpty() ? "/" : segment;
    }
}
