package alpha.onionhttp.route;

import alpha.onionhttp.context.BadRequestException;
import alpha.onionhttp.handler.HandlerChain;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link RouteTree}.
 */
class RouteTreeTest
{
    private static final HandlerChain NOOP = HandlerChain.of(ctx -> {});
    
    private final RouteTree testee = new RouteTree("GET");
    
    // Simple match cases
    // ----
    
    @Test
    void match_root() {
        Route r = add("/");
        assertMatch("/", r);
        assertNoMatch("/blabla");
        assertNoMatch("");
    }
    
    @Test
    void literal_levels() {
        Route a = add("/a"),
              ab = add("/a/b");
        assertMatch("/a", a);
        assertMatch("/a/b", ab);
        assertNoMatch("/a/c");
        assertNoMatch("/b");
    }
    
    @Test
    void param_binds_segment() {
        Route r = add("/users/:id");
        assertMatch("/users/42", r, Map.of("id", "42"));
        assertNoMatch("/users");
        assertNoMatch("/users/42/x");
    }
    
    @Test
    void param_never_binds_empty_segment() {
        add("/users/:id");
        assertNoMatch("/users/");
    }
    
    @Test
    void two_params() {
        Route r = add("/:a/x/:b");
        assertMatch("/1/x/2", r, Map.of("a", "1", "b", "2"));
    }
    
    @Test
    void trailing_slash_is_exact() {
        Route noSlash = add("/users"),
              slash   = add("/users/");
        assertMatch("/users", noSlash);
        assertMatch("/users/", slash);
    }
    
    @Test
    void case_is_exact() {
        add("/Users");
        assertNoMatch("/users");
    }
    
    // Catch-all
    // ----
    
    @Test
    void catch_all_binds_rest() {
        Route r = add("/src/*filepath");
        assertMatch("/src/", r, Map.of("filepath", "/"));
        assertMatch("/src/a", r, Map.of("filepath", "/a"));
        assertMatch("/src/a/b", r, Map.of("filepath", "/a/b"));
        assertMatch("/src/a/b/", r, Map.of("filepath", "/a/b/"));
        assertNoMatch("/src");
    }
    
    @Test
    void root_catch_all() {
        Route r = add("/*all");
        assertMatch("/", r, Map.of("all", "/"));
        assertMatch("/x/y", r, Map.of("all", "/x/y"));
    }
    
    // Precedence
    // ----
    
    @Test
    void static_beats_param() {
        Route lit = add("/users/new"),
              par = add("/users/:id");
        assertMatch("/users/new", lit);
        assertMatch("/users/old", par, Map.of("id", "old"));
    }
    
    @Test
    void static_beats_param_regardless_of_order() {
        Route par = add("/users/:id"),
              lit = add("/users/new");
        assertMatch("/users/new", lit);
        assertMatch("/users/7", par, Map.of("id", "7"));
    }
    
    @Test
    void param_beats_catch_all() {
        Route par = add("/files/:name"),
              all = add("/files/*path");
        assertMatch("/files/a", par, Map.of("name", "a"));
        assertMatch("/files/a/b", all, Map.of("path", "/a/b"));
        assertMatch("/files/", all, Map.of("path", "/"));
    }
    
    @Test
    void backtrack_from_static_to_param() {
        Route lit = add("/a/b/c"),
              par = add("/a/:x/d");
        assertMatch("/a/b/c", lit);
        assertMatch("/a/b/d", par, Map.of("x", "b"));
    }
    
    @Test
    void backtrack_from_param_to_catch_all() {
        Route par = add("/a/:x/c"),
              all = add("/a/*rest");
        assertMatch("/a/b/c", par, Map.of("x", "b"));
        // Param binding of "b" must not survive the backtrack
        assertMatch("/a/b/z", all, Map.of("rest", "/b/z"));
    }
    
    // Decoding
    // ----
    
    @Test
    void segments_are_decoded() {
        Route lit = add("/a b"),
              par = add("/p/:v");
        assertMatch("/a%20b", lit);
        
        Params p = new Params(1);
        assertThat(testee.lookup("/p/x%2Fy", p)).isSameAs(par);
        assertThat(p.get("v")).isEqualTo("x/y");
        assertThat(p.getRaw("v")).isEqualTo("x%2Fy");
    }
    
    @Test
    void plus_is_not_space() {
        Route r = add("/p/:v");
        assertMatch("/p/a+b", r, Map.of("v", "a+b"));
    }
    
    @Test
    void malformed_escape_is_bad_request() {
        add("/p/:v");
        assertThatThrownBy(() -> testee.lookup("/p/%zz"))
                .isExactlyInstanceOf(BadRequestException.class)
                .hasMessage("Failed to percent-decode path segment: %zz");
    }
    
    // Collisions
    // ----
    
    @Test
    void duplicate_pattern() {
        add("/a/:x");
        assertThatThrownBy(() -> add("/a/:x"))
                .isExactlyInstanceOf(RouteCollisionException.class)
                .hasMessage("Route \"GET /a/:x\" is equivalent to an already added route \"GET /a/:x\".");
    }
    
    @Test
    void different_param_names_at_same_position() {
        add("/a/:x");
        assertThatThrownBy(() -> add("/a/:y/b"))
                .isExactlyInstanceOf(RouteCollisionException.class)
                .hasMessage("Segment \":y\" of route \"/a/:y/b\" conflicts with \":x\" already registered at the same position.");
    }
    
    @Test
    void different_catch_all_names_at_same_position() {
        add("/a/*x");
        assertThatThrownBy(() -> add("/a/*y"))
                .isExactlyInstanceOf(RouteCollisionException.class)
                .hasMessage("Segment \"*y\" of route \"/a/*y\" conflicts with \"*x\" already registered at the same position.");
    }
    
    @Test
    void empty_chain_rejected() {
        assertThatThrownBy(() -> testee.add("/a", HandlerChain.EMPTY))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Route \"/a\" has no handler.");
    }
    
    @Test
    void bookkeeping() {
        Route a = add("/a"),
              b = add("/b/:x/*y");
        assertThat(testee.routes()).containsExactly(a, b);
        assertThat(testee.maxParams()).isEqualTo(2);
        assertThat(a.toString()).isEqualTo("GET /a");
    }
    
    private Route add(String pattern) {
        return testee.add(pattern, NOOP);
    }
    
    private void assertMatch(String path, Route expected) {
        assertMatch(path, expected, Map.of());
    }
    
    private void assertMatch(String path, Route expected, Map<String, String> params) {
        RouteTree.Match m = testee.lookup(path);
        assertThat(m).isNotNull();
        assertThat(m.route()).isSameAs(expected);
        assertThat(m.params().asMap()).isEqualTo(params);
    }
    
    private void assertNoMatch(String path) {
        assertThat(testee.lookup(path)).isNull();
    }
}
