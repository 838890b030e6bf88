package alpha.onionhttp;

import alpha.onionhttp.context.RequestContext;
import alpha.onionhttp.handler.ErrorHandler;
import alpha.onionhttp.handler.Handler;
import alpha.onionhttp.route.Route;
import alpha.onionhttp.route.RouteCollisionException;
import alpha.onionhttp.testutil.Logging;
import alpha.onionhttp.testutil.TestRequest;
import alpha.onionhttp.testutil.TestResponse;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static java.util.stream.Collectors.toList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Engine}; the whole dispatch path over a fake
 * transport.
 */
class EngineTest
{
    private Engine testee = Engine.create();
    private final List<String> trace = new ArrayList<>();
    
    // Routing
    // ----
    
    @Test
    void route_with_param() throws IOException {
        testee.get("/users/:id", ctx -> ctx.string(200, "user " + ctx.param("id")));
        TestResponse res = serve(TestRequest.get("/users/42"));
        assertThat(res.status()).isEqualTo(200);
        assertThat(res.body()).isEqualTo("user 42");
    }
    
    @Test
    void static_beats_param() throws IOException {
        testee.get("/users/new", ctx -> ctx.string(200, "new"));
        testee.get("/users/:id", ctx -> ctx.string(200, "id=" + ctx.param("id")));
        assertThat(serve(TestRequest.get("/users/new")).body()).isEqualTo("new");
        assertThat(serve(TestRequest.get("/users/7")).body()).isEqualTo("id=7");
    }
    
    @Test
    void param_vs_catch_all() throws IOException {
        testee.get("/static/*filepath", ctx -> ctx.string(200, ctx.param("filepath")));
        testee.get("/static/:name/info", ctx -> ctx.string(200, "info " + ctx.param("name")));
        assertThat(serve(TestRequest.get("/static/css/info")).body()).isEqualTo("info css");
        assertThat(serve(TestRequest.get("/static/css/site.css")).body()).isEqualTo("/css/site.css");
        assertThat(serve(TestRequest.get("/static/")).body()).isEqualTo("/");
        assertThat(serve(TestRequest.get("/static")).status()).isEqualTo(404);
    }
    
    @Test
    void full_path_and_raw_param() throws IOException {
        testee.get("/files/:name", ctx ->
                ctx.string(200, ctx.fullPath() + " " + ctx.param("name") + " " + ctx.paramRaw("name")));
        assertThat(serve(TestRequest.get("/files/a%20b")).body())
                .isEqualTo("/files/:name a b a%20b");
    }
    
    @Test
    void not_found() throws IOException {
        testee.get("/a", ctx -> ctx.string(200, "a"));
        TestResponse res = serve(TestRequest.get("/b"));
        assertThat(res.status()).isEqualTo(404);
        assertThat(res.body()).isEqualTo("404 page not found");
        assertThat(serve(TestRequest.of("POST", "/a")).status()).isEqualTo(404);
    }
    
    @Test
    void malformed_path_is_bad_request() throws IOException {
        testee.get("/p/:v", ctx -> ctx.string(200, "v"));
        TestResponse res = serve(TestRequest.get("/p/%zz"));
        assertThat(res.status()).isEqualTo(400);
        assertThat(res.body()).isEqualTo("400 bad request");
    }
    
    @Test
    void any_registers_all_methods() throws IOException {
        testee.any("/x", ctx -> ctx.string(200, ctx.method()));
        for (String m : HttpConstants.Method.ANY) {
            assertThat(serve(TestRequest.of(m, "/x")).body()).isEqualTo(m);
        }
        assertThat(testee.routes()).hasSize(HttpConstants.Method.ANY.size());
    }
    
    @Test
    void collision_surfaces_at_registration() {
        testee.get("/a/:x", ctx -> {});
        assertThatThrownBy(() -> testee.get("/a/:y", ctx -> {}))
                .isExactlyInstanceOf(RouteCollisionException.class);
        // Same pattern, other method, is fine
        testee.post("/a/:x", ctx -> {});
    }
    
    @Test
    void route_needs_a_handler() {
        assertThatThrownBy(() -> testee.get("/a"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Route \"/a\" has no handler.");
    }
    
    // Chain
    // ----
    
    @Test
    void onion_order_across_global_group_and_route() throws IOException {
        testee.use(wrap("global"));
        RouterGroup g = testee.group("/api", wrap("group"));
        g.get("/x", wrap("route"), ctx -> trace.add("final"));
        serve(TestRequest.get("/api/x"));
        assertThat(trace).containsExactly(
                "global-pre", "group-pre", "route-pre", "final",
                "route-post", "group-post", "global-post");
    }
    
    @Test
    void implicit_halt() throws IOException {
        testee.get("/x", wrap("a"), ctx -> trace.add("halt"), ctx -> trace.add("never"));
        serve(TestRequest.get("/x"));
        assertThat(trace).containsExactly("a-pre", "halt", "a-post");
    }
    
    @Test
    void abort_keeps_what_was_written() throws IOException {
        Handler auth = ctx -> {
            ctx.string(401, "no");
            ctx.abort();
        };
        testee.get("/x", auth, ctx -> trace.add("never"));
        TestResponse res = serve(TestRequest.get("/x"));
        assertThat(trace).isEmpty();
        assertThat(res.status()).isEqualTo(401);
        assertThat(res.body()).isEqualTo("no");
    }
    
    @Test
    void abort_without_write_commits_status() throws IOException {
        testee.get("/x", ctx -> ctx.abort(), ctx -> trace.add("never"));
        TestResponse res = serve(TestRequest.get("/x"));
        assertThat(res.status()).isEqualTo(200);
        assertThat(res.body()).isEmpty();
        assertThat(res.commits()).isOne();
    }
    
    @Test
    void middleware_added_later_does_not_apply_to_earlier_routes() throws IOException {
        RouterGroup g = testee.group("/g");
        g.get("/early", ctx -> trace.add("early"));
        g.use(ctx -> trace.add("late-mw"));
        g.get("/late", ctx -> trace.add("late"));
        serve(TestRequest.get("/g/early"));
        serve(TestRequest.get("/g/late"));
        // late-mw does not call next(), so "late" is never reached
        assertThat(trace).containsExactly("early", "late-mw");
    }
    
    @Test
    void nested_groups() throws IOException {
        RouterGroup v1 = testee.group("/api").group("v1/");
        assertThat(v1.basePath()).isEqualTo("/api/v1/");
        v1.get("/users", ctx -> ctx.string(200, "users"));
        assertThat(serve(TestRequest.get("/api/v1/users")).body()).isEqualTo("users");
    }
    
    // Errors
    // ----
    
    @Test
    void panic_is_contained() throws IOException {
        testee.get("/boom", wrap("mw"), ctx -> { throw new IllegalStateException("secret"); });
        testee.get("/ok", ctx -> ctx.string(200, "ok"));
        
        Logging.Recorder rec = Logging.startRecording(Engine.class);
        TestResponse res;
        List<LogRecord> logged;
        try {
            res = serve(TestRequest.get("/boom"));
        } finally {
            logged = Logging.stopRecording(rec).collect(toList());
        }
        
        assertThat(res.status()).isEqualTo(500);
        assertThat(res.body()).isEqualTo("500 internal server error").doesNotContain("secret");
        assertThat(trace).containsExactly("mw-pre");
        
        LogRecord err = logged.stream().filter(r -> r.getLevel() == Level.SEVERE).findFirst().orElseThrow();
        assertThat(err.getMessage()).isEqualTo("Handler chain failed: GET /boom");
        assertThat(err.getThrown()).hasMessage("secret");
        
        // Engine stays healthy
        for (int i = 0; i < 50; ++i) {
            assertThat(serve(TestRequest.get("/boom")).status()).isEqualTo(500);
        }
        assertThat(serve(TestRequest.get("/ok")).body()).isEqualTo("ok");
    }
    
    @Test
    void partial_response_is_discarded_on_error() throws IOException {
        testee.get("/x", ctx -> {
            ctx.setHeader("X-Partial", "1");
            ctx.string(200, "half");
            throw new IllegalStateException();
        });
        TestResponse res = serve(TestRequest.get("/x"));
        assertThat(res.status()).isEqualTo(500);
        assertThat(res.header("X-Partial")).isNull();
        assertThat(res.body()).isEqualTo("500 internal server error");
    }
    
    @Test
    void committed_response_is_left_alone() throws IOException {
        testee.get("/x", ctx -> {
            ctx.string(200, "streamed");
            ctx.writer().flush();
            throw new IllegalStateException();
        });
        TestResponse res = serve(TestRequest.get("/x"));
        assertThat(res.status()).isEqualTo(200);
        assertThat(res.body()).isEqualTo("streamed");
        assertThat(res.commits()).isOne();
    }
    
    @Test
    void failed_flush_still_gets_error_response() throws IOException {
        testee.get("/x", ctx -> {
            ctx.write(new byte[]{1});
            ctx.writer().flush();
        });
        TestResponse res = new TestResponse().failCommits(1);
        testee.serveOne(TestRequest.get("/x"), res);
        assertThat(res.status()).isEqualTo(500);
        assertThat(res.body()).isEqualTo("500 internal server error");
        assertThat(res.commits()).isOne();
    }
    
    @Test
    void transport_failure_propagates_as_io_exception() throws IOException {
        testee.get("/x", ctx -> {
            ctx.write(new byte[]{1});
            ctx.writer().flush();
        });
        testee.get("/ok", ctx -> ctx.string(200, "ok"));
        TestResponse dead = new TestResponse().failCommits(2);
        assertThatThrownBy(() -> testee.serveOne(TestRequest.get("/x"), dead))
                .isExactlyInstanceOf(IOException.class)
                .hasMessage("client gone");
        assertThat(dead.commits()).isZero();
        // Context went back to the pool in a usable state
        assertThat(serve(TestRequest.get("/ok")).body()).isEqualTo("ok");
    }
    
    @Test
    void custom_error_handlers_in_order() throws IOException {
        List<Throwable> seen = new ArrayList<>();
        ErrorHandler first = (thr, chain, ctx) -> {
            seen.add(thr);
            chain.proceed();
        };
        ErrorHandler second = (thr, chain, ctx) -> {
            if (thr instanceof IllegalArgumentException) {
                ctx.string(422, "unprocessable");
            } else {
                chain.proceed();
            }
        };
        testee = Engine.create(Config.DEFAULT, first, second);
        testee.get("/iae", ctx -> { throw new IllegalArgumentException(); });
        testee.get("/ise", ctx -> { throw new IllegalStateException(); });
        
        assertThat(serve(TestRequest.get("/iae")).status()).isEqualTo(422);
        assertThat(serve(TestRequest.get("/ise")).status()).isEqualTo(500);
        assertThat(seen).hasSize(2);
    }
    
    @Test
    void error_handler_sees_aborted_context_with_error() throws IOException {
        List<Object> seen = new ArrayList<>();
        testee.errorHandler((thr, chain, ctx) -> {
            seen.add(ctx.isAborted());
            seen.add(ctx.errors().contains(thr));
            chain.proceed();
        });
        testee.get("/x", ctx -> { throw new IOException(); });
        serve(TestRequest.get("/x"));
        assertThat(seen).containsExactly(true, true);
    }
    
    @Test
    void failing_error_handler_falls_back_to_base() throws IOException {
        testee.errorHandler((thr, chain, ctx) -> {
            ctx.string(418, "teapot");
            throw new IllegalStateException("handler bug");
        });
        testee.get("/x", ctx -> { throw new IOException(); });
        TestResponse res = serve(TestRequest.get("/x"));
        assertThat(res.status()).isEqualTo(500);
        assertThat(res.body()).isEqualTo("500 internal server error");
    }
    
    // Fallbacks
    // ----
    
    @Test
    void no_route_runs_global_middleware() throws IOException {
        testee.use(wrap("global"));
        testee.noRoute(ctx -> {
            trace.add("noRoute");
            ctx.string(404, "custom");
        });
        TestResponse res = serve(TestRequest.get("/nothing"));
        assertThat(trace).containsExactly("global-pre", "noRoute", "global-post");
        assertThat(res.status()).isEqualTo(404);
        assertThat(res.body()).isEqualTo("custom");
    }
    
    @Test
    void no_route_status_changed_skips_default_body() throws IOException {
        testee.noRoute(ctx -> ctx.status(410));
        TestResponse res = serve(TestRequest.get("/gone"));
        assertThat(res.status()).isEqualTo(410);
        assertThat(res.body()).isEmpty();
    }
    
    @Test
    void method_not_allowed() throws IOException {
        testee = Engine.create(Config.configuration().handleMethodNotAllowed(true).build());
        testee.get("/r/:id", ctx -> {});
        testee.put("/r/:id", ctx -> {});
        testee.post("/other", ctx -> {});
        TestResponse res = serve(TestRequest.of("DELETE", "/r/1"));
        assertThat(res.status()).isEqualTo(405);
        assertThat(res.header("Allow")).isEqualTo("GET, PUT");
        assertThat(res.body()).isEqualTo("405 method not allowed");
        
        assertThat(serve(TestRequest.of("DELETE", "/none")).status()).isEqualTo(404);
    }
    
    @Test
    void method_not_allowed_disabled_by_default() throws IOException {
        testee.get("/r", ctx -> {});
        assertThat(serve(TestRequest.of("DELETE", "/r")).status()).isEqualTo(404);
    }
    
    @Test
    void redirect_trailing_slash() throws IOException {
        testee = Engine.create(Config.configuration().redirectTrailingSlash(true).build());
        testee.get("/users", ctx -> {});
        testee.post("/items/", ctx -> {});
        
        TestResponse get = serve(TestRequest.get("/users/?page=2"));
        assertThat(get.status()).isEqualTo(301);
        assertThat(get.header("Location")).isEqualTo("/users?page=2");
        
        TestResponse post = serve(TestRequest.of("POST", "/items"));
        assertThat(post.status()).isEqualTo(307);
        assertThat(post.header("Location")).isEqualTo("/items/");
        
        assertThat(serve(TestRequest.get("/other/")).status()).isEqualTo(404);
    }
    
    @Test
    void redirect_trailing_slash_disabled_by_default() throws IOException {
        testee.get("/users", ctx -> {});
        assertThat(serve(TestRequest.get("/users/")).status()).isEqualTo(404);
    }
    
    // Lifecycle
    // ----
    
    @Test
    void registration_closes_on_first_request() throws IOException {
        testee.get("/a", ctx -> {});
        assertThat(testee.isStarted()).isFalse();
        serve(TestRequest.get("/a"));
        assertThat(testee.isStarted()).isTrue();
        
        assertThatThrownBy(() -> testee.get("/b", ctx -> {}))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Engine has started; registration is closed.");
        assertThatThrownBy(() -> testee.use(ctx -> {}))
                .isExactlyInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> testee.noRoute(ctx -> {}))
                .isExactlyInstanceOf(IllegalStateException.class);
    }
    
    @Test
    void routes_listing() {
        testee.get("/a", ctx -> {});
        testee.post("/b", ctx -> {});
        testee.get("/c", ctx -> {});
        assertThat(testee.routes()).extracting(Route::toString)
                .containsExactly("GET /a", "GET /c", "POST /b");
    }
    
    @Test
    void context_isolation_across_requests() throws IOException {
        testee.get("/x", ctx -> {
            if (ctx.query("set") != null) {
                ctx.set("secret", "s3cr3t");
            }
            ctx.next();
        }, ctx -> ctx.string(200, String.valueOf(ctx.get("secret").orElse("none"))));
        
        assertThat(serve(TestRequest.get("/x?set=1")).body()).isEqualTo("s3cr3t");
        assertThat(serve(TestRequest.get("/x")).body()).isEqualTo("none");
    }
    
    @Test
    void concurrent_requests() throws Exception {
        testee.use(ctx -> {
            ctx.set("id", ctx.param("id"));
            ctx.next();
        });
        testee.get("/echo/:id", ctx -> {
            RequestContext snapshot = ctx.copy();
            ctx.string(200, ctx.param("id") + "/" + ctx.getAny("id") + "/" + snapshot.param("id"));
        });
        
        ExecutorService ex = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; ++t) {
                final int thread = t;
                tasks.add(() -> {
                    for (int i = 0; i < 200; ++i) {
                        String id = thread + "-" + i;
                        TestResponse res = serve(TestRequest.get("/echo/" + id));
                        if (!res.body().equals(id + "/" + id + "/" + id)) {
                            return false;
                        }
                    }
                    return true;
                });
            }
            for (Future<Boolean> f : ex.invokeAll(tasks)) {
                assertThat(f.get()).isTrue();
            }
        } finally {
            ex.shutdown();
        }
    }
    
    private TestResponse serve(TestRequest req) throws IOException {
        TestResponse res = new TestResponse();
        testee.serveOne(req, res);
        return res;
    }
    
    private Handler wrap(String name) {
        return ctx -> {
            trace.add(name + "-pre");
            ctx.next();
            trace.add(name + "-post");
        };
    }
}
