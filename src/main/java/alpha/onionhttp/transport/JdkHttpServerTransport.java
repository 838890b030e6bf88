package alpha.onionhttp.transport;

import alpha.onionhttp.Engine;
import alpha.onionhttp.context.RawRequest;
import alpha.onionhttp.context.RawResponse;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static alpha.onionhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.onionhttp.HttpConstants.Method.HEAD;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Serves an {@link Engine} over the JDK's built-in HTTP server.<p>
 * 
 * The JDK server parses requests; this class only adapts its exchange to
 * {@link RawRequest} and {@link RawResponse}. Each request is served on a
 * thread of a cached thread pool.
 * 
 * <pre>{@code
 *   try (JdkHttpServerTransport t = JdkHttpServerTransport.start(
 *           engine, new InetSocketAddress(8080))) {
 *       ...
 *   }
 * }</pre>
 */
public final class JdkHttpServerTransport implements Closeable
{
    private static final System.Logger LOG
            = System.getLogger(JdkHttpServerTransport.class.getPackageName());
    
    private final HttpServer server;
    private final ExecutorService executor;
    
    private JdkHttpServerTransport(HttpServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }
    
    /**
     * Binds to the given address and starts serving.
     * 
     * @param engine to serve
     * @param address to bind, port 0 for a system-picked port
     * 
     * @return the started transport
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IOException if binding fails
     */
    public static JdkHttpServerTransport start(Engine engine, InetSocketAddress address)
            throws IOException
    {
        requireNonNull(engine);
        HttpServer s = HttpServer.create(requireNonNull(address), 0);
        ExecutorService ex = Executors.newCachedThreadPool();
        s.setExecutor(ex);
        s.createContext("/", exchange -> serve(engine, exchange));
        s.start();
        JdkHttpServerTransport t = new JdkHttpServerTransport(s, ex);
        LOG.log(INFO, () -> "Listening on " + t.address());
        return t;
    }
    
    private static void serve(Engine engine, HttpExchange exchange) throws IOException {
        try {
            engine.serveOne(new ExchangeRequest(exchange), new ExchangeResponse(exchange));
        } finally {
            exchange.close();
        }
    }
    
    /**
     * Returns the bound address.
     * 
     * @return the bound address
     */
    public InetSocketAddress address() {
        return server.getAddress();
    }
    
    /**
     * Stops the server, closing all connections, and shuts down the thread
     * pool.
     */
    @Override
    public void close() {
        server.stop(0);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.log(WARNING, "Request threads did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.log(WARNING, "Interrupted while awaiting request threads.", e);
        }
    }
    
    private record ExchangeRequest(HttpExchange exchange) implements RawRequest {
        @Override
        public String method() {
            return exchange.getRequestMethod();
        }
        
        @Override
        public String path() {
            return exchange.getRequestURI().getRawPath();
        }
        
        @Override
        public String query() {
            return exchange.getRequestURI().getRawQuery();
        }
        
        @Override
        public Map<String, List<String>> headers() {
            // Headers normalizes keys; lookups are case-insensitive
            return exchange.getRequestHeaders();
        }
        
        @Override
        public InputStream body() {
            return exchange.getRequestBody();
        }
        
        @Override
        public InetSocketAddress remoteAddress() {
            return exchange.getRemoteAddress();
        }
    }
    
    private record ExchangeResponse(HttpExchange exchange) implements RawResponse {
        @Override
        public OutputStream commit(int status, Map<String, List<String>> headers, long length)
                throws IOException
        {
            Headers h = exchange.getResponseHeaders();
            headers.forEach((name, values) -> h.put(name, List.copyOf(values)));
            
            if (HEAD.equals(exchange.getRequestMethod())) {
                if (length > 0) {
                    h.set(CONTENT_LENGTH, Long.toString(length));
                }
                exchange.sendResponseHeaders(status, -1);
                return OutputStream.nullOutputStream();
            }
            
            // JDK: 0 means chunked, -1 means no body
            final long jdk = length == 0 ? -1 : length == -1 ? 0 : length;
            exchange.sendResponseHeaders(status, jdk);
            return exchange.getResponseBody();
        }
    }
}
