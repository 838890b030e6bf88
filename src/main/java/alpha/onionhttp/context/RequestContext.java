package alpha.onionhttp.context;

import alpha.onionhttp.Config;
import alpha.onionhttp.handler.Handler;
import alpha.onionhttp.handler.HandlerChain;
import alpha.onionhttp.route.Params;
import alpha.onionhttp.util.PercentDecoder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static alpha.onionhttp.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.onionhttp.HttpConstants.HeaderName.LOCATION;
import static alpha.onionhttp.HttpConstants.HeaderName.X_FORWARDED_FOR;
import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The request-scoped context passed through the handler chain.<p>
 * 
 * The context gives access to the request, the matched path parameters, a
 * key/value store shared by the handlers of the chain, an error list, and the
 * response. It also drives the chain; see {@link #next()} and {@link
 * #abort()}.<p>
 * 
 * Contexts are pooled by the engine and reused across requests. Everything is
 * reset when a context is reused, so nothing a handler stored leaks into the
 * next request. A context must not be retained after the request; a handler
 * that starts background work passes on a {@link #copy()}.<p>
 * 
 * A context is owned by one thread at a time and is not thread-safe.
 */
public final class RequestContext
{
    private static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    
    private final Config config;
    private final Params params = new Params(4);
    private final Map<String, Object> keys = new HashMap<>();
    private final List<Throwable> errors = new ArrayList<>();
    private final ResponseWriter writer;
    private final boolean detached;
    private RawRequest request;
    private Map<String, List<String>> queryCache;
    private HandlerChain chain;
    private String fullPath;
    private int cursor, current;
    private boolean aborted, released;
    
    RequestContext(Config config) {
        this(config, new ResponseWriter(), false);
    }
    
    private RequestContext(Config config, ResponseWriter writer, boolean detached) {
        this.config = requireNonNull(config);
        this.writer = writer;
        this.detached = detached;
        this.chain = HandlerChain.EMPTY;
        this.current = -1;
    }
    
    // Engine-facing
    // ----
    
    /**
     * Binds this context to a new request.<p>
     * 
     * All state of a previous request is cleared. Called by the engine.
     * 
     * @param request  the request
     * @param response the response channel
     * 
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalStateException if this context is released or detached
     */
    public void init(RawRequest request, RawResponse response) {
        requireActive();
        this.request = requireNonNull(request);
        writer.reset(requireNonNull(response));
        params.clear();
        keys.clear();
        errors.clear();
        queryCache = null;
        chain = HandlerChain.EMPTY;
        fullPath = null;
        cursor = 0;
        current = -1;
        aborted = false;
    }
    
    /**
     * Sets the chain to run.<p>
     * 
     * Called by the engine after route lookup, before the first {@link
     * #next()}.
     * 
     * @param chain    to run
     * @param fullPath the matched route pattern, or {@code null} if none matched
     * 
     * @throws IllegalStateException if the chain has already started
     */
    public void handlers(HandlerChain chain, String fullPath) {
        requireActive();
        if (cursor != 0) {
            throw new IllegalStateException("Chain already started.");
        }
        this.chain = requireNonNull(chain);
        this.fullPath = fullPath;
    }
    
    /**
     * Returns the path parameters; bound by the engine's route lookup.
     * 
     * @return the path parameters
     */
    public Params params() {
        return params;
    }
    
    /**
     * Returns the response writer.
     * 
     * @return the response writer
     */
    public ResponseWriter writer() {
        return writer;
    }
    
    boolean markReleased() {
        if (detached) {
            throw new IllegalArgumentException("A detached copy can not be released.");
        }
        if (released) {
            return false;
        }
        released = true;
        request = null;
        writer.reset(null);
        return true;
    }
    
    void markAcquired() {
        released = false;
    }
    
    boolean isReleased() {
        return released;
    }
    
    private void requireActive() {
        if (released) {
            throw new IllegalStateException("Context has been released.");
        }
        if (detached) {
            throw new IllegalStateException("Context is a detached copy.");
        }
    }
    
    // Chain
    // ----
    
    /**
     * Runs the rest of the chain.<p>
     * 
     * Invokes the next handler, which may in turn call this method, and so on.
     * When this method returns, the whole downstream chain has finished.<p>
     * 
     * The call is a no-op if the context is aborted, if the chain is
     * exhausted, or if the caller already ran the downstream chain. In
     * particular, a handler that returns without calling {@code next()} halts
     * the chain; outer handlers calling {@code next()} again will not resume
     * it.
     * 
     * @throws Exception from a downstream handler
     * @throws IllegalStateException if this context has been released
     */
    public void next() throws Exception {
        if (released) {
            throw new IllegalStateException("Context has been released.");
        }
        if (aborted || cursor >= chain.size() || cursor != current + 1) {
            return;
        }
        final int caller = current;
        current = cursor++;
        try {
            Handler h = chain.get(current);
            h.handle(this);
        } finally {
            current = caller;
        }
    }
    
    /**
     * Prevents pending handlers from being entered.<p>
     * 
     * The remaining code of the current handler still runs, as does the
     * post-processing of outer handlers already inside their {@code next()}
     * call.
     */
    public void abort() {
        aborted = true;
    }
    
    /**
     * Sets the status, then aborts.
     * 
     * @param code status code
     * 
     * @see #abort()
     */
    public void abortWithStatus(int code) {
        writer.status(code);
        abort();
    }
    
    /**
     * Records the error, sets the status, then aborts.
     * 
     * @param code status code
     * @param err  error
     * 
     * @see #abort()
     * @see #addError(Throwable)
     */
    public void abortWithError(int code, Throwable err) {
        addError(err);
        abortWithStatus(code);
    }
    
    /**
     * Returns {@code true} if this context has been aborted.
     * 
     * @return see JavaDoc
     */
    public boolean isAborted() {
        return aborted;
    }
    
    /**
     * Returns the route pattern that matched the request, e.g.
     * "/users/:id".
     * 
     * @return the matched pattern, or {@code null} if no route matched
     */
    public String fullPath() {
        return fullPath;
    }
    
    // Key/value store
    // ----
    
    /**
     * Stores a value.
     * 
     * @param name  of key
     * @param value to store ({@code null} removes)
     */
    public void set(String name, Object value) {
        if (value == null) {
            keys.remove(name);
        } else {
            keys.put(name, value);
        }
    }
    
    /**
     * Stores a value.
     * 
     * @param key   typed key
     * @param value to store ({@code null} removes)
     * @param <T>   value type
     */
    public <T> void set(Key<T> key, T value) {
        set(key.name(), value);
    }
    
    /**
     * Returns a stored value.
     * 
     * @param name of key
     * 
     * @return the value, if stored
     */
    public Optional<Object> get(String name) {
        return Optional.ofNullable(keys.get(name));
    }
    
    /**
     * Returns a stored value.
     * 
     * @param key typed key
     * @param <T> value type
     * 
     * @return the value, if stored
     * 
     * @throws ClassCastException if the stored value is not of the key's type
     */
    public <T> Optional<T> get(Key<T> key) {
        return get(key.name()).map(key.type()::cast);
    }
    
    /**
     * Returns a stored value, or {@code null}.
     * 
     * @param name of key
     * @param <T> value type, unchecked
     * 
     * @return the value, or {@code null} if not stored
     */
    @SuppressWarnings("unchecked")
    public <T> T getAny(String name) {
        return (T) keys.get(name);
    }
    
    /**
     * Returns a snapshot of all stored values.
     * 
     * @return a snapshot (unmodifiable)
     */
    public Map<String, Object> keys() {
        return unmodifiableMap(new HashMap<>(keys));
    }
    
    // Errors
    // ----
    
    /**
     * Records a non-fatal error.
     * 
     * @param err to record
     * 
     * @throws NullPointerException if {@code err} is {@code null}
     */
    public void addError(Throwable err) {
        errors.add(requireNonNull(err));
    }
    
    /**
     * Returns all recorded errors, in the order recorded.
     * 
     * @return the errors (unmodifiable)
     */
    public List<Throwable> errors() {
        return unmodifiableList(errors);
    }
    
    // Request
    // ----
    
    /**
     * Returns the request.
     * 
     * @return the request
     */
    public RawRequest request() {
        return request;
    }
    
    /**
     * Returns the request method.
     * 
     * @return the request method
     */
    public String method() {
        return request.method();
    }
    
    /**
     * Returns the raw request path.
     * 
     * @return the raw request path
     */
    public String path() {
        return request.path();
    }
    
    /**
     * Returns the percent-decoded value of a path parameter.
     * 
     * @param name of parameter
     * 
     * @return the value, or {@code null} if not bound
     */
    public String param(String name) {
        return params.get(name);
    }
    
    /**
     * Returns the raw value of a path parameter.
     * 
     * @param name of parameter
     * 
     * @return the raw value, or {@code null} if not bound
     */
    public String paramRaw(String name) {
        return params.getRaw(name);
    }
    
    /**
     * Returns the first decoded value of a query parameter.
     * 
     * @param name of parameter
     * 
     * @return the first value, or {@code null} if absent
     * 
     * @throws BadRequestException if the query can not be decoded
     */
    public String query(String name) {
        List<String> v = queryMap().get(name);
        return v == null ? null : v.get(0);
    }
    
    /**
     * Returns the first decoded value of a query parameter, or a default.
     * 
     * @param name of parameter
     * @param defaultValue returned if the parameter is absent
     * 
     * @return the first value, or {@code defaultValue}
     * 
     * @throws BadRequestException if the query can not be decoded
     */
    public String query(String name, String defaultValue) {
        String v = query(name);
        return v == null ? defaultValue : v;
    }
    
    /**
     * Returns all decoded values of a query parameter.
     * 
     * @param name of parameter
     * 
     * @return all values (unmodifiable, possibly empty)
     * 
     * @throws BadRequestException if the query can not be decoded
     */
    public List<String> queries(String name) {
        return queryMap().getOrDefault(name, List.of());
    }
    
    /**
     * Returns all decoded query parameters, in order of appearance.
     * 
     * @return all query parameters (unmodifiable)
     * 
     * @throws BadRequestException if the query can not be decoded
     */
    public Map<String, List<String>> queryMap() {
        if (queryCache == null) {
            queryCache = parseQuery(request.query());
        }
        return queryCache;
    }
    
    private static Map<String, List<String>> parseQuery(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> m = new LinkedHashMap<>();
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String k = eq == -1 ? pair : pair.substring(0, eq),
                   v = eq == -1 ? "" : pair.substring(eq + 1);
            try {
                m.computeIfAbsent(PercentDecoder.decodeQuery(k), x -> new ArrayList<>())
                 .add(PercentDecoder.decodeQuery(v));
            } catch (IllegalArgumentException e) {
                throw new BadRequestException("Failed to decode query: " + raw, e);
            }
        }
        m.replaceAll((k, v) -> unmodifiableList(v));
        return unmodifiableMap(m);
    }
    
    /**
     * Returns the first value of a request header.
     * 
     * @param name of header (case-insensitive)
     * 
     * @return the first value, or {@code null} if absent
     */
    public String header(String name) {
        List<String> v = request.headers().get(name);
        return v == null || v.isEmpty() ? null : v.get(0);
    }
    
    /**
     * Returns the request body.
     * 
     * @return the request body
     */
    public InputStream body() {
        return request.body();
    }
    
    /**
     * Returns the client's IP address.<p>
     * 
     * If {@link Config#trustForwardedFor()} is enabled and the request has an
     * {@code X-Forwarded-For} header, the first address of the header is
     * returned. Otherwise, the address of the connected peer.
     * 
     * @return the client's IP address, or the empty string if unknown
     */
    public String clientIp() {
        if (config.trustForwardedFor()) {
            String xff = header(X_FORWARDED_FOR);
            if (xff != null) {
                int c = xff.indexOf(',');
                String first = (c == -1 ? xff : xff.substring(0, c)).strip();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        InetSocketAddress a = request.remoteAddress();
        if (a == null) {
            return "";
        }
        return a.getAddress() == null ? a.getHostString() : a.getAddress().getHostAddress();
    }
    
    // Response
    // ----
    
    /**
     * Sets the response status.
     * 
     * @param code status code
     * 
     * @see ResponseWriter#status(int)
     */
    public void status(int code) {
        writer.status(code);
    }
    
    /**
     * Sets a response header, replacing any previous values.
     * 
     * @param name  of header
     * @param value of header
     */
    public void setHeader(String name, String value) {
        writer.setHeader(name, value);
    }
    
    /**
     * Adds a response header value.
     * 
     * @param name  of header
     * @param value to add
     */
    public void addHeader(String name, String value) {
        writer.addHeader(name, value);
    }
    
    /**
     * Writes body bytes.
     * 
     * @param bytes to write
     * 
     * @throws IOException if an I/O error occurs
     */
    public void write(byte[] bytes) throws IOException {
        writer.write(bytes);
    }
    
    /**
     * Responds with a plain text body.
     * 
     * @param code status code
     * @param body text
     * 
     * @throws IOException if an I/O error occurs
     */
    public void string(int code, String body) throws IOException {
        data(code, TEXT_PLAIN, body.getBytes(UTF_8));
    }
    
    /**
     * Responds with a body of the given content type.
     * 
     * @param code        status code
     * @param contentType of body
     * @param body        bytes
     * 
     * @throws IOException if an I/O error occurs
     */
    public void data(int code, String contentType, byte[] body) throws IOException {
        writer.status(code);
        writer.setHeader(CONTENT_TYPE, contentType);
        writer.write(body);
    }
    
    /**
     * Responds with a redirect.
     * 
     * @param code     a 3XX status code, or 201 (Created)
     * @param location target
     * 
     * @throws IllegalArgumentException if {@code code} is not a redirect code
     */
    public void redirect(int code, String location) {
        if ((code < 300 || code > 308) && code != 201) {
            throw new IllegalArgumentException("Cannot redirect with status code " + code);
        }
        writer.status(code);
        writer.setHeader(LOCATION, location);
    }
    
    // Copy
    // ----
    
    /**
     * Returns a detached snapshot of this context.<p>
     * 
     * The copy holds the path parameters, stored values, errors, matched
     * pattern and request metadata (method, path, query, headers, client
     * address). It has no body and no chain, and its response writer rejects
     * writes. The copy may be retained and used by another thread after the
     * request has finished.
     * 
     * @return a detached copy
     */
    public RequestContext copy() {
        RequestContext c = new RequestContext(config, ResponseWriter.detached(), true);
        if (request != null) {
            Map<String, List<String>> h = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            request.headers().forEach((k, v) -> h.put(k, List.copyOf(v)));
            c.request = new SnapshotRequest(
                    request.method(), request.path(), request.query(),
                    unmodifiableMap(h), request.remoteAddress());
        }
        c.params.copyFrom(params);
        c.keys.putAll(keys);
        c.errors.addAll(errors);
        c.fullPath = fullPath;
        c.aborted = true;
        c.writer.status(writer.status());
        return c;
    }
    
    @Override
    public String toString() {
        return RequestContext.class.getSimpleName() + "{" +
                (request == null ? "unbound" : request.method() + " " + request.path()) +
                ", cursor=" + cursor +
                ", aborted=" + aborted + "}";
    }
    
    private record SnapshotRequest(
            String method, String path, String query,
            Map<String, List<String>> headers, InetSocketAddress remoteAddress)
            implements RawRequest
    {
        @Override
        public InputStream body() {
            return new ByteArrayInputStream(new byte[0]);
        }
    }
}
