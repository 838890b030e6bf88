package alpha.onionhttp.context;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static alpha.onionhttp.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.onionhttp.HttpConstants.StatusCode.isBodyless;
import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Accumulates the response of one request and commits it to the transport.<p>
 * 
 * Commit is deferred. Status and headers may be changed, and body bytes are
 * buffered, until either the engine finishes the request, or a handler calls
 * {@link #flush()} or {@link #writeHeaderNow()}. After commit, status and
 * header changes are logged on WARNING and ignored, and body bytes go straight
 * to the transport.<p>
 * 
 * Since the body is buffered, a middleware can still change headers after
 * {@code next()} returns, and the response carries an exact
 * {@code Content-Length}. A handler streaming a large body should call
 * {@code flush()} early.<p>
 * 
 * A writer belonging to a {@link RequestContext#copy() detached copy} rejects
 * all writes with {@link IllegalStateException}.<p>
 * 
 * The writer is owned by one request thread and is not thread-safe.
 */
public final class ResponseWriter
{
    private static final System.Logger LOG
            = System.getLogger(ResponseWriter.class.getPackageName());
    
    private final Map<String, List<String>> headers = new TreeMap<>(CASE_INSENSITIVE_ORDER);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private RawResponse raw;
    private OutputStream out;
    private ByteArrayOutputStream capture;
    private int status;
    private long size;
    private boolean committed, finished;
    
    ResponseWriter() {
        reset(null);
    }
    
    static ResponseWriter detached() {
        return new ResponseWriter();
    }
    
    void reset(RawResponse raw) {
        this.raw = raw;
        headers.clear();
        buffer.reset();
        out = null;
        capture = null;
        status = TWO_HUNDRED;
        size = -1;
        committed = false;
        finished = false;
    }
    
    /**
     * Returns the status code.<p>
     * 
     * The default is 200.
     * 
     * @return the status code
     */
    public int status() {
        return status;
    }
    
    /**
     * Sets the status code.<p>
     * 
     * If the response is committed, the call is logged and ignored.
     * 
     * @param code status code
     * 
     * @throws IllegalArgumentException if {@code code} is not a three-digit code
     */
    public void status(int code) {
        if (code < 100 || code > 999) {
            throw new IllegalArgumentException("Invalid status code: " + code);
        }
        if (committed) {
            if (code != status) {
                LOG.log(WARNING, () -> "Response already committed; status " +
                        status + " not changed to " + code + ".");
            }
            return;
        }
        status = code;
    }
    
    /**
     * Returns the number of body bytes written, or -1 if none has been written.
     * 
     * @return the number of body bytes written, or -1
     */
    public long size() {
        return size;
    }
    
    /**
     * Returns {@code true} if status and headers have been sent.
     * 
     * @return see JavaDoc
     */
    public boolean isCommitted() {
        return committed;
    }
    
    /**
     * Returns {@code true} if the response is committed or body bytes have
     * been written.
     * 
     * @return see JavaDoc
     */
    public boolean isWritten() {
        return committed || size != -1;
    }
    
    /**
     * Returns the first value of the named header.
     * 
     * @param name of header
     * 
     * @return the first value, or {@code null} if not set
     */
    public String header(String name) {
        List<String> v = headers.get(name);
        return v == null ? null : v.get(0);
    }
    
    /**
     * Returns a snapshot of the response headers.
     * 
     * @return a snapshot of the response headers (unmodifiable)
     */
    public Map<String, List<String>> headers() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        headers.forEach((k, v) -> m.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(m);
    }
    
    /**
     * Sets the named header, replacing any previous values.
     * 
     * @param name  of header
     * @param value of header
     */
    public void setHeader(String name, String value) {
        if (headerChangeRejected(name)) {
            return;
        }
        List<String> l = new ArrayList<>(1);
        l.add(value);
        headers.put(name, l);
    }
    
    /**
     * Adds a value to the named header.
     * 
     * @param name  of header
     * @param value to add
     */
    public void addHeader(String name, String value) {
        if (headerChangeRejected(name)) {
            return;
        }
        headers.computeIfAbsent(name, k -> new ArrayList<>(1)).add(value);
    }
    
    /**
     * Removes the named header.
     * 
     * @param name of header
     */
    public void removeHeader(String name) {
        if (!headerChangeRejected(name)) {
            headers.remove(name);
        }
    }
    
    /**
     * Discards status, headers and buffered body bytes, as if nothing had
     * been written.
     * 
     * @throws IllegalStateException if committed
     */
    public void discard() {
        if (committed) {
            throw new IllegalStateException("Response already committed.");
        }
        headers.clear();
        buffer.reset();
        capture = null;
        status = TWO_HUNDRED;
        size = -1;
    }
    
    private boolean headerChangeRejected(String name) {
        if (committed) {
            LOG.log(WARNING, () -> "Response already committed; header \"" +
                    name + "\" not changed.");
            return true;
        }
        return false;
    }
    
    /**
     * Writes body bytes.
     * 
     * @param bytes to write
     * 
     * @throws IOException if an I/O error occurs
     * @throws IllegalStateException if detached or finished
     */
    public void write(byte[] bytes) throws IOException {
        write(bytes, 0, bytes.length);
    }
    
    /**
     * Writes body bytes.
     * 
     * @param bytes to write
     * @param off   offset
     * @param len   number of bytes
     * 
     * @throws IOException if an I/O error occurs
     * @throws IllegalStateException if detached or finished
     */
    public void write(byte[] bytes, int off, int len) throws IOException {
        requireWritable();
        if (committed) {
            out.write(bytes, off, len);
        } else {
            buffer.write(bytes, off, len);
        }
        if (capture != null) {
            capture.write(bytes, off, len);
        }
        size = Math.max(size, 0) + len;
    }
    
    /**
     * Commits status and headers now, with a streamed body of unknown
     * length.<p>
     * 
     * Does nothing if already committed.
     * 
     * @throws IOException if an I/O error occurs
     * @throws IllegalStateException if detached or finished
     */
    public void writeHeaderNow() throws IOException {
        requireWritable();
        if (!committed) {
            commit(isBodyless(status) ? 0 : -1);
        }
    }
    
    /**
     * Commits, writes buffered bytes and flushes the transport's stream.
     * 
     * @throws IOException if an I/O error occurs
     * @throws IllegalStateException if detached or finished
     */
    public void flush() throws IOException {
        writeHeaderNow();
        out.flush();
    }
    
    /**
     * Starts a copy of all body bytes written from now on.<p>
     * 
     * Bytes written before this call are not included.
     */
    public void capture() {
        if (capture == null) {
            capture = new ByteArrayOutputStream();
        }
    }
    
    /**
     * Returns the bytes captured since {@link #capture()}.
     * 
     * @return the captured bytes, or {@code null} if not capturing
     */
    public byte[] captured() {
        return capture == null ? null : capture.toByteArray();
    }
    
    /**
     * Commits the response, if not already committed, and closes the body
     * stream.<p>
     * 
     * Called by the engine once per request, after the handler chain and the
     * error handlers.
     * 
     * @throws IOException if an I/O error occurs
     */
    public void finish() throws IOException {
        if (finished || raw == null) {
            return;
        }
        finished = true;
        if (!committed) {
            if (isBodyless(status) && buffer.size() > 0) {
                LOG.log(WARNING, () -> "Status " + status + " can not have a body, " +
                        buffer.size() + " byte(s) discarded.");
                buffer.reset();
            }
            commit(buffer.size());
        }
        out.close();
    }
    
    private void commit(long length) throws IOException {
        // Not committed unless the transport accepted the head
        out = raw.commit(status, headers(), length);
        committed = true;
        if (buffer.size() > 0) {
            buffer.writeTo(out);
            buffer.reset();
        }
    }
    
    private void requireWritable() {
        if (raw == null) {
            throw new IllegalStateException("Response writer is detached.");
        }
        if (finished) {
            throw new IllegalStateException("Response already finished.");
        }
    }
}
