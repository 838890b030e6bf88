package alpha.onionhttp.context;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * The response channel of a transport.<p>
 * 
 * Only {@link ResponseWriter} calls this interface, at most once per request.
 */
@FunctionalInterface
public interface RawResponse
{
    /**
     * Sends the status line and headers.<p>
     * 
     * The length is the exact number of body bytes that will follow, where
     * zero means no body. The value -1 means the length is not known and the
     * body is streamed until the returned stream is closed.
     * 
     * @param status  status code
     * @param headers response headers
     * @param length  body length, or -1 if unknown
     * 
     * @return the body stream, to be closed by the caller
     * 
     * @throws IOException if an I/O error occurs
     */
    OutputStream commit(int status, Map<String, List<String>> headers, long length)
            throws IOException;
}
