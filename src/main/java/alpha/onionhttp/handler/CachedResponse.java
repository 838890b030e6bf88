package alpha.onionhttp.handler;

import java.util.List;
import java.util.Map;

/**
 * A response stored by {@link Middlewares#responseCache(
 * alpha.onionhttp.guard.FragmentCache, java.time.Duration)}.
 * 
 * @param status  status code
 * @param headers response headers
 * @param body    response body
 */
public record CachedResponse(int status, Map<String, List<String>> headers, byte[] body)
{
    /**
     * Constructs a {@code CachedResponse}.
     */
    public CachedResponse {
        headers = Map.copyOf(headers);
        body = body.clone();
    }
    
    @Override
    public byte[] body() {
        return body.clone();
    }
}
