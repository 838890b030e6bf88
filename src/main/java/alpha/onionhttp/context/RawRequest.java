package alpha.onionhttp.context;

import java.io.InputStream;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;

/**
 * The request as delivered by a transport.<p>
 * 
 * The engine does no parsing of the HTTP wire format. A transport hands over
 * an already parsed request through this interface.
 */
public interface RawRequest
{
    /**
     * Returns the method token, e.g. "GET".
     * 
     * @return the method token
     */
    String method();
    
    /**
     * Returns the path of the request-target, not percent-decoded and without
     * the query.
     * 
     * @return the raw path
     */
    String path();
    
    /**
     * Returns the query of the request-target, not decoded and without the
     * leading '?'.
     * 
     * @return the raw query, or {@code null} if the request has none
     */
    String query();
    
    /**
     * Returns the request headers.<p>
     * 
     * Lookups of the returned map must be case-insensitive. Every value list
     * must be non-empty.
     * 
     * @return the request headers (never {@code null})
     */
    Map<String, List<String>> headers();
    
    /**
     * Returns the body.
     * 
     * @return the body (never {@code null}, possibly empty)
     */
    InputStream body();
    
    /**
     * Returns the address of the connected peer.
     * 
     * @return the address of the connected peer, or {@code null} if unknown
     */
    InetSocketAddress remoteAddress();
}
