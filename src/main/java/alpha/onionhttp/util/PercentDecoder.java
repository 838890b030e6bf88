package alpha.onionhttp.util;

import java.net.URLDecoder;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Util for percent-decoding path segments.<p>
 * 
 * Unlike {@link URLDecoder}, the plus character is left as-is. '+' only means
 * space in form-encoded query strings, never in a path.
 * 
 * @see alpha.onionhttp.route.RouteTree
 */
public final class PercentDecoder
{
    private PercentDecoder() {
        // Empty
    }
    
    /**
     * Percent-decodes the given string.
     * 
     * @param str to decode
     * 
     * @return the decoded string
     * 
     * @throws NullPointerException if {@code str} is {@code null}
     * @throws IllegalArgumentException if an escape sequence is malformed
     */
    public static String decode(String str) {
        if (str.indexOf('%') == -1) {
            return str;
        }
        final int p = str.indexOf('+');
        if (p == -1) {
            return URLDecoder.decode(str, UTF_8);
        }
        // Decode chunks in-between
        return decode(str.substring(0, p)) + "+" + decode(str.substring(p + 1));
    }
    
    /**
     * Decodes a form-encoded query component, where '+' means space.
     * 
     * @param str to decode
     * 
     * @return the decoded string
     * 
     * @throws IllegalArgumentException if an escape sequence is malformed
     */
    public static String decodeQuery(String str) {
        return URLDecoder.decode(str, UTF_8);
    }
}
