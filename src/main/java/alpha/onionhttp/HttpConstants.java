package alpha.onionhttp;

import java.util.List;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 *
 * Only the subset the engine and its built-in middleware use is declared
 * here. The engine never inspects a method token beyond comparing it to the
 * token a route was registered with, so any token is acceptable to
 * {@link Router#handle(String, String, alpha.onionhttp.handler.Handler...)}.
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * HTTP methods are included on the first line of a request and indicate
     * the desired action to be performed on a server-side resource. The value
     * is a case-sensitive token (
     * <a href="https://tools.ietf.org/html/rfc7231#section-4.1">RFC 7231 §4.1</a>
     * ).
     */
    public static final class Method {
        private Method() {
            // Private
        }

        /** Retrieve a representation of the resource. */
        public static final String GET = "GET";

        /** Same as {@link #GET}, except the response has no body. */
        public static final String HEAD = "HEAD";

        /** Let the resource process the enclosed representation. */
        public static final String POST = "POST";

        /** Replace the resource with the enclosed representation. */
        public static final String PUT = "PUT";

        /** Partially modify the resource. */
        public static final String PATCH = "PATCH";

        /** Remove the resource. */
        public static final String DELETE = "DELETE";

        /** Establish a tunnel. */
        public static final String CONNECT = "CONNECT";

        /** Describe the communication options of the resource. */
        public static final String OPTIONS = "OPTIONS";

        /** Message loop-back test. */
        public static final String TRACE = "TRACE";

        /**
         * All methods registered by {@link Router#any(String,
         * alpha.onionhttp.handler.Handler...)}, in the order they are
         * registered.
         */
        public static final List<String> ANY = List.of(
                GET, POST, PUT, PATCH, HEAD, OPTIONS, DELETE, CONNECT, TRACE);
    }

    /**
     * Status codes used by the engine and the built-in middleware.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-6">RFC 7231 §6</a>
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }

        /** OK. */
        public static final int TWO_HUNDRED = 200;

        /** No Content. */
        public static final int TWO_HUNDRED_FOUR = 204;

        /** Moved Permanently. */
        public static final int THREE_HUNDRED_ONE = 301;

        /** Found. */
        public static final int THREE_HUNDRED_TWO = 302;

        /** Not Modified. */
        public static final int THREE_HUNDRED_FOUR = 304;

        /** Temporary Redirect. */
        public static final int THREE_HUNDRED_SEVEN = 307;

        /** Permanent Redirect. */
        public static final int THREE_HUNDRED_EIGHT = 308;

        /** Bad Request. */
        public static final int FOUR_HUNDRED = 400;

        /** Unauthorized. */
        public static final int FOUR_HUNDRED_ONE = 401;

        /** Forbidden. */
        public static final int FOUR_HUNDRED_THREE = 403;

        /** Not Found. */
        public static final int FOUR_HUNDRED_FOUR = 404;

        /** Method Not Allowed. */
        public static final int FOUR_HUNDRED_FIVE = 405;

        /** Too Many Requests. */
        public static final int FOUR_HUNDRED_TWENTY_NINE = 429;

        /** Internal Server Error. */
        public static final int FIVE_HUNDRED = 500;

        /** Service Unavailable. */
        public static final int FIVE_HUNDRED_THREE = 503;

        /**
         * Returns {@code true} if the status code may not carry a body.
         *
         * @param code status code
         * @return see JavaDoc
         */
        public static boolean isBodyless(int code) {
            return (code >= 100 && code < 200) ||
                   code == TWO_HUNDRED_FOUR ||
                   code == THREE_HUNDRED_FOUR;
        }
    }

    /**
     * Reason phrases matching {@link StatusCode}.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Private
        }

        /** 400. */
        public static final String BAD_REQUEST = "Bad Request";

        /** 404. */
        public static final String NOT_FOUND = "Not Found";

        /** 405. */
        public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";

        /** 429. */
        public static final String TOO_MANY_REQUESTS = "Too Many Requests";

        /** 500. */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
    }

    /**
     * Header names used by the engine and the built-in middleware.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Private
        }

        /** Methods supported by the target resource. */
        public static final String ALLOW = "Allow";

        /** Caching directives. */
        public static final String CACHE_CONTROL = "Cache-Control";

        /** Size of the body in bytes. */
        public static final String CONTENT_LENGTH = "Content-Length";

        /** Media type of the body. */
        public static final String CONTENT_TYPE = "Content-Type";

        /** Target of a redirect. */
        public static final String LOCATION = "Location";

        /** Seconds the client ought to wait before retrying. */
        public static final String RETRY_AFTER = "Retry-After";

        /** Originating client address as appended by proxies. */
        public static final String X_FORWARDED_FOR = "X-Forwarded-For";

        /** Set by the response cache middleware: HIT or MISS. */
        public static final String X_CACHE = "X-Cache";
    }
}
