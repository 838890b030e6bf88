package alpha.onionhttp.context;

import java.io.Serial;

/**
 * Thrown when the request can not be processed because it is malformed, for
 * example a path or query containing an invalid percent-escape sequence.<p>
 * 
 * The base error handler translates this exception to a 400 (Bad Request)
 * response.
 */
public class BadRequestException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code BadRequestException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause   passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
