package mn.astvision.catalog.exception;

import lombok.Getter;

/**
 * Raised when a filter definition cannot be translated into an executable query.
 *
 * @author zorigtbaatar
 */

@Getter
public class FilterException extends RuntimeException {
    private final String hint;

    public FilterException(String message) {
        super(message);
        this.hint = null;
    }

    public FilterException(String message, Throwable cause) {
        super(message, cause);
        this.hint = null;
    }

    public FilterException(String message, String hint) {
        super(buildMessage(message, hint));
        this.hint = hint;
    }

    private static String buildMessage(String base, String hint) {
        if (hint == null) {
            return base;
        }
        return base + " Hint: " + hint;
    }

}
