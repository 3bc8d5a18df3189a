package im.arun.pagetree.exception;

/**
 * Raised when a page or page source is unusable, e.g. a page added to itself
 * or loose input that cannot be converted into a page.
 */
public class InvalidArgumentException extends NavigationException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
