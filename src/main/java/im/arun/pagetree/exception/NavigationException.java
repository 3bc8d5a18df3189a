package im.arun.pagetree.exception;

/**
 * Base class for all errors raised by page containers and pages.
 */
public class NavigationException extends RuntimeException {

    public NavigationException(String message) {
        super(message);
    }

    public NavigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
