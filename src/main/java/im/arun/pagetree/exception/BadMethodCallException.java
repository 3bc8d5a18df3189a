package im.arun.pagetree.exception;

/**
 * Raised when a finder is invoked by a name that is not a known finder shape.
 */
public class BadMethodCallException extends NavigationException {

    public BadMethodCallException(String message) {
        super(message);
    }
}
