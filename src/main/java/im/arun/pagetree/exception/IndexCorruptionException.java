package im.arun.pagetree.exception;

/**
 * The order index of a container points at a page its storage no longer holds.
 * Signals a programming error; there is no recovery.
 */
public class IndexCorruptionException extends NavigationException {

    public IndexCorruptionException(String message) {
        super(message);
    }
}
