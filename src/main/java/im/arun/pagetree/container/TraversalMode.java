package im.arun.pagetree.container;

/**
 * Visit order used by {@link PageTreeIterator}.
 */
public enum TraversalMode {
    /**
     * Only pages without children are returned.
     */
    LEAVES_ONLY,

    /**
     * A page is returned before its children (pre-order).
     */
    SELF_FIRST,

    /**
     * A page is returned after its children (post-order).
     */
    CHILD_FIRST
}
