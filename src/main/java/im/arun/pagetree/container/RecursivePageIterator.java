package im.arun.pagetree.container;

import im.arun.pagetree.page.AbstractPage;

/**
 * Cursor-style iteration over one level of a page tree, with access to the
 * nested level under the current position.
 *
 * @see PageTreeIterator
 */
public interface RecursivePageIterator {

    /**
     * Positions the cursor on the first page, or past the end if there is none.
     */
    void rewind();

    boolean valid();

    /**
     * @return page under the cursor
     */
    AbstractPage current();

    /**
     * @return identity of the page under the cursor, or {@code null} past the end
     */
    String key();

    void next();

    /**
     * @return whether the page under the cursor holds pages of its own
     */
    boolean hasChildren();

    /**
     * @return iterator over the level below the cursor, or {@code null} past the end
     */
    RecursivePageIterator getChildren();
}
