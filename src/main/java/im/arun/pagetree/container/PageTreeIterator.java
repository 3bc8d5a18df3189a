package im.arun.pagetree.container;

import im.arun.pagetree.page.AbstractPage;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Depth-first walk over a tree of {@link RecursivePageIterator}s.
 *
 * <p>Each level is driven through its own cursor, so the walk sees every
 * level in its current sort order. Two walks over the same tree must not be
 * interleaved since they share those cursors.
 */
public class PageTreeIterator implements Iterator<AbstractPage> {

    private final Deque<Level> stack = new ArrayDeque<>();
    private final TraversalMode mode;
    private AbstractPage nextPage;
    private int nextDepth;
    private int depth = -1;

    public PageTreeIterator(RecursivePageIterator root) {
        this(root, TraversalMode.LEAVES_ONLY);
    }

    public PageTreeIterator(RecursivePageIterator root, TraversalMode mode) {
        this.mode = mode;
        root.rewind();
        stack.push(new Level(root, null));
        nextPage = fetch();
    }

    @Override
    public boolean hasNext() {
        return nextPage != null;
    }

    @Override
    public AbstractPage next() {
        if (nextPage == null) {
            throw new NoSuchElementException();
        }
        AbstractPage page = nextPage;
        depth = nextDepth;
        nextPage = fetch();
        return page;
    }

    /**
     * @return depth of the page last returned by {@link #next()}, 0 for the
     *         top level, -1 before the first call
     */
    public int getDepth() {
        return depth;
    }

    public TraversalMode getMode() {
        return mode;
    }

    private AbstractPage fetch() {
        while (!stack.isEmpty()) {
            Level level = stack.peek();
            RecursivePageIterator iterator = level.iterator;

            if (!iterator.valid()) {
                stack.pop();
                if (stack.isEmpty()) {
                    return null;
                }
                // The owner may have been removed while its children were walked;
                // next() then lands on its successor instead of skipping it
                RecursivePageIterator parent = stack.peek().iterator;
                AbstractPage owner = level.owner;
                boolean ownerStillThere = owner.getIdentity().equals(parent.key());
                parent.next();
                if (mode == TraversalMode.CHILD_FIRST && ownerStillThere) {
                    nextDepth = stack.size() - 1;
                    return owner;
                }
                continue;
            }

            AbstractPage page = iterator.current();
            if (iterator.hasChildren()) {
                RecursivePageIterator children = iterator.getChildren();
                children.rewind();
                stack.push(new Level(children, page));
                if (mode == TraversalMode.SELF_FIRST) {
                    nextDepth = stack.size() - 2;
                    return page;
                }
                continue;
            }

            iterator.next();
            nextDepth = stack.size() - 1;
            return page;
        }
        return null;
    }

    private static final class Level {
        private final RecursivePageIterator iterator;
        private final AbstractPage owner;

        private Level(RecursivePageIterator iterator, AbstractPage owner) {
            this.iterator = iterator;
            this.owner = owner;
        }
    }
}
