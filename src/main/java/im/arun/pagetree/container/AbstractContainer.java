package im.arun.pagetree.container;

import im.arun.pagetree.exception.IndexCorruptionException;
import im.arun.pagetree.exception.InvalidArgumentException;
import im.arun.pagetree.model.PageRecord;
import im.arun.pagetree.page.AbstractPage;
import im.arun.pagetree.page.PageFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered container of pages.
 *
 * <p>Pages are stored by identity. Traversal follows an index sorted by page
 * order, which is rebuilt lazily: every mutation only marks the index dirty
 * and the next order-sensitive call re-sorts it. Pages without an explicit
 * order keep their insertion order among themselves.
 *
 * <p>Not thread-safe.
 */
public abstract class AbstractContainer implements RecursivePageIterator, Iterable<AbstractPage> {
    private static final Logger logger = LoggerFactory.getLogger(AbstractContainer.class);

    /**
     * Pages keyed by identity, in insertion order.
     */
    protected final Map<String, AbstractPage> pages = new LinkedHashMap<>();

    /**
     * Effective order keyed by identity. Once sorted, its iteration order is
     * the traversal order.
     */
    protected Map<String, Integer> index = new LinkedHashMap<>();

    /**
     * Whether {@link #index} must be re-sorted before the next traversal.
     */
    protected boolean dirtyIndex;

    private List<String> sortedKeys = new ArrayList<>();
    private int cursor;
    private boolean cursorAdvanced;
    private PageFactory pageFactory;

    /**
     * Re-sorts the index by page order if it is dirty.
     *
     * <p>A page without an order gets the next value of a counter that starts
     * at 0 and only advances on such pages. Ties keep storage order.
     */
    protected void sort() {
        if (!dirtyIndex) {
            return;
        }

        String cursorKey = cursorKey();
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(pages.size());
        int unordered = 0;

        for (Map.Entry<String, AbstractPage> entry : pages.entrySet()) {
            Integer order = entry.getValue().getOrder();
            if (order == null) {
                order = unordered++;
            }
            entries.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), order));
        }

        // List.sort is stable
        entries.sort(Map.Entry.comparingByValue());

        Map<String, Integer> newIndex = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : entries) {
            newIndex.put(entry.getKey(), entry.getValue());
        }

        index = newIndex;
        sortedKeys = new ArrayList<>(newIndex.keySet());

        // Follow the page under the cursor; if it is gone, its successor
        // slides into the slot and the next advance must not skip it
        int position = cursorKey == null ? -1 : sortedKeys.indexOf(cursorKey);
        if (position >= 0) {
            cursor = position;
        } else {
            cursor = Math.min(cursor, sortedKeys.size());
            cursorAdvanced |= cursorKey != null;
        }
        dirtyIndex = false;

        logger.debug("Rebuilt page index of {} with {} entries", getClass().getSimpleName(), sortedKeys.size());
    }

    private String cursorKey() {
        return cursor < sortedKeys.size() ? sortedKeys.get(cursor) : null;
    }

    /**
     * Marks the index dirty so the next traversal re-sorts it. Pages call
     * this on their parent when their order changes.
     */
    public void notifyOrderUpdated() {
        dirtyIndex = true;
    }

    public PageFactory getPageFactory() {
        return pageFactory != null ? pageFactory : PageFactory.getDefault();
    }

    public void setPageFactory(PageFactory pageFactory) {
        this.pageFactory = pageFactory;
    }

    /**
     * Adds a page and makes this container its parent. Adding a page that is
     * already here does nothing.
     *
     * <p>Pages form a tree: a page that already holds this container
     * somewhere below it is rejected.
     *
     * @throws InvalidArgumentException if the page is null, is this container
     *                                  or is one of its ancestors
     */
    public AbstractContainer addPage(AbstractPage page) {
        if (page == null) {
            throw new InvalidArgumentException("Invalid argument: page must not be null");
        }
        if (page == this) {
            throw new InvalidArgumentException("A page cannot have itself as a parent");
        }
        if (this instanceof AbstractPage && page.hasPage((AbstractPage) this, true)) {
            throw new InvalidArgumentException("A page cannot be added below one of its own descendants");
        }

        String identity = page.getIdentity();
        if (index.containsKey(identity)) {
            return this;
        }

        pages.put(identity, page);
        // Stale until the next sort
        index.put(identity, page.getOrder());
        dirtyIndex = true;

        page.setParent(this);
        return this;
    }

    /**
     * Builds a page from loose options with the page factory and adds it.
     */
    public AbstractContainer addPage(Map<String, ?> options) {
        return addPage(getPageFactory().fromMap(options));
    }

    public AbstractContainer addPage(PageRecord record) {
        return addPage(getPageFactory().fromRecord(record));
    }

    /**
     * Adds several pages. Entries may be pages, {@link PageRecord}s or option
     * maps; null entries are skipped.
     *
     * @throws InvalidArgumentException if the source is null or holds an
     *                                  entry of another type
     */
    public AbstractContainer addPages(Iterable<?> source) {
        if (source == null) {
            throw new InvalidArgumentException("Invalid argument: pages must be an Iterable, an array or an instance of "
                    + AbstractContainer.class.getName());
        }

        Iterable<?> entries = source;
        // Each add detaches the page from the source container, so walk a copy
        if (source instanceof AbstractContainer) {
            entries = ((AbstractContainer) source).toPageList();
        }

        int added = 0;
        for (Object entry : entries) {
            if (entry == null) {
                continue;
            }
            addEntry(entry);
            added++;
        }

        logger.debug("Added {} pages to {}", added, getClass().getSimpleName());
        return this;
    }

    public AbstractContainer addPages(Object[] source) {
        if (source == null) {
            throw new InvalidArgumentException("Invalid argument: pages must be an Iterable, an array or an instance of "
                    + AbstractContainer.class.getName());
        }
        return addPages(Arrays.asList(source));
    }

    @SuppressWarnings("unchecked")
    private void addEntry(Object entry) {
        if (entry instanceof AbstractPage) {
            addPage((AbstractPage) entry);
        } else if (entry instanceof PageRecord) {
            addPage((PageRecord) entry);
        } else if (entry instanceof Map) {
            addPage((Map<String, ?>) entry);
        } else {
            throw new InvalidArgumentException("Invalid argument: page must be an instance of "
                    + AbstractPage.class.getName() + ", a PageRecord or a Map, got " + entry.getClass().getName());
        }
    }

    /**
     * Replaces all pages of this container.
     */
    public AbstractContainer setPages(List<?> source) {
        removePages();
        return addPages(source);
    }

    /**
     * @return read-only view of the pages keyed by identity, in insertion order
     */
    public Map<String, AbstractPage> getPages() {
        return Collections.unmodifiableMap(pages);
    }

    public boolean removePage(AbstractPage page) {
        return removePage(page, false);
    }

    /**
     * Removes a page from this container, or with {@code recursive} from the
     * first child subtree that holds it.
     *
     * @return whether a page was removed
     */
    public boolean removePage(AbstractPage page, boolean recursive) {
        if (page == null) {
            return false;
        }
        return removeByIdentity(page.getIdentity(), page, recursive);
    }

    public boolean removePage(int order) {
        return removePage(order, false);
    }

    /**
     * Removes the first page, in sorted order, whose effective order equals
     * {@code order}. Only predictable when orders are unique.
     *
     * @return whether a page was removed
     */
    public boolean removePage(int order, boolean recursive) {
        sort();

        String identity = null;
        for (Map.Entry<String, Integer> entry : index.entrySet()) {
            if (Integer.valueOf(order).equals(entry.getValue())) {
                identity = entry.getKey();
                break;
            }
        }
        if (identity == null) {
            return false;
        }

        return removeByIdentity(identity, pages.get(identity), recursive);
    }

    private boolean removeByIdentity(String identity, AbstractPage target, boolean recursive) {
        AbstractPage removed = pages.remove(identity);
        if (removed != null) {
            index.remove(identity);
            dirtyIndex = true;
            release(removed);
            return true;
        }

        if (recursive && target != null) {
            for (AbstractPage child : pages.values()) {
                if (child.hasPage(target, true)) {
                    return child.removePage(target, true);
                }
            }
        }

        return false;
    }

    private void release(AbstractPage page) {
        if (page.getParent() == this) {
            page.setParent(null);
        }
    }

    /**
     * Removes all pages.
     */
    public AbstractContainer removePages() {
        List<AbstractPage> released = new ArrayList<>(pages.values());
        pages.clear();
        index.clear();
        dirtyIndex = true;
        released.forEach(this::release);
        return this;
    }

    public boolean hasPage(AbstractPage page) {
        return hasPage(page, false);
    }

    /**
     * @param recursive whether to look into child pages as well
     * @return whether the page is in this container
     */
    public boolean hasPage(AbstractPage page, boolean recursive) {
        if (page == null) {
            return false;
        }
        if (index.containsKey(page.getIdentity())) {
            return true;
        }
        if (recursive) {
            for (AbstractPage child : pages.values()) {
                if (child.hasPage(page, true)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean hasPages() {
        return hasPages(false);
    }

    /**
     * @param onlyVisible whether only visible pages count
     */
    public boolean hasPages(boolean onlyVisible) {
        if (onlyVisible) {
            for (AbstractPage page : pages.values()) {
                if (page.isVisible()) {
                    return true;
                }
            }
            return false;
        }
        return !index.isEmpty();
    }

    /**
     * Returns the first page in the subtree, parents before children, whose
     * {@code property} equals {@code value}.
     *
     * @return matching page or {@code null}
     */
    public AbstractPage findOneBy(String property, Object value) {
        PageTreeIterator iterator = new PageTreeIterator(this, TraversalMode.SELF_FIRST);
        while (iterator.hasNext()) {
            AbstractPage page = iterator.next();
            if (Objects.equals(page.get(property), value)) {
                return page;
            }
        }
        return null;
    }

    /**
     * Returns every page in the subtree whose {@code property} equals
     * {@code value}, parents before children.
     */
    public List<AbstractPage> findAllBy(String property, Object value) {
        List<AbstractPage> found = new ArrayList<>();
        PageTreeIterator iterator = new PageTreeIterator(this, TraversalMode.SELF_FIRST);
        while (iterator.hasNext()) {
            AbstractPage page = iterator.next();
            if (Objects.equals(page.get(property), value)) {
                found.add(page);
            }
        }
        return found;
    }

    public AbstractPage findBy(String property, Object value) {
        return findOneBy(property, value);
    }

    /**
     * @param all whether to return every match or at most the first one
     */
    public List<AbstractPage> findBy(String property, Object value, boolean all) {
        return findBy(all ? FinderKind.ALL : FinderKind.ONE, property, value);
    }

    public List<AbstractPage> findBy(FinderKind kind, String property, Object value) {
        if (kind == FinderKind.ALL) {
            return findAllBy(property, value);
        }
        AbstractPage page = findOneBy(property, value);
        return page == null ? Collections.emptyList() : Collections.singletonList(page);
    }

    /**
     * Runs a finder given by name, e.g. {@code findByLabel}, {@code findOneByLabel}
     * or {@code findAllByClass}.
     *
     * @return the matching page or {@code null} for one-finders, a list for all-finders
     * @throws im.arun.pagetree.exception.BadMethodCallException if the name is not a finder
     */
    public Object invokeFinder(String method, Object value) {
        FinderMethod finder = FinderMethod.parse(getClass(), method);
        if (finder.getKind() == FinderKind.ALL) {
            return findAllBy(finder.getProperty(), value);
        }
        return findOneBy(finder.getProperty(), value);
    }

    /**
     * @return records of the pages in traversal order
     */
    public List<PageRecord> toList() {
        sort();
        List<PageRecord> records = new ArrayList<>(sortedKeys.size());
        for (String key : sortedKeys) {
            records.add(pages.get(key).toRecord());
        }
        return records;
    }

    /**
     * @return detached copy of the pages in traversal order
     */
    public List<AbstractPage> toPageList() {
        sort();
        List<AbstractPage> list = new ArrayList<>(sortedKeys.size());
        for (String key : sortedKeys) {
            list.add(pages.get(key));
        }
        return list;
    }

    /**
     * Iterates a snapshot of the pages in traversal order; the container may
     * be changed while the iterator is in use.
     */
    @Override
    public Iterator<AbstractPage> iterator() {
        return toPageList().iterator();
    }

    public int count() {
        return index.size();
    }

    // RecursivePageIterator

    @Override
    public void rewind() {
        sort();
        cursor = 0;
        cursorAdvanced = false;
    }

    @Override
    public boolean valid() {
        sort();
        return cursor < sortedKeys.size();
    }

    /**
     * @throws IndexCorruptionException if the cursor points at a page that is
     *                                  no longer stored
     */
    @Override
    public AbstractPage current() {
        sort();

        String key = cursorKey();
        AbstractPage page = key == null ? null : pages.get(key);
        if (page == null) {
            logger.error("Index of {} points at missing page {}", getClass().getSimpleName(), key);
            throw new IndexCorruptionException(
                    "Corruption detected in container; invalid key found in internal iterator");
        }
        return page;
    }

    @Override
    public String key() {
        sort();
        return cursorKey();
    }

    @Override
    public void next() {
        sort();
        if (cursorAdvanced) {
            cursorAdvanced = false;
            return;
        }
        if (cursor < sortedKeys.size()) {
            cursor++;
        }
    }

    @Override
    public boolean hasChildren() {
        return valid() && current().hasPages();
    }

    @Override
    public AbstractPage getChildren() {
        sort();
        String key = cursorKey();
        return key == null ? null : pages.get(key);
    }
}
