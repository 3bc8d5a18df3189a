package im.arun.pagetree.container;

import im.arun.pagetree.page.PageFactory;

/**
 * Root container of a page tree.
 */
public class Navigation extends AbstractContainer {

    public Navigation() {
    }

    public Navigation(PageFactory pageFactory) {
        setPageFactory(pageFactory);
    }

    /**
     * @param pages pages, records or option maps to add
     */
    public Navigation(Iterable<?> pages) {
        addPages(pages);
    }

    public Navigation(Object[] pages) {
        addPages(pages);
    }
}
