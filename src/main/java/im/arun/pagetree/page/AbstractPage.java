package im.arun.pagetree.page;

import im.arun.pagetree.container.AbstractContainer;
import im.arun.pagetree.exception.InvalidArgumentException;
import im.arun.pagetree.model.PageRecord;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A page in a page tree. Every page is also a container for its sub pages.
 *
 * <p>Built-in properties are reachable by name through {@link #get(String)}
 * and {@link #set(String, Object)}; any other name reads or writes a custom
 * property.
 */
public abstract class AbstractPage extends AbstractContainer {
    private static final AtomicLong IDENTITY_SEQUENCE = new AtomicLong();

    @Getter
    private final String identity = "page-" + IDENTITY_SEQUENCE.incrementAndGet();

    @Getter
    private String label;

    @Getter
    private String id;

    @Getter
    private String fragment;

    @Getter
    private String cssClass;

    @Getter
    private String title;

    @Getter
    private String target;

    @Getter
    private Integer order;

    private boolean visible = true;
    private boolean active;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    @Getter
    private AbstractContainer parent;

    /**
     * @return name this page type is registered under in {@link PageFactory}
     */
    public abstract String getType();

    /**
     * @return link target of this page, may be null
     */
    public abstract String getHref();

    public AbstractPage setLabel(String label) {
        this.label = label;
        return this;
    }

    public AbstractPage setId(String id) {
        this.id = id;
        return this;
    }

    public AbstractPage setFragment(String fragment) {
        this.fragment = fragment;
        return this;
    }

    public AbstractPage setCssClass(String cssClass) {
        this.cssClass = cssClass;
        return this;
    }

    public AbstractPage setTitle(String title) {
        this.title = title;
        return this;
    }

    public AbstractPage setTarget(String target) {
        this.target = target;
        return this;
    }

    /**
     * Sets the position of this page among its siblings and tells the parent
     * to re-sort. {@code null} places the page after explicitly ordered pages
     * of lower order, in insertion order.
     */
    public AbstractPage setOrder(Integer order) {
        this.order = order;
        if (parent != null) {
            parent.notifyOrderUpdated();
        }
        return this;
    }

    public boolean isVisible() {
        return visible;
    }

    /**
     * @param recursive whether every ancestor page must be visible too
     */
    public boolean isVisible(boolean recursive) {
        if (recursive && visible && parent instanceof AbstractPage) {
            return ((AbstractPage) parent).isVisible(true);
        }
        return visible;
    }

    public AbstractPage setVisible(boolean visible) {
        this.visible = visible;
        return this;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * @param recursive whether an active descendant makes this page active
     */
    public boolean isActive(boolean recursive) {
        if (!active && recursive) {
            for (AbstractPage page : getPages().values()) {
                if (page.isActive(true)) {
                    return true;
                }
            }
        }
        return active;
    }

    public AbstractPage setActive(boolean active) {
        this.active = active;
        return this;
    }

    /**
     * Moves this page under {@code parent}, removing it from its current
     * parent first. {@code null} only detaches it.
     *
     * @throws InvalidArgumentException if {@code parent} is this page or one
     *                                  of its descendants
     */
    public AbstractPage setParent(AbstractContainer parent) {
        if (parent == this) {
            throw new InvalidArgumentException("A page cannot have itself as a parent");
        }
        if (parent instanceof AbstractPage && hasPage((AbstractPage) parent, true)) {
            throw new InvalidArgumentException("A page cannot be moved below one of its own descendants");
        }
        if (parent == this.parent) {
            return this;
        }

        if (this.parent != null) {
            this.parent.removePage(this);
        }

        this.parent = parent;

        if (parent != null && !parent.hasPage(this, false)) {
            parent.addPage(this);
        }
        return this;
    }

    /**
     * @return custom properties, read-only
     */
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    /**
     * Returns a built-in or custom property by name.
     *
     * @throws InvalidArgumentException if the name is null or empty
     */
    public Object get(String property) {
        requireName(property);

        switch (property) {
            case "label":
                return label;
            case "id":
                return id;
            case "fragment":
                return fragment;
            case "class":
            case "cssClass":
                return cssClass;
            case "title":
                return title;
            case "target":
                return target;
            case "order":
                return order;
            case "visible":
                return visible;
            case "active":
                return active;
            case "href":
                return getHref();
            default:
                return properties.get(property);
        }
    }

    /**
     * Sets a built-in or custom property by name.
     *
     * @throws InvalidArgumentException if the name is empty or the value does
     *                                  not fit a built-in property
     */
    public AbstractPage set(String property, Object value) {
        requireName(property);

        switch (property) {
            case "label":
                return setLabel(asString(property, value));
            case "id":
                return setId(asString(property, value));
            case "fragment":
                return setFragment(asString(property, value));
            case "class":
            case "cssClass":
                return setCssClass(asString(property, value));
            case "title":
                return setTitle(asString(property, value));
            case "target":
                return setTarget(asString(property, value));
            case "order":
                return setOrder(asOrder(value));
            case "visible":
                return setVisible(asBoolean(property, value));
            case "active":
                return setActive(asBoolean(property, value));
            default:
                properties.put(property, value);
                return this;
        }
    }

    /**
     * Exports this page and its sub pages.
     */
    public PageRecord toRecord() {
        PageRecord record = new PageRecord();
        record.setType(getType());
        record.setLabel(label);
        record.setId(id);
        record.setFragment(fragment);
        record.setCssClass(cssClass);
        record.setTitle(title);
        record.setTarget(target);
        record.setOrder(order);
        record.setVisible(visible);
        record.setActive(active);
        record.getProperties().putAll(properties);
        if (hasPages()) {
            record.setPages(toList());
        }
        return record;
    }

    private static void requireName(String property) {
        if (property == null || property.isEmpty()) {
            throw new InvalidArgumentException("Invalid argument: property must be a non-empty string");
        }
    }

    protected static String asString(String property, Object value) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new InvalidArgumentException("Invalid argument: " + property + " must be a string or null");
    }

    private static boolean asBoolean(String property, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        throw new InvalidArgumentException("Invalid argument: " + property + " must be a boolean");
    }

    static Integer asOrder(Object value) {
        if (value == null || value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new InvalidArgumentException("Invalid argument: order must be an integer, got '" + value + "'", e);
            }
        }
        throw new InvalidArgumentException("Invalid argument: order must be an integer, a numeric string or null");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + (label != null ? label : identity) + "]";
    }
}
