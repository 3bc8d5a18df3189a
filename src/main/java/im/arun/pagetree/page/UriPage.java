package im.arun.pagetree.page;

import im.arun.pagetree.model.PageRecord;

/**
 * Page that links to a plain URI.
 */
public class UriPage extends AbstractPage {
    public static final String TYPE = "uri";

    private String uri;

    public UriPage() {
    }

    public UriPage(String label, String uri) {
        setLabel(label);
        this.uri = uri;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    public String getUri() {
        return uri;
    }

    public UriPage setUri(String uri) {
        this.uri = uri;
        return this;
    }

    /**
     * @return the URI, with {@code #fragment} appended when a fragment is set
     */
    @Override
    public String getHref() {
        String fragment = getFragment();
        if (fragment == null) {
            return uri;
        }

        String base = uri == null ? "" : uri;
        return base.endsWith("#") ? base + fragment : base + "#" + fragment;
    }

    @Override
    public Object get(String property) {
        if ("uri".equals(property)) {
            return uri;
        }
        return super.get(property);
    }

    @Override
    public AbstractPage set(String property, Object value) {
        if ("uri".equals(property)) {
            return setUri(asString(property, value));
        }
        return super.set(property, value);
    }

    @Override
    public PageRecord toRecord() {
        PageRecord record = super.toRecord();
        record.setUri(uri);
        return record;
    }
}
