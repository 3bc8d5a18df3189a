package im.arun.pagetree.page;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.pagetree.config.ConfigLoader;
import im.arun.pagetree.config.PageTreeConfig;
import im.arun.pagetree.exception.InvalidArgumentException;
import im.arun.pagetree.model.PageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds pages, including their sub pages, from loose input: option maps,
 * {@link PageRecord}s or JSON text.
 *
 * <p>The page type comes from the {@code type} key, or the configured
 * default type when absent. {@code uri} is always registered.
 */
public class PageFactory {
    private static final Logger logger = LoggerFactory.getLogger(PageFactory.class);
    private static volatile PageFactory defaultInstance;
    private static final Object LOCK = new Object();

    private final PageTreeConfig config;
    private final ObjectMapper objectMapper;
    private final Map<String, Supplier<? extends AbstractPage>> types = new LinkedHashMap<>();

    public PageFactory() {
        this(new ConfigLoader().load());
    }

    public PageFactory(PageTreeConfig config) {
        this.config = config;
        this.objectMapper = new ObjectMapper()
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        register(UriPage.TYPE, UriPage::new);
    }

    /**
     * Returns the shared factory configured from {@code pagetree.yaml}.
     */
    public static PageFactory getDefault() {
        if (defaultInstance == null) {
            synchronized (LOCK) {
                if (defaultInstance == null) {
                    defaultInstance = new PageFactory();
                }
            }
        }
        return defaultInstance;
    }

    /**
     * Registers a page type under {@code type}, replacing any previous one.
     */
    public PageFactory register(String type, Supplier<? extends AbstractPage> supplier) {
        types.put(type, supplier);
        return this;
    }

    public boolean isRegistered(String type) {
        return types.containsKey(type);
    }

    /**
     * @throws InvalidArgumentException if the options cannot be converted into a page
     */
    public AbstractPage fromMap(Map<String, ?> options) {
        if (options == null) {
            throw new InvalidArgumentException("Invalid argument: page options must not be null");
        }

        PageRecord record;
        try {
            record = objectMapper.convertValue(options, PageRecord.class);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected page options {}: {}", options, e.getMessage());
            throw new InvalidArgumentException("Invalid argument: unable to convert page options: " + e.getMessage(), e);
        }
        return fromRecord(record);
    }

    /**
     * @param json a single page object
     * @throws InvalidArgumentException if the text is not a valid page object
     */
    public AbstractPage fromJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new InvalidArgumentException("Invalid argument: page JSON must not be empty");
        }

        PageRecord record;
        try {
            record = objectMapper.readValue(json, PageRecord.class);
        } catch (JsonProcessingException e) {
            logger.warn("Rejected page JSON: {}", e.getOriginalMessage());
            throw new InvalidArgumentException("Invalid argument: unable to parse page JSON: " + e.getOriginalMessage(), e);
        }
        return fromRecord(record);
    }

    /**
     * @throws InvalidArgumentException if the record is null or names an unknown type
     */
    public AbstractPage fromRecord(PageRecord record) {
        if (record == null) {
            throw new InvalidArgumentException("Invalid argument: page record must not be null");
        }

        String type = record.getType() != null ? record.getType() : config.getDefaultPageType();
        Supplier<? extends AbstractPage> supplier = types.get(type);
        if (supplier == null) {
            throw new InvalidArgumentException("Invalid argument: unable to determine page type '" + type + "'");
        }

        AbstractPage page = supplier.get();
        page.setPageFactory(this);
        page.setLabel(record.getLabel())
            .setId(record.getId())
            .setFragment(record.getFragment())
            .setCssClass(record.getCssClass())
            .setTitle(record.getTitle())
            .setTarget(record.getTarget())
            .setOrder(record.getOrder())
            .setVisible(record.getVisible() != null ? record.getVisible() : config.isPagesVisibleByDefault())
            .setActive(Boolean.TRUE.equals(record.getActive()));

        if (record.getUri() != null) {
            page.set("uri", record.getUri());
        }
        record.getProperties().forEach(page::set);

        if (record.getPages() != null) {
            for (PageRecord child : record.getPages()) {
                if (child != null) {
                    page.addPage(fromRecord(child));
                }
            }
        }

        logger.debug("Built {} page {} with {} sub pages", type, page, page.count());
        return page;
    }
}
