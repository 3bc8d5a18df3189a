package im.arun.pagetree.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.pagetree.config.ConfigLoader;
import im.arun.pagetree.config.PageTreeConfig;
import im.arun.pagetree.container.AbstractContainer;
import im.arun.pagetree.exception.NavigationException;
import im.arun.pagetree.model.PageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders the pages of a container, in traversal order, as JSON or YAML text.
 */
public class PageTreeExporter {
    private static final Logger logger = LoggerFactory.getLogger(PageTreeExporter.class);
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public PageTreeExporter() {
        this(new ConfigLoader().load());
    }

    public PageTreeExporter(PageTreeConfig config) {
        this.jsonMapper = new ObjectMapper();
        if (config.isPrettyPrint()) {
            this.jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public String toJson(AbstractContainer container) {
        return write(jsonMapper, container.toList(), "JSON");
    }

    public String toYaml(AbstractContainer container) {
        return write(yamlMapper, container.toList(), "YAML");
    }

    private String write(ObjectMapper mapper, List<PageRecord> records, String format) {
        try {
            return mapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            logger.error("Failed to export {} pages as {}", records.size(), format, e);
            throw new NavigationException("Failed to export pages as " + format, e);
        }
    }
}
