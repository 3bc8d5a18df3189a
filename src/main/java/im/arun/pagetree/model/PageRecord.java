package im.arun.pagetree.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured form of a page and its subtree.
 * Used both as the export format and as loose input for building pages.
 * Keys that are not built-in page fields land in {@link #getProperties()}.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "label", "id", "uri", "fragment", "class", "title", "target",
        "order", "visible", "active", "pages"})
public class PageRecord {

    @JsonProperty("type")
    private String type;

    @JsonProperty("label")
    private String label;

    @JsonProperty("id")
    private String id;

    @JsonProperty("uri")
    private String uri;

    @JsonProperty("fragment")
    private String fragment;

    @JsonProperty("class")
    private String cssClass;

    @JsonProperty("title")
    private String title;

    @JsonProperty("target")
    private String target;

    @JsonProperty("order")
    private Integer order;

    @JsonProperty("visible")
    private Boolean visible;

    @JsonProperty("active")
    private Boolean active;

    @JsonProperty("pages")
    private List<PageRecord> pages;

    private Map<String, Object> properties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return properties;
    }

    @JsonAnySetter
    public void setProperty(String name, Object value) {
        properties.put(name, value);
    }
}
