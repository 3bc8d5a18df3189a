package im.arun.pagetree.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.pagetree.config.PageTreeConfig;
import im.arun.pagetree.container.Navigation;
import im.arun.pagetree.page.UriPage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PageTreeExporterTest {

    private static Navigation sampleNavigation() {
        Navigation nav = new Navigation();
        UriPage home = new UriPage("Home", "/");
        home.setCssClass("main");
        UriPage about = new UriPage("About", "/about");
        about.setOrder(-1);
        nav.addPage(home).addPage(about);
        home.addPage(new UriPage("News", "/news"));
        return nav;
    }

    @Test
    void toJson_writesPagesInTraversalOrder() throws Exception {
        String json = new PageTreeExporter(new PageTreeConfig()).toJson(sampleNavigation());

        JsonNode root = new ObjectMapper().readTree(json);
        assertTrue(root.isArray());
        assertEquals(2, root.size());
        assertEquals("About", root.get(0).get("label").asText());
        assertEquals("Home", root.get(1).get("label").asText());
        assertEquals("main", root.get(1).get("class").asText());
        assertEquals("uri", root.get(1).get("type").asText());
        assertEquals("News", root.get(1).get("pages").get(0).get("label").asText());
        assertFalse(root.get(0).has("pages"));
        assertTrue(json.contains("\n"));
    }

    @Test
    void toJson_compactWhenPrettyPrintIsOff() {
        PageTreeConfig config = new PageTreeConfig();
        config.setPrettyPrint(false);

        String json = new PageTreeExporter(config).toJson(sampleNavigation());

        assertFalse(json.contains("\n"));
    }

    @Test
    void toYaml_writesSameStructure() throws Exception {
        String yaml = new PageTreeExporter(new PageTreeConfig()).toYaml(sampleNavigation());

        JsonNode root = new ObjectMapper(new YAMLFactory()).readTree(yaml);
        assertEquals(2, root.size());
        assertEquals("/about", root.get(0).get("uri").asText());
        assertEquals(-1, root.get(0).get("order").asInt());
    }
}
