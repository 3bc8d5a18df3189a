package im.arun.pagetree.config;

import lombok.Data;

@Data
public class PageTreeConfig {
    private String defaultPageType = "uri";
    private boolean pagesVisibleByDefault = true;
    private boolean prettyPrint = true;
}
