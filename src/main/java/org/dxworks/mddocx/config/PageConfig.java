package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageConfig {
    public PageMargins margin;
    public PageSize size;

    public static PageConfig defaults() {
        PageConfig page = new PageConfig();
        page.margin = PageMargins.defaults();
        page.size = PageSize.defaults();
        return page;
    }

    /**
     * Margin and size are merged key by key, never replaced wholesale.
     */
    public PageConfig overlay(PageConfig override) {
        PageConfig merged = new PageConfig();
        PageMargins overrideMargin = override != null ? override.margin : null;
        PageSize overrideSize = override != null ? override.size : null;
        merged.margin = (margin != null ? margin : new PageMargins()).overlay(overrideMargin);
        merged.size = (size != null ? size : new PageSize()).overlay(overrideSize);
        return merged;
    }
}
