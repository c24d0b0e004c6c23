package org.dxworks.mddocx.config;

/**
 * Configuration of one section after template and section overrides have been applied.
 * Owned by its section: nothing here is shared with the inputs it was resolved from.
 */
public final class ResolvedSectionConfig {
    public final Style style;
    public final PageConfig page;
    public final ResolvedHeaderFooter headers;
    public final ResolvedHeaderFooter footers;
    public final PageNumbering pageNumbering;
    public final boolean titlePage;
    public final SectionBreakType type;

    public ResolvedSectionConfig(Style style, PageConfig page,
                                 ResolvedHeaderFooter headers, ResolvedHeaderFooter footers,
                                 PageNumbering pageNumbering, boolean titlePage, SectionBreakType type) {
        this.style = style;
        this.page = page;
        this.headers = headers;
        this.footers = footers;
        this.pageNumbering = pageNumbering;
        this.titlePage = titlePage;
        this.type = type;
    }
}
