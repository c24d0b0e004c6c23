package org.dxworks.mddocx.assembly;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.mddocx.config.PageMargins;
import org.dxworks.mddocx.config.PageSize;
import org.dxworks.mddocx.config.ResolvedSectionConfig;
import org.dxworks.mddocx.config.SectionBreakType;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SectionProperties {
    public final SectionBreakType type;
    public final Boolean titlePage; // only present when set
    public final Page page;

    public SectionProperties(SectionBreakType type, Boolean titlePage, Page page) {
        this.type = type;
        this.titlePage = titlePage;
        this.page = page;
    }

    static SectionProperties from(ResolvedSectionConfig config) {
        Page page = new Page(config.page.margin, config.page.size, PageNumbers.from(config.pageNumbering));
        return new SectionProperties(config.type, config.titlePage ? Boolean.TRUE : null, page);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Page {
        public final PageMargins margin;
        public final PageSize size;
        public final PageNumbers pageNumbers;

        public Page(PageMargins margin, PageSize size, PageNumbers pageNumbers) {
            this.margin = margin;
            this.size = size;
            this.pageNumbers = pageNumbers;
        }
    }
}
