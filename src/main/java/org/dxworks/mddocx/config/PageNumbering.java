package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageNumbering {
    public Integer start;
    public PageNumberFormat formatType;
    public PageNumberSeparator separator;
    public PageNumberDisplay display; // footer page number style
    public Alignment alignment; // alignment of the generated page number footer

    public PageNumbering overlay(PageNumbering override) {
        PageNumbering o = override != null ? override : new PageNumbering();
        PageNumbering merged = new PageNumbering();
        merged.start = Merge.pick(o.start, start);
        merged.formatType = Merge.pick(o.formatType, formatType);
        merged.separator = Merge.pick(o.separator, separator);
        merged.display = Merge.pick(o.display, display);
        merged.alignment = Merge.pick(o.alignment, alignment);
        return merged;
    }

    public boolean showsPageNumbers() {
        return display != null && display != PageNumberDisplay.NONE;
    }
}
