package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Page margins in twips (1440 per inch).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageMargins {
    public Integer top;
    public Integer right;
    public Integer bottom;
    public Integer left;
    public Integer header;
    public Integer footer;
    public Integer gutter;

    public static PageMargins defaults() {
        PageMargins margins = new PageMargins();
        margins.top = 1440;
        margins.right = 1080;
        margins.bottom = 1440;
        margins.left = 1080;
        return margins;
    }

    public PageMargins overlay(PageMargins override) {
        PageMargins o = override != null ? override : new PageMargins();
        PageMargins merged = new PageMargins();
        merged.top = Merge.pick(o.top, top);
        merged.right = Merge.pick(o.right, right);
        merged.bottom = Merge.pick(o.bottom, bottom);
        merged.left = Merge.pick(o.left, left);
        merged.header = Merge.pick(o.header, header);
        merged.footer = Merge.pick(o.footer, footer);
        merged.gutter = Merge.pick(o.gutter, gutter);
        return merged;
    }
}
