package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageSize {
    public Integer width;
    public Integer height;
    public Orientation orientation;

    public static PageSize defaults() {
        PageSize size = new PageSize();
        size.orientation = Orientation.PORTRAIT;
        return size;
    }

    public PageSize overlay(PageSize override) {
        PageSize o = override != null ? override : new PageSize();
        PageSize merged = new PageSize();
        merged.width = Merge.pick(o.width, width);
        merged.height = Merge.pick(o.height, height);
        merged.orientation = Merge.pick(o.orientation, orientation);
        return merged;
    }
}
