package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class HeaderFooterContent {
    public String text; // rendered before any page number field
    public Alignment alignment;
    public PageNumberDisplay pageNumberDisplay;

    public HeaderFooterContent() {
    }

    public HeaderFooterContent(String text, Alignment alignment, PageNumberDisplay pageNumberDisplay) {
        this.text = text;
        this.alignment = alignment;
        this.pageNumberDisplay = pageNumberDisplay;
    }

    public HeaderFooterContent overlay(HeaderFooterContent override) {
        HeaderFooterContent o = override != null ? override : new HeaderFooterContent();
        return new HeaderFooterContent(
                Merge.pick(o.text, text),
                Merge.pick(o.alignment, alignment),
                Merge.pick(o.pageNumberDisplay, pageNumberDisplay));
    }

    public HeaderFooterContent copy() {
        return overlay(null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeaderFooterContent other)) return false;
        return Objects.equals(text, other.text)
                && alignment == other.alignment
                && pageNumberDisplay == other.pageNumberDisplay;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, alignment, pageNumberDisplay);
    }
}
