package org.dxworks.mddocx.config;

/**
 * Per-section overrides. A template is a {@code SectionConfig} applied beneath every section.
 */
public class SectionConfig {
    public Style style;
    public PageConfig page;
    public HeaderFooterGroup headers;
    public HeaderFooterGroup footers;
    public PageNumbering pageNumbering;
    public Boolean titlePage; // different first-page header/footer
    public SectionBreakType type;
}
