package org.dxworks.mddocx.config;

public class DocumentSection extends SectionConfig {
    public String markdown;

    public DocumentSection() {
    }

    public DocumentSection(String markdown) {
        this.markdown = markdown;
    }
}
