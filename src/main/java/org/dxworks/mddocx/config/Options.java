package org.dxworks.mddocx.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied conversion options, already validated.
 */
public class Options {
    public DocumentType documentType;
    public Style style;
    public SectionConfig template;
    /**
     * When empty, the whole Markdown input forms one section.
     */
    public List<DocumentSection> sections = new ArrayList<>();
    public List<TextReplacement> textReplacements = new ArrayList<>();
}
