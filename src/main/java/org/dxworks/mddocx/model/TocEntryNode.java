package org.dxworks.mddocx.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One generated table-of-contents line, linked to the bookmark of its heading.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TocEntryNode extends BlockNode {
    public final String text;
    public final int level;
    public final String anchorId;
    public final int indent; // twips
    public final Integer fontSize;
    public final Boolean bold;
    public final Boolean italic;

    public TocEntryNode(String text, int level, String anchorId, int indent,
                        Integer fontSize, Boolean bold, Boolean italic) {
        super(BlockType.TOC_ENTRY);
        this.text = text;
        this.level = level;
        this.anchorId = anchorId;
        this.indent = indent;
        this.fontSize = fontSize;
        this.bold = bold;
        this.italic = italic;
    }
}
