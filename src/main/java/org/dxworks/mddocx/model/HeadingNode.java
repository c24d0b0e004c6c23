package org.dxworks.mddocx.model;

import java.util.List;

public final class HeadingNode extends BlockNode {
    public final int level;
    public final List<TextRun> children;
    public final String anchorId; // bookmark target for generated TOC entries

    public HeadingNode(int level, List<TextRun> children, String anchorId) {
        super(BlockType.HEADING);
        this.level = level;
        this.children = List.copyOf(children);
        this.anchorId = anchorId;
    }
}
