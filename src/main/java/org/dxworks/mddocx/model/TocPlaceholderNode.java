package org.dxworks.mddocx.model;

public final class TocPlaceholderNode extends BlockNode {

    public TocPlaceholderNode() {
        super(BlockType.TOC_PLACEHOLDER);
    }
}
