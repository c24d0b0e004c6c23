package org.dxworks.mddocx.model;

public final class PageBreakNode extends BlockNode {

    public PageBreakNode() {
        super(BlockType.PAGE_BREAK);
    }
}
