package org.dxworks.mddocx.model;

public final class CommentNode extends BlockNode {
    public final String value;

    public CommentNode(String value) {
        super(BlockType.COMMENT);
        this.value = value;
    }
}
