package org.dxworks.mddocx.model;

import java.util.List;

public final class BlockquoteNode extends BlockNode {
    public final List<BlockNode> children;

    public BlockquoteNode(List<BlockNode> children) {
        super(BlockType.BLOCKQUOTE);
        this.children = List.copyOf(children);
    }
}
