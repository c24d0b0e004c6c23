package org.dxworks.mddocx.model;

import java.util.List;

public final class ListItemNode extends BlockNode {
    public final List<BlockNode> children;

    /**
     * Items are never childless: an item without block content holds one empty paragraph.
     */
    public ListItemNode(List<BlockNode> children) {
        super(BlockType.LIST_ITEM);
        this.children = children.isEmpty() ? List.of(ParagraphNode.empty()) : List.copyOf(children);
    }
}
