package org.dxworks.mddocx.model;

/**
 * One structural unit of the document model.
 * <p>
 * The set of variants is closed: every subclass lives in this package and is final.
 * Nodes are immutable once constructed; child lists are unmodifiable copies.
 */
public abstract class BlockNode {
    public final BlockType type;

    BlockNode(BlockType type) {
        this.type = type;
    }
}
