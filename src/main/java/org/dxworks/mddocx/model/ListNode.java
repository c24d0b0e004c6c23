package org.dxworks.mddocx.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ListNode extends BlockNode {
    public final boolean ordered;
    public final List<ListItemNode> children;
    public final Integer sequenceId; // only set for ordered lists

    public ListNode(boolean ordered, List<ListItemNode> children, Integer sequenceId) {
        super(BlockType.LIST);
        if (ordered && sequenceId == null) {
            throw new IllegalArgumentException("Ordered lists require a sequence id");
        }
        this.ordered = ordered;
        this.children = List.copyOf(children);
        this.sequenceId = ordered ? sequenceId : null;
    }
}
