package org.dxworks.mddocx.model;

import java.util.List;

public final class DocumentModel {
    public final List<BlockNode> children;

    public DocumentModel(List<BlockNode> children) {
        this.children = List.copyOf(children);
    }
}
