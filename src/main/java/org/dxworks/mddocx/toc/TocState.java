package org.dxworks.mddocx.toc;

public enum TocState {
    PENDING,
    INSERTED
}
