package org.dxworks.mddocx.toc;

public final class HeadingEntry {
    public final String text;
    public final int level;
    public final String anchorId;

    public HeadingEntry(String text, int level, String anchorId) {
        this.text = text;
        this.level = level;
        this.anchorId = anchorId;
    }
}
