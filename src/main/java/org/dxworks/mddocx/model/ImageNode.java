package org.dxworks.mddocx.model;

public final class ImageNode extends BlockNode {
    public final String alt;
    public final String url;

    public ImageNode(String alt, String url) {
        super(BlockType.IMAGE);
        this.alt = alt == null ? "" : alt;
        this.url = url == null ? "" : url;
    }
}
