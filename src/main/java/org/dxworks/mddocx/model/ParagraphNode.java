package org.dxworks.mddocx.model;

import java.util.List;

public final class ParagraphNode extends BlockNode {
    public final List<TextRun> children;

    public ParagraphNode(List<TextRun> children) {
        super(BlockType.PARAGRAPH);
        this.children = List.copyOf(children);
    }

    public static ParagraphNode empty() {
        return new ParagraphNode(List.of());
    }

    public String plainText() {
        StringBuilder text = new StringBuilder();
        for (TextRun run : children) {
            text.append(run.value);
        }
        return text.toString();
    }
}
