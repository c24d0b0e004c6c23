package org.dxworks.mddocx.numbering;

public final class NumberingLevel {
    public final int level;
    public final String format;
    public final String text;
    public final String alignment;
    public final int indentLeft; // twips
    public final int indentHanging; // twips

    public NumberingLevel(int level, String format, String text, String alignment, int indentLeft, int indentHanging) {
        this.level = level;
        this.format = format;
        this.text = text;
        this.alignment = alignment;
        this.indentLeft = indentLeft;
        this.indentHanging = indentHanging;
    }
}
