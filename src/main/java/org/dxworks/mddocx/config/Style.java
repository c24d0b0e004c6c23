package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.mddocx.model.TableLayout;

/**
 * Style overrides. Every field is optional; {@code null} means "not set here" and
 * leaves the value of the enclosing level in place when styles are merged.
 * Sizes are in half-points, spacing in twips.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Style {
    public Integer titleSize;
    public Integer headingSpacing;
    public Integer paragraphSpacing;
    public Double lineSpacing;

    public String fontFamily;
    /**
     * Misspelled name of {@link #fontFamily}, still accepted on input.
     * Folded into {@code fontFamily} by {@link #normalized()} before any merge.
     */
    @Deprecated
    public String fontFamilly;
    public TextDirection direction;

    public Integer heading1Size;
    public Integer heading2Size;
    public Integer heading3Size;
    public Integer heading4Size;
    public Integer heading5Size;
    public Integer paragraphSize;
    public Integer listItemSize;
    public Integer codeBlockSize;
    public Integer blockquoteSize;

    public Integer tocFontSize;
    public Integer tocHeading1FontSize;
    public Integer tocHeading2FontSize;
    public Integer tocHeading3FontSize;
    public Integer tocHeading4FontSize;
    public Integer tocHeading5FontSize;
    public Boolean tocHeading1Bold;
    public Boolean tocHeading2Bold;
    public Boolean tocHeading3Bold;
    public Boolean tocHeading4Bold;
    public Boolean tocHeading5Bold;
    public Boolean tocHeading1Italic;
    public Boolean tocHeading2Italic;
    public Boolean tocHeading3Italic;
    public Boolean tocHeading4Italic;
    public Boolean tocHeading5Italic;

    public Alignment paragraphAlignment;
    public Alignment headingAlignment;
    public Alignment heading1Alignment;
    public Alignment heading2Alignment;
    public Alignment heading3Alignment;
    public Alignment heading4Alignment;
    public Alignment heading5Alignment;
    public Alignment blockquoteAlignment;

    public TableLayout tableLayout;

    public static Style defaults() {
        Style style = new Style();
        style.titleSize = 32;
        style.headingSpacing = 240;
        style.paragraphSpacing = 240;
        style.lineSpacing = 1.15;
        style.direction = TextDirection.LTR;
        style.heading1Size = 32;
        style.heading2Size = 28;
        style.heading3Size = 24;
        style.heading4Size = 20;
        style.heading5Size = 18;
        style.paragraphSize = 24;
        style.listItemSize = 24;
        style.codeBlockSize = 20;
        style.blockquoteSize = 24;
        style.paragraphAlignment = Alignment.LEFT;
        style.headingAlignment = Alignment.LEFT;
        style.heading1Alignment = Alignment.LEFT;
        style.heading2Alignment = Alignment.LEFT;
        style.heading3Alignment = Alignment.LEFT;
        style.heading4Alignment = Alignment.LEFT;
        style.heading5Alignment = Alignment.LEFT;
        style.blockquoteAlignment = Alignment.LEFT;
        style.tableLayout = TableLayout.AUTOFIT;
        return style;
    }

    /**
     * Returns a copy where the deprecated alias has been folded into {@code fontFamily}.
     * An explicit {@code fontFamily} wins over the alias.
     */
    public Style normalized() {
        Style copy = overlay(null);
        copy.fontFamily = Merge.pick(fontFamily, fontFamilly);
        copy.fontFamilly = null;
        return copy;
    }

    /**
     * Returns a new style holding every field of {@code override} that is set,
     * and this style's value for every other field. Neither input is modified.
     */
    public Style overlay(Style override) {
        Style o = override != null ? override : new Style();
        Style merged = new Style();
        merged.titleSize = Merge.pick(o.titleSize, titleSize);
        merged.headingSpacing = Merge.pick(o.headingSpacing, headingSpacing);
        merged.paragraphSpacing = Merge.pick(o.paragraphSpacing, paragraphSpacing);
        merged.lineSpacing = Merge.pick(o.lineSpacing, lineSpacing);
        merged.fontFamily = Merge.pick(o.fontFamily, fontFamily);
        merged.fontFamilly = Merge.pick(o.fontFamilly, fontFamilly);
        merged.direction = Merge.pick(o.direction, direction);
        merged.heading1Size = Merge.pick(o.heading1Size, heading1Size);
        merged.heading2Size = Merge.pick(o.heading2Size, heading2Size);
        merged.heading3Size = Merge.pick(o.heading3Size, heading3Size);
        merged.heading4Size = Merge.pick(o.heading4Size, heading4Size);
        merged.heading5Size = Merge.pick(o.heading5Size, heading5Size);
        merged.paragraphSize = Merge.pick(o.paragraphSize, paragraphSize);
        merged.listItemSize = Merge.pick(o.listItemSize, listItemSize);
        merged.codeBlockSize = Merge.pick(o.codeBlockSize, codeBlockSize);
        merged.blockquoteSize = Merge.pick(o.blockquoteSize, blockquoteSize);
        merged.tocFontSize = Merge.pick(o.tocFontSize, tocFontSize);
        merged.tocHeading1FontSize = Merge.pick(o.tocHeading1FontSize, tocHeading1FontSize);
        merged.tocHeading2FontSize = Merge.pick(o.tocHeading2FontSize, tocHeading2FontSize);
        merged.tocHeading3FontSize = Merge.pick(o.tocHeading3FontSize, tocHeading3FontSize);
        merged.tocHeading4FontSize = Merge.pick(o.tocHeading4FontSize, tocHeading4FontSize);
        merged.tocHeading5FontSize = Merge.pick(o.tocHeading5FontSize, tocHeading5FontSize);
        merged.tocHeading1Bold = Merge.pick(o.tocHeading1Bold, tocHeading1Bold);
        merged.tocHeading2Bold = Merge.pick(o.tocHeading2Bold, tocHeading2Bold);
        merged.tocHeading3Bold = Merge.pick(o.tocHeading3Bold, tocHeading3Bold);
        merged.tocHeading4Bold = Merge.pick(o.tocHeading4Bold, tocHeading4Bold);
        merged.tocHeading5Bold = Merge.pick(o.tocHeading5Bold, tocHeading5Bold);
        merged.tocHeading1Italic = Merge.pick(o.tocHeading1Italic, tocHeading1Italic);
        merged.tocHeading2Italic = Merge.pick(o.tocHeading2Italic, tocHeading2Italic);
        merged.tocHeading3Italic = Merge.pick(o.tocHeading3Italic, tocHeading3Italic);
        merged.tocHeading4Italic = Merge.pick(o.tocHeading4Italic, tocHeading4Italic);
        merged.tocHeading5Italic = Merge.pick(o.tocHeading5Italic, tocHeading5Italic);
        merged.paragraphAlignment = Merge.pick(o.paragraphAlignment, paragraphAlignment);
        merged.headingAlignment = Merge.pick(o.headingAlignment, headingAlignment);
        merged.heading1Alignment = Merge.pick(o.heading1Alignment, heading1Alignment);
        merged.heading2Alignment = Merge.pick(o.heading2Alignment, heading2Alignment);
        merged.heading3Alignment = Merge.pick(o.heading3Alignment, heading3Alignment);
        merged.heading4Alignment = Merge.pick(o.heading4Alignment, heading4Alignment);
        merged.heading5Alignment = Merge.pick(o.heading5Alignment, heading5Alignment);
        merged.blockquoteAlignment = Merge.pick(o.blockquoteAlignment, blockquoteAlignment);
        merged.tableLayout = Merge.pick(o.tableLayout, tableLayout);
        return merged;
    }

    public Integer tocFontSizeForLevel(int level) {
        return switch (level) {
            case 1 -> tocHeading1FontSize;
            case 2 -> tocHeading2FontSize;
            case 3 -> tocHeading3FontSize;
            case 4 -> tocHeading4FontSize;
            case 5 -> tocHeading5FontSize;
            default -> null;
        };
    }

    public Boolean tocBoldForLevel(int level) {
        return switch (level) {
            case 1 -> tocHeading1Bold;
            case 2 -> tocHeading2Bold;
            case 3 -> tocHeading3Bold;
            case 4 -> tocHeading4Bold;
            case 5 -> tocHeading5Bold;
            default -> null;
        };
    }

    public Boolean tocItalicForLevel(int level) {
        return switch (level) {
            case 1 -> tocHeading1Italic;
            case 2 -> tocHeading2Italic;
            case 3 -> tocHeading3Italic;
            case 4 -> tocHeading4Italic;
            case 5 -> tocHeading5Italic;
            default -> null;
        };
    }
}
