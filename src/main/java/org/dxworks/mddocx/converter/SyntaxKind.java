package org.dxworks.mddocx.converter;

import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;

/**
 * The node kinds the converter understands. Everything else maps to {@link #UNKNOWN},
 * which the converter handles explicitly by producing nothing.
 */
public enum SyntaxKind {
    DOCUMENT,
    HEADING,
    PARAGRAPH,
    BULLET_LIST,
    ORDERED_LIST,
    LIST_ITEM,
    FENCED_CODE,
    INDENTED_CODE,
    BLOCK_QUOTE,
    IMAGE,
    TABLE,
    TABLE_HEAD,
    TABLE_BODY,
    TABLE_ROW,
    TABLE_CELL,
    HTML_BLOCK,
    THEMATIC_BREAK,
    FRONT_MATTER,
    TEXT,
    EMPHASIS,
    STRONG,
    INLINE_CODE,
    INLINE_HTML,
    LINK,
    HARD_BREAK,
    SOFT_BREAK,
    UNKNOWN;

    public static SyntaxKind of(Node node) {
        if (node instanceof Document) return DOCUMENT;
        if (node instanceof Heading) return HEADING;
        if (node instanceof Paragraph) return PARAGRAPH;
        if (node instanceof BulletList) return BULLET_LIST;
        if (node instanceof OrderedList) return ORDERED_LIST;
        if (node instanceof ListItem) return LIST_ITEM;
        if (node instanceof FencedCodeBlock) return FENCED_CODE;
        if (node instanceof IndentedCodeBlock) return INDENTED_CODE;
        if (node instanceof BlockQuote) return BLOCK_QUOTE;
        if (node instanceof Image) return IMAGE;
        if (node instanceof TableBlock) return TABLE;
        if (node instanceof TableHead) return TABLE_HEAD;
        if (node instanceof TableBody) return TABLE_BODY;
        if (node instanceof TableRow) return TABLE_ROW;
        if (node instanceof TableCell) return TABLE_CELL;
        if (node instanceof HtmlBlock) return HTML_BLOCK;
        if (node instanceof ThematicBreak) return THEMATIC_BREAK;
        if (node instanceof YamlFrontMatterBlock) return FRONT_MATTER;
        if (node instanceof Text) return TEXT;
        if (node instanceof Emphasis) return EMPHASIS;
        if (node instanceof StrongEmphasis) return STRONG;
        if (node instanceof Code) return INLINE_CODE;
        if (node instanceof HtmlInline) return INLINE_HTML;
        if (node instanceof Link) return LINK;
        if (node instanceof HardLineBreak) return HARD_BREAK;
        if (node instanceof SoftLineBreak) return SOFT_BREAK;
        return UNKNOWN;
    }
}
