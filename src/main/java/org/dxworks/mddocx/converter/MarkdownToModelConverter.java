package org.dxworks.mddocx.converter;

import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.node.Text;
import org.dxworks.mddocx.config.Style;
import org.dxworks.mddocx.model.BlockNode;
import org.dxworks.mddocx.model.BlockquoteNode;
import org.dxworks.mddocx.model.CodeBlockNode;
import org.dxworks.mddocx.model.ColumnAlignment;
import org.dxworks.mddocx.model.CommentNode;
import org.dxworks.mddocx.model.DocumentModel;
import org.dxworks.mddocx.model.HeadingNode;
import org.dxworks.mddocx.model.ImageNode;
import org.dxworks.mddocx.model.ListItemNode;
import org.dxworks.mddocx.model.ListNode;
import org.dxworks.mddocx.model.PageBreakNode;
import org.dxworks.mddocx.model.ParagraphNode;
import org.dxworks.mddocx.model.TableNode;
import org.dxworks.mddocx.model.TextRun;
import org.dxworks.mddocx.model.TocPlaceholderNode;
import org.dxworks.mddocx.numbering.NumberingRegistry;
import org.dxworks.mddocx.toc.HeadingRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a parsed Markdown tree into the document model of one section.
 * <p>
 * Ordered lists are allocated in the numbering registry when first visited, before their items, and
 * every heading is registered in the heading registry in document order. The conversion never fails:
 * unknown node kinds and unsupported raw HTML are dropped, table cells are flattened to plain text.
 */
public class MarkdownToModelConverter {

    private final NumberingRegistry numbering;
    private final HeadingRegistry headings;
    private final Style style;

    public MarkdownToModelConverter(NumberingRegistry numbering, HeadingRegistry headings, Style style) {
        this.numbering = numbering;
        this.headings = headings;
        this.style = style != null ? style : Style.defaults();
    }

    public DocumentModel convert(Node document) {
        List<BlockNode> children = new ArrayList<>();
        for (Node child = document.getFirstChild(); child != null; child = child.getNext()) {
            children.addAll(convertTopLevel(child));
        }
        return new DocumentModel(children);
    }

    private List<BlockNode> convertTopLevel(Node node) {
        if (node instanceof Paragraph paragraph) {
            RawMarkers.Match marker = RawMarkers.classifyLine(standaloneText(paragraph));
            switch (marker.kind) {
                case TOC:
                    return List.of(new TocPlaceholderNode());
                case PAGE_BREAK:
                    return List.of(new PageBreakNode());
                default:
                    break;
            }
        }
        return convertBlock(node);
    }

    List<BlockNode> convertBlock(Node node) {
        return switch (SyntaxKind.of(node)) {
            case HEADING -> List.of(convertHeading((Heading) node));
            case PARAGRAPH -> convertParagraph((Paragraph) node);
            case BULLET_LIST, ORDERED_LIST -> List.of(convertList((ListBlock) node));
            case FENCED_CODE -> List.of(convertFencedCode((FencedCodeBlock) node));
            case INDENTED_CODE -> List.of(new CodeBlockNode(null,
                    stripTrailingNewline(((IndentedCodeBlock) node).getLiteral())));
            case BLOCK_QUOTE -> List.of(new BlockquoteNode(convertChildren(node)));
            case IMAGE -> List.of(convertImage((Image) node));
            case TABLE -> List.of(convertTable((TableBlock) node));
            case HTML_BLOCK -> convertRaw(((HtmlBlock) node).getLiteral());
            case THEMATIC_BREAK, FRONT_MATTER -> List.of();
            default -> List.of();
        };
    }

    private List<BlockNode> convertChildren(Node parent) {
        List<BlockNode> children = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
            children.addAll(convertBlock(child));
        }
        return children;
    }

    private HeadingNode convertHeading(Heading heading) {
        List<TextRun> runs = convertInlines(heading);
        StringBuilder text = new StringBuilder();
        for (TextRun run : runs) {
            text.append(run.value);
        }
        String anchorId = headings.register(text.toString().trim(), heading.getLevel());
        return new HeadingNode(heading.getLevel(), runs, anchorId);
    }

    private List<BlockNode> convertParagraph(Paragraph paragraph) {
        Node first = paragraph.getFirstChild();
        if (first instanceof Image image && first.getNext() == null) {
            return List.of(convertImage(image));
        }
        List<BlockNode> blocks = new ArrayList<>();
        blocks.add(new ParagraphNode(convertInlines(paragraph)));
        // comments written inside running text follow their paragraph
        collectInlineComments(paragraph, blocks);
        return blocks;
    }

    private static void collectInlineComments(Node parent, List<BlockNode> out) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof HtmlInline html) {
                RawMarkers.Match marker = RawMarkers.classifyRaw(html.getLiteral());
                if (marker.kind == RawMarkers.Kind.COMMENT) {
                    out.add(new CommentNode(marker.body));
                }
            } else {
                collectInlineComments(child, out);
            }
        }
    }

    private ListNode convertList(ListBlock list) {
        boolean ordered = SyntaxKind.of(list) == SyntaxKind.ORDERED_LIST;
        // allocate before the items so an outer list always gets the lower id
        Integer sequenceId = ordered ? numbering.allocate(list) : null;

        List<ListItemNode> items = new ArrayList<>();
        for (Node item = list.getFirstChild(); item != null; item = item.getNext()) {
            if (item instanceof ListItem) {
                items.add(new ListItemNode(convertChildren(item)));
            }
        }
        return new ListNode(ordered, items, sequenceId);
    }

    private CodeBlockNode convertFencedCode(FencedCodeBlock codeBlock) {
        String language = null;
        String info = codeBlock.getInfo();
        if (info != null && !info.isBlank()) {
            language = info.trim().split("\\s+", 2)[0];
        }
        return new CodeBlockNode(language, stripTrailingNewline(codeBlock.getLiteral()));
    }

    private ImageNode convertImage(Image image) {
        return new ImageNode(flattenText(image), image.getDestination());
    }

    private TableNode convertTable(TableBlock table) {
        List<String> headers = null;
        List<ColumnAlignment> alignments = new ArrayList<>();
        List<List<String>> rows = new ArrayList<>();

        // first row is the header, whether it sits in a head or a body section
        for (Node part = table.getFirstChild(); part != null; part = part.getNext()) {
            for (Node row = part.getFirstChild(); row != null; row = row.getNext()) {
                if (!(row instanceof TableRow)) {
                    continue;
                }
                List<String> cells = new ArrayList<>();
                for (Node cell = row.getFirstChild(); cell != null; cell = cell.getNext()) {
                    if (cell instanceof TableCell tableCell) {
                        cells.add(flattenText(tableCell).trim());
                        if (headers == null) {
                            alignments.add(toColumnAlignment(tableCell.getAlignment()));
                        }
                    }
                }
                if (headers == null) {
                    headers = cells;
                } else {
                    rows.add(cells);
                }
            }
        }

        return new TableNode(headers != null ? headers : List.of(), rows, alignments, style.tableLayout);
    }

    private static ColumnAlignment toColumnAlignment(TableCell.Alignment alignment) {
        if (alignment == null) {
            return null;
        }
        return switch (alignment) {
            case LEFT -> ColumnAlignment.LEFT;
            case CENTER -> ColumnAlignment.CENTER;
            case RIGHT -> ColumnAlignment.RIGHT;
        };
    }

    private static List<BlockNode> convertRaw(String literal) {
        RawMarkers.Match marker = RawMarkers.classifyRaw(literal);
        return switch (marker.kind) {
            case COMMENT -> List.of(new CommentNode(marker.body));
            case PAGE_BREAK -> List.of(new PageBreakNode());
            default -> List.of();
        };
    }

    // ---- inline content ----

    private List<TextRun> convertInlines(Node parent) {
        InlineCollector collector = new InlineCollector();
        collectChildren(parent, InlineAttributes.NONE, collector);
        return collector.finish();
    }

    private void collectChildren(Node parent, InlineAttributes attributes, InlineCollector out) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
            collectInline(child, attributes, out);
        }
    }

    private void collectInline(Node node, InlineAttributes attributes, InlineCollector out) {
        switch (SyntaxKind.of(node)) {
            case TEXT -> out.append(((Text) node).getLiteral(), attributes);
            case EMPHASIS -> collectChildren(node, attributes.withItalic(), out);
            case STRONG -> collectChildren(node, attributes.withBold(), out);
            case INLINE_CODE -> out.append(((Code) node).getLiteral(), attributes.withCode());
            case LINK -> collectChildren(node, attributes.withLink(((Link) node).getDestination()), out);
            case HARD_BREAK, SOFT_BREAK -> out.append("\n", attributes);
            case INLINE_HTML -> {
                if (RawMarkers.isLineBreakTag(((HtmlInline) node).getLiteral())) {
                    out.append("\n", attributes);
                }
            }
            case IMAGE -> {
                // images inside running text carry no text of their own
            }
            default -> collectChildren(node, attributes, out);
        }
    }

    /**
     * Concatenated text of the paragraph, or {@code null} when it holds anything but plain text.
     */
    private static String standaloneText(Paragraph paragraph) {
        StringBuilder text = new StringBuilder();
        for (Node child = paragraph.getFirstChild(); child != null; child = child.getNext()) {
            if (!(child instanceof Text textNode)) {
                return null;
            }
            text.append(textNode.getLiteral());
        }
        return text.toString();
    }

    /**
     * Plain text of every text-bearing descendant; line breaks become {@code \n}.
     */
    static String flattenText(Node node) {
        StringBuilder text = new StringBuilder();
        appendText(node, text);
        return text.toString();
    }

    private static void appendText(Node node, StringBuilder text) {
        for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
            switch (SyntaxKind.of(child)) {
                case TEXT -> text.append(((Text) child).getLiteral());
                case INLINE_CODE -> text.append(((Code) child).getLiteral());
                case HARD_BREAK, SOFT_BREAK -> text.append('\n');
                case INLINE_HTML -> {
                    if (RawMarkers.isLineBreakTag(((HtmlInline) child).getLiteral())) {
                        text.append('\n');
                    }
                }
                default -> appendText(child, text);
            }
        }
    }

    private static String stripTrailingNewline(String literal) {
        if (literal == null) {
            return "";
        }
        return literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
    }
}
