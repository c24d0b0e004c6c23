package org.dxworks.mddocx.toc;

import org.dxworks.mddocx.config.Style;
import org.dxworks.mddocx.model.BlockNode;
import org.dxworks.mddocx.model.BlockType;
import org.dxworks.mddocx.model.Diagnostic;
import org.dxworks.mddocx.model.DocumentModel;
import org.dxworks.mddocx.model.ParagraphNode;
import org.dxworks.mddocx.model.TextRun;
import org.dxworks.mddocx.model.TocEntryNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces table-of-contents placeholders once the headings of every section are known.
 * <p>
 * Only the first placeholder of the document (in section order) is replaced; the resolver then moves
 * from {@link TocState#PENDING} to {@link TocState#INSERTED} and any later placeholder is left as is
 * and reported as a {@code DUPLICATE_TOC} warning. With no registered headings every placeholder is
 * removed and nothing is generated.
 */
public class TocResolver {

    private static final Logger logger = LoggerFactory.getLogger(TocResolver.class);

    public static final String TITLE = "Table of Contents";
    public static final String DUPLICATE_TOC = "DUPLICATE_TOC";
    static final int INDENT_PER_LEVEL = 360;

    private final HeadingRegistry registry;
    private final List<Diagnostic> diagnostics;
    private TocState state = TocState.PENDING;

    public TocResolver(HeadingRegistry registry, List<Diagnostic> diagnostics) {
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    /**
     * @param sections models in section order
     * @param styles   resolved style of each section, same order; styles the generated entries
     * @return new models; the inputs are not modified
     */
    public List<DocumentModel> resolvePlaceholders(List<DocumentModel> sections, List<Style> styles) {
        List<DocumentModel> resolved = new ArrayList<>(sections.size());
        for (int i = 0; i < sections.size(); i++) {
            Style style = i < styles.size() ? styles.get(i) : Style.defaults();
            resolved.add(resolveSection(sections.get(i), style, i));
        }
        return resolved;
    }

    private DocumentModel resolveSection(DocumentModel section, Style style, int sectionIndex) {
        boolean changed = false;
        List<BlockNode> children = new ArrayList<>();
        for (BlockNode block : section.children) {
            if (block.type != BlockType.TOC_PLACEHOLDER) {
                children.add(block);
                continue;
            }
            if (registry.isEmpty()) {
                state = TocState.INSERTED;
                changed = true;
                continue;
            }
            if (state == TocState.PENDING) {
                children.addAll(buildToc(style));
                state = TocState.INSERTED;
                changed = true;
                continue;
            }
            Diagnostic diagnostic = Diagnostic.warning(DUPLICATE_TOC,
                    "Table of contents already inserted; additional placeholder left unresolved", sectionIndex);
            logger.warn("{}", diagnostic);
            diagnostics.add(diagnostic);
            children.add(block);
        }
        return changed ? new DocumentModel(children) : section;
    }

    private List<BlockNode> buildToc(Style style) {
        List<BlockNode> blocks = new ArrayList<>();
        blocks.add(new ParagraphNode(List.of(new TextRun(TITLE, true, false, false, null))));
        for (HeadingEntry entry : registry.getEntries()) {
            Integer fontSize = style.tocFontSizeForLevel(entry.level);
            blocks.add(new TocEntryNode(
                    entry.text,
                    entry.level,
                    entry.anchorId,
                    (entry.level - 1) * INDENT_PER_LEVEL,
                    fontSize != null ? fontSize : style.tocFontSize,
                    style.tocBoldForLevel(entry.level),
                    style.tocItalicForLevel(entry.level)));
        }
        return blocks;
    }

    public TocState getState() {
        return state;
    }
}
