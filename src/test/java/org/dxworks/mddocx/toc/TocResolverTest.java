package org.dxworks.mddocx.toc;

import org.dxworks.mddocx.config.Style;
import org.dxworks.mddocx.model.BlockNode;
import org.dxworks.mddocx.model.BlockType;
import org.dxworks.mddocx.model.Diagnostic;
import org.dxworks.mddocx.model.DocumentModel;
import org.dxworks.mddocx.model.ParagraphNode;
import org.dxworks.mddocx.model.TextRun;
import org.dxworks.mddocx.model.TocEntryNode;
import org.dxworks.mddocx.model.TocPlaceholderNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TocResolverTest {

    private static DocumentModel model(BlockNode... blocks) {
        return new DocumentModel(List.of(blocks));
    }

    private static ParagraphNode text(String value) {
        return new ParagraphNode(List.of(TextRun.plain(value)));
    }

    private static HeadingRegistry headings(String... texts) {
        HeadingRegistry registry = new HeadingRegistry();
        int level = 1;
        for (String text : texts) {
            registry.register(text, level++);
        }
        return registry;
    }

    @Test
    void resolve_FirstPlaceholderReplaced() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        TocResolver resolver = new TocResolver(headings("Intro", "Usage"), diagnostics);

        List<DocumentModel> resolved = resolver.resolvePlaceholders(
                List.of(model(text("before"), new TocPlaceholderNode(), text("after"))),
                List.of(Style.defaults()));

        List<BlockNode> children = resolved.get(0).children;
        assertEquals(5, children.size());
        ParagraphNode title = (ParagraphNode) children.get(1);
        assertEquals(TocResolver.TITLE, title.plainText());
        assertTrue(title.children.get(0).bold);

        TocEntryNode intro = (TocEntryNode) children.get(2);
        TocEntryNode usage = (TocEntryNode) children.get(3);
        assertEquals("Intro", intro.text);
        assertEquals("_intro", intro.anchorId);
        assertEquals(0, intro.indent);
        assertEquals(2, usage.level);
        assertEquals(360, usage.indent);
        assertEquals("after", ((ParagraphNode) children.get(4)).plainText());

        assertEquals(TocState.INSERTED, resolver.getState());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void resolve_LaterPlaceholdersReported() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        TocResolver resolver = new TocResolver(headings("Intro"), diagnostics);

        List<DocumentModel> resolved = resolver.resolvePlaceholders(
                List.of(model(new TocPlaceholderNode()), model(new TocPlaceholderNode(), new TocPlaceholderNode())),
                List.of(Style.defaults(), Style.defaults()));

        long entries = resolved.stream()
                .flatMap(section -> section.children.stream())
                .filter(block -> block.type == BlockType.TOC_ENTRY)
                .count();
        assertEquals(1, entries);
        assertEquals(2, resolved.get(1).children.size());
        assertEquals(BlockType.TOC_PLACEHOLDER, resolved.get(1).children.get(0).type);

        assertEquals(2, diagnostics.size());
        assertEquals(TocResolver.DUPLICATE_TOC, diagnostics.get(0).code);
        assertEquals(Diagnostic.Severity.WARNING, diagnostics.get(0).severity);
        assertEquals(1, diagnostics.get(0).sectionIndex);
    }

    @Test
    void resolve_NoHeadingsRemovesPlaceholders() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        TocResolver resolver = new TocResolver(new HeadingRegistry(), diagnostics);

        List<DocumentModel> resolved = resolver.resolvePlaceholders(
                List.of(model(new TocPlaceholderNode(), text("only")), model(new TocPlaceholderNode())),
                List.of(Style.defaults(), Style.defaults()));

        assertEquals(1, resolved.get(0).children.size());
        assertEquals(BlockType.PARAGRAPH, resolved.get(0).children.get(0).type);
        assertTrue(resolved.get(1).children.isEmpty());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void resolve_EntriesStyledByHostingSection() {
        Style style = Style.defaults();
        style.tocFontSize = 20;
        style.tocHeading1FontSize = 28;
        style.tocHeading1Bold = true;
        style.tocHeading2Italic = true;
        TocResolver resolver = new TocResolver(headings("Top", "Sub"), new ArrayList<>());

        List<DocumentModel> resolved = resolver.resolvePlaceholders(
                List.of(model(text("cover")), model(new TocPlaceholderNode())),
                List.of(Style.defaults(), style));

        TocEntryNode top = (TocEntryNode) resolved.get(1).children.get(1);
        TocEntryNode sub = (TocEntryNode) resolved.get(1).children.get(2);
        assertEquals(28, top.fontSize);
        assertTrue(top.bold);
        assertNull(top.italic);
        assertEquals(20, sub.fontSize);
        assertTrue(sub.italic);
    }

    @Test
    void resolve_SectionsWithoutPlaceholderUnchanged() {
        DocumentModel section = model(text("plain"));
        TocResolver resolver = new TocResolver(headings("Intro"), new ArrayList<>());

        List<DocumentModel> resolved = resolver.resolvePlaceholders(List.of(section), List.of(Style.defaults()));

        assertSame(section, resolved.get(0));
        assertEquals(TocState.PENDING, resolver.getState());
    }
}
