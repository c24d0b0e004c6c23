package org.dxworks.mddocx.assembly;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.mddocx.OptionsLoader;
import org.dxworks.mddocx.TestUtils;
import org.dxworks.mddocx.config.Alignment;
import org.dxworks.mddocx.config.DocumentSection;
import org.dxworks.mddocx.config.DocumentType;
import org.dxworks.mddocx.config.Options;
import org.dxworks.mddocx.config.PageNumberFormat;
import org.dxworks.mddocx.config.TextReplacement;
import org.dxworks.mddocx.converter.CommonmarkMarkdownParser;
import org.dxworks.mddocx.model.BlockType;
import org.dxworks.mddocx.model.HeadingNode;
import org.dxworks.mddocx.model.ListNode;
import org.dxworks.mddocx.model.TocEntryNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DocumentAssemblerTest {

    private final DocumentAssembler assembler = new DocumentAssembler();

    private static Options sections(String... markdowns) {
        Options options = new Options();
        for (String markdown : markdowns) {
            options.sections.add(new DocumentSection(markdown));
        }
        return options;
    }

    @Test
    void assemble_SingleSectionFromMarkdown() throws Exception {
        DocumentOptions document = assembler.assemble("# Title\n\n1. a\n2. b", null);

        assertEquals(DocumentType.DOCUMENT, document.documentType);
        assertEquals(1, document.sections.size());

        SectionDescriptor section = document.sections.get(0);
        HeadingNode heading = (HeadingNode) section.children.get(0);
        assertEquals(1, heading.level);
        assertEquals("Title", heading.children.get(0).value);

        ListNode list = (ListNode) section.children.get(1);
        assertEquals(1, list.sequenceId);
        assertEquals(1, document.numbering.config.size());
        assertEquals("numbered-list-1", document.numbering.config.get(0).reference);
    }

    @Test
    void assemble_SequenceIdsDisjointAcrossSections() throws Exception {
        DocumentOptions document = assembler.assemble("", sections("1. x", "1. y"));

        assertEquals(2, document.numbering.config.size());
        assertNotEquals(document.numbering.config.get(0).reference, document.numbering.config.get(1).reference);
        assertEquals(1, ((ListNode) document.sections.get(0).children.get(0)).sequenceId);
        assertEquals(2, ((ListNode) document.sections.get(1).children.get(0)).sequenceId);
    }

    @Test
    void assemble_SectionsIgnoreTopLevelMarkdown() throws Exception {
        DocumentOptions document = assembler.assemble("# Ignored", sections("text"));

        assertEquals(1, document.sections.size());
        assertEquals(BlockType.PARAGRAPH, document.sections.get(0).children.get(0).type);
    }

    @Test
    void assemble_RepeatedPassesGiveSameOutput() throws Exception {
        Options options = sections("# Intro\n\n[TOC]\n\n1. a", "# Intro\n\n1. b\n   1. c");

        JsonNode first = TestUtils.APPROVAL_MAPPER.valueToTree(assembler.assemble("", options));
        JsonNode second = TestUtils.APPROVAL_MAPPER.valueToTree(assembler.assemble("", options));

        assertEquals(first, second);
    }

    @Test
    void assemble_CoverAndBodySections() throws Exception {
        Options options = OptionsLoader.load(TestUtils.sample("options/sections.json"));

        DocumentOptions document = assembler.assemble("", options);

        assertEquals(2, document.sections.size());
        assertNull(document.sections.get(0).footers);
        assertNull(document.sections.get(0).properties.page.pageNumbers);

        SectionDescriptor body = document.sections.get(1);
        assertNotNull(body.footers.defaultContent);
        assertEquals(1, body.properties.page.pageNumbers.start);
        assertEquals(PageNumberFormat.DECIMAL, body.properties.page.pageNumbers.formatType);
    }

    @Test
    void assemble_YamlOptionsWithTocAndReplacements() throws Exception {
        Options options = OptionsLoader.load(TestUtils.sample("options/sections.yml"));

        DocumentOptions document = assembler.assemble("", options);

        assertEquals(DocumentType.REPORT, document.documentType);
        SectionDescriptor first = document.sections.get(0);
        SectionDescriptor second = document.sections.get(1);

        assertNull(first.headers);
        assertEquals("Quarterly report", second.headers.defaultContent.text);
        assertEquals(Alignment.CENTER, second.headers.defaultContent.alignment);

        assertEquals("Georgia", first.style.fontFamily);
        assertEquals(22, first.style.paragraphSize);
        assertEquals(26, second.style.paragraphSize);

        HeadingNode heading = (HeadingNode) first.children.get(0);
        assertEquals("Acme overview", heading.children.get(0).value);

        assertEquals(4, first.children.size());
        assertEquals(BlockType.PARAGRAPH, first.children.get(1).type);
        TocEntryNode numbers = assertInstanceOf(TocEntryNode.class, first.children.get(3));
        assertEquals("Numbers", numbers.text);
        assertEquals("_numbers", numbers.anchorId);
        assertEquals(2, numbers.level);

        assertEquals(1, ((ListNode) second.children.get(1)).sequenceId);
        assertEquals(1, document.numbering.config.size());
        assertEquals(0, document.diagnostics.size());
    }

    @Test
    void assemble_DuplicateTocReported() throws Exception {
        DocumentOptions document = assembler.assemble("", sections("# A\n\n[TOC]", "[TOC]"));

        assertEquals(1, document.diagnostics.size());
        assertEquals(1, document.diagnostics.get(0).sectionIndex);
        assertEquals(BlockType.TOC_PLACEHOLDER, document.sections.get(1).children.get(0).type);
    }

    @Test
    void assemble_ParserFailureWrapped() {
        IllegalStateException failure = new IllegalStateException("parser down");
        CommonmarkMarkdownParser delegate = new CommonmarkMarkdownParser();
        DocumentAssembler failing = new DocumentAssembler(markdown -> {
            if (markdown.contains("boom")) {
                throw failure;
            }
            return delegate.parse(markdown);
        });

        DocumentAssemblyException e = assertThrows(DocumentAssemblyException.class,
                () -> failing.assemble("", sections("fine", "boom")));

        assertEquals(1, e.getSectionIndex());
        assertSame(failure, e.getCause());
    }

    @Test
    void assemble_BadReplacementGroupRejected() {
        Options options = sections("word");
        options.textReplacements.add(new TextReplacement("(\\w+)", "$2", true));

        assertThrows(IllegalArgumentException.class, () -> assembler.assemble("", options));
    }

    @Test
    void render_SerializerFailureWrapped() {
        IOException failure = new IOException("disk full");

        DocumentAssemblyException e = assertThrows(DocumentAssemblyException.class,
                () -> assembler.render("text", null, options -> {
                    throw failure;
                }));

        assertNull(e.getSectionIndex());
        assertSame(failure, e.getCause());
    }

    @Test
    void render_WritesJson() throws Exception {
        byte[] bytes = assembler.render("# Title", null, new JsonDocumentWriter(false));

        JsonNode tree = TestUtils.APPROVAL_MAPPER.readTree(bytes);
        assertEquals("document", tree.get("documentType").asText());
        assertEquals("_title", tree.at("/sections/0/children/0/anchorId").asText());
        assertEquals(0, tree.get("diagnostics").size());
    }
}
