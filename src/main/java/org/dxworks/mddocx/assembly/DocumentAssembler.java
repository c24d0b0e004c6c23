package org.dxworks.mddocx.assembly;

import org.commonmark.node.Node;
import org.dxworks.mddocx.config.DocumentSection;
import org.dxworks.mddocx.config.DocumentType;
import org.dxworks.mddocx.config.Options;
import org.dxworks.mddocx.config.ResolvedSectionConfig;
import org.dxworks.mddocx.config.SectionConfigResolver;
import org.dxworks.mddocx.config.Style;
import org.dxworks.mddocx.converter.CommonmarkMarkdownParser;
import org.dxworks.mddocx.converter.MarkdownParser;
import org.dxworks.mddocx.converter.MarkdownToModelConverter;
import org.dxworks.mddocx.converter.TextReplacer;
import org.dxworks.mddocx.model.Diagnostic;
import org.dxworks.mddocx.model.DocumentModel;
import org.dxworks.mddocx.numbering.NumberingRegistry;
import org.dxworks.mddocx.toc.HeadingRegistry;
import org.dxworks.mddocx.toc.TocResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one assembly pass: parse, convert and number every section in order, then resolve the
 * table of contents across all of them.
 * <p>
 * The registries live only as long as a single call, so one assembler can serve concurrent passes.
 */
public class DocumentAssembler {

    private static final Logger logger = LoggerFactory.getLogger(DocumentAssembler.class);

    private final MarkdownParser parser;

    public DocumentAssembler() {
        this(new CommonmarkMarkdownParser());
    }

    public DocumentAssembler(MarkdownParser parser) {
        this.parser = parser;
    }

    /**
     * @param markdown used as the only section when {@code options} lists no sections
     * @param options  validated options; {@code null} means defaults
     */
    public DocumentOptions assemble(String markdown, Options options) throws DocumentAssemblyException {
        Options effective = options != null ? options : new Options();
        List<DocumentSection> sections = sectionsOf(markdown, effective);

        NumberingRegistry numbering = new NumberingRegistry();
        HeadingRegistry headings = new HeadingRegistry();
        List<Diagnostic> diagnostics = new ArrayList<>();
        SectionConfigResolver resolver = new SectionConfigResolver(effective.style);
        TextReplacer replacer = new TextReplacer(effective.textReplacements);

        List<ResolvedSectionConfig> configs = new ArrayList<>();
        List<DocumentModel> models = new ArrayList<>();
        for (int i = 0; i < sections.size(); i++) {
            DocumentSection section = sections.get(i);
            ResolvedSectionConfig config = resolver.resolve(effective.template, section);

            Node tree = parse(section.markdown, i);
            replacer.apply(tree);

            int offset = numbering.registerSection(numbering.getMaxSequenceId());
            DocumentModel model = new MarkdownToModelConverter(numbering, headings, config.style).convert(tree);
            int lists = numbering.completeSection();

            logger.debug("Section {}: {} blocks, {} ordered lists numbered after {}",
                    i, model.children.size(), lists, offset);
            configs.add(config);
            models.add(model);
        }

        List<Style> styles = new ArrayList<>();
        for (ResolvedSectionConfig config : configs) {
            styles.add(config.style);
        }
        List<DocumentModel> resolved = new TocResolver(headings, diagnostics).resolvePlaceholders(models, styles);

        List<SectionDescriptor> descriptors = new ArrayList<>();
        for (int i = 0; i < resolved.size(); i++) {
            descriptors.add(SectionDescriptor.of(configs.get(i), resolved.get(i)));
        }

        DocumentType documentType = effective.documentType != null ? effective.documentType : DocumentType.DOCUMENT;
        return new DocumentOptions(documentType, descriptors, numbering.numberingConfig(), diagnostics);
    }

    /**
     * Assembles the document and hands it to {@code serializer}.
     */
    public byte[] render(String markdown, Options options, DocumentSerializer serializer)
            throws DocumentAssemblyException {
        DocumentOptions document = assemble(markdown, options);
        try {
            return serializer.serialize(document);
        } catch (IOException | RuntimeException e) {
            throw new DocumentAssemblyException("Failed to serialize document: " + e.getMessage(), e);
        }
    }

    private Node parse(String markdown, int sectionIndex) throws DocumentAssemblyException {
        try {
            return parser.parse(markdown != null ? markdown : "");
        } catch (RuntimeException e) {
            throw new DocumentAssemblyException(
                    "Failed to parse section " + sectionIndex + ": " + e.getMessage(), sectionIndex, e);
        }
    }

    private static List<DocumentSection> sectionsOf(String markdown, Options options) {
        if (options.sections == null || options.sections.isEmpty()) {
            return List.of(new DocumentSection(markdown));
        }
        return options.sections;
    }
}
