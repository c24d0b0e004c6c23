package org.dxworks.mddocx.assembly;

import org.dxworks.mddocx.config.DocumentType;
import org.dxworks.mddocx.model.Diagnostic;
import org.dxworks.mddocx.numbering.NumberingDefinition;

import java.util.Collections;
import java.util.List;

/**
 * Result of one assembly pass: the sections to render, the numbering definitions their ordered
 * lists refer to, and the diagnostics collected on the way.
 */
public final class DocumentOptions {
    public final DocumentType documentType;
    public final List<SectionDescriptor> sections;
    public final Numbering numbering;
    public final List<Diagnostic> diagnostics;

    public DocumentOptions(DocumentType documentType, List<SectionDescriptor> sections,
                           List<NumberingDefinition> numberingConfig, List<Diagnostic> diagnostics) {
        this.documentType = documentType;
        this.sections = Collections.unmodifiableList(sections);
        this.numbering = new Numbering(numberingConfig);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public static final class Numbering {
        public final List<NumberingDefinition> config;

        Numbering(List<NumberingDefinition> config) {
            this.config = Collections.unmodifiableList(config);
        }
    }
}
