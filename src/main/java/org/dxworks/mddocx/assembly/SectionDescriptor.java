package org.dxworks.mddocx.assembly;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.mddocx.config.ResolvedHeaderFooter;
import org.dxworks.mddocx.config.ResolvedSectionConfig;
import org.dxworks.mddocx.config.Style;
import org.dxworks.mddocx.model.BlockNode;
import org.dxworks.mddocx.model.DocumentModel;

import java.util.List;

/**
 * Everything the serializer needs to render one section. Header and footer groups are omitted
 * when every slot is empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SectionDescriptor {
    public final SectionProperties properties;
    public final ResolvedHeaderFooter headers;
    public final ResolvedHeaderFooter footers;
    public final Style style;
    public final List<BlockNode> children;

    public SectionDescriptor(SectionProperties properties, ResolvedHeaderFooter headers,
                             ResolvedHeaderFooter footers, Style style, List<BlockNode> children) {
        this.properties = properties;
        this.headers = headers;
        this.footers = footers;
        this.style = style;
        this.children = children;
    }

    static SectionDescriptor of(ResolvedSectionConfig config, DocumentModel model) {
        return new SectionDescriptor(
                SectionProperties.from(config),
                nonEmpty(config.headers),
                nonEmpty(config.footers),
                config.style,
                model.children);
    }

    private static ResolvedHeaderFooter nonEmpty(ResolvedHeaderFooter group) {
        return group == null || group.isEmpty() ? null : group;
    }
}
