package org.dxworks.mddocx.config;

/**
 * Merges the configuration levels of a section, outermost first:
 * built-in defaults, the caller's global style, the template, the section's own overrides.
 * <p>
 * Scalars take the innermost value that is set. Style, page margin, page size and page numbering
 * are merged key by key. Header and footer slots follow {@link HeaderFooterSlot} semantics, so an
 * explicit {@code null} in the section removes a slot the template set.
 * <p>
 * Resolution is pure: inputs are never modified and identical inputs give identical results.
 */
public class SectionConfigResolver {

    private final Style baseStyle;

    public SectionConfigResolver(Style globalStyle) {
        this.baseStyle = Style.defaults().overlay(normalize(globalStyle));
    }

    public ResolvedSectionConfig resolve(SectionConfig template, SectionConfig section) {
        SectionConfig t = template != null ? template : new SectionConfig();
        SectionConfig s = section != null ? section : new SectionConfig();

        Style style = baseStyle.overlay(normalize(t.style)).overlay(normalize(s.style));
        PageConfig page = PageConfig.defaults().overlay(t.page).overlay(s.page);
        PageNumbering numbering = new PageNumbering().overlay(t.pageNumbering).overlay(s.pageNumbering);

        HeaderFooterGroup templateHeaders = groupOrEmpty(t.headers);
        HeaderFooterGroup sectionHeaders = groupOrEmpty(s.headers);
        HeaderFooterGroup templateFooters = groupOrEmpty(t.footers);
        HeaderFooterGroup sectionFooters = groupOrEmpty(s.footers);

        ResolvedHeaderFooter headers = new ResolvedHeaderFooter(
                resolveSlot(templateHeaders.defaultSlot, sectionHeaders.defaultSlot),
                resolveSlot(templateHeaders.firstSlot, sectionHeaders.firstSlot),
                resolveSlot(templateHeaders.evenSlot, sectionHeaders.evenSlot));

        HeaderFooterContent defaultFooter = resolveSlot(templateFooters.defaultSlot, sectionFooters.defaultSlot);
        boolean defaultFooterCleared = effectiveState(templateFooters.defaultSlot, sectionFooters.defaultSlot)
                == HeaderFooterSlot.State.CLEAR;
        if (defaultFooter == null && !defaultFooterCleared && numbering.showsPageNumbers()) {
            defaultFooter = new HeaderFooterContent(null, numbering.alignment, numbering.display);
        }
        ResolvedHeaderFooter footers = new ResolvedHeaderFooter(
                defaultFooter,
                resolveSlot(templateFooters.firstSlot, sectionFooters.firstSlot),
                resolveSlot(templateFooters.evenSlot, sectionFooters.evenSlot));

        boolean titlePage = Merge.pick(s.titlePage, Merge.pick(t.titlePage, Boolean.FALSE));
        SectionBreakType type = Merge.pick(s.type, t.type);

        return new ResolvedSectionConfig(style, page, headers, footers, numbering, titlePage, type);
    }

    static HeaderFooterContent resolveSlot(HeaderFooterSlot inherited, HeaderFooterSlot override) {
        HeaderFooterContent base = inherited.isSet() ? inherited.getValue() : null;
        switch (override.getState()) {
            case CLEAR:
                return null;
            case SET:
                return base == null ? override.getValue().copy() : base.overlay(override.getValue());
            case INHERIT:
            default:
                return base == null ? null : base.copy();
        }
    }

    private static HeaderFooterSlot.State effectiveState(HeaderFooterSlot inherited, HeaderFooterSlot override) {
        return override.isInherit() ? inherited.getState() : override.getState();
    }

    private static HeaderFooterGroup groupOrEmpty(HeaderFooterGroup group) {
        if (group == null) {
            return HeaderFooterGroup.empty();
        }
        // fields are public and may have been nulled by a caller
        HeaderFooterGroup safe = new HeaderFooterGroup();
        safe.defaultSlot = group.defaultSlot != null ? group.defaultSlot : HeaderFooterSlot.inherit();
        safe.firstSlot = group.firstSlot != null ? group.firstSlot : HeaderFooterSlot.inherit();
        safe.evenSlot = group.evenSlot != null ? group.evenSlot : HeaderFooterSlot.inherit();
        return safe;
    }

    private static Style normalize(Style style) {
        return style == null ? null : style.normalized();
    }

    public Style getBaseStyle() {
        return baseStyle.overlay(null);
    }
}
