package org.dxworks.mddocx.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mddocx.TestUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SectionConfigResolverTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static SectionConfig withHeader(HeaderFooterSlot slot) {
        SectionConfig config = new SectionConfig();
        config.headers = new HeaderFooterGroup();
        config.headers.defaultSlot = slot;
        return config;
    }

    // ---- header / footer slots ----

    @Test
    void resolve_ExplicitNullClearsTemplateSlot() {
        SectionConfig template = withHeader(HeaderFooterSlot.set(new HeaderFooterContent("Report", Alignment.CENTER, null)));
        SectionConfig section = withHeader(HeaderFooterSlot.clear());

        ResolvedSectionConfig resolved = new SectionConfigResolver(null).resolve(template, section);

        assertNull(resolved.headers.defaultContent);
        assertTrue(resolved.headers.isEmpty());
    }

    @Test
    void resolve_AbsentSlotInheritsTemplateCopy() {
        HeaderFooterContent templateHeader = new HeaderFooterContent("Report", Alignment.CENTER, null);
        SectionConfig template = withHeader(HeaderFooterSlot.set(templateHeader));

        ResolvedSectionConfig resolved = new SectionConfigResolver(null).resolve(template, new SectionConfig());

        assertEquals(templateHeader, resolved.headers.defaultContent);
        assertNotSame(templateHeader, resolved.headers.defaultContent);
    }

    @Test
    void resolve_SetSlotMergesOverTemplate() {
        SectionConfig template = withHeader(HeaderFooterSlot.set(new HeaderFooterContent("Report", Alignment.CENTER, null)));
        SectionConfig section = withHeader(HeaderFooterSlot.set(new HeaderFooterContent(null, Alignment.RIGHT, null)));

        ResolvedSectionConfig resolved = new SectionConfigResolver(null).resolve(template, section);

        assertEquals(new HeaderFooterContent("Report", Alignment.RIGHT, null), resolved.headers.defaultContent);
    }

    @Test
    void resolve_CoverAndBodyFooters() throws Exception {
        Options options = MAPPER.readValue(TestUtils.sample("options/sections.json").toFile(), Options.class);
        SectionConfigResolver resolver = new SectionConfigResolver(options.style);

        ResolvedSectionConfig cover = resolver.resolve(options.template, options.sections.get(0));
        ResolvedSectionConfig body = resolver.resolve(options.template, options.sections.get(1));

        assertTrue(cover.footers.isEmpty());
        assertEquals(PageNumberDisplay.NONE, cover.pageNumbering.display);
        assertEquals(Alignment.CENTER, cover.style.paragraphAlignment);

        assertEquals(new HeaderFooterContent("Page", Alignment.RIGHT, PageNumberDisplay.CURRENT_AND_SECTION_TOTAL),
                body.footers.defaultContent);
        assertEquals(1, body.pageNumbering.start);
        assertEquals(PageNumberFormat.DECIMAL, body.pageNumbering.formatType);
        assertEquals(PageNumberDisplay.CURRENT, body.pageNumbering.display);
        assertEquals(Alignment.LEFT, body.style.paragraphAlignment);
    }

    @Test
    void resolve_PageNumbersAddDefaultFooter() {
        SectionConfig template = new SectionConfig();
        template.pageNumbering = new PageNumbering();
        template.pageNumbering.display = PageNumberDisplay.CURRENT_AND_TOTAL;
        template.pageNumbering.alignment = Alignment.RIGHT;

        ResolvedSectionConfig resolved = new SectionConfigResolver(null).resolve(template, new SectionConfig());

        assertEquals(new HeaderFooterContent(null, Alignment.RIGHT, PageNumberDisplay.CURRENT_AND_TOTAL),
                resolved.footers.defaultContent);
    }

    @Test
    void resolve_ClearedFooterStaysClearedWithPageNumbers() {
        SectionConfig template = new SectionConfig();
        template.pageNumbering = new PageNumbering();
        template.pageNumbering.display = PageNumberDisplay.CURRENT;
        SectionConfig section = new SectionConfig();
        section.footers = new HeaderFooterGroup();
        section.footers.defaultSlot = HeaderFooterSlot.clear();

        ResolvedSectionConfig resolved = new SectionConfigResolver(null).resolve(template, section);

        assertNull(resolved.footers.defaultContent);
    }

    // ---- tri-state from JSON ----

    @Test
    void deserialize_SlotStates() throws Exception {
        HeaderFooterGroup cleared = MAPPER.readValue("{\"default\": null}", HeaderFooterGroup.class);
        HeaderFooterGroup absent = MAPPER.readValue("{}", HeaderFooterGroup.class);
        HeaderFooterGroup set = MAPPER.readValue("{\"even\": {\"text\": \"x\"}}", HeaderFooterGroup.class);

        assertTrue(cleared.defaultSlot.isClear());
        assertTrue(cleared.firstSlot.isInherit());
        assertTrue(absent.defaultSlot.isInherit());
        assertTrue(set.evenSlot.isSet());
        assertEquals("x", set.evenSlot.getValue().text);
    }

    // ---- style and page merging ----

    @Test
    void resolve_StyleMergedPerKey() {
        Style global = new Style();
        global.paragraphSize = 22;
        SectionConfig template = new SectionConfig();
        template.style = new Style();
        template.style.heading1Size = 40;
        SectionConfig section = new SectionConfig();
        section.style = new Style();
        section.style.paragraphSize = 26;

        ResolvedSectionConfig resolved = new SectionConfigResolver(global).resolve(template, section);

        assertEquals(26, resolved.style.paragraphSize);
        assertEquals(40, resolved.style.heading1Size);
        assertEquals(28, resolved.style.heading2Size);
        assertEquals(1.15, resolved.style.lineSpacing);
    }

    @Test
    void resolve_DeprecatedFontAliasFolded() {
        Style global = new Style();
        global.fontFamilly = "Georgia";
        SectionConfig template = new SectionConfig();
        template.style = new Style();
        template.style.fontFamily = "Times New Roman";
        template.style.fontFamilly = "Ignored";
        SectionConfig section = new SectionConfig();
        section.style = new Style();
        section.style.fontFamilly = "Arial";

        SectionConfigResolver resolver = new SectionConfigResolver(global);

        assertEquals("Georgia", resolver.getBaseStyle().fontFamily);
        assertEquals("Times New Roman", resolver.resolve(template, new SectionConfig()).style.fontFamily);
        ResolvedSectionConfig resolved = resolver.resolve(template, section);
        assertEquals("Arial", resolved.style.fontFamily);
        assertNull(resolved.style.fontFamilly);
    }

    @Test
    void resolve_PageMergedPerKey() {
        SectionConfig template = new SectionConfig();
        template.page = new PageConfig();
        template.page.margin = new PageMargins();
        template.page.margin.top = 720;
        SectionConfig section = new SectionConfig();
        section.page = new PageConfig();
        section.page.margin = new PageMargins();
        section.page.margin.left = 500;
        section.page.size = new PageSize();
        section.page.size.orientation = Orientation.LANDSCAPE;

        ResolvedSectionConfig resolved = new SectionConfigResolver(null).resolve(template, section);

        assertEquals(720, resolved.page.margin.top);
        assertEquals(500, resolved.page.margin.left);
        assertEquals(1080, resolved.page.margin.right);
        assertEquals(1440, resolved.page.margin.bottom);
        assertEquals(Orientation.LANDSCAPE, resolved.page.size.orientation);
    }

    @Test
    void resolve_ScalarsTakeInnermostValue() {
        SectionConfig template = new SectionConfig();
        template.titlePage = true;
        template.type = SectionBreakType.ODD_PAGE;
        SectionConfig section = new SectionConfig();
        section.titlePage = false;

        ResolvedSectionConfig resolved = new SectionConfigResolver(null).resolve(template, section);
        ResolvedSectionConfig inherited = new SectionConfigResolver(null).resolve(template, null);

        assertFalse(resolved.titlePage);
        assertEquals(SectionBreakType.ODD_PAGE, resolved.type);
        assertTrue(inherited.titlePage);
    }

    @Test
    void resolve_NoTemplateGivesDefaults() {
        ResolvedSectionConfig resolved = new SectionConfigResolver(null).resolve(null, null);

        assertEquals(Style.defaults().paragraphSize, resolved.style.paragraphSize);
        assertEquals(Orientation.PORTRAIT, resolved.page.size.orientation);
        assertTrue(resolved.headers.isEmpty());
        assertTrue(resolved.footers.isEmpty());
        assertFalse(resolved.titlePage);
        assertNull(resolved.type);
    }

    @Test
    void resolve_IsDeterministicAndPure() throws Exception {
        Options options = MAPPER.readValue(TestUtils.sample("options/sections.json").toFile(), Options.class);
        String before = TestUtils.APPROVAL_MAPPER.writeValueAsString(options);
        SectionConfigResolver resolver = new SectionConfigResolver(options.style);

        ResolvedSectionConfig first = resolver.resolve(options.template, options.sections.get(1));
        ResolvedSectionConfig second = resolver.resolve(options.template, options.sections.get(1));

        assertEquals(TestUtils.APPROVAL_MAPPER.valueToTree(first), TestUtils.APPROVAL_MAPPER.valueToTree(second));
        assertEquals(before, TestUtils.APPROVAL_MAPPER.writeValueAsString(options));
    }
}
