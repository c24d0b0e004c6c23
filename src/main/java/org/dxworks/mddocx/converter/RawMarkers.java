package org.dxworks.mddocx.converter;

import java.util.regex.Pattern;

/**
 * Recognises the special markers by matching on literal content.
 * <p>
 * Standalone lines (a top-level paragraph made only of text):
 * <ul>
 *   <li>{@code [TOC]}: table of contents placeholder</li>
 *   <li>{@code \pagebreak}: page break</li>
 * </ul>
 * Raw HTML blocks:
 * <ul>
 *   <li>containing {@code COMMENT:}: comment whose body is the text after the marker, up to {@code -->}</li>
 *   <li>containing {@code pagebreak}: page break</li>
 *   <li>anything else: no marker, the raw block is dropped</li>
 * </ul>
 * Inline HTML inside a paragraph only yields comments, placed after the paragraph.
 * This is a heuristic, kept in one place so its rules can be tested on their own.
 */
public final class RawMarkers {

    public static final String TOC_TOKEN = "[TOC]";
    public static final String PAGE_BREAK_TOKEN = "\\pagebreak";
    public static final String COMMENT_MARKER = "COMMENT:";
    public static final String RAW_PAGE_BREAK = "pagebreak";

    private static final String HTML_COMMENT_END = "-->";
    private static final Pattern LINE_BREAK_TAG = Pattern.compile("(?i)^<br\\s*/?>$");

    public enum Kind { TOC, PAGE_BREAK, COMMENT, NONE }

    public static final class Match {
        private static final Match NONE = new Match(Kind.NONE, null);

        public final Kind kind;
        public final String body; // comment text, null for other kinds

        private Match(Kind kind, String body) {
            this.kind = kind;
            this.body = body;
        }
    }

    private RawMarkers() {
        // utility class
    }

    public static Match classifyLine(String text) {
        if (text == null) {
            return Match.NONE;
        }
        String trimmed = text.trim();
        if (TOC_TOKEN.equals(trimmed)) {
            return new Match(Kind.TOC, null);
        }
        if (PAGE_BREAK_TOKEN.equals(trimmed)) {
            return new Match(Kind.PAGE_BREAK, null);
        }
        return Match.NONE;
    }

    public static Match classifyRaw(String raw) {
        if (raw == null) {
            return Match.NONE;
        }
        int markerIndex = raw.indexOf(COMMENT_MARKER);
        if (markerIndex >= 0) {
            String rest = raw.substring(markerIndex + COMMENT_MARKER.length());
            int end = rest.indexOf(HTML_COMMENT_END);
            String body = (end >= 0 ? rest.substring(0, end) : rest).trim();
            if (!body.isEmpty()) {
                return new Match(Kind.COMMENT, body);
            }
        }
        if (raw.contains(RAW_PAGE_BREAK)) {
            return new Match(Kind.PAGE_BREAK, null);
        }
        return Match.NONE;
    }

    public static boolean isLineBreakTag(String rawInline) {
        return rawInline != null && LINE_BREAK_TAG.matcher(rawInline.trim()).matches();
    }
}
