package org.dxworks.mddocx.converter;

import org.dxworks.mddocx.model.TextRun;

import java.util.Objects;

/**
 * Attributes accumulated from the enclosing inline markup of a text segment.
 * Flags are OR-ed in; the outermost link wins.
 */
final class InlineAttributes {

    static final InlineAttributes NONE = new InlineAttributes(false, false, false, null);

    final boolean bold;
    final boolean italic;
    final boolean code;
    final String link;

    private InlineAttributes(boolean bold, boolean italic, boolean code, String link) {
        this.bold = bold;
        this.italic = italic;
        this.code = code;
        this.link = link;
    }

    InlineAttributes withBold() {
        return bold ? this : new InlineAttributes(true, italic, code, link);
    }

    InlineAttributes withItalic() {
        return italic ? this : new InlineAttributes(bold, true, code, link);
    }

    InlineAttributes withCode() {
        return code ? this : new InlineAttributes(bold, italic, true, link);
    }

    InlineAttributes withLink(String url) {
        return link != null ? this : new InlineAttributes(bold, italic, code, url);
    }

    TextRun toRun(String value) {
        return new TextRun(value, bold, italic, code, link);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InlineAttributes other)) return false;
        return bold == other.bold && italic == other.italic && code == other.code
                && Objects.equals(link, other.link);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bold, italic, code, link);
    }
}
