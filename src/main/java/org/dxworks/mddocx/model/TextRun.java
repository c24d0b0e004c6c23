package org.dxworks.mddocx.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A contiguous span of text sharing one set of inline attributes.
 * Unset flags are kept as {@code null} so they are omitted from the serialized form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TextRun {
    public final String value;
    public final Boolean bold;
    public final Boolean italic;
    public final Boolean code;
    public final String link;

    public TextRun(String value, boolean bold, boolean italic, boolean code, String link) {
        this.value = Objects.requireNonNull(value, "value");
        this.bold = bold ? Boolean.TRUE : null;
        this.italic = italic ? Boolean.TRUE : null;
        this.code = code ? Boolean.TRUE : null;
        this.link = link;
    }

    public static TextRun plain(String value) {
        return new TextRun(value, false, false, false, null);
    }
}
