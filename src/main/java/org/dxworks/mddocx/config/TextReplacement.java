package org.dxworks.mddocx.config;

/**
 * Find-and-replace applied to the text of the parsed document before conversion.
 * {@code find} is a literal unless {@code regex} is set; regex replacements may use group references.
 */
public class TextReplacement {
    public String find;
    public String replace;
    public boolean regex;

    public TextReplacement() {
    }

    public TextReplacement(String find, String replace, boolean regex) {
        this.find = find;
        this.replace = replace;
        this.regex = regex;
    }
}
