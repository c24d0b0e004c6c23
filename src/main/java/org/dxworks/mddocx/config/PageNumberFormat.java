package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PageNumberFormat {
    DECIMAL("decimal"),
    UPPER_ROMAN("upperRoman"),
    LOWER_ROMAN("lowerRoman"),
    UPPER_LETTER("upperLetter"),
    LOWER_LETTER("lowerLetter");

    private final String name;

    PageNumberFormat(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static PageNumberFormat fromName(String name) {
        for (PageNumberFormat format : values()) {
            if (format.name.equals(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown page number format: " + name);
    }
}
