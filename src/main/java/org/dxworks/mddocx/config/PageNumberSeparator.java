package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PageNumberSeparator {
    HYPHEN("hyphen"),
    PERIOD("period"),
    COLON("colon"),
    EM_DASH("emDash"),
    EN_DASH("endash");

    private final String name;

    PageNumberSeparator(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static PageNumberSeparator fromName(String name) {
        for (PageNumberSeparator separator : values()) {
            if (separator.name.equals(name)) {
                return separator;
            }
        }
        throw new IllegalArgumentException("Unknown page number separator: " + name);
    }
}
