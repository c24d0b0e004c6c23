package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PageNumberDisplay {
    NONE("none"),
    CURRENT("current"),
    CURRENT_AND_TOTAL("currentAndTotal"),
    CURRENT_AND_SECTION_TOTAL("currentAndSectionTotal");

    private final String name;

    PageNumberDisplay(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static PageNumberDisplay fromName(String name) {
        for (PageNumberDisplay display : values()) {
            if (display.name.equals(name)) {
                return display;
            }
        }
        throw new IllegalArgumentException("Unknown page number display: " + name);
    }
}
