package org.dxworks.mddocx.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TableLayout {
    AUTOFIT("autofit"),
    FIXED("fixed");

    private final String name;

    TableLayout(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static TableLayout fromName(String name) {
        for (TableLayout layout : values()) {
            if (layout.name.equalsIgnoreCase(name)) {
                return layout;
            }
        }
        throw new IllegalArgumentException("Unknown table layout: " + name);
    }
}
