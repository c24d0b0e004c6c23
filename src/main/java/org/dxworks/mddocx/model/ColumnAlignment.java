package org.dxworks.mddocx.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ColumnAlignment {
    LEFT("left"),
    CENTER("center"),
    RIGHT("right");

    private final String name;

    ColumnAlignment(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
