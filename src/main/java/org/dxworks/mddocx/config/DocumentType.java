package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentType {
    DOCUMENT("document"),
    REPORT("report");

    private final String name;

    DocumentType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static DocumentType fromName(String name) {
        for (DocumentType type : values()) {
            if (type.name.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown document type: " + name);
    }
}
