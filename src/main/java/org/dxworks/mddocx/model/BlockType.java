package org.dxworks.mddocx.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlockType {
    PARAGRAPH("paragraph"),
    HEADING("heading"),
    LIST("list"),
    LIST_ITEM("listItem"),
    CODE_BLOCK("codeBlock"),
    BLOCKQUOTE("blockquote"),
    IMAGE("image"),
    TABLE("table"),
    COMMENT("comment"),
    PAGE_BREAK("pageBreak"),
    TOC_PLACEHOLDER("tocPlaceholder"),
    TOC_ENTRY("tocEntry");

    private final String name;

    BlockType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
