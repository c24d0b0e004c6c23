package org.dxworks.mddocx.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CodeBlockNode extends BlockNode {
    public final String language;
    public final String value;

    public CodeBlockNode(String language, String value) {
        super(BlockType.CODE_BLOCK);
        this.language = language;
        this.value = value;
    }
}
