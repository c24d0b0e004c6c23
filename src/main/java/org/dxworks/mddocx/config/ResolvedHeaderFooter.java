package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fully resolved header or footer slots of one section. A {@code null} slot means nothing is rendered there.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ResolvedHeaderFooter {
    @JsonProperty("default")
    public final HeaderFooterContent defaultContent;
    @JsonProperty("first")
    public final HeaderFooterContent firstContent;
    @JsonProperty("even")
    public final HeaderFooterContent evenContent;

    public ResolvedHeaderFooter(HeaderFooterContent defaultContent,
                                HeaderFooterContent firstContent,
                                HeaderFooterContent evenContent) {
        this.defaultContent = defaultContent;
        this.firstContent = firstContent;
        this.evenContent = evenContent;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return defaultContent == null && firstContent == null && evenContent == null;
    }
}
