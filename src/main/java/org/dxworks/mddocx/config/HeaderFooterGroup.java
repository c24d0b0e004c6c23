package org.dxworks.mddocx.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class HeaderFooterGroup {
    @JsonProperty("default")
    public HeaderFooterSlot defaultSlot = HeaderFooterSlot.inherit();
    @JsonProperty("first")
    public HeaderFooterSlot firstSlot = HeaderFooterSlot.inherit();
    @JsonProperty("even")
    public HeaderFooterSlot evenSlot = HeaderFooterSlot.inherit();

    public static HeaderFooterGroup empty() {
        return new HeaderFooterGroup();
    }
}
