package org.dxworks.mddocx.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Maps an explicit JSON {@code null} to {@link HeaderFooterSlot#clear()}.
 * Absent keys never reach the deserializer and keep the field default, {@link HeaderFooterSlot#inherit()}.
 */
public class HeaderFooterSlotDeserializer extends StdDeserializer<HeaderFooterSlot> {

    public HeaderFooterSlotDeserializer() {
        super(HeaderFooterSlot.class);
    }

    @Override
    public HeaderFooterSlot deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        return HeaderFooterSlot.set(context.readValue(parser, HeaderFooterContent.class));
    }

    @Override
    public HeaderFooterSlot getNullValue(DeserializationContext context) {
        return HeaderFooterSlot.clear();
    }
}
