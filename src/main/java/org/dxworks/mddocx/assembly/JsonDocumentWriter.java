package org.dxworks.mddocx.assembly;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * Writes the document options as UTF-8 JSON, for inspection or for a renderer running elsewhere.
 */
public class JsonDocumentWriter implements DocumentSerializer {

    private final ObjectMapper mapper;

    public JsonDocumentWriter(boolean prettyPrint) {
        this.mapper = new ObjectMapper();
        if (prettyPrint) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    @Override
    public byte[] serialize(DocumentOptions options) throws IOException {
        return mapper.writeValueAsBytes(options);
    }
}
