package org.dxworks.mddocx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.mddocx.config.DocumentType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MddocxConfig {

    private static final String CONFIG_FILE_NAME = "mddocx-config.yml";
    private static final boolean DEFAULT_PRETTY_PRINT = true;
    private static final DocumentType DEFAULT_DOCUMENT_TYPE = DocumentType.DOCUMENT;

    private final boolean prettyPrint;
    private final DocumentType documentType;

    private MddocxConfig(boolean prettyPrint, DocumentType documentType) {
        this.prettyPrint = prettyPrint;
        this.documentType = documentType;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public DocumentType getDocumentType() {
        return documentType;
    }

    public static MddocxConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    static MddocxConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectivePrettyPrint = yamlConfig.prettyPrint != null
                        ? yamlConfig.prettyPrint
                        : DEFAULT_PRETTY_PRINT;
                DocumentType effectiveDocumentType = yamlConfig.documentType != null
                        ? yamlConfig.documentType
                        : DEFAULT_DOCUMENT_TYPE;

                return new MddocxConfig(effectivePrettyPrint, effectiveDocumentType);
            }
        } catch (IOException e) {
            // Fall through to default
        }

        return defaults();
    }

    public static MddocxConfig defaults() {
        return new MddocxConfig(DEFAULT_PRETTY_PRINT, DEFAULT_DOCUMENT_TYPE);
    }

    public static MddocxConfig with(boolean prettyPrint, DocumentType documentType) {
        return new MddocxConfig(prettyPrint, documentType != null ? documentType : DEFAULT_DOCUMENT_TYPE);
    }

    private static class YamlConfig {
        public Boolean prettyPrint;
        public DocumentType documentType;
    }
}
