package org.dxworks.mddocx;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.mddocx.config.Options;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads conversion options from a JSON or YAML file, chosen by extension.
 */
public final class OptionsLoader {

    private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
    private static final ObjectMapper YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));

    private OptionsLoader() {
        // utility class
    }

    /**
     * A blank file yields default options.
     */
    public static Options load(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return new Options();
        }
        Options options = mapperFor(file).readValue(content, Options.class);
        return options != null ? options : new Options();
    }

    static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static ObjectMapper mapperFor(Path file) {
        return isYaml(file) ? YAML_MAPPER : JSON_MAPPER;
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
