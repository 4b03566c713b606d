package io.tablegen.generators.java.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class GeneratorConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GeneratorConfigLoader() {
    }

    /**
     * @return {@link GeneratorConfig#EMPTY} when the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static GeneratorConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return GeneratorConfig.EMPTY;
        }
        try {
            GeneratorConfig config = MAPPER.readValue(Files.readString(path), GeneratorConfig.class);
            return config == null ? GeneratorConfig.EMPTY : config;
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid config file " + path + ": " + e.getOriginalMessage(), e);
        }
    }
}
