package io.tablegen.generators.java.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Project-level defaults read from {@code tablegen.json}. Command-line flags win over
 * every value here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratorConfig(
    String dialect,
    String basePackage,
    String outputPath,
    String metadataFile,
    String storePath
) {
    public static final String DEFAULT_FILE = "tablegen.json";

    public static final GeneratorConfig EMPTY = new GeneratorConfig(null, null, null, null, null);

    @JsonCreator
    public GeneratorConfig(
        @JsonProperty("dialect") String dialect,
        @JsonProperty("basePackage") @JsonAlias({"base_package", "package"}) String basePackage,
        @JsonProperty("outputPath") @JsonAlias({"output_path", "output"}) String outputPath,
        @JsonProperty("metadataFile") @JsonAlias({"metadata_file"}) String metadataFile,
        @JsonProperty("storePath") @JsonAlias({"store_path", "store"}) String storePath
    ) {
        this.dialect = dialect;
        this.basePackage = basePackage;
        this.outputPath = outputPath;
        this.metadataFile = metadataFile;
        this.storePath = storePath;
    }
}
