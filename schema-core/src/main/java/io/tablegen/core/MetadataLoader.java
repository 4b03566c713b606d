package io.tablegen.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tablegen.core.model.TableMetadata;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class MetadataLoader {
  private static final ObjectMapper JSON = new ObjectMapper();

  private MetadataLoader() {}

  public static TableMetadata load(Path path) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    return parse(bytes);
  }

  public static TableMetadata parse(byte[] json) throws IOException {
    TableMetadata m = JSON.readValue(json, TableMetadata.class);
    MetadataValidator.validate(m);
    return m;
  }
}
