package io.tablegen.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.tablegen.core.model.ColumnMetadata;
import io.tablegen.core.model.DataType;
import io.tablegen.core.model.TableMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class MetadataLoaderTest {

  @TempDir
  Path tempDir;

  @Test
  void loadsCamelCaseMetadata() throws IOException {
    Path file = tempDir.resolve("orders.json");
    Files.writeString(file, """
      {
        "schema": "public",
        "table": "orders",
        "primaryKey": "id",
        "hasTimestamps": true,
        "columns": [
          { "name": "id", "dataType": "uuid", "primaryKey": true, "hasDefault": true, "filterable": true },
          { "name": "status", "dataType": "enum", "enumValues": ["new", "paid"], "filterable": true },
          { "name": "total", "dataType": "decimal", "min": 0 },
          { "name": "created_at", "dataType": "datetime" },
          { "name": "updated_at", "dataType": "datetime" }
        ]
      }
      """);

    TableMetadata t = MetadataLoader.load(file);

    assertThat(t.key()).isEqualTo("public.orders");
    assertThat(t.hasTimestamps()).isTrue();
    assertThat(t.hasSoftDelete()).isFalse();
    assertThat(t.columns()).hasSize(5);
    assertThat(t.filterableColumns()).containsExactly("id", "status");
    ColumnMetadata status = t.column("status").orElseThrow();
    assertThat(status.dataType()).isEqualTo(DataType.ENUM);
    assertThat(status.enumValues()).containsExactly("new", "paid");
    assertThat(t.column("total").orElseThrow().min()).isEqualTo(0.0);
    assertThat(t.primaryKeyColumn().orElseThrow().hasDefault()).isTrue();
  }

  @Test
  void acceptsCatalogSnakeCase() throws IOException {
    String json = """
      {
        "schema_name": "sales",
        "table_name": "line_items",
        "has_soft_delete": true,
        "unique_columns": ["sku"],
        "columns": [
          { "column_name": "id", "data_type": "bigserial", "is_primary_key": true },
          { "column_name": "sku", "data_type": "varchar", "max_length": 32, "is_filterable": true },
          { "column_name": "deleted_at", "data_type": "timestamptz", "is_nullable": true }
        ]
      }
      """;

    TableMetadata t = MetadataLoader.parse(json.getBytes(StandardCharsets.UTF_8));

    assertThat(t.key()).isEqualTo("sales.line_items");
    assertThat(t.primaryKey()).isEqualTo("id");
    assertThat(t.hasSoftDelete()).isTrue();
    assertThat(t.uniqueColumns()).containsExactly("sku");
    assertThat(t.column("id").orElseThrow().dataType()).isEqualTo(DataType.INTEGER);
    assertThat(t.column("sku").orElseThrow().maxLength()).isEqualTo(32);
    assertThat(t.column("deleted_at").orElseThrow().nullable()).isTrue();
  }

  @Test
  void ignoresUnknownProperties() throws IOException {
    String json = """
      { "schema": "public", "table": "t", "comment": "x",
        "columns": [ { "name": "id", "dataType": "integer", "ordinal": 1 } ] }
      """;
    assertThat(MetadataLoader.parse(json.getBytes(StandardCharsets.UTF_8)).columns()).hasSize(1);
  }

  @Test
  void validatesAfterParsing() {
    String json = """
      { "schema": "public", "table": "t", "columns": [] }
      """;
    assertThatThrownBy(() -> MetadataLoader.parse(json.getBytes(StandardCharsets.UTF_8)))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("at least one column");
  }

  @Test
  void unknownDataTypeFailsParsing() {
    String json = """
      { "schema": "public", "table": "t", "columns": [ { "name": "g", "dataType": "geometry" } ] }
      """;
    assertThatThrownBy(() -> MetadataLoader.parse(json.getBytes(StandardCharsets.UTF_8)))
      .isInstanceOf(JsonProcessingException.class)
      .hasMessageContaining("geometry");
  }

  @Test
  void nullColumnEntryIsRejected() {
    String json = """
      { "schema": "public", "table": "t", "columns": [ null ] }
      """;
    assertThatThrownBy(() -> MetadataLoader.parse(json.getBytes(StandardCharsets.UTF_8)))
      .isInstanceOf(JsonProcessingException.class)
      .hasMessageContaining("public.t: null column entry");
  }

  @Test
  void missingFileIsAnIOException() {
    assertThatThrownBy(() -> MetadataLoader.load(tempDir.resolve("absent.json")))
      .isInstanceOf(NoSuchFileException.class);
  }
}
