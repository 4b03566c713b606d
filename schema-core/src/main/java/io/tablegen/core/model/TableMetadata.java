package io.tablegen.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Identity and shape of a generation target.
 *
 * Immutable for the duration of one generation run. It is either supplied literally
 * (JSON file, tests) or produced by a schema introspector, and re-fetched on every
 * regeneration. {@code uniqueColumns} is held sorted so that the canonical JSON form
 * used for checksums does not depend on insertion order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableMetadata(
    String schema,
    String table,
    List<ColumnMetadata> columns,
    String primaryKey,
    SortedSet<String> uniqueColumns,
    boolean hasTimestamps,
    boolean hasSoftDelete
) {
  /** Columns managed by the generated DML when {@code hasTimestamps} / {@code hasSoftDelete} is set. */
  public static final String CREATED_AT = "created_at";
  public static final String UPDATED_AT = "updated_at";
  public static final String DELETED_AT = "deleted_at";

  @JsonCreator
  public TableMetadata(
      @JsonProperty("schema") @JsonAlias({"schema_name", "schemaName"}) String schema,
      @JsonProperty("table") @JsonAlias({"table_name", "tableName"}) String table,
      @JsonProperty("columns") List<ColumnMetadata> columns,
      @JsonProperty("primaryKey") @JsonAlias({"primary_key_column", "primaryKeyColumn"}) String primaryKey,
      @JsonProperty("uniqueColumns") @JsonAlias({"unique_columns"}) SortedSet<String> uniqueColumns,
      @JsonProperty("hasTimestamps") @JsonAlias({"has_timestamps"}) boolean hasTimestamps,
      @JsonProperty("hasSoftDelete") @JsonAlias({"has_soft_delete"}) boolean hasSoftDelete
  ) {
    this.schema = schema;
    this.table = table;
    if (columns != null) {
      // immutable lists reject contains(null), so scan by hand
      for (ColumnMetadata c : columns) {
        if (c == null) throw new IllegalArgumentException(schema + "." + table + ": null column entry");
      }
    }
    this.columns = columns == null ? List.of() : List.copyOf(columns);
    this.primaryKey = resolvePrimaryKey(primaryKey, this.columns);
    this.uniqueColumns = uniqueColumns == null
        ? Collections.emptySortedSet()
        : Collections.unmodifiableSortedSet(new TreeSet<>(uniqueColumns));
    this.hasTimestamps = hasTimestamps;
    this.hasSoftDelete = hasSoftDelete;
  }

  public static TableMetadata of(String schema, String table, List<ColumnMetadata> columns) {
    return new TableMetadata(schema, table, columns, null, null, false, false);
  }

  /** Falls back to the first column flagged {@code primaryKey} when none is named. */
  private static String resolvePrimaryKey(String declared, List<ColumnMetadata> columns) {
    if (declared != null && !declared.isBlank()) return declared;
    for (ColumnMetadata c : columns) {
      if (c.primaryKey()) return c.name();
    }
    return null;
  }

  /** Checksum-store key, {@code schema.table}. */
  public String key() {
    return schema + "." + table;
  }

  @JsonIgnore
  public List<String> filterableColumns() {
    List<String> names = new ArrayList<>();
    for (ColumnMetadata c : columns) {
      if (c.filterable()) names.add(c.name());
    }
    return names;
  }

  public Optional<ColumnMetadata> column(String name) {
    for (ColumnMetadata c : columns) {
      if (c.name().equals(name)) return Optional.of(c);
    }
    return Optional.empty();
  }

  @JsonIgnore
  public Optional<ColumnMetadata> primaryKeyColumn() {
    return primaryKey == null ? Optional.empty() : column(primaryKey);
  }

  public TableMetadata withColumns(List<ColumnMetadata> newColumns) {
    return new TableMetadata(schema, table, newColumns, primaryKey, uniqueColumns, hasTimestamps, hasSoftDelete);
  }

  public TableMetadata withFlags(boolean timestamps, boolean softDelete) {
    return new TableMetadata(schema, table, columns, primaryKey, uniqueColumns, timestamps, softDelete);
  }
}
