package io.tablegen.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One column of a generation target.
 *
 * <p>Only columns with {@code filterable == true} may appear as keys of a runtime filter.
 * JSON accepts both the camelCase names and the snake_case names of the metadata catalog.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnMetadata(
    String name,
    DataType dataType,
    boolean nullable,
    boolean primaryKey,
    boolean unique,
    boolean filterable,
    boolean hasDefault,
    Integer maxLength,
    Double min,
    Double max,
    List<String> enumValues,
    String description
) {
  @JsonCreator
  public ColumnMetadata(
      @JsonProperty("name") @JsonAlias({"column_name", "columnName"}) String name,
      @JsonProperty("dataType") @JsonAlias({"data_type", "type"}) DataType dataType,
      @JsonProperty("nullable") @JsonAlias({"is_nullable", "isNullable"}) boolean nullable,
      @JsonProperty("primaryKey") @JsonAlias({"is_primary_key", "isPrimaryKey"}) boolean primaryKey,
      @JsonProperty("unique") @JsonAlias({"is_unique", "isUnique"}) boolean unique,
      @JsonProperty("filterable") @JsonAlias({"is_filterable", "isFilterable"}) boolean filterable,
      @JsonProperty("hasDefault") @JsonAlias({"has_default"}) boolean hasDefault,
      @JsonProperty("maxLength") @JsonAlias({"max_length"}) Integer maxLength,
      @JsonProperty("min") @JsonAlias({"min_value", "minValue"}) Double min,
      @JsonProperty("max") @JsonAlias({"max_value", "maxValue"}) Double max,
      @JsonProperty("enumValues") @JsonAlias({"enum_values", "enum"}) List<String> enumValues,
      @JsonProperty("description") String description
  ) {
    this.name = name;
    this.dataType = dataType == null ? DataType.STRING : dataType;
    this.nullable = nullable;
    this.primaryKey = primaryKey;
    this.unique = unique;
    this.filterable = filterable;
    this.hasDefault = hasDefault;
    this.maxLength = maxLength;
    this.min = min;
    this.max = max;
    this.enumValues = enumValues == null ? null : List.copyOf(enumValues);
    this.description = description;
  }

  /** Shorthand for the common case in tests and literal metadata. */
  public static ColumnMetadata of(String name, DataType dataType, boolean nullable, boolean filterable) {
    return new ColumnMetadata(name, dataType, nullable, false, false, filterable, false,
        null, null, null, null, null);
  }

  public boolean hasEnumValues() {
    return enumValues != null && !enumValues.isEmpty();
  }

  public ColumnMetadata withFilterable(boolean value) {
    return new ColumnMetadata(name, dataType, nullable, primaryKey, unique, value, hasDefault,
        maxLength, min, max, enumValues, description);
  }

  public ColumnMetadata withDataType(DataType value) {
    return new ColumnMetadata(name, value, nullable, primaryKey, unique, filterable, hasDefault,
        maxLength, min, max, enumValues, description);
  }

  public ColumnMetadata withPrimaryKey(boolean value, boolean generated) {
    return new ColumnMetadata(name, dataType, nullable, value, unique, filterable, generated,
        maxLength, min, max, enumValues, description);
  }

  public ColumnMetadata withLimits(Integer maxLength, Double min, Double max) {
    return new ColumnMetadata(name, dataType, nullable, primaryKey, unique, filterable, hasDefault,
        maxLength, min, max, enumValues, description);
  }

  public ColumnMetadata withEnumValues(List<String> values) {
    return new ColumnMetadata(name, values == null ? dataType : DataType.ENUM, nullable, primaryKey, unique,
        filterable, hasDefault, maxLength, min, max, values, description);
  }
}
