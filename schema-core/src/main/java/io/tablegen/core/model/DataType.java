package io.tablegen.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Column data type vocabulary.
 *
 * <p>Accepts both the canonical names ({@code "string"}, {@code "integer"}, ...) and the
 * database catalog names they cover:
 * <pre>
 *   string   ← varchar, char, text, character varying
 *   integer  ← int, integer, bigint, smallint, tinyint, mediumint, serial, bigserial
 *   decimal  ← decimal, numeric, real, float, double, double precision
 *   boolean  ← boolean, bool
 *   datetime ← date, time, timestamp, timestamptz, datetime
 *   uuid     ← uuid
 *   json     ← json, jsonb
 *   enum     ← enum (values come from the column's enumValues)
 * </pre>
 */
public enum DataType {
  STRING, INTEGER, DECIMAL, BOOLEAN, DATETIME, UUID, JSON, ENUM;

  private static final Map<String, DataType> ALIASES = Map.ofEntries(
      Map.entry("varchar", STRING),
      Map.entry("char", STRING),
      Map.entry("text", STRING),
      Map.entry("character varying", STRING),
      Map.entry("int", INTEGER),
      Map.entry("bigint", INTEGER),
      Map.entry("smallint", INTEGER),
      Map.entry("tinyint", INTEGER),
      Map.entry("mediumint", INTEGER),
      Map.entry("serial", INTEGER),
      Map.entry("bigserial", INTEGER),
      Map.entry("numeric", DECIMAL),
      Map.entry("real", DECIMAL),
      Map.entry("float", DECIMAL),
      Map.entry("double", DECIMAL),
      Map.entry("double precision", DECIMAL),
      Map.entry("bool", BOOLEAN),
      Map.entry("date", DATETIME),
      Map.entry("time", DATETIME),
      Map.entry("timestamp", DATETIME),
      Map.entry("timestamptz", DATETIME),
      Map.entry("timestamp with time zone", DATETIME),
      Map.entry("timestamp without time zone", DATETIME),
      Map.entry("jsonb", JSON)
  );

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolve a canonical or catalog type name.
   *
   * @throws IllegalArgumentException if the name is not recognized
   */
  @JsonCreator
  public static DataType from(String s) {
    DataType t = lookup(s);
    if (t == null) throw new IllegalArgumentException("unsupported data type " + s);
    return t;
  }

  /**
   * Return true if {@code s} names a supported type, canonical or catalog spelling.
   */
  public static boolean isValid(String s) {
    return lookup(s) != null;
  }

  private static DataType lookup(String s) {
    if (s == null || s.isBlank()) return null;
    String key = s.trim().toLowerCase(Locale.ROOT);
    for (DataType t : values()) {
      if (t.id().equals(key)) return t;
    }
    return ALIASES.get(key);
  }

  public boolean isNumeric() {
    return this == INTEGER || this == DECIMAL;
  }
}
