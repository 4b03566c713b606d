package io.tablegen.core;

import io.tablegen.core.model.ColumnMetadata;
import io.tablegen.core.model.DataType;
import io.tablegen.core.model.TableMetadata;
import io.tablegen.core.security.IdentifierValidator;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Structural checks on table metadata before anything is generated from it.
 * Identifier problems surface as {@link io.tablegen.core.security.InvalidIdentifierException};
 * everything else as {@link IllegalArgumentException}.
 */
public final class MetadataValidator {

  private MetadataValidator() {}

  public static void validate(TableMetadata m) {
    if (m == null) fail("metadata required");
    IdentifierValidator.validateIdentifier(m.schema(), null, "schema name");
    IdentifierValidator.validateIdentifier(m.table(), null, "table name");

    String t = m.key();
    if (m.columns().isEmpty()) fail(t + ": columns must have at least one column");

    Set<String> names = new HashSet<>();
    for (ColumnMetadata c : m.columns()) {
      IdentifierValidator.validateIdentifier(c.name(), null, "column name in " + t);
      if (!names.add(c.name().toLowerCase(Locale.ROOT))) fail(t + ": duplicate column " + c.name());

      if (c.dataType() == DataType.ENUM && !c.hasEnumValues()) {
        fail(t + "." + c.name() + ": enum column requires enumValues");
      }
      if (c.enumValues() != null) {
        for (String v : c.enumValues()) {
          if (v == null || v.isEmpty()) fail(t + "." + c.name() + ": enum values cannot be empty");
        }
      }
      if (c.maxLength() != null && c.maxLength() < 1) {
        fail(t + "." + c.name() + ": maxLength must be positive");
      }
      if (c.min() != null && c.max() != null && c.min() > c.max()) {
        fail(t + "." + c.name() + ": min " + c.min() + " exceeds max " + c.max());
      }
    }

    if (m.primaryKey() != null && m.column(m.primaryKey()).isEmpty()) {
      fail(t + ": primary key " + m.primaryKey() + " is not a column");
    }
    for (String u : m.uniqueColumns()) {
      if (m.column(u).isEmpty()) fail(t + ": unique column " + u + " is not a column");
    }
    if (m.hasTimestamps()) {
      requireColumn(m, TableMetadata.CREATED_AT, "hasTimestamps");
      requireColumn(m, TableMetadata.UPDATED_AT, "hasTimestamps");
    }
    if (m.hasSoftDelete()) requireColumn(m, TableMetadata.DELETED_AT, "hasSoftDelete");
  }

  private static void requireColumn(TableMetadata m, String name, String flag) {
    if (m.column(name).isEmpty()) fail(m.key() + ": " + flag + " requires a " + name + " column");
  }

  private static void fail(String msg) { throw new IllegalArgumentException(msg); }
}
