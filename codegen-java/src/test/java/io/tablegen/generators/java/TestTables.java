package io.tablegen.generators.java;

import io.tablegen.core.model.ColumnMetadata;
import io.tablegen.core.model.DataType;
import io.tablegen.core.model.TableMetadata;

import java.util.List;

/** Metadata fixtures shared by the generator tests. */
final class TestTables {

  private TestTables() {}

  static ColumnMetadata column(String name, DataType type, boolean nullable, boolean filterable) {
    return ColumnMetadata.of(name, type, nullable, filterable);
  }

  /** public.orders: generated key, enum, bounded decimal, timestamps and soft delete. */
  static TableMetadata orders() {
    return new TableMetadata("public", "orders", List.of(
        new ColumnMetadata("id", DataType.INTEGER, false, true, false, true, true,
            null, null, null, null, "Order number"),
        column("customer_id", DataType.UUID, false, true),
        new ColumnMetadata("status", DataType.ENUM, false, false, false, true, false,
            null, null, null, List.of("pending", "paid", "shipped"), null),
        new ColumnMetadata("total", DataType.DECIMAL, false, false, false, true, false,
            null, 0.0, null, null, null),
        new ColumnMetadata("note", DataType.STRING, true, false, false, false, false,
            200, null, null, null, null),
        column("created_at", DataType.DATETIME, false, false),
        column("updated_at", DataType.DATETIME, false, false),
        column("deleted_at", DataType.DATETIME, true, false)
    ), "id", null, true, true);
  }

  /** app.users: no managed columns. */
  static TableMetadata users() {
    return new TableMetadata("app", "users", List.of(
        new ColumnMetadata("id", DataType.INTEGER, false, true, false, true, false,
            null, null, null, null, null),
        new ColumnMetadata("email", DataType.STRING, false, false, true, true, false,
            120, null, null, null, null),
        new ColumnMetadata("age", DataType.INTEGER, true, false, false, true, false,
            null, 0.0, 150.0, null, null),
        column("active", DataType.BOOLEAN, false, true)
    ), "id", null, false, false);
  }

  /** Escape a Java source fragment the way a string literal in generated code carries it. */
  static String literal(String s) {
    return s.replace("\"", "\\\"");
  }
}
