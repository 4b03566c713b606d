package io.tablegen.core.query;

import java.util.Locale;

public final class SqlDialects {
  public static final SqlDialect POSTGRES = new PostgresDialect();
  public static final SqlDialect MYSQL = new MySqlDialect();

  private SqlDialects() {}

  /**
   * @param id {@code postgres} (also {@code postgresql}, {@code pg}) or {@code mysql}; null means postgres
   */
  public static SqlDialect of(String id) {
    if (id == null || id.isBlank()) return POSTGRES;
    return switch (id.trim().toLowerCase(Locale.ROOT)) {
      case "postgres", "postgresql", "pg" -> POSTGRES;
      case "mysql", "mariadb"             -> MYSQL;
      default -> throw new IllegalArgumentException("Unsupported dialect: " + id);
    };
  }
}
