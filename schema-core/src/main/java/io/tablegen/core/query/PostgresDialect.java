package io.tablegen.core.query;

/**
 * PostgreSQL: {@code $n} placeholders, double-quoted identifiers, native {@code ILIKE}.
 */
public final class PostgresDialect implements SqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  public String placeholder(int index) {
    return "$" + index;
  }

  @Override
  public String quoteIdentifier(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String likeCondition(String quotedColumn, String placeholder) {
    return quotedColumn + " ILIKE " + placeholder;
  }
}
