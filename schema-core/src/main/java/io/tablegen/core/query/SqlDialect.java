package io.tablegen.core.query;

/**
 * Dialect-specific rendering of the parts of a query that differ between backends.
 * Identifiers handed to these methods have already been validated.
 */
public interface SqlDialect {

  String id();

  /** Placeholder for the 1-based parameter {@code index}. */
  String placeholder(int index);

  String quoteIdentifier(String identifier);

  /** Case-insensitive match of a quoted column against a bound pattern. */
  String likeCondition(String quotedColumn, String placeholder);

  default String quoteQualified(String schema, String table) {
    return quoteIdentifier(schema) + "." + quoteIdentifier(table);
  }

  /** LIMIT / OFFSET suffix, with a leading space; empty when both are null. */
  default String paginate(Integer limit, Long offset) {
    StringBuilder sb = new StringBuilder();
    if (limit != null) sb.append(" LIMIT ").append(limit);
    if (offset != null) sb.append(" OFFSET ").append(offset);
    return sb.toString();
  }

  /** Expression the generated DML uses to stamp timestamp columns. */
  default String currentTimestamp() {
    return "NOW()";
  }
}
