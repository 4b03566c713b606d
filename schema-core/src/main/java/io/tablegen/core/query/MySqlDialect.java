package io.tablegen.core.query;

/**
 * MySQL: {@code ?} placeholders, back-quoted identifiers. LIKE sensitivity depends on the
 * collation, so both sides are lower-cased.
 */
public final class MySqlDialect implements SqlDialect {

  /** MySQL has no OFFSET without LIMIT; this is the documented "all rows" value. */
  static final String UNBOUNDED_LIMIT = "18446744073709551615";

  @Override public String id() { return "mysql"; }

  @Override
  public String placeholder(int index) {
    return "?";
  }

  @Override
  public String quoteIdentifier(String identifier) {
    return "`" + identifier.replace("`", "``") + "`";
  }

  @Override
  public String likeCondition(String quotedColumn, String placeholder) {
    return "LOWER(" + quotedColumn + ") LIKE LOWER(" + placeholder + ")";
  }

  @Override
  public String paginate(Integer limit, Long offset) {
    if (limit == null && offset != null) return " LIMIT " + UNBOUNDED_LIMIT + " OFFSET " + offset;
    return SqlDialect.super.paginate(limit, offset);
  }
}
