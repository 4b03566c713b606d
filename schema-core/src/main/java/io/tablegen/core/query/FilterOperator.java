package io.tablegen.core.query;

import io.tablegen.core.model.DataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The twelve filter operator tokens recognized as {@code <column>_<token>} key suffixes.
 */
public enum FilterOperator {
  EQ("eq", "="),
  NE("ne", "<>"),
  GT("gt", ">"),
  GTE("gte", ">="),
  LT("lt", "<"),
  LTE("lte", "<="),
  LIKE("like", null),
  IN("in", "IN"),
  NIN("nin", "NOT IN"),
  BETWEEN("between", "BETWEEN"),
  NULL("null", "IS NULL"),
  NNULL("nnull", "IS NOT NULL");

  private final String token;
  private final String sql;

  FilterOperator(String token, String sql) {
    this.token = token;
    this.sql = sql;
  }

  public String token() { return token; }

  /** SQL operator text; null for LIKE, which is dialect specific. */
  public String sql() { return sql; }

  /** Exact, case-sensitive token lookup; null when unknown. */
  public static FilterOperator fromToken(String token) {
    if (token == null) return null;
    for (FilterOperator op : values()) {
      if (op.token.equals(token)) return op;
    }
    return null;
  }

  public static List<String> tokens() {
    List<String> out = new ArrayList<>();
    for (FilterOperator op : values()) out.add(op.token);
    return out;
  }

  /**
   * Operators that make sense on a column of the given type. Equality, membership and null
   * checks apply to every type; LIKE only to strings; ordering comparisons to numbers, dates
   * and strings; BETWEEN to numbers and dates.
   */
  public static Set<FilterOperator> availableFor(DataType type) {
    Set<FilterOperator> ops = EnumSet.of(EQ, NE, IN, NIN, NULL, NNULL);
    if (type == DataType.STRING) ops.add(LIKE);
    if (type == DataType.STRING || type == DataType.DATETIME || (type != null && type.isNumeric())) {
      ops.addAll(EnumSet.of(GT, GTE, LT, LTE));
    }
    if (type == DataType.DATETIME || (type != null && type.isNumeric())) ops.add(BETWEEN);
    return Collections.unmodifiableSet(ops);
  }
}
