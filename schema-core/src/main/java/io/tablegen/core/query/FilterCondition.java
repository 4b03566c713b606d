package io.tablegen.core.query;

import java.util.List;

/**
 * One parsed filter condition. The field name has already passed whitelist validation;
 * every payload value is bound as a parameter when rendered.
 */
public interface FilterCondition {

  String field();

  FilterOperator operator();

  /** {@code eq, ne, gt, gte, lt, lte}. */
  record Comparison(String field, FilterOperator operator, Object value) implements FilterCondition {}

  /** Case-insensitive containment; {@code pattern} already carries the {@code %} wildcards. */
  record Like(String field, String pattern) implements FilterCondition {
    @Override public FilterOperator operator() { return FilterOperator.LIKE; }
  }

  /** {@code in} / {@code nin}; never empty. */
  record InList(String field, List<Object> values, boolean negated) implements FilterCondition {
    public InList {
      values = List.copyOf(values);
    }
    @Override public FilterOperator operator() { return negated ? FilterOperator.NIN : FilterOperator.IN; }
  }

  record Between(String field, Object lower, Object upper) implements FilterCondition {
    @Override public FilterOperator operator() { return FilterOperator.BETWEEN; }
  }

  /** {@code null} / {@code nnull}; binds nothing. */
  record NullCheck(String field, boolean negated) implements FilterCondition {
    @Override public FilterOperator operator() { return negated ? FilterOperator.NNULL : FilterOperator.NULL; }
  }
}
