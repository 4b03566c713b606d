package io.tablegen.core.query;

import java.util.List;

/**
 * SQL text with positional placeholders, and the values bound to them in order.
 * Filter values only ever appear in {@code values}.
 */
public record CompiledQuery(String text, List<Object> values) {
  public CompiledQuery {
    values = List.copyOf(values);
  }

  public int placeholderCount() {
    return values.size();
  }
}
