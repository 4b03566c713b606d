package io.tablegen.core.query;

import java.util.List;
import java.util.Map;

/**
 * Minimal execution seam the generated repositories are written against. Placeholders in
 * {@code sql} follow the dialect the code was generated for, so implementations bind
 * {@code params} positionally in that dialect's driver.
 */
public interface SqlExecutor {

  /** Run a query and return each row as a column-name to value map, in column order. */
  List<Map<String, Object>> query(String sql, List<Object> params);

  /** Run a statement and return the affected row count. */
  int update(String sql, List<Object> params);
}
