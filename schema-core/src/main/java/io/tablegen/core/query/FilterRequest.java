package io.tablegen.core.query;

import java.util.List;

/**
 * Result of the parse step: typed conditions in filter-map order, optional sort, pagination.
 */
public record FilterRequest(List<FilterCondition> conditions, SortSpec sort, Pagination pagination) {
  public FilterRequest {
    conditions = List.copyOf(conditions);
    pagination = pagination == null ? Pagination.NONE : pagination;
  }
}
