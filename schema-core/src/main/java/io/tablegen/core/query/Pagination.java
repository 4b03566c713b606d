package io.tablegen.core.query;

/**
 * Resolved pagination controls. Any component may be null when absent or unusable.
 */
public record Pagination(Integer limit, Integer page, Integer offset) {

  public static final Pagination NONE = new Pagination(null, null, null);

  /**
   * Explicit offset wins; otherwise derived from page and limit. A page without a limit
   * has no effect. Widened to {@code long} since a derived offset can exceed the int range.
   */
  public Long effectiveOffset() {
    if (offset != null) return offset.longValue();
    if (limit != null && page != null) return (page - 1L) * limit;
    return null;
  }
}
