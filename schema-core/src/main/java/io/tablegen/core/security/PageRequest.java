package io.tablegen.core.security;

/** Validated pagination, both values at least 1. */
public record PageRequest(int page, int limit) {
  public long offset() {
    return (page - 1L) * limit;
  }
}
