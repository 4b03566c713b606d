package io.tablegen.core.security;

public enum SortDirection {
  ASC, DESC
}
