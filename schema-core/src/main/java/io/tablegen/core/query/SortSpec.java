package io.tablegen.core.query;

import io.tablegen.core.security.SortDirection;

public record SortSpec(String field, SortDirection direction) {}
