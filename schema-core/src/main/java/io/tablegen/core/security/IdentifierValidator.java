package io.tablegen.core.security;

import io.tablegen.core.model.ColumnMetadata;
import io.tablegen.core.model.TableMetadata;
import io.tablegen.core.query.FilterOperator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Guards every name that has to be spliced into SQL text instead of being bound as a parameter.
 *
 * <p>Two modes:
 * <ul>
 *   <li>whitelist supplied: the trimmed name must match an entry case-insensitively, and the
 *       entry's own spelling is returned. No pattern check follows, membership is the stronger
 *       guarantee. An empty whitelist rejects everything.</li>
 *   <li>no whitelist: the name must match {@code ^[A-Za-z_][A-Za-z0-9_]*$}, must not be a
 *       reserved keyword or comment token, and must fit in 63 characters.</li>
 * </ul>
 *
 * <p>The remaining helpers validate the scalar inputs callers splice into queries
 * (pagination, sort direction, UUIDs, filter operators).
 */
public final class IdentifierValidator {

  /** Identifier length ceiling shared by PostgreSQL and MySQL. */
  public static final int MAX_IDENTIFIER_LENGTH = 63;

  /** Hard ceiling on page size. */
  public static final int MAX_LIMIT = 1000;

  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
  private static final Pattern UUID_PATTERN =
      Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

  private static final Set<String> RESERVED = Set.of(
      "SELECT", "INSERT", "UPDATE", "DELETE", "DROP", "CREATE", "ALTER", "TRUNCATE",
      "UNION", "EXEC", "EXECUTE", "--", ";", "/*", "*/", "XP_", "SP_"
  );

  private IdentifierValidator() {}

  /**
   * Validate a single identifier.
   *
   * @param identifier the raw name
   * @param whitelist allowed names, or {@code null} to fall back to pattern checks
   * @param context what the name is used as, for error messages ("column", "table name", ...)
   * @return the validated name: the whitelist entry, or the trimmed input
   * @throws InvalidIdentifierException if the name is rejected
   */
  public static String validateIdentifier(String identifier, Collection<String> whitelist, String context) {
    if (identifier == null || identifier.isEmpty()) {
      throw new InvalidIdentifierException(identifier, context, "must be a non-empty string");
    }
    String trimmed = identifier.trim();
    if (trimmed.isEmpty()) {
      throw new InvalidIdentifierException(identifier, context, "must be a non-empty string");
    }

    if (whitelist != null) {
      String lower = trimmed.toLowerCase(Locale.ROOT);
      for (String allowed : whitelist) {
        if (allowed != null && allowed.toLowerCase(Locale.ROOT).equals(lower)) {
          return allowed;
        }
      }
      throw new InvalidIdentifierException(identifier, context, "\"" + trimmed + "\" not in allowed values");
    }

    if (!IDENTIFIER.matcher(trimmed).matches()) {
      throw new InvalidIdentifierException(identifier, context, "\"" + trimmed
          + "\" contains invalid characters. Only alphanumeric and underscore allowed, "
          + "must start with letter or underscore.");
    }
    if (RESERVED.contains(trimmed.toUpperCase(Locale.ROOT))) {
      throw new InvalidIdentifierException(identifier, context, "\"" + trimmed + "\" is a reserved SQL keyword");
    }
    if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
      throw new InvalidIdentifierException(identifier, context, "\"" + trimmed
          + "\" exceeds maximum length of " + MAX_IDENTIFIER_LENGTH + " characters");
    }
    return trimmed;
  }

  /**
   * Validate an ordered list of identifiers (ORDER BY / GROUP BY column lists).
   * Fails on the first invalid entry; its index is part of the error context.
   */
  public static List<String> validateIdentifiers(List<String> identifiers, Collection<String> whitelist, String context) {
    if (identifiers == null || identifiers.isEmpty()) {
      throw new InvalidIdentifierException(null, context, "must be a non-empty list");
    }
    List<String> out = new ArrayList<>(identifiers.size());
    for (int i = 0; i < identifiers.size(); i++) {
      out.add(validateIdentifier(identifiers.get(i), whitelist, context + "[" + i + "]"));
    }
    return out;
  }

  /** Names of the filterable columns of a table, as declared. */
  public static List<String> columnWhitelist(TableMetadata table) {
    List<String> names = new ArrayList<>();
    for (ColumnMetadata c : table.columns()) {
      if (c.filterable()) names.add(c.name());
    }
    return names;
  }

  public static BigDecimal validateNumeric(Object input, String context) {
    if (input instanceof BigDecimal b) return b;
    if (input instanceof Double || input instanceof Float) {
      double d = ((Number) input).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) fail(context, "must be a valid number");
      return BigDecimal.valueOf(d);
    }
    if (input instanceof Number n) return new BigDecimal(n.toString());
    if (input instanceof String s) {
      try {
        return new BigDecimal(s.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid " + context + ": must be a valid number", e);
      }
    }
    throw new IllegalArgumentException("Invalid " + context + ": must be a valid number");
  }

  public static long validateInteger(Object input, String context) {
    BigDecimal n = validateNumeric(input, context);
    try {
      return n.stripTrailingZeros().longValueExact();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Invalid " + context + ": must be an integer", e);
    }
  }

  public static long validatePositiveInteger(Object input, String context) {
    long n = validateInteger(input, context);
    if (n <= 0) fail(context, "must be positive");
    return n;
  }

  /**
   * @throws IllegalArgumentException if page or limit is not a positive integer, or limit exceeds {@link #MAX_LIMIT}
   */
  public static PageRequest validatePagination(Object page, Object limit) {
    long p = validatePositiveInteger(page, "page");
    long l = validatePositiveInteger(limit, "limit");
    if (l > MAX_LIMIT) fail("limit", "maximum allowed is " + MAX_LIMIT);
    if (p > Integer.MAX_VALUE) fail("page", "too large");
    return new PageRequest((int) p, (int) l);
  }

  public static SortDirection validateSortDirection(String direction) {
    String upper = direction == null ? "" : direction.trim().toUpperCase(Locale.ROOT);
    if (upper.equals("ASC")) return SortDirection.ASC;
    if (upper.equals("DESC")) return SortDirection.DESC;
    throw new IllegalArgumentException("Invalid sort direction: must be 'ASC' or 'DESC', got '" + direction + "'");
  }

  /** @return the UUID in lower case */
  public static String validateUuid(String uuid, String context) {
    if (uuid == null || !UUID_PATTERN.matcher(uuid).matches()) fail(context, "not a valid UUID format");
    return uuid.toLowerCase(Locale.ROOT);
  }

  public static FilterOperator validateFilterOperator(String operator) {
    FilterOperator op = FilterOperator.fromToken(operator == null ? null : operator.toLowerCase(Locale.ROOT));
    if (op == null) {
      throw new IllegalArgumentException("Invalid filter operator: '" + operator + "'. Allowed: "
          + FilterOperator.tokens());
    }
    return op;
  }

  private static void fail(String context, String reason) {
    throw new IllegalArgumentException("Invalid " + context + ": " + reason);
  }
}
