package io.tablegen.core.query;

import io.tablegen.core.model.ColumnMetadata;
import io.tablegen.core.model.TableMetadata;
import io.tablegen.core.query.FilterCondition.Between;
import io.tablegen.core.query.FilterCondition.Comparison;
import io.tablegen.core.query.FilterCondition.InList;
import io.tablegen.core.query.FilterCondition.Like;
import io.tablegen.core.query.FilterCondition.NullCheck;
import io.tablegen.core.security.IdentifierValidator;
import io.tablegen.core.security.SortDirection;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles an open-ended filter map into a parameterized WHERE / ORDER BY / LIMIT / OFFSET
 * suffix for a base query.
 *
 * <h3>Filter keys</h3>
 * <pre>
 *   status            → "status" = $1
 *   status_ne         → "status" &lt;&gt; $1
 *   name_like         → "name" ILIKE $1            (value wrapped in %...%)
 *   id_in / id_nin    → "id" IN ($1, $2)           (list, or comma separated string)
 *   age_between       → "age" BETWEEN $1 AND $2    (two values)
 *   deleted_at_null   → "deleted_at" IS NULL       (value only has to be present)
 *   deleted_at_nnull  → "deleted_at" IS NOT NULL
 * </pre>
 * Control keys ({@code page, limit, sort, order, offset}, with or without a leading underscore)
 * never become conditions. {@code sort} is {@code field} or {@code field:DESC}.
 *
 * <p>Every field name, including the sort field, must be in the filterable-column whitelist;
 * otherwise the whole call fails with {@link io.tablegen.core.security.InvalidIdentifierException}.
 * Values are only ever bound. Entries whose values cannot form a condition are dropped, or
 * rejected with {@link MalformedFilterValueException} when the compiler is strict.
 *
 * <p>The {@link TableMetadata} overloads also check each condition against its column: the
 * operator must be one {@link FilterOperator#availableFor} allows for the column type, eq / in
 * values on enum columns must be enum members, and gt / gte / lt / lte values must lie within
 * the column's min / max. A failing condition is treated like a malformed value.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class FilterQueryCompiler {

  public static final Set<String> CONTROL_KEYS = Set.of(
      "page", "limit", "sort", "order", "offset",
      "_page", "_limit", "_sort", "_order", "_offset"
  );

  private static final Pattern OPERATOR_SUFFIX = Pattern.compile("^(.+)_([a-z]+)$");
  private static final Pattern WHERE = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern LEADING_INT = Pattern.compile("^\\s*([+-]?\\d+)");

  private final SqlDialect dialect;
  private final boolean strict;

  public FilterQueryCompiler() {
    this(SqlDialects.POSTGRES, false);
  }

  public FilterQueryCompiler(SqlDialect dialect) {
    this(dialect, false);
  }

  public FilterQueryCompiler(SqlDialect dialect, boolean strict) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.strict = strict;
  }

  public SqlDialect dialect() { return dialect; }

  public boolean strict() { return strict; }

  /**
   * Parse and render in one step.
   *
   * @param baseQuery query the fragment is appended to, e.g. {@code SELECT * FROM "public"."orders"}
   * @param filter filter map, iterated in its own order; may be null
   * @param filterableColumns names allowed as filter and sort fields
   */
  public CompiledQuery compile(String baseQuery, Map<String, ?> filter, Collection<String> filterableColumns) {
    return render(baseQuery, parse(filter, filterableColumns));
  }

  /** Parse and render with the table's filterable columns and per-column checks. */
  public CompiledQuery compile(String baseQuery, Map<String, ?> filter, TableMetadata table) {
    return render(baseQuery, parse(filter, table));
  }

  /**
   * Turn a filter map into typed conditions, sort and pagination without producing SQL.
   */
  public FilterRequest parse(Map<String, ?> filter, Collection<String> filterableColumns) {
    Objects.requireNonNull(filterableColumns, "filterableColumns");
    return parse(filter, filterableColumns, null);
  }

  public FilterRequest parse(Map<String, ?> filter, TableMetadata table) {
    Objects.requireNonNull(table, "table");
    return parse(filter, table.filterableColumns(), table);
  }

  private FilterRequest parse(Map<String, ?> filter, Collection<String> filterableColumns, TableMetadata table) {
    if (filter == null || filter.isEmpty()) {
      return new FilterRequest(List.of(), null, Pagination.NONE);
    }

    List<FilterCondition> conditions = new ArrayList<>();
    for (Map.Entry<String, ?> e : filter.entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      if (key == null || isAbsent(value) || CONTROL_KEYS.contains(key)) continue;

      Matcher m = OPERATOR_SUFFIX.matcher(key);
      String field = key;
      FilterOperator op = FilterOperator.EQ;
      if (m.matches()) {
        FilterOperator suffix = FilterOperator.fromToken(m.group(2));
        // a column literally named e.g. "is_null" keeps its equality meaning
        if (suffix != null && !(isListed(key, filterableColumns) && !isListed(m.group(1), filterableColumns))) {
          field = m.group(1);
          op = suffix;
        }
      }

      String column = IdentifierValidator.validateIdentifier(field, filterableColumns, "filter field");
      FilterCondition condition = toCondition(key, column, op, value);
      if (condition != null && table != null) {
        condition = checkColumn(key, condition, table.column(column).orElse(null));
      }
      if (condition != null) conditions.add(condition);
    }

    SortSpec sort = parseSort(filter, filterableColumns);
    Pagination pagination = new Pagination(
        controlNumber(filter, "limit", 1),
        controlNumber(filter, "page", 1),
        controlNumber(filter, "offset", 0));
    return new FilterRequest(conditions, sort, pagination);
  }

  /**
   * Render parsed conditions onto a base query. Conditions are joined with AND and attached
   * with WHERE, or with AND when the base query already has a WHERE clause.
   */
  public CompiledQuery render(String baseQuery, FilterRequest request) {
    Objects.requireNonNull(baseQuery, "baseQuery");
    StringBuilder sql = new StringBuilder(baseQuery);
    List<Object> values = new ArrayList<>();

    List<String> parts = new ArrayList<>();
    for (FilterCondition c : request.conditions()) {
      parts.add(renderCondition(c, values));
    }
    if (!parts.isEmpty()) {
      sql.append(WHERE.matcher(baseQuery).find() ? " AND " : " WHERE ");
      sql.append(String.join(" AND ", parts));
    }

    if (request.sort() != null) {
      sql.append(" ORDER BY ")
          .append(dialect.quoteIdentifier(request.sort().field()))
          .append(' ')
          .append(request.sort().direction().name());
    }

    Pagination p = request.pagination();
    sql.append(dialect.paginate(p.limit(), p.effectiveOffset()));
    return new CompiledQuery(sql.toString(), values);
  }

  /** Copy of {@code filter} without pagination and sort keys, for count queries. */
  public static Map<String, Object> withoutControlKeys(Map<String, ?> filter) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (filter == null) return out;
    for (Map.Entry<String, ?> e : filter.entrySet()) {
      if (!CONTROL_KEYS.contains(e.getKey())) out.put(e.getKey(), e.getValue());
    }
    return out;
  }

  // =========================================================================
  // Conditions
  // =========================================================================

  private FilterCondition toCondition(String key, String column, FilterOperator op, Object value) {
    switch (op) {
      case EQ, NE, GT, GTE, LT, LTE -> {
        if (isMulti(value)) return malformed(key, op.token() + " expects a single value");
        return new Comparison(column, op, value);
      }
      case LIKE -> {
        if (isMulti(value)) return malformed(key, "like expects a single value");
        return new Like(column, "%" + value + "%");
      }
      case IN, NIN -> {
        List<Object> list = toList(value);
        if (list.isEmpty()) return malformed(key, op.token() + " expects at least one value");
        return new InList(column, list, op == FilterOperator.NIN);
      }
      case BETWEEN -> {
        List<Object> list = toList(value);
        if (list.size() < 2) return malformed(key, "between expects two values, got " + list.size());
        if (list.size() > 2 && strict) return malformed(key, "between expects two values, got " + list.size());
        return new Between(column, list.get(0), list.get(1));
      }
      case NULL -> {
        return new NullCheck(column, false);
      }
      case NNULL -> {
        return new NullCheck(column, true);
      }
    }
    throw new IllegalStateException("Unhandled operator " + op);
  }

  private FilterCondition checkColumn(String key, FilterCondition c, ColumnMetadata column) {
    if (column == null) return c;
    FilterOperator op = c.operator();
    if (!FilterOperator.availableFor(column.dataType()).contains(op)) {
      return malformed(key, op.token() + " is not supported for " + column.dataType().id() + " column " + column.name());
    }

    if (column.hasEnumValues()) {
      if (c instanceof Comparison cmp && op == FilterOperator.EQ && !isEnumMember(column, cmp.value())) {
        return malformed(key, "'" + cmp.value() + "' is not one of " + column.enumValues());
      }
      if (c instanceof InList in && !in.negated()) {
        for (Object v : in.values()) {
          if (!isEnumMember(column, v)) return malformed(key, "'" + v + "' is not one of " + column.enumValues());
        }
      }
    }

    if (c instanceof Comparison cmp && isOrdering(op) && column.dataType().isNumeric()) {
      BigDecimal n = toDecimal(cmp.value());
      if (n == null) return malformed(key, "expected a number, got '" + cmp.value() + "'");
      if (column.min() != null && n.compareTo(BigDecimal.valueOf(column.min())) < 0) {
        return malformed(key, n.toPlainString() + " is less than minimum " + column.min());
      }
      if (column.max() != null && n.compareTo(BigDecimal.valueOf(column.max())) > 0) {
        return malformed(key, n.toPlainString() + " is greater than maximum " + column.max());
      }
    }
    return c;
  }

  private static boolean isOrdering(FilterOperator op) {
    return op == FilterOperator.GT || op == FilterOperator.GTE || op == FilterOperator.LT || op == FilterOperator.LTE;
  }

  private static boolean isEnumMember(ColumnMetadata column, Object value) {
    return column.enumValues().contains(String.valueOf(value));
  }

  private String renderCondition(FilterCondition c, List<Object> values) {
    String column = dialect.quoteIdentifier(c.field());
    if (c instanceof Comparison cmp) {
      return column + " " + cmp.operator().sql() + " " + bind(values, cmp.value());
    }
    if (c instanceof Like like) {
      return dialect.likeCondition(column, bind(values, like.pattern()));
    }
    if (c instanceof InList in) {
      List<String> placeholders = new ArrayList<>();
      for (Object v : in.values()) placeholders.add(bind(values, v));
      return column + " " + in.operator().sql() + " (" + String.join(", ", placeholders) + ")";
    }
    if (c instanceof Between b) {
      String lower = bind(values, b.lower());
      String upper = bind(values, b.upper());
      return column + " BETWEEN " + lower + " AND " + upper;
    }
    if (c instanceof NullCheck n) {
      return column + " " + n.operator().sql();
    }
    throw new IllegalArgumentException("Unsupported FilterCondition: " + c.getClass().getName());
  }

  private String bind(List<Object> values, Object value) {
    values.add(value);
    return dialect.placeholder(values.size());
  }

  private FilterCondition malformed(String key, String reason) {
    if (strict) throw new MalformedFilterValueException(key, reason);
    return null;
  }

  // =========================================================================
  // Sort and pagination
  // =========================================================================

  private SortSpec parseSort(Map<String, ?> filter, Collection<String> whitelist) {
    Object raw = control(filter, "sort");
    if (raw == null) return null;

    String spec = raw.toString().trim();
    String field = spec;
    String direction = null;
    int colon = spec.indexOf(':');
    if (colon >= 0) {
      field = spec.substring(0, colon).trim();
      direction = spec.substring(colon + 1).trim();
    }
    if (direction == null || direction.isEmpty()) {
      Object order = control(filter, "order");
      direction = order == null ? null : order.toString().trim();
    }

    String column = IdentifierValidator.validateIdentifier(field, whitelist, "sort field");
    if (strict && direction != null) {
      String d = direction.toLowerCase(Locale.ROOT);
      if (!d.equals("asc") && !d.equals("desc")) {
        throw new MalformedFilterValueException("sort", "direction must be ASC or DESC, got '" + direction + "'");
      }
    }
    SortDirection dir = "desc".equalsIgnoreCase(direction) ? SortDirection.DESC : SortDirection.ASC;
    return new SortSpec(column, dir);
  }

  private Integer controlNumber(Map<String, ?> filter, String name, int minimum) {
    Object raw = control(filter, name);
    if (raw == null) return null;
    Integer n = toInteger(raw);
    if (n == null || n < minimum) {
      if (strict) throw new MalformedFilterValueException(name, "expected an integer >= " + minimum + ", got '" + raw + "'");
      return null;
    }
    return n;
  }

  /** Value of a control key, plain spelling first, then the underscore spelling. */
  private static Object control(Map<String, ?> filter, String name) {
    Object v = filter.get(name);
    if (isAbsent(v)) v = filter.get("_" + name);
    return isAbsent(v) ? null : v;
  }

  static Integer toInteger(Object raw) {
    if (raw instanceof Double || raw instanceof Float) {
      double d = ((Number) raw).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) > Integer.MAX_VALUE) return null;
      return (int) d;
    }
    if (raw instanceof Number n) {
      long l = n.longValue();
      return l > Integer.MAX_VALUE || l < Integer.MIN_VALUE ? null : (int) l;
    }
    if (raw instanceof String s) {
      Matcher m = LEADING_INT.matcher(s);
      if (!m.find()) return null;
      try {
        return Integer.parseInt(m.group(1));
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  // =========================================================================
  // Value helpers
  // =========================================================================

  static BigDecimal toDecimal(Object raw) {
    if (raw instanceof BigDecimal d) return d;
    if (raw instanceof Double || raw instanceof Float) {
      double d = ((Number) raw).doubleValue();
      return Double.isNaN(d) || Double.isInfinite(d) ? null : BigDecimal.valueOf(d);
    }
    if (raw instanceof Number n) return new BigDecimal(n.toString());
    if (raw instanceof String s) {
      try {
        return new BigDecimal(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static boolean isAbsent(Object value) {
    return value == null || (value instanceof String s && s.isEmpty());
  }

  private static boolean isMulti(Object value) {
    return value instanceof Collection<?> || value instanceof Object[] || value instanceof Map<?, ?>;
  }

  /** Collections and arrays as-is, strings split on commas, any other scalar as a singleton. */
  private static List<Object> toList(Object value) {
    List<Object> out = new ArrayList<>();
    if (value instanceof Collection<?> c) {
      for (Object o : c) if (!isAbsent(o)) out.add(o);
    } else if (value instanceof Object[] arr) {
      for (Object o : Arrays.asList(arr)) if (!isAbsent(o)) out.add(o);
    } else if (value instanceof String s) {
      for (String part : s.split(",")) {
        String t = part.trim();
        if (!t.isEmpty()) out.add(t);
      }
    } else if (value != null && !(value instanceof Map<?, ?>)) {
      out.add(value);
    }
    return out;
  }

  private static boolean isListed(String name, Collection<String> whitelist) {
    String lower = name.toLowerCase(Locale.ROOT);
    for (String w : whitelist) {
      if (w != null && w.toLowerCase(Locale.ROOT).equals(lower)) return true;
    }
    return false;
  }
}
