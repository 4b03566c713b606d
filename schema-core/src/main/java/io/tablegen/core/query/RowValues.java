package io.tablegen.core.query;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.UUID;

/**
 * Coercions from raw driver values to the Java types generated entities declare.
 * Every method maps null to null and rejects values it cannot convert.
 */
public final class RowValues {
  private RowValues() {}

  public static String asString(Object raw) {
    if (raw == null) return null;
    return raw.toString();
  }

  public static Long asLong(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Long l) return l;
    if (raw instanceof BigDecimal bd) return bd.longValueExact();
    if (raw instanceof Number n) return n.longValue();
    if (raw instanceof String s) return Long.parseLong(s.trim());
    throw unexpected("Long", raw);
  }

  public static BigDecimal asBigDecimal(Object raw) {
    if (raw == null) return null;
    if (raw instanceof BigDecimal bd) return bd;
    if (raw instanceof Double || raw instanceof Float) return BigDecimal.valueOf(((Number) raw).doubleValue());
    if (raw instanceof Number n) return BigDecimal.valueOf(n.longValue());
    if (raw instanceof String s) return new BigDecimal(s.trim());
    throw unexpected("BigDecimal", raw);
  }

  public static Boolean asBoolean(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Boolean b) return b;
    if (raw instanceof Number n) return n.intValue() != 0;
    if (raw instanceof String s) {
      String t = s.trim();
      if (t.equalsIgnoreCase("true") || t.equals("1") || t.equalsIgnoreCase("t")) return true;
      if (t.equalsIgnoreCase("false") || t.equals("0") || t.equalsIgnoreCase("f")) return false;
    }
    throw unexpected("Boolean", raw);
  }

  public static Instant asInstant(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Instant i) return i;
    if (raw instanceof Timestamp ts) return ts.toInstant();
    if (raw instanceof OffsetDateTime odt) return odt.toInstant();
    if (raw instanceof ZonedDateTime zdt) return zdt.toInstant();
    if (raw instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
    if (raw instanceof Date d) return d.toInstant();
    if (raw instanceof String s) return Instant.parse(s.trim());
    throw unexpected("Instant", raw);
  }

  public static UUID asUuid(Object raw) {
    if (raw == null) return null;
    if (raw instanceof UUID u) return u;
    if (raw instanceof String s) return UUID.fromString(s.trim());
    throw unexpected("UUID", raw);
  }

  private static IllegalArgumentException unexpected(String target, Object raw) {
    return new IllegalArgumentException("Cannot convert " + raw.getClass().getName() + " to " + target + ": " + raw);
  }
}
