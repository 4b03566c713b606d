package io.tablegen.core.query;

/**
 * A filter value that cannot be turned into a condition. Only thrown by a strict
 * {@link FilterQueryCompiler}; the lenient default drops the entry instead.
 */
public final class MalformedFilterValueException extends IllegalArgumentException {
  private final String key;

  public MalformedFilterValueException(String key, String reason) {
    super("Malformed filter value for '" + key + "': " + reason);
    this.key = key;
  }

  public String key() { return key; }
}
