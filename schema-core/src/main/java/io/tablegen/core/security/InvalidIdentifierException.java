package io.tablegen.core.security;

/**
 * Raised when a table, schema or column name fails the whitelist or the pattern/keyword checks.
 * Always fatal to the enclosing compile or validate call.
 */
public final class InvalidIdentifierException extends IllegalArgumentException {
  private final String identifier;
  private final String context;

  public InvalidIdentifierException(String identifier, String context, String reason) {
    super("Invalid " + context + ": " + reason);
    this.identifier = identifier;
    this.context = context;
  }

  /** The offending name as supplied (may be null). */
  public String identifier() { return identifier; }

  public String context() { return context; }
}
