package io.intellixity.dynattr.query;

/**
 * Raised when search criteria are malformed: unknown operator, BETWEEN without bounds, IN without
 * a list, or an operand that cannot be cast to the attribute's type.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
