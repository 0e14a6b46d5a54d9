package animexpr;

/**
 * Raised when an expression tree is built or used incorrectly.
 *
 * <p>Every kind indicates a bug in the code authoring the expression, never a transient
 * condition, so nothing in this package catches or retries it.
 */
public class ExpressionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    // A value tag or node class outside the nine supported value types.
    UNSUPPORTED_TYPE,
    // A malformed request, e.g. a bad keyword kind or swizzle channel count.
    INVALID_ARGUMENT,
    // An arity or required-field invariant was violated during compilation.
    STRUCTURAL_ERROR,
    // A reference parameter cannot be resolved to exactly one name and object.
    AMBIGUOUS_REFERENCE;
  }

  private final Kind kind;

  public ExpressionException(Kind kind, String errorMsg) {
    super(errorMsg);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  static ExpressionException unsupportedType(String format, Object... args) {
    return new ExpressionException(Kind.UNSUPPORTED_TYPE, String.format(format, args));
  }

  static ExpressionException invalidArgument(String format, Object... args) {
    return new ExpressionException(Kind.INVALID_ARGUMENT, String.format(format, args));
  }

  static ExpressionException structuralError(String format, Object... args) {
    return new ExpressionException(Kind.STRUCTURAL_ERROR, String.format(format, args));
  }

  static ExpressionException ambiguousReference(String format, Object... args) {
    return new ExpressionException(Kind.AMBIGUOUS_REFERENCE, String.format(format, args));
  }

  @Override
  public String toString() {
    return String.format("%s: %s", kind, getMessage());
  }
}
