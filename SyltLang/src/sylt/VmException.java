package sylt;

import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/**
 * A runtime fault, raised either during a real run or during the typecheck pass. The VM fills in
 * the span of the op that failed; extern functions throw it without one.
 */
public class VmException extends SyltException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    TYPE_ERROR,
    ASSERT_FAILED,
    INDEX_OUT_OF_BOUNDS,
    UNKNOWN_FIELD,
    ARGUMENT_COUNT,
    DIVISION_BY_ZERO,
    UNREACHABLE,
    // Raised by extern functions.
    EXTERN_TYPE_MISMATCH,
    EXTERN_ERROR,
    // Broken stack or bytecode invariants; never recoverable.
    INVALID_PROGRAM;
  }

  private final Kind kind;

  public VmException(Span span, Kind kind, String errorMsg) {
    super(span, errorMsg);
    this.kind = kind;
  }

  public VmException(Kind kind, String errorMsg) {
    this(Span.internal(), kind, errorMsg);
  }

  public Kind kind() {
    return kind;
  }

  /** Re-anchors an error raised without a location (by an extern, or a value helper). */
  public VmException at(Span span) {
    if (!span().equals(Span.internal()) || span.equals(Span.internal())) return this;

    VmException located = new VmException(span, kind, errorMsg());
    located.setStackTrace(getStackTrace());
    return located;
  }

  @Override
  protected String category() {
    return kind.name();
  }

  public static VmException typeError(String format, Object... args) {
    return new VmException(Kind.TYPE_ERROR, String.format(format, args));
  }

  public static VmException externTypeMismatch(String function, ImmutableList<Type> argTypes) {
    return new VmException(
        Kind.EXTERN_TYPE_MISMATCH,
        String.format(
            "Extern function '%s' cannot be called with (%s)",
            function,
            argTypes.stream().map(Type::toString).collect(Collectors.joining(", "))));
  }

  public static VmException externError(String function, String message) {
    return new VmException(
        Kind.EXTERN_ERROR, String.format("Extern function '%s' failed: %s", function, message));
  }

  public static VmException invalidProgram(String format, Object... args) {
    return new VmException(Kind.INVALID_PROGRAM, String.format(format, args));
  }
}
