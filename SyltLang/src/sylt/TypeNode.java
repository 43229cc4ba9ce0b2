package sylt;

import java.util.Optional;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A type annotation as written. Everything except blob names is resolved by the parser; blob
 * names are resolved by the compiler, which knows the blob table.
 */
@AutoValue
public abstract class TypeNode {

  public enum Kind {
    RESOLVED,
    USER_DEFINED,
    TUPLE,
    LIST,
    SET,
    DICT,
    // args are the parameters followed by the return type.
    FUNCTION,
    UNION;
  }

  public abstract Kind kind();

  public abstract Optional<Type> resolved();

  /** For {@code other.Point}, the import alias {@code other}. */
  public abstract Optional<String> namespace();

  public abstract Optional<String> name();

  public abstract ImmutableList<TypeNode> args();

  public abstract Span span();

  public static TypeNode resolved(Type type, Span span) {
    return new AutoValue_TypeNode(
        Kind.RESOLVED,
        Optional.of(type),
        Optional.empty(),
        Optional.empty(),
        ImmutableList.of(),
        span);
  }

  public static TypeNode userDefined(Optional<String> namespace, String name, Span span) {
    return new AutoValue_TypeNode(
        Kind.USER_DEFINED,
        Optional.empty(),
        namespace,
        Optional.of(name),
        ImmutableList.of(),
        span);
  }

  public static TypeNode composite(Kind kind, ImmutableList<TypeNode> args, Span span) {
    return new AutoValue_TypeNode(
        kind, Optional.empty(), Optional.empty(), Optional.empty(), args, span);
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case RESOLVED:
        return resolved().get().toString();
      case USER_DEFINED:
        return namespace().map(n -> n + ".").orElse("") + name().get();
      case TUPLE:
        return joinArgs(args(), "(", ")");
      case LIST:
        return "[" + args().get(0) + "]";
      case SET:
        return "{" + args().get(0) + "}";
      case DICT:
        return "{" + args().get(0) + ": " + args().get(1) + "}";
      case FUNCTION:
        return joinArgs(args().subList(0, args().size() - 1), "fn ", " -> ")
            + args().get(args().size() - 1);
      case UNION:
        return args().stream().map(TypeNode::toString).collect(Collectors.joining(" | "));
    }
    throw new AssertionError(kind());
  }

  private static String joinArgs(ImmutableList<TypeNode> args, String prefix, String suffix) {
    return args.stream().map(TypeNode::toString).collect(Collectors.joining(", ", prefix, suffix));
  }
}
