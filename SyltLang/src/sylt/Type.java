package sylt;

import java.util.Comparator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Streams;

/**
 * The static type of a value. Composite types keep their components in {@link #args()}: the
 * element type of lists, sets and iterators, key and value of dicts, the parameters followed by the
 * return type of functions, and the sorted members of unions.
 */
@AutoValue
public abstract class Type {

  public enum Kind {
    VOID,
    UNKNOWN,
    INVALID,
    INT,
    FLOAT,
    BOOL,
    STRING,
    TUPLE,
    LIST,
    SET,
    DICT,
    FUNCTION,
    INSTANCE,
    BLOB,
    ITER,
    UNION,
    EXTERN_FUNCTION,
    FIELD,
    TY;
  }

  public abstract Kind kind();

  public abstract ImmutableList<Type> args();

  /** Blob id for {@code INSTANCE} and {@code BLOB}, extern index for {@code EXTERN_FUNCTION}. */
  abstract int index();

  /** Blob name for {@code INSTANCE} and {@code BLOB}, field name for {@code FIELD}. */
  abstract String name();

  private static Type create(Kind kind, ImmutableList<Type> args, int index, String name) {
    return new AutoValue_Type(kind, args, index, name);
  }

  /** Rebuilds a type from its serialized parts. */
  static Type restore(Kind kind, ImmutableList<Type> args, int index, String name) {
    return create(kind, args, index, name);
  }

  private static Type simple(Kind kind) {
    return create(kind, ImmutableList.of(), 0, "");
  }

  private static final Type VOID = simple(Kind.VOID);
  private static final Type UNKNOWN = simple(Kind.UNKNOWN);
  private static final Type INVALID = simple(Kind.INVALID);
  private static final Type INT = simple(Kind.INT);
  private static final Type FLOAT = simple(Kind.FLOAT);
  private static final Type BOOL = simple(Kind.BOOL);
  private static final Type STRING = simple(Kind.STRING);
  private static final Type TY = simple(Kind.TY);

  public static Type voidType() {
    return VOID;
  }

  public static Type unknown() {
    return UNKNOWN;
  }

  public static Type invalid() {
    return INVALID;
  }

  public static Type intType() {
    return INT;
  }

  public static Type floatType() {
    return FLOAT;
  }

  public static Type boolType() {
    return BOOL;
  }

  public static Type stringType() {
    return STRING;
  }

  public static Type ty() {
    return TY;
  }

  public static Type tuple(ImmutableList<Type> elements) {
    return create(Kind.TUPLE, elements, 0, "");
  }

  public static Type list(Type element) {
    return create(Kind.LIST, ImmutableList.of(element), 0, "");
  }

  public static Type set(Type element) {
    return create(Kind.SET, ImmutableList.of(element), 0, "");
  }

  public static Type dict(Type key, Type value) {
    return create(Kind.DICT, ImmutableList.of(key, value), 0, "");
  }

  public static Type iter(Type element) {
    return create(Kind.ITER, ImmutableList.of(element), 0, "");
  }

  public static Type function(ImmutableList<Type> params, Type returnType) {
    return create(
        Kind.FUNCTION,
        ImmutableList.<Type>builder().addAll(params).add(returnType).build(),
        0,
        "");
  }

  public static Type instance(int blobId, String blobName) {
    return create(Kind.INSTANCE, ImmutableList.of(), blobId, blobName);
  }

  public static Type blob(int blobId, String blobName) {
    return create(Kind.BLOB, ImmutableList.of(), blobId, blobName);
  }

  public static Type externFunction(int index) {
    return create(Kind.EXTERN_FUNCTION, ImmutableList.of(), index, "");
  }

  public static Type field(String name) {
    return create(Kind.FIELD, ImmutableList.of(), 0, name);
  }

  /**
   * The union of {@code types}, flattened and deduplicated. A union of one type is that type; a
   * union of nothing is unknown.
   */
  public static Type union(Iterable<Type> types) {
    ImmutableSet<Type> members =
        Streams.stream(types)
            .flatMap(t -> t.is(Kind.UNION) ? t.args().stream() : Stream.of(t))
            .collect(ImmutableSet.toImmutableSet());
    if (members.isEmpty()) return UNKNOWN;
    if (members.size() == 1) return members.iterator().next();
    return create(
        Kind.UNION,
        ImmutableList.sortedCopyOf(Comparator.comparing(Type::toString), members),
        0,
        "");
  }

  public final boolean is(Kind kind) {
    return kind() == kind;
  }

  public final boolean isUnknown() {
    return kind() == Kind.UNKNOWN;
  }

  public final Type elementType() {
    Preconditions.checkState(is(Kind.LIST) || is(Kind.SET) || is(Kind.ITER), this);
    return args().get(0);
  }

  public final Type keyType() {
    Preconditions.checkState(is(Kind.DICT), this);
    return args().get(0);
  }

  public final Type valueType() {
    Preconditions.checkState(is(Kind.DICT), this);
    return args().get(1);
  }

  public final ImmutableList<Type> params() {
    Preconditions.checkState(is(Kind.FUNCTION), this);
    return args().subList(0, args().size() - 1);
  }

  public final Type returnType() {
    Preconditions.checkState(is(Kind.FUNCTION), this);
    return args().get(args().size() - 1);
  }

  public final int blobId() {
    Preconditions.checkState(is(Kind.INSTANCE) || is(Kind.BLOB), this);
    return index();
  }

  public final int externIndex() {
    Preconditions.checkState(is(Kind.EXTERN_FUNCTION), this);
    return index();
  }

  public final String fieldName() {
    Preconditions.checkState(is(Kind.FIELD), this);
    return name();
  }

  /** Whether a value of this type can be used where {@code expected} is required. */
  public final boolean fits(Type expected) {
    if (isUnknown() || expected.isUnknown()) return true;
    if (is(Kind.UNION)) return args().stream().allMatch(t -> t.fits(expected));
    if (expected.is(Kind.UNION)) return expected.args().stream().anyMatch(this::fits);
    if (kind() != expected.kind()) return false;

    switch (kind()) {
      case TUPLE:
      case LIST:
      case SET:
      case DICT:
      case ITER:
      case FUNCTION:
        return argsFit(expected);
      case INSTANCE:
      case BLOB:
      case EXTERN_FUNCTION:
        return index() == expected.index();
      case FIELD:
        return name().equals(expected.name());
      default:
        return true;
    }
  }

  private boolean argsFit(Type expected) {
    if (args().size() != expected.args().size()) return false;
    for (int i = 0; i < args().size(); i++) {
      if (!args().get(i).fits(expected.args().get(i))) return false;
    }
    return true;
  }

  /** The inferred type of {@code value}. Container element types are unions of their elements. */
  public static Type of(Value value) {
    switch (value.kind()) {
      case NIL:
        return VOID;
      case BOOL:
        return BOOL;
      case INT:
        return INT;
      case FLOAT:
        return FLOAT;
      case STRING:
        return STRING;
      case TUPLE:
        return tuple(
            value.<Value.Tuple>cast().elements().stream()
                .map(Type::of)
                .collect(ImmutableList.toImmutableList()));
      case LIST:
        return list(unionOf(value.<Value.List>cast().elements()));
      case SET:
        return set(unionOf(value.<Value.Set>cast().elements()));
      case DICT:
        {
          Value.Dict dict = value.cast();
          return dict(unionOf(dict.entries().keySet()), unionOf(dict.entries().values()));
        }
      case INSTANCE:
        {
          Value.Instance instance = value.cast();
          return instance(instance.blobId(), instance.blobName());
        }
      case FUNCTION:
        return value.<Value.Function>cast().signature();
      case EXTERN_FUNCTION:
        return externFunction(value.<Value.Extern>cast().index());
      case ITER:
        return iter(value.<Value.Iter>cast().elementType());
      case UNION:
        return union(
            value.<Value.Union>cast().members().stream()
                .map(Type::of)
                .collect(ImmutableList.toImmutableList()));
      case UNKNOWN:
        return UNKNOWN;
      case TY:
        return TY;
      case FIELD:
        return field(value.<Value.Field>cast().name());
      case BLOB:
        {
          Value.Blob blob = value.cast();
          return blob(blob.blobId(), blob.blobName());
        }
    }
    throw new AssertionError(value.kind());
  }

  private static Type unionOf(Iterable<Value> values) {
    return union(Streams.stream(values).map(Type::of).collect(ImmutableList.toImmutableList()));
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case VOID:
        return "void";
      case UNKNOWN:
        return "?";
      case INVALID:
        return "!invalid";
      case INT:
        return "int";
      case FLOAT:
        return "float";
      case BOOL:
        return "bool";
      case STRING:
        return "str";
      case TY:
        return "type";
      case TUPLE:
        return join(args(), "(", ")");
      case LIST:
        return "[" + elementType() + "]";
      case SET:
        return "{" + elementType() + "}";
      case DICT:
        return "{" + keyType() + ": " + valueType() + "}";
      case ITER:
        return "iter " + elementType();
      case FUNCTION:
        return join(params(), "fn ", " -> ") + returnType();
      case INSTANCE:
        return name();
      case BLOB:
        return "blob " + name();
      case UNION:
        return args().stream().map(Type::toString).collect(Collectors.joining(" | "));
      case EXTERN_FUNCTION:
        return "extern #" + index();
      case FIELD:
        return "." + name();
    }
    throw new AssertionError(kind());
  }

  private static String join(ImmutableList<Type> types, String prefix, String suffix) {
    return types.stream().map(Type::toString).collect(Collectors.joining(", ", prefix, suffix));
  }
}
