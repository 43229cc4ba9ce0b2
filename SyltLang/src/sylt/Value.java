package sylt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

/**
 * A runtime value.
 *
 * <p>Lists, sets, dicts and instances are shared: copying the value copies the handle, so every
 * alias observes mutations. Tuples and strings are immutable.
 *
 * <p>Equality is structural for primitives and containers and by identity for instances,
 * functions and iterators. A union equals any value one of its members equals. Only primitives,
 * strings, tuples, fields and blobs hash by content; every other kind hashes to a constant.
 */
public abstract class Value {

  public enum Kind {
    NIL,
    BOOL,
    INT,
    FLOAT,
    STRING,
    TUPLE,
    LIST,
    SET,
    DICT,
    INSTANCE,
    FUNCTION,
    EXTERN_FUNCTION,
    ITER,
    UNION,
    // Only produced by the typecheck pass.
    UNKNOWN,
    TY,
    FIELD,
    BLOB;
  }

  private final Kind kind;

  private Value(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  public final boolean is(Kind kind) {
    return this.kind == kind;
  }

  @SuppressWarnings("unchecked")
  public <T extends Value> T cast() {
    return (T) this;
  }

  public final Type type() {
    return Type.of(this);
  }

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof Value)) return false;

    Value other = (Value) obj;
    if (kind == Kind.UNION) return this.<Union>cast().members.stream().anyMatch(other::equals);
    if (other.kind == Kind.UNION) return other.equals(this);
    return kind == other.kind && equalsSameKind(other);
  }

  protected abstract boolean equalsSameKind(Value other);

  @Override
  public int hashCode() {
    return kind.ordinal();
  }

  /** How {@code print} shows the value: like {@link #toString()}, but strings are unquoted. */
  public String display() {
    return toString();
  }

  // ---------------------------------------------------------------------------
  // Factories

  private static final Nil NIL = new Nil();
  private static final Unknown UNKNOWN = new Unknown();
  private static final Bool TRUE = new Bool(true);
  private static final Bool FALSE = new Bool(false);

  public static Value nil() {
    return NIL;
  }

  public static Value unknown() {
    return UNKNOWN;
  }

  public static Value of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static Value of(long value) {
    return new Int(value);
  }

  public static Value of(double value) {
    return new Float(value);
  }

  public static Value of(String value) {
    return new Str(value);
  }

  public static Value tuple(Iterable<Value> elements) {
    return new Tuple(ImmutableList.copyOf(elements));
  }

  public static Value list(Iterable<Value> elements) {
    return new List(new ArrayList<>(ImmutableList.copyOf(elements)));
  }

  public static Value set(Iterable<Value> elements) {
    LinkedHashSet<Value> set = new LinkedHashSet<>();
    Iterables.addAll(set, elements);
    return new Set(set);
  }

  public static Value dict(Map<Value, Value> entries) {
    return new Dict(new LinkedHashMap<>(entries));
  }

  public static Value instance(int blobId, String blobName, Map<String, Value> fields) {
    return new Instance(blobId, blobName, new LinkedHashMap<>(fields));
  }

  public static Value function(ImmutableList<Upvalue> upvalues, Type type, int block) {
    return new Function(upvalues, type, block);
  }

  public static Value extern(int index) {
    return new Extern(index);
  }

  public static Value iter(Type elementType, Supplier<Optional<Value>> generator) {
    return new Iter(elementType, generator);
  }

  public static Value union(Iterable<Value> members) {
    return new Union(ImmutableList.copyOf(new LinkedHashSet<>(ImmutableList.copyOf(members))));
  }

  public static Value ty(Type type) {
    return new Ty(type);
  }

  public static Value field(String name) {
    return new Field(name);
  }

  public static Value blob(int blobId, String blobName) {
    return new Blob(blobId, blobName);
  }

  /** A representative value of {@code type}, used as a placeholder by the typecheck pass. */
  public static Value from(Type type) {
    switch (type.kind()) {
      case VOID:
        return NIL;
      case UNKNOWN:
      case INVALID:
        return UNKNOWN;
      case INT:
        return of(1L);
      case FLOAT:
        return of(1.0);
      case BOOL:
        return TRUE;
      case STRING:
        return of("");
      case TUPLE:
        return tuple(Iterables.transform(type.args(), Value::from));
      case LIST:
        return list(ImmutableList.of(from(type.elementType())));
      case SET:
        return set(ImmutableList.of(from(type.elementType())));
      case DICT:
        {
          Map<Value, Value> entries = new LinkedHashMap<>();
          entries.put(from(type.keyType()), from(type.valueType()));
          return dict(entries);
        }
      case ITER:
        return iter(type.elementType(), Optional::empty);
      case UNION:
        return union(Iterables.transform(type.args(), Value::from));
      case INSTANCE:
        return instance(type.blobId(), type.name(), ImmutableMap.of());
      case FUNCTION:
        return function(ImmutableList.of(), type, 0);
      case EXTERN_FUNCTION:
        return extern(type.externIndex());
      case BLOB:
        return blob(type.blobId(), type.name());
      case FIELD:
        return field(type.fieldName());
      case TY:
        return ty(Type.voidType());
    }
    throw new AssertionError(type.kind());
  }

  // ---------------------------------------------------------------------------
  // Variants

  public static final class Nil extends Value {
    private Nil() {
      super(Kind.NIL);
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return true;
    }

    @Override
    public String toString() {
      return "nil";
    }
  }

  public static final class Bool extends Value {
    private final boolean value;

    private Bool(boolean value) {
      super(Kind.BOOL);
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return value == other.<Bool>cast().value;
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  public static final class Int extends Value {
    private final long value;

    private Int(long value) {
      super(Kind.INT);
      this.value = value;
    }

    public long value() {
      return value;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return value == other.<Int>cast().value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  public static final class Float extends Value {
    private final double value;

    private Float(double value) {
      super(Kind.FLOAT);
      this.value = value;
    }

    public double value() {
      return value;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return value == other.<Float>cast().value;
    }

    /** Non-finite floats must never reach a hashed container or the constant pool. */
    @Override
    public int hashCode() {
      Verify.verify(Double.isFinite(value), "cannot hash non-finite float %s", value);
      // 0.0 == -0.0, so they must hash alike.
      return value == 0.0 ? 0 : Double.hashCode(value);
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  public static final class Str extends Value {
    private final String value;

    private Str(String value) {
      super(Kind.STRING);
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return value.equals(other.<Str>cast().value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String display() {
      return value;
    }

    @Override
    public String toString() {
      return '"' + value + '"';
    }
  }

  public static final class Tuple extends Value {
    private final ImmutableList<Value> elements;

    private Tuple(ImmutableList<Value> elements) {
      super(Kind.TUPLE);
      this.elements = elements;
    }

    public ImmutableList<Value> elements() {
      return elements;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return elements.equals(other.<Tuple>cast().elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public String toString() {
      return elements.size() == 1 ? "(" + elements.get(0) + ",)" : join(elements, "(", ")");
    }
  }

  public static final class List extends Value {
    private final ArrayList<Value> elements;

    private List(ArrayList<Value> elements) {
      super(Kind.LIST);
      this.elements = elements;
    }

    /** The shared, mutable storage. */
    public ArrayList<Value> elements() {
      return elements;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return elements.equals(other.<List>cast().elements);
    }

    @Override
    public String toString() {
      return join(elements, "[", "]");
    }
  }

  public static final class Set extends Value {
    private final LinkedHashSet<Value> elements;

    private Set(LinkedHashSet<Value> elements) {
      super(Kind.SET);
      this.elements = elements;
    }

    /** The shared, mutable storage. */
    public LinkedHashSet<Value> elements() {
      return elements;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return elements.equals(other.<Set>cast().elements);
    }

    @Override
    public String toString() {
      return join(elements, "{", "}");
    }
  }

  public static final class Dict extends Value {
    private final LinkedHashMap<Value, Value> entries;

    private Dict(LinkedHashMap<Value, Value> entries) {
      super(Kind.DICT);
      this.entries = entries;
    }

    /** The shared, mutable storage. */
    public LinkedHashMap<Value, Value> entries() {
      return entries;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return entries.equals(other.<Dict>cast().entries);
    }

    @Override
    public String toString() {
      if (entries.isEmpty()) return "{:}";
      return entries.entrySet().stream()
          .map(e -> e.getKey() + ": " + e.getValue())
          .collect(Collectors.joining(", ", "{", "}"));
    }
  }

  public static final class Instance extends Value {
    private final int blobId;
    private final String blobName;
    private final LinkedHashMap<String, Value> fields;

    private Instance(int blobId, String blobName, LinkedHashMap<String, Value> fields) {
      super(Kind.INSTANCE);
      this.blobId = blobId;
      this.blobName = blobName;
      this.fields = fields;
    }

    public int blobId() {
      return blobId;
    }

    public String blobName() {
      return blobName;
    }

    /** The shared, mutable storage. */
    public LinkedHashMap<String, Value> fields() {
      return fields;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return false;
    }

    @Override
    public String toString() {
      return blobName
          + fields.entrySet().stream()
              .map(e -> e.getKey() + ": " + e.getValue())
              .collect(Collectors.joining(", ", " { ", " }"));
    }
  }

  public static final class Function extends Value {
    private final ImmutableList<Upvalue> upvalues;
    private final Type type;
    private final int block;

    private Function(ImmutableList<Upvalue> upvalues, Type type, int block) {
      super(Kind.FUNCTION);
      this.upvalues = upvalues;
      this.type = type;
      this.block = block;
    }

    public ImmutableList<Upvalue> upvalues() {
      return upvalues;
    }

    public Type signature() {
      return type;
    }

    public int block() {
      return block;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return false;
    }

    @Override
    public String toString() {
      return String.format("<fn #%d %s>", block, type);
    }
  }

  public static final class Extern extends Value {
    private final int index;

    private Extern(int index) {
      super(Kind.EXTERN_FUNCTION);
      this.index = index;
    }

    public int index() {
      return index;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return index == other.<Extern>cast().index;
    }

    @Override
    public String toString() {
      return "<extern #" + index + ">";
    }
  }

  /** A stateful generator. Advancing it is visible through every alias; it cannot restart. */
  public static final class Iter extends Value {
    private final Type elementType;
    private final Supplier<Optional<Value>> generator;

    private Iter(Type elementType, Supplier<Optional<Value>> generator) {
      super(Kind.ITER);
      this.elementType = elementType;
      this.generator = generator;
    }

    public Type elementType() {
      return elementType;
    }

    public Optional<Value> next() {
      return generator.get();
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return false;
    }

    @Override
    public String toString() {
      return "<iter " + elementType + ">";
    }
  }

  public static final class Union extends Value {
    private final ImmutableList<Value> members;

    private Union(ImmutableList<Value> members) {
      super(Kind.UNION);
      this.members = members;
    }

    public ImmutableList<Value> members() {
      return members;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      throw new AssertionError("unions are compared member-wise");
    }

    @Override
    public String toString() {
      return members.stream().map(Value::toString).collect(Collectors.joining(" | "));
    }
  }

  public static final class Unknown extends Value {
    private Unknown() {
      super(Kind.UNKNOWN);
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return true;
    }

    @Override
    public String toString() {
      return "?";
    }
  }

  public static final class Ty extends Value {
    private final Type type;

    private Ty(Type type) {
      super(Kind.TY);
      this.type = type;
    }

    public Type value() {
      return type;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return type.equals(other.<Ty>cast().type);
    }

    @Override
    public int hashCode() {
      return type.hashCode();
    }

    @Override
    public String toString() {
      return "<type " + type + ">";
    }
  }

  public static final class Field extends Value {
    private final String name;

    private Field(String name) {
      super(Kind.FIELD);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return name.equals(other.<Field>cast().name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return "." + name;
    }
  }

  public static final class Blob extends Value {
    private final int blobId;
    private final String blobName;

    private Blob(int blobId, String blobName) {
      super(Kind.BLOB);
      this.blobId = blobId;
      this.blobName = blobName;
    }

    public int blobId() {
      return blobId;
    }

    public String blobName() {
      return blobName;
    }

    @Override
    protected boolean equalsSameKind(Value other) {
      return blobId == other.<Blob>cast().blobId;
    }

    @Override
    public int hashCode() {
      return blobId;
    }

    @Override
    public String toString() {
      return "<blob " + blobName + ">";
    }
  }

  private static String join(Iterable<Value> values, String prefix, String suffix) {
    StringBuilder sb = new StringBuilder(prefix);
    boolean first = true;
    for (Value value : values) {
      if (!first) sb.append(", ");
      sb.append(value);
      first = false;
    }
    return sb.append(suffix).toString();
  }
}
