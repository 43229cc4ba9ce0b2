package sylt;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/** The extern functions every program can call. */
public final class StandardLibrary {
  private static final Logger logger = LoggerFactory.getLogger(StandardLibrary.class);

  private StandardLibrary() {}

  public static ImmutableList<ExternFunction> functions() {
    return ImmutableList.of(
        new Dbg(),
        new Len(),
        new Push(),
        new Pop(),
        new Sqrt(),
        new Abs(),
        new AsInt(),
        new AsFloat(),
        new AsStr(),
        new Range(),
        new IterOf(),
        new Next(),
        new ReadLines());
  }

  private abstract static class Builtin implements ExternFunction {
    private final String name;
    private final int arity;

    Builtin(String name, int arity) {
      this.name = name;
      this.arity = arity;
    }

    @Override
    public final String name() {
      return name;
    }

    @Override
    public final Value invoke(ImmutableList<Value> args) throws VmException {
      if (args.size() != arity) throw mismatch(types(args));
      return apply(args);
    }

    @Override
    public final Type resultType(ImmutableList<Type> argTypes) throws VmException {
      if (argTypes.size() != arity) throw mismatch(argTypes);
      return result(argTypes);
    }

    abstract Value apply(ImmutableList<Value> args) throws VmException;

    abstract Type result(ImmutableList<Type> argTypes) throws VmException;

    VmException mismatch(ImmutableList<Type> argTypes) {
      return VmException.externTypeMismatch(name, argTypes);
    }

    VmException mismatchValues(ImmutableList<Value> args) {
      return mismatch(types(args));
    }

    /** Fails unless {@code argType} can be used as {@code expected}. */
    void expect(ImmutableList<Type> argTypes, Type argType, Type expected) throws VmException {
      if (!argType.fits(expected)) throw mismatch(argTypes);
    }

    /** The members of a union, or just {@code type}. */
    static ImmutableList<Type> members(Type type) {
      return type.is(Type.Kind.UNION) ? type.args() : ImmutableList.of(type);
    }

    private static ImmutableList<Type> types(ImmutableList<Value> args) {
      return args.stream().map(Value::type).collect(ImmutableList.toImmutableList());
    }
  }

  private static final class Dbg extends Builtin {
    Dbg() {
      super("dbg", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) {
      logger.info("dbg: {}", args.get(0));
      return args.get(0);
    }

    @Override
    Type result(ImmutableList<Type> argTypes) {
      return argTypes.get(0);
    }
  }

  private static final class Len extends Builtin {
    Len() {
      super("len", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      Value value = args.get(0);
      switch (value.kind()) {
        case LIST:
          return Value.of((long) value.<Value.List>cast().elements().size());
        case SET:
          return Value.of((long) value.<Value.Set>cast().elements().size());
        case DICT:
          return Value.of((long) value.<Value.Dict>cast().entries().size());
        case TUPLE:
          return Value.of((long) value.<Value.Tuple>cast().elements().size());
        case STRING:
          return Value.of((long) value.<Value.Str>cast().value().length());
        default:
          throw mismatchValues(args);
      }
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      for (Type member : members(argTypes.get(0))) {
        switch (member.kind()) {
          case UNKNOWN:
          case LIST:
          case SET:
          case DICT:
          case TUPLE:
          case STRING:
            break;
          default:
            throw mismatch(argTypes);
        }
      }
      return Type.intType();
    }
  }

  private static final class Push extends Builtin {
    Push() {
      super("push", 2);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      if (!args.get(0).is(Value.Kind.LIST)) throw mismatchValues(args);
      args.get(0).<Value.List>cast().elements().add(args.get(1));
      return Value.nil();
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      Type list = argTypes.get(0);
      if (list.is(Type.Kind.LIST)) {
        expect(argTypes, argTypes.get(1), list.elementType());
      } else if (!list.isUnknown()) {
        throw mismatch(argTypes);
      }
      return Type.voidType();
    }
  }

  private static final class Pop extends Builtin {
    Pop() {
      super("pop", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      if (!args.get(0).is(Value.Kind.LIST)) throw mismatchValues(args);
      List<Value> elements = args.get(0).<Value.List>cast().elements();
      if (elements.isEmpty()) throw VmException.externError(name(), "the list is empty");
      return elements.remove(elements.size() - 1);
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      Type list = argTypes.get(0);
      if (list.isUnknown()) return Type.unknown();
      if (!list.is(Type.Kind.LIST)) throw mismatch(argTypes);
      return list.elementType();
    }
  }

  private static final class Sqrt extends Builtin {
    Sqrt() {
      super("sqrt", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      if (!args.get(0).is(Value.Kind.FLOAT)) throw mismatchValues(args);
      return Value.of(Math.sqrt(args.get(0).<Value.Float>cast().value()));
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      expect(argTypes, argTypes.get(0), Type.floatType());
      return Type.floatType();
    }
  }

  private static final class Abs extends Builtin {
    Abs() {
      super("abs", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      Value value = args.get(0);
      switch (value.kind()) {
        case INT:
          return Value.of(Math.abs(value.<Value.Int>cast().value()));
        case FLOAT:
          return Value.of(Math.abs(value.<Value.Float>cast().value()));
        default:
          throw mismatchValues(args);
      }
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      Type arg = argTypes.get(0);
      for (Type member : members(arg)) {
        if (!member.isUnknown() && !member.is(Type.Kind.INT) && !member.is(Type.Kind.FLOAT)) {
          throw mismatch(argTypes);
        }
      }
      return arg;
    }
  }

  private static final class AsInt extends Builtin {
    AsInt() {
      super("as_int", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      if (!args.get(0).is(Value.Kind.FLOAT)) throw mismatchValues(args);
      return Value.of((long) args.get(0).<Value.Float>cast().value());
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      expect(argTypes, argTypes.get(0), Type.floatType());
      return Type.intType();
    }
  }

  private static final class AsFloat extends Builtin {
    AsFloat() {
      super("as_float", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      if (!args.get(0).is(Value.Kind.INT)) throw mismatchValues(args);
      return Value.of((double) args.get(0).<Value.Int>cast().value());
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      expect(argTypes, argTypes.get(0), Type.intType());
      return Type.floatType();
    }
  }

  private static final class AsStr extends Builtin {
    AsStr() {
      super("as_str", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) {
      return Value.of(args.get(0).display());
    }

    @Override
    Type result(ImmutableList<Type> argTypes) {
      return Type.stringType();
    }
  }

  private static final class Range extends Builtin {
    Range() {
      super("range", 2);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      if (!args.get(0).is(Value.Kind.INT) || !args.get(1).is(Value.Kind.INT)) {
        throw mismatchValues(args);
      }
      long hi = args.get(1).<Value.Int>cast().value();
      long[] next = {args.get(0).<Value.Int>cast().value()};
      return Value.iter(
          Type.intType(),
          () -> next[0] < hi ? Optional.of(Value.of(next[0]++)) : Optional.empty());
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      expect(argTypes, argTypes.get(0), Type.intType());
      expect(argTypes, argTypes.get(1), Type.intType());
      return Type.iter(Type.intType());
    }
  }

  /** Iterates over a snapshot of a container. Dicts yield (key, value) tuples. */
  private static final class IterOf extends Builtin {
    IterOf() {
      super("iter", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      Value value = args.get(0);
      List<Value> elements = new ArrayList<>();
      switch (value.kind()) {
        case LIST:
          elements.addAll(value.<Value.List>cast().elements());
          break;
        case SET:
          elements.addAll(value.<Value.Set>cast().elements());
          break;
        case TUPLE:
          elements.addAll(value.<Value.Tuple>cast().elements());
          break;
        case DICT:
          for (Map.Entry<Value, Value> e : value.<Value.Dict>cast().entries().entrySet()) {
            elements.add(Value.tuple(ImmutableList.of(e.getKey(), e.getValue())));
          }
          break;
        default:
          throw mismatchValues(args);
      }
      Type elementType = result(ImmutableList.of(value.type())).elementType();
      Iterator<Value> it = elements.iterator();
      return Value.iter(
          elementType, () -> it.hasNext() ? Optional.of(it.next()) : Optional.empty());
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      Type arg = argTypes.get(0);
      switch (arg.kind()) {
        case UNKNOWN:
          return Type.iter(Type.unknown());
        case LIST:
        case SET:
          return Type.iter(arg.elementType());
        case TUPLE:
          return Type.iter(Type.union(arg.args()));
        case DICT:
          return Type.iter(Type.tuple(ImmutableList.of(arg.keyType(), arg.valueType())));
        default:
          throw mismatch(argTypes);
      }
    }
  }

  private static final class Next extends Builtin {
    Next() {
      super("next", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      if (!args.get(0).is(Value.Kind.ITER)) throw mismatchValues(args);
      return args.get(0).<Value.Iter>cast().next().orElse(Value.nil());
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      Type iter = argTypes.get(0);
      if (iter.isUnknown()) return Type.unknown();
      if (!iter.is(Type.Kind.ITER)) throw mismatch(argTypes);
      return iter.elementType();
    }
  }

  private static final class ReadLines extends Builtin {
    ReadLines() {
      super("read_lines", 1);
    }

    @Override
    Value apply(ImmutableList<Value> args) throws VmException {
      if (!args.get(0).is(Value.Kind.STRING)) throw mismatchValues(args);
      File file = new File(args.get(0).<Value.Str>cast().value());
      try {
        return Value.list(
            Files.asCharSource(file, StandardCharsets.UTF_8).readLines().stream()
                .map(Value::of)
                .collect(ImmutableList.toImmutableList()));
      } catch (IOException e) {
        throw VmException.externError(name(), e.getMessage());
      }
    }

    @Override
    Type result(ImmutableList<Type> argTypes) throws VmException {
      expect(argTypes, argTypes.get(0), Type.stringType());
      return Type.list(Type.stringType());
    }
  }
}
