package sylt;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The value-level semantics of the arithmetic, logic and comparison ops.
 *
 * <p>Unknown operands, which only the typecheck pass produces, make the result unknown. A union
 * operand is expanded: the op must succeed for every member, and the result is the union of the
 * results.
 */
final class Operators {

  interface Binary {
    Value apply(Value a, Value b) throws VmException;
  }

  interface Unary {
    Value apply(Value a) throws VmException;
  }

  private Operators() {}

  static Value binary(Op.Code code, Value a, Value b) throws VmException {
    switch (code) {
      case ADD:
        return lift(a, b, Operators::add);
      case SUB:
        return lift(a, b, (x, y) -> arithmetic("-", x, y, (i, j) -> i - j, (f, g) -> f - g));
      case MUL:
        return lift(a, b, (x, y) -> arithmetic("*", x, y, (i, j) -> i * j, (f, g) -> f * g));
      case DIV:
        return lift(a, b, Operators::div);
      case AND:
        return lift(a, b, (x, y) -> logic("&&", x, y));
      case OR:
        return lift(a, b, (x, y) -> logic("||", x, y));
      case LESS:
        return lift(a, b, (x, y) -> Value.of(compare("<", x, y) < 0));
      case GREATER:
        return lift(a, b, (x, y) -> Value.of(compare(">", x, y) > 0));
      default:
        throw VmException.invalidProgram("%s is not a binary operator", code);
    }
  }

  static Value unary(Op.Code code, Value a) throws VmException {
    switch (code) {
      case NEG:
        return lift(a, Operators::neg);
      case NOT:
        return lift(a, Operators::not);
      default:
        throw VmException.invalidProgram("%s is not a unary operator", code);
    }
  }

  private static Value lift(Value a, Value b, Binary op) throws VmException {
    if (a.is(Value.Kind.UNKNOWN) || b.is(Value.Kind.UNKNOWN)) return Value.unknown();
    if (a.is(Value.Kind.UNION)) {
      List<Value> results = new ArrayList<>();
      for (Value member : a.<Value.Union>cast().members()) {
        results.add(lift(member, b, op));
      }
      return Value.union(results);
    }
    if (b.is(Value.Kind.UNION)) {
      List<Value> results = new ArrayList<>();
      for (Value member : b.<Value.Union>cast().members()) {
        results.add(lift(a, member, op));
      }
      return Value.union(results);
    }
    return op.apply(a, b);
  }

  private static Value lift(Value a, Unary op) throws VmException {
    if (a.is(Value.Kind.UNKNOWN)) return Value.unknown();
    if (a.is(Value.Kind.UNION)) {
      List<Value> results = new ArrayList<>();
      for (Value member : a.<Value.Union>cast().members()) {
        results.add(lift(member, op));
      }
      return Value.union(results);
    }
    return op.apply(a);
  }

  private interface LongOp {
    long apply(long a, long b);
  }

  private interface DoubleOp {
    double apply(double a, double b);
  }

  private static Value arithmetic(String symbol, Value a, Value b, LongOp ints, DoubleOp floats)
      throws VmException {
    if (a.is(Value.Kind.INT) && b.is(Value.Kind.INT)) {
      return Value.of(ints.apply(a.<Value.Int>cast().value(), b.<Value.Int>cast().value()));
    }
    if (a.is(Value.Kind.FLOAT) && b.is(Value.Kind.FLOAT)) {
      return Value.of(floats.apply(a.<Value.Float>cast().value(), b.<Value.Float>cast().value()));
    }
    if (a.is(Value.Kind.TUPLE) && b.is(Value.Kind.TUPLE)) {
      return elementwise(
          symbol, a, b, (x, y) -> lift(x, y, (p, q) -> arithmetic(symbol, p, q, ints, floats)));
    }
    throw mismatch(symbol, a, b);
  }

  private static Value add(Value a, Value b) throws VmException {
    if (a.is(Value.Kind.STRING) && b.is(Value.Kind.STRING)) {
      return Value.of(a.<Value.Str>cast().value() + b.<Value.Str>cast().value());
    }
    if (a.is(Value.Kind.TUPLE) && b.is(Value.Kind.TUPLE)) {
      return elementwise("+", a, b, (x, y) -> lift(x, y, Operators::add));
    }
    return arithmetic("+", a, b, (i, j) -> i + j, (f, g) -> f + g);
  }

  private static Value div(Value a, Value b) throws VmException {
    if (a.is(Value.Kind.INT) && b.is(Value.Kind.INT) && b.<Value.Int>cast().value() == 0) {
      throw new VmException(VmException.Kind.DIVISION_BY_ZERO, "Integer division by zero");
    }
    if (a.is(Value.Kind.TUPLE) && b.is(Value.Kind.TUPLE)) {
      return elementwise("/", a, b, (x, y) -> lift(x, y, Operators::div));
    }
    return arithmetic("/", a, b, (i, j) -> i / j, (f, g) -> f / g);
  }

  private static Value elementwise(String symbol, Value a, Value b, Binary op)
      throws VmException {
    ImmutableList<Value> lhs = a.<Value.Tuple>cast().elements();
    ImmutableList<Value> rhs = b.<Value.Tuple>cast().elements();
    if (lhs.size() != rhs.size()) {
      throw VmException.typeError(
          "Cannot apply '%s' to tuples of different lengths: %s and %s", symbol, a, b);
    }
    ImmutableList.Builder<Value> result = ImmutableList.builder();
    for (int i = 0; i < lhs.size(); i++) {
      result.add(op.apply(lhs.get(i), rhs.get(i)));
    }
    return Value.tuple(result.build());
  }

  private static Value logic(String symbol, Value a, Value b) throws VmException {
    if (!a.is(Value.Kind.BOOL) || !b.is(Value.Kind.BOOL)) throw mismatch(symbol, a, b);
    boolean x = a.<Value.Bool>cast().value();
    boolean y = b.<Value.Bool>cast().value();
    return Value.of(symbol.equals("&&") ? x && y : x || y);
  }

  private static int compare(String symbol, Value a, Value b) throws VmException {
    if (a.is(Value.Kind.INT) && b.is(Value.Kind.INT)) {
      return Long.compare(a.<Value.Int>cast().value(), b.<Value.Int>cast().value());
    }
    if (a.is(Value.Kind.FLOAT) && b.is(Value.Kind.FLOAT)) {
      double x = a.<Value.Float>cast().value();
      double y = b.<Value.Float>cast().value();
      // NaN is neither less nor greater than anything.
      return x < y ? -1 : x > y ? 1 : 0;
    }
    if (a.is(Value.Kind.STRING) && b.is(Value.Kind.STRING)) {
      return Integer.signum(a.<Value.Str>cast().value().compareTo(b.<Value.Str>cast().value()));
    }
    throw mismatch(symbol, a, b);
  }

  private static Value neg(Value a) throws VmException {
    switch (a.kind()) {
      case INT:
        return Value.of(-a.<Value.Int>cast().value());
      case FLOAT:
        return Value.of(-a.<Value.Float>cast().value());
      case TUPLE:
        {
          ImmutableList.Builder<Value> result = ImmutableList.builder();
          for (Value element : a.<Value.Tuple>cast().elements()) {
            result.add(lift(element, Operators::neg));
          }
          return Value.tuple(result.build());
        }
      default:
        throw VmException.typeError("Cannot negate %s", a.type());
    }
  }

  private static Value not(Value a) throws VmException {
    if (!a.is(Value.Kind.BOOL)) throw VmException.typeError("Cannot apply '!' to %s", a.type());
    return Value.of(!a.<Value.Bool>cast().value());
  }

  /** Whether {@code container} holds {@code element}; for strings, whether it is a substring. */
  static Value contains(Value element, Value container) throws VmException {
    if (element.is(Value.Kind.UNKNOWN) || container.is(Value.Kind.UNKNOWN)) {
      return Value.unknown();
    }
    switch (container.kind()) {
      case LIST:
        return Value.of(container.<Value.List>cast().elements().contains(element));
      case SET:
        checkHashable(element);
        return Value.of(container.<Value.Set>cast().elements().contains(element));
      case TUPLE:
        return Value.of(container.<Value.Tuple>cast().elements().contains(element));
      case DICT:
        checkHashable(element);
        return Value.of(container.<Value.Dict>cast().entries().containsKey(element));
      case STRING:
        if (!element.is(Value.Kind.STRING)) throw mismatch("in", element, container);
        return Value.of(
            container.<Value.Str>cast().value().contains(element.<Value.Str>cast().value()));
      case UNION:
        {
          List<Value> results = new ArrayList<>();
          for (Value member : container.<Value.Union>cast().members()) {
            results.add(contains(element, member));
          }
          return Value.union(results);
        }
      default:
        throw mismatch("in", element, container);
    }
  }

  /** Fails for values that cannot be stored in a set or used as a dict key. */
  static void checkHashable(Value value) throws VmException {
    if (value.is(Value.Kind.FLOAT) && !Double.isFinite(value.<Value.Float>cast().value())) {
      throw VmException.typeError("Cannot hash the non-finite float %s", value);
    }
    if (value.is(Value.Kind.TUPLE)) {
      for (Value element : value.<Value.Tuple>cast().elements()) {
        checkHashable(element);
      }
    }
  }

  private static VmException mismatch(String symbol, Value a, Value b) {
    return VmException.typeError("Cannot apply '%s' to %s and %s", symbol, a.type(), b.type());
  }
}
