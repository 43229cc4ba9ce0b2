package sylt;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** One bytecode instruction: an opcode and, for opcodes that take one, an integer operand. */
@AutoValue
public abstract class Op {

  public enum Code {
    POP(false),
    // Duplicates the top n values.
    COPY(true),
    CONSTANT(true),

    TUPLE(true),
    LIST(true),
    SET(true),
    // Operand counts keys and values.
    DICT(true),
    // Stack: blob, then (field, value) pairs. Operand counts pairs.
    INSTANCE(true),

    GET_INDEX(false),
    ASSIGN_INDEX(false),
    CONTAINS(false),
    // Operand indexes the string table.
    GET_FIELD(true),
    ASSIGN_FIELD(true),

    ADD(false),
    SUB(false),
    MUL(false),
    DIV(false),
    NEG(false),
    NOT(false),
    AND(false),
    OR(false),
    EQUAL(false),
    LESS(false),
    GREATER(false),
    // Fails unless the top value is true; leaves it on the stack.
    ASSERT(false),

    // Absolute op index.
    JMP(true),
    JMP_FALSE(true),

    READ_LOCAL(true),
    ASSIGN_LOCAL(true),
    READ_UPVALUE(true),
    ASSIGN_UPVALUE(true),
    READ_GLOBAL(true),
    ASSIGN_GLOBAL(true),
    // Operand is the constant holding the declared type.
    DEFINE(true),

    CALL(true),
    // Operand is the constant holding the function template.
    CLOSURE(true),
    CLOSE_UPVALUE(false),

    PRINT(false),
    RETURN(false),
    UNREACHABLE(false);

    private final boolean hasArg;

    Code(boolean hasArg) {
      this.hasArg = hasArg;
    }

    public boolean hasArg() {
      return hasArg;
    }
  }

  public abstract Code code();

  public abstract int arg();

  public static Op of(Code code) {
    Preconditions.checkArgument(!code.hasArg(), "%s needs an operand", code);
    return new AutoValue_Op(code, 0);
  }

  public static Op of(Code code, int arg) {
    Preconditions.checkArgument(code.hasArg(), "%s takes no operand", code);
    Preconditions.checkArgument(arg >= 0, "negative operand %s", arg);
    return new AutoValue_Op(code, arg);
  }

  @Override
  public final String toString() {
    return code().hasArg() ? code() + " " + arg() : code().toString();
  }
}
