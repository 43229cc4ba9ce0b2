package sylt;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Executes a {@link Program} on one operand stack.
 *
 * <p>The VM runs in one of two modes. A real run executes the entry block to completion. The
 * typecheck mode, driven by {@link Typechecker}, executes one block at a time straight through:
 * jumps are not taken, calls are not entered, and values stand in for their types.
 *
 * <p>Not thread-safe; see {@link SyltRunner}.
 */
public class Vm {
  private static final Logger logger = LoggerFactory.getLogger(Vm.class);

  private static final class Frame {
    final Block code;
    final int base;
    final ImmutableList<Upvalue> upvalues;
    int ip = 0;

    Frame(Block code, int base, ImmutableList<Upvalue> upvalues) {
      this.code = code;
      this.base = base;
      this.upvalues = upvalues;
    }
  }

  private final Program program;
  private final PrintStream out;
  private final boolean trace;

  private final List<Value> stack = new ArrayList<>();
  private final List<Frame> frames = new ArrayList<>();
  // Sorted by slot.
  private final List<Upvalue> openUpvalues = new ArrayList<>();

  private boolean typecheck = false;
  private ImmutableList<Value> checkedGlobals = ImmutableList.of();

  public Vm(Program program, PrintStream out, boolean trace) {
    this.program = program;
    this.out = out;
    this.trace = trace;
  }

  public Vm(Program program) {
    this(program, System.out, false);
  }

  public Program program() {
    return program;
  }

  /** Runs the entry block to completion. */
  public void run() throws VmException {
    typecheck = false;
    reset();
    push(Value.function(ImmutableList.of(), program.entry().type(), 0));
    frames.add(new Frame(program.entry(), 0, ImmutableList.of()));
    execute();
  }

  // ---------------------------------------------------------------------------
  // Typecheck mode

  /**
   * Typechecks the entry block. The globals it leaves behind are the environment of every later
   * {@link #checkBlock}; globals it never defined are unknown.
   */
  void checkEntry() throws VmException {
    typecheck = true;
    reset();
    push(Value.function(ImmutableList.of(), program.entry().type(), 0));
    frames.add(new Frame(program.entry(), 0, ImmutableList.of()));
    try {
      execute();
    } finally {
      ImmutableList.Builder<Value> globals = ImmutableList.builder();
      for (int slot = 0; slot <= program.globals() && slot < stack.size(); slot++) {
        Value global = stack.get(slot);
        globals.add(global.is(Value.Kind.NIL) ? Value.unknown() : global);
      }
      checkedGlobals = globals.build();
    }
  }

  /** Typechecks one function block, with its parameters bound to values of their types. */
  void checkBlock(int index) throws VmException {
    typecheck = true;
    reset();
    stack.addAll(checkedGlobals);
    while (stack.size() <= program.globals()) {
      stack.add(Value.unknown());
    }

    Block block = program.blocks().get(index);
    int base = stack.size();
    push(Value.function(ImmutableList.of(), block.type(), index));
    for (Type param : block.type().params()) {
      push(Value.from(param));
    }
    ImmutableList.Builder<Upvalue> upvalues = ImmutableList.builder();
    for (int i = 0; i < block.captures().size(); i++) {
      upvalues.add(Upvalue.closed(Value.unknown()));
    }
    frames.add(new Frame(block, base, upvalues.build()));
    execute();
  }

  private void reset() {
    stack.clear();
    frames.clear();
    openUpvalues.clear();
  }

  // ---------------------------------------------------------------------------
  // Stack

  private void push(Value value) {
    stack.add(value);
  }

  private Value pop() throws VmException {
    if (stack.isEmpty()) throw VmException.invalidProgram("Pop from an empty stack");
    return stack.remove(stack.size() - 1);
  }

  private ImmutableList<Value> pop(int count) throws VmException {
    if (count > stack.size()) throw VmException.invalidProgram("Pop %d from %s", count, stack);
    List<Value> top = stack.subList(stack.size() - count, stack.size());
    ImmutableList<Value> values = ImmutableList.copyOf(top);
    top.clear();
    return values;
  }

  private Value peek(int depth) throws VmException {
    if (depth >= stack.size()) throw VmException.invalidProgram("Peek below the stack");
    return stack.get(stack.size() - 1 - depth);
  }

  private Frame frame() {
    return frames.get(frames.size() - 1);
  }

  // ---------------------------------------------------------------------------
  // Execution

  private void execute() throws VmException {
    while (!frames.isEmpty()) {
      Frame frame = frame();
      if (frame.ip >= frame.code.size()) {
        // Typechecking walks straight through a block and stops at its end.
        if (typecheck) return;
        throw VmException.invalidProgram("Ran past the end of block '%s'", frame.code.name())
            .at(frame.code.span(frame.ip - 1));
      }

      int ip = frame.ip++;
      Op op = frame.code.op(ip);
      if (trace && logger.isTraceEnabled()) {
        logger.trace(
            String.format("%-12s %04d %-18s %s", frame.code.name(), ip, op, stackString()));
      }

      try {
        if (!step(frame, op)) return;
      } catch (VmException e) {
        throw e.at(frame.code.span(ip));
      }
    }
  }

  private String stackString() {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < stack.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(stack.get(i));
    }
    return sb.append("]").toString();
  }

  /** Executes one op. Returns false when execution is over. */
  private boolean step(Frame frame, Op op) throws VmException {
    switch (op.code()) {
      case POP:
        pop();
        break;
      case COPY:
        {
          int count = op.arg();
          for (int i = 0; i < count; i++) {
            push(peek(count - 1));
          }
          break;
        }
      case CONSTANT:
        push(constant(op.arg()));
        break;

      case TUPLE:
        push(Value.tuple(pop(op.arg())));
        break;
      case LIST:
        push(Value.list(pop(op.arg())));
        break;
      case SET:
        {
          ImmutableList<Value> elements = pop(op.arg());
          for (Value element : elements) {
            Operators.checkHashable(element);
          }
          push(Value.set(elements));
          break;
        }
      case DICT:
        {
          ImmutableList<Value> elements = pop(op.arg());
          Map<Value, Value> entries = new LinkedHashMap<>();
          for (int i = 0; i + 1 < elements.size(); i += 2) {
            Operators.checkHashable(elements.get(i));
            entries.put(elements.get(i), elements.get(i + 1));
          }
          push(Value.dict(entries));
          break;
        }
      case INSTANCE:
        instance(op.arg());
        break;

      case GET_INDEX:
        {
          Value index = pop();
          Value target = pop();
          push(getIndex(target, index));
          break;
        }
      case ASSIGN_INDEX:
        {
          Value value = pop();
          Value index = pop();
          Value target = pop();
          assignIndex(target, index, value);
          break;
        }
      case CONTAINS:
        {
          Value container = pop();
          Value element = pop();
          Value result = Operators.contains(element, container);
          push(typecheck ? Value.of(true) : result);
          break;
        }
      case GET_FIELD:
        push(getField(pop(), string(op.arg())));
        break;
      case ASSIGN_FIELD:
        {
          Value value = pop();
          Value target = pop();
          assignField(target, string(op.arg()), value);
          break;
        }

      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case AND:
      case OR:
      case LESS:
      case GREATER:
        {
          Value b = pop();
          Value a = pop();
          push(binary(op.code(), a, b));
          break;
        }
      case NEG:
      case NOT:
        push(Operators.unary(op.code(), pop()));
        break;
      case EQUAL:
        {
          Value b = pop();
          Value a = pop();
          push(Value.of(typecheck || a.equals(b)));
          break;
        }
      case ASSERT:
        if (!typecheck && !peek(0).equals(Value.of(true))) {
          throw new VmException(VmException.Kind.ASSERT_FAILED, "Assertion failed");
        }
        break;

      case JMP:
        if (!typecheck) frame.ip = op.arg();
        break;
      case JMP_FALSE:
        {
          Value condition = pop();
          if (!condition.is(Value.Kind.BOOL) && !condition.is(Value.Kind.UNKNOWN)) {
            throw VmException.typeError(
                "Expected a condition of type bool, got %s", condition.type());
          }
          if (!typecheck && !condition.<Value.Bool>cast().value()) frame.ip = op.arg();
          break;
        }

      case READ_LOCAL:
        push(stack.get(slot(frame.base + op.arg())));
        break;
      case ASSIGN_LOCAL:
        {
          Value value = pop();
          int index = slot(frame.base + op.arg());
          checkAssignment(stack.get(index), value);
          stack.set(index, value);
          break;
        }
      case READ_UPVALUE:
        push(upvalue(frame, op.arg()).get());
        break;
      case ASSIGN_UPVALUE:
        {
          Value value = pop();
          Upvalue upvalue = upvalue(frame, op.arg());
          checkAssignment(upvalue.get(), value);
          upvalue.set(value);
          break;
        }
      case READ_GLOBAL:
        push(stack.get(slot(op.arg())));
        break;
      case ASSIGN_GLOBAL:
        {
          Value value = pop();
          int index = slot(op.arg());
          checkAssignment(stack.get(index), value);
          stack.set(index, value);
          break;
        }
      case DEFINE:
        if (typecheck) define(constant(op.arg()).<Value.Ty>cast().value());
        break;

      case CALL:
        call(op.arg());
        break;
      case CLOSURE:
        push(closure(frame, constant(op.arg()).cast()));
        break;
      case CLOSE_UPVALUE:
        closeUpvalues(stack.size() - 1);
        pop();
        break;

      case PRINT:
        {
          Value value = pop();
          if (!typecheck) out.println(value.display());
          break;
        }
      case RETURN:
        return ret(frame);
      case UNREACHABLE:
        if (typecheck) return false;
        throw new VmException(
            VmException.Kind.UNREACHABLE,
            String.format("Reached the end of '%s' without returning a value", frame.code.name()));
    }
    return true;
  }

  private Value constant(int index) throws VmException {
    if (index >= program.constants().size()) {
      throw VmException.invalidProgram("No constant %d", index);
    }
    return program.constants().get(index);
  }

  private String string(int index) throws VmException {
    if (index >= program.strings().size()) throw VmException.invalidProgram("No string %d", index);
    return program.strings().get(index);
  }

  private Value binary(Op.Code code, Value a, Value b) throws VmException {
    // A zero divisor may be a placeholder.
    if (typecheck
        && code == Op.Code.DIV
        && a.is(Value.Kind.INT)
        && b.equals(Value.of(0L))) {
      return Value.from(Type.intType());
    }
    return Operators.binary(code, a, b);
  }

  private void checkAssignment(Value current, Value value) throws VmException {
    if (!typecheck) return;
    if (current.is(Value.Kind.NIL) || current.is(Value.Kind.UNKNOWN)) return;
    if (!value.type().fits(current.type())) {
      throw VmException.typeError(
          "Cannot assign %s to a variable of type %s", value.type(), current.type());
    }
  }

  private void define(Type declared) throws VmException {
    Value value = pop();
    if (!value.type().fits(declared)) {
      throw VmException.typeError(
          "Cannot assign %s to a variable declared %s", value.type(), declared);
    }
    // Functions keep their real block, so that their captures stay intact.
    push(declared.is(Type.Kind.FUNCTION) ? value : Value.from(declared));
  }

  // ---------------------------------------------------------------------------
  // Containers and blobs

  private BlobDefinition blob(int id) throws VmException {
    if (id >= program.blobs().size()) throw VmException.invalidProgram("No blob %d", id);
    return program.blobs().get(id);
  }

  private void instance(int count) throws VmException {
    ImmutableList<Value> pairs = pop(2 * count);
    Value blobValue = pop();
    if (!blobValue.is(Value.Kind.BLOB)) {
      throw VmException.typeError("Cannot create an instance of %s", blobValue.type());
    }
    Value.Blob blobRef = blobValue.cast();
    BlobDefinition blob = blob(blobRef.blobId());

    Map<String, Value> fields = new LinkedHashMap<>();
    for (Map.Entry<String, Type> field : blob.fields().entrySet()) {
      fields.put(field.getKey(), typecheck ? Value.from(field.getValue()) : Value.nil());
    }
    for (int i = 0; i < pairs.size(); i += 2) {
      String name = pairs.get(i).<Value.Field>cast().name();
      Value value = pairs.get(i + 1);
      Type declared = blob.fields().get(name);
      if (declared == null) {
        throw new VmException(
            VmException.Kind.UNKNOWN_FIELD,
            String.format("Blob '%s' has no field '%s'", blob.name(), name));
      }
      if (typecheck && !value.type().fits(declared)) {
        throw VmException.typeError(
            "Field '%s.%s' is declared %s, got %s", blob.name(), name, declared, value.type());
      }
      fields.put(name, value);
    }
    push(Value.instance(blob.id(), blob.name(), fields));
  }

  private Value getField(Value target, String name) throws VmException {
    switch (target.kind()) {
      case UNKNOWN:
        return Value.unknown();
      case INSTANCE:
        {
          Value.Instance instance = target.cast();
          Value value = instance.fields().get(name);
          if (value != null) return value;
          Type declared = blob(instance.blobId()).fields().get(name);
          if (declared == null) {
            throw new VmException(
                VmException.Kind.UNKNOWN_FIELD,
                String.format("Blob '%s' has no field '%s'", instance.blobName(), name));
          }
          return typecheck ? Value.from(declared) : Value.nil();
        }
      default:
        throw VmException.typeError("Cannot access field '%s' on %s", name, target.type());
    }
  }

  private void assignField(Value target, String name, Value value) throws VmException {
    switch (target.kind()) {
      case UNKNOWN:
        return;
      case INSTANCE:
        {
          Value.Instance instance = target.cast();
          Type declared = blob(instance.blobId()).fields().get(name);
          if (declared == null) {
            throw new VmException(
                VmException.Kind.UNKNOWN_FIELD,
                String.format("Blob '%s' has no field '%s'", instance.blobName(), name));
          }
          if (typecheck) {
            if (!value.type().fits(declared)) {
              throw VmException.typeError(
                  "Field '%s.%s' is declared %s, got %s",
                  instance.blobName(), name, declared, value.type());
            }
            return;
          }
          instance.fields().put(name, value);
          return;
        }
      default:
        throw VmException.typeError("Cannot assign field '%s' on %s", name, target.type());
    }
  }

  private Value getIndex(Value target, Value index) throws VmException {
    if (target.is(Value.Kind.UNKNOWN)) return Value.unknown();
    switch (target.kind()) {
      case LIST:
        {
          List<Value> elements = target.<Value.List>cast().elements();
          int i = intIndex(index, elements.size());
          if (i < 0) return Value.from(target.type().elementType());
          return elements.get(i);
        }
      case TUPLE:
        {
          List<Value> elements = target.<Value.Tuple>cast().elements();
          int i = intIndex(index, elements.size());
          return i < 0 ? Value.unknown() : elements.get(i);
        }
      case DICT:
        {
          Operators.checkHashable(index);
          Value value = target.<Value.Dict>cast().entries().get(index);
          if (value != null) return value;
          if (typecheck) return Value.from(target.type().valueType());
          throw new VmException(
              VmException.Kind.INDEX_OUT_OF_BOUNDS,
              String.format("No key %s in %s", index, target));
        }
      default:
        throw VmException.typeError("Cannot index %s", target.type());
    }
  }

  private void assignIndex(Value target, Value index, Value value) throws VmException {
    switch (target.kind()) {
      case UNKNOWN:
        return;
      case LIST:
        {
          List<Value> elements = target.<Value.List>cast().elements();
          if (typecheck) {
            checkElement(target.type().elementType(), value);
            intIndex(index, elements.size());
            return;
          }
          elements.set(intIndex(index, elements.size()), value);
          return;
        }
      case DICT:
        {
          Operators.checkHashable(index);
          if (typecheck) {
            checkElement(target.type().keyType(), index);
            checkElement(target.type().valueType(), value);
            return;
          }
          target.<Value.Dict>cast().entries().put(index, value);
          return;
        }
      case TUPLE:
        throw VmException.typeError("Tuples are immutable");
      default:
        throw VmException.typeError("Cannot index %s", target.type());
    }
  }

  private static void checkElement(Type expected, Value value) throws VmException {
    if (!value.type().fits(expected)) {
      throw VmException.typeError("Expected an element of type %s, got %s", expected, value.type());
    }
  }

  /**
   * The list position {@code index} refers to. Out of range is an error in a real run; while
   * typechecking it returns -1 instead.
   */
  private int intIndex(Value index, int size) throws VmException {
    if (index.is(Value.Kind.UNKNOWN)) return -1;
    if (!index.is(Value.Kind.INT)) {
      throw VmException.typeError("Cannot index with %s", index.type());
    }

    long i = index.<Value.Int>cast().value();
    if (i >= 0 && i < size) return (int) i;
    if (typecheck) return -1;
    throw new VmException(
        VmException.Kind.INDEX_OUT_OF_BOUNDS,
        String.format("Index %d out of bounds for length %d", i, size));
  }

  // ---------------------------------------------------------------------------
  // Calls and closures

  private void call(int argc) throws VmException {
    int calleeSlot = stack.size() - argc - 1;
    if (calleeSlot < 0) throw VmException.invalidProgram("Call below the stack");
    Value callee = stack.get(calleeSlot);

    switch (callee.kind()) {
      case FUNCTION:
        {
          Value.Function function = callee.cast();
          Type type = function.signature();
          if (type.params().size() != argc) {
            throw new VmException(
                VmException.Kind.ARGUMENT_COUNT,
                String.format("Expected %d arguments, got %d", type.params().size(), argc));
          }
          if (typecheck) {
            ImmutableList<Value> args = pop(argc);
            for (int i = 0; i < argc; i++) {
              if (!args.get(i).type().fits(type.params().get(i))) {
                throw VmException.typeError(
                    "Argument %d should be %s, got %s",
                    i + 1, type.params().get(i), args.get(i).type());
              }
            }
            pop();
            push(Value.from(type.returnType()));
            return;
          }
          int block = function.block();
          if (block >= program.blocks().size()) {
            throw VmException.invalidProgram("No block %d", block);
          }
          frames.add(
              new Frame(program.blocks().get(block), calleeSlot, function.upvalues()));
          return;
        }
      case EXTERN_FUNCTION:
        {
          int index = callee.<Value.Extern>cast().index();
          if (index >= program.externs().size()) {
            throw VmException.invalidProgram("No extern function %d", index);
          }
          ImmutableList<Value> args = pop(argc);
          pop();
          push(program.externs().get(index).call(args, typecheck));
          return;
        }
      case UNKNOWN:
        pop(argc + 1);
        push(Value.unknown());
        return;
      default:
        throw VmException.typeError("Cannot call %s", callee.type());
    }
  }

  private Value closure(Frame frame, Value.Function template) throws VmException {
    if (template.block() >= program.blocks().size()) {
      throw VmException.invalidProgram("No block %d", template.block());
    }
    ImmutableList.Builder<Upvalue> upvalues = ImmutableList.builder();
    for (Block.Capture capture : program.blocks().get(template.block()).captures()) {
      if (capture.fromLocal()) {
        upvalues.add(captureUpvalue(slot(frame.base + capture.index())));
      } else {
        upvalues.add(upvalue(frame, capture.index()));
      }
    }
    return Value.function(upvalues.build(), template.signature(), template.block());
  }

  private int slot(int slot) throws VmException {
    return checkIndex(slot, stack.size(), "stack slot");
  }

  private static Upvalue upvalue(Frame frame, int index) throws VmException {
    return frame.upvalues.get(checkIndex(index, frame.upvalues.size(), "upvalue"));
  }

  private static int checkIndex(int index, int size, String what) throws VmException {
    try {
      return Preconditions.checkElementIndex(index, size, what);
    } catch (IndexOutOfBoundsException e) {
      VmException ex = VmException.invalidProgram("%s", e.getMessage());
      ex.initCause(e);
      throw ex;
    }
  }

  private Upvalue captureUpvalue(int slot) {
    int i = 0;
    while (i < openUpvalues.size() && openUpvalues.get(i).slot() < slot) {
      i++;
    }
    if (i < openUpvalues.size() && openUpvalues.get(i).slot() == slot) {
      return openUpvalues.get(i);
    }
    Upvalue upvalue = Upvalue.open(stack, slot);
    openUpvalues.add(i, upvalue);
    return upvalue;
  }

  /** Closes every open upvalue at or above {@code slot}. */
  private void closeUpvalues(int slot) {
    Iterator<Upvalue> it = openUpvalues.iterator();
    while (it.hasNext()) {
      Upvalue upvalue = it.next();
      if (upvalue.slot() >= slot) {
        upvalue.close();
        it.remove();
      }
    }
  }

  private boolean ret(Frame frame) throws VmException {
    Value result = pop();
    if (typecheck) {
      Type expected = frame.code.type().returnType();
      if (!result.type().fits(expected)) {
        throw VmException.typeError(
            "'%s' should return %s, got %s", frame.code.name(), expected, result.type());
      }
      return true;
    }

    closeUpvalues(frame.base);
    pop(stack.size() - frame.base);
    frames.remove(frames.size() - 1);
    if (frames.isEmpty()) return false;
    push(result);
    return true;
  }
}
