package sylt;

import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A variable captured by a closure. While open it aliases a slot of the VM stack; once the slot
 * goes out of scope it is closed and holds the value itself. Every closure that captured the
 * variable shares the same cell.
 */
public final class Upvalue {
  private List<Value> stack;
  private final int slot;
  private Value closed;

  private Upvalue(List<Value> stack, int slot, Value closed) {
    this.stack = stack;
    this.slot = slot;
    this.closed = closed;
  }

  static Upvalue open(List<Value> stack, int slot) {
    return new Upvalue(stack, slot, null);
  }

  static Upvalue closed(Value value) {
    return new Upvalue(null, -1, value);
  }

  public boolean isOpen() {
    return stack != null;
  }

  /** The stack slot this cell aliases; only meaningful while open. */
  public int slot() {
    Preconditions.checkState(isOpen(), "upvalue is closed");
    return slot;
  }

  public Value get() {
    return isOpen() ? stack.get(slot) : closed;
  }

  public void set(Value value) {
    if (isOpen()) {
      stack.set(slot, value);
    } else {
      closed = value;
    }
  }

  /** Moves the value off the stack; the cell owns it from now on. */
  public void close() {
    if (!isOpen()) return;
    closed = stack.get(slot);
    stack = null;
  }
}
