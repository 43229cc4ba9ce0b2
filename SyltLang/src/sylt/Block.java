package sylt;

import java.util.ArrayList;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** A compiled function: its ops, the source line of every op, and what it captures. */
public final class Block {

  /** Where a closure gets one of its upvalues: a local of the enclosing frame, or its upvalue. */
  @AutoValue
  public abstract static class Capture {
    public abstract int index();

    public abstract boolean fromLocal();

    public static Capture create(int index, boolean fromLocal) {
      return new AutoValue_Block_Capture(index, fromLocal);
    }
  }

  private final String name;
  private final String file;
  private Type type;
  private final List<Op> ops = new ArrayList<>();
  private final List<Integer> lines = new ArrayList<>();
  private final List<Capture> captures = new ArrayList<>();

  public Block(String name, String file, Type type) {
    this.name = name;
    this.file = file;
    this.type = type;
  }

  public String name() {
    return name;
  }

  public String file() {
    return file;
  }

  public Type type() {
    return type;
  }

  void setType(Type type) {
    this.type = type;
  }

  public int size() {
    return ops.size();
  }

  public Op op(int ip) {
    return ops.get(ip);
  }

  public ImmutableList<Op> ops() {
    return ImmutableList.copyOf(ops);
  }

  public int line(int ip) {
    return lines.get(ip);
  }

  public Span span(int ip) {
    return Span.create(file, ip < lines.size() ? lines.get(ip) : 0);
  }

  public ImmutableList<Capture> captures() {
    return ImmutableList.copyOf(captures);
  }

  /** Appends {@code op} and returns its index. */
  public int add(Op op, int line) {
    ops.add(op);
    lines.add(line);
    return ops.size() - 1;
  }

  public void patch(int ip, Op op) {
    Preconditions.checkElementIndex(ip, ops.size());
    ops.set(ip, op);
  }

  /** Returns the index of the capture, reusing an identical one. */
  int addCapture(Capture capture) {
    int existing = captures.indexOf(capture);
    if (existing >= 0) return existing;
    captures.add(capture);
    return captures.size() - 1;
  }

  public String disassemble() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("=== %s (%s) %s ===%n", name, file, type));
    for (int ip = 0; ip < ops.size(); ip++) {
      sb.append(String.format("%04d %5d  %s%n", ip, lines.get(ip), ops.get(ip)));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return name;
  }
}
