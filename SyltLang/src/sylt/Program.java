package sylt;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Output of the compiler and input of the VM. Block 0 is the entry point. */
@AutoValue
public abstract class Program {
  public abstract ImmutableList<Block> blocks();

  public abstract ImmutableList<Value> constants();

  public abstract ImmutableList<String> strings();

  public abstract ImmutableList<BlobDefinition> blobs();

  /** The host functions, in the order the bytecode refers to them. */
  public abstract ImmutableList<ExternFunction> externs();

  /** Number of global slots, not counting slot 0. */
  public abstract int globals();

  public static Program create(
      ImmutableList<Block> blocks,
      ImmutableList<Value> constants,
      ImmutableList<String> strings,
      ImmutableList<BlobDefinition> blobs,
      ImmutableList<ExternFunction> externs,
      int globals) {
    return new AutoValue_Program(blocks, constants, strings, blobs, externs, globals);
  }

  public final Block entry() {
    return blocks().get(0);
  }

  public final String disassemble() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < constants().size(); i++) {
      sb.append(String.format("const %4d: %s%n", i, constants().get(i)));
    }
    blocks().forEach(block -> sb.append(block.disassemble()));
    return sb.toString();
  }
}
