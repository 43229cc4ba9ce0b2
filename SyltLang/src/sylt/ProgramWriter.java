package sylt;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

/**
 * Serializes a {@link Program}. {@link ProgramReader} reads it back.
 *
 * <p>Layout, in order: magic, version, strings, blobs, constants, blocks, extern names, global
 * count. Counts and indices are varints; strings are varint-length-prefixed UTF-8. Extern
 * functions are stored by name only.
 */
public final class ProgramWriter {

  static final int MAGIC = 0x53594c54; // "SYLT"
  static final int VERSION = 1;

  private ProgramWriter() {}

  public static byte[] write(Program program) {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    out.writeInt(MAGIC);
    writeVarint(VERSION, out);

    writeVarint(program.strings().size(), out);
    program.strings().forEach(s -> writeUTF8(s, out));

    writeVarint(program.blobs().size(), out);
    for (BlobDefinition blob : program.blobs()) {
      writeUTF8(blob.name(), out);
      writeVarint(blob.fields().size(), out);
      for (Map.Entry<String, Type> field : blob.fields().entrySet()) {
        writeUTF8(field.getKey(), out);
        writeType(field.getValue(), out);
      }
    }

    writeVarint(program.constants().size(), out);
    program.constants().forEach(c -> writeConstant(c, out));

    writeVarint(program.blocks().size(), out);
    program.blocks().forEach(b -> writeBlock(b, out));

    writeVarint(program.externs().size(), out);
    program.externs().forEach(e -> writeUTF8(e.name(), out));

    writeVarint(program.globals(), out);
    return out.toByteArray();
  }

  private static void writeBlock(Block block, ByteArrayDataOutput out) {
    writeUTF8(block.name(), out);
    writeUTF8(block.file(), out);
    writeType(block.type(), out);

    writeVarint(block.size(), out);
    for (int ip = 0; ip < block.size(); ip++) {
      Op op = block.op(ip);
      writeVarint(op.code().ordinal(), out);
      if (op.code().hasArg()) writeVarint(op.arg(), out);
      writeVarint(block.line(ip), out);
    }

    writeVarint(block.captures().size(), out);
    for (Block.Capture capture : block.captures()) {
      writeVarint(capture.index(), out);
      out.writeBoolean(capture.fromLocal());
    }
  }

  static void writeType(Type type, ByteArrayDataOutput out) {
    writeVarint(type.kind().ordinal(), out);
    writeVarint(type.args().size(), out);
    type.args().forEach(arg -> writeType(arg, out));
    writeVarint(type.index(), out);
    writeUTF8(type.name(), out);
  }

  /** Only the kinds of values the compiler puts in the constant pool can be written. */
  static void writeConstant(Value value, ByteArrayDataOutput out) {
    writeVarint(value.kind().ordinal(), out);
    switch (value.kind()) {
      case NIL:
        return;
      case BOOL:
        out.writeBoolean(value.<Value.Bool>cast().value());
        return;
      case INT:
        out.writeLong(value.<Value.Int>cast().value());
        return;
      case FLOAT:
        out.writeDouble(value.<Value.Float>cast().value());
        return;
      case STRING:
        writeUTF8(value.<Value.Str>cast().value(), out);
        return;
      case FUNCTION:
        {
          Value.Function function = value.cast();
          writeType(function.signature(), out);
          writeVarint(function.block(), out);
          return;
        }
      case EXTERN_FUNCTION:
        writeVarint(value.<Value.Extern>cast().index(), out);
        return;
      case TY:
        writeType(value.<Value.Ty>cast().value(), out);
        return;
      case FIELD:
        writeUTF8(value.<Value.Field>cast().name(), out);
        return;
      case BLOB:
        writeVarint(value.<Value.Blob>cast().blobId(), out);
        writeUTF8(value.<Value.Blob>cast().blobName(), out);
        return;
      default:
        throw new IllegalArgumentException("Not a constant: " + value);
    }
  }

  public static void writeVarint(int value, ByteArrayDataOutput out) {
    while (value >= 128) {
      out.writeByte((value % 128) | 128);
      value /= 128;
    }
    out.writeByte(value);
  }

  public static void writeUTF8(String value, ByteArrayDataOutput out) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    writeVarint(bytes.length, out);
    out.write(bytes);
  }
}
