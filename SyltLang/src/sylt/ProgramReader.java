package sylt;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteStreams;

/**
 * Reads a program written by {@link ProgramWriter}, linking its extern names against a host
 * table. The program's externs keep their serialized order, so the bytecode's indices stay valid.
 */
public final class ProgramReader {

  private final ByteArrayInputStream source;
  private final ByteArrayDataInput in;
  private final ImmutableMap<String, ExternFunction> host;

  private ProgramReader(byte[] bytes, ImmutableList<ExternFunction> host) {
    this.source = new ByteArrayInputStream(bytes);
    this.in = ByteStreams.newDataInput(source);
    this.host = host.stream().collect(ImmutableMap.toImmutableMap(ExternFunction::name, f -> f));
  }

  public static Program read(byte[] bytes, ImmutableList<ExternFunction> externs)
      throws VmException {
    try {
      return new ProgramReader(bytes, externs).program();
    } catch (IllegalStateException | IllegalArgumentException e) {
      // ByteArrayDataInput signals truncation with IllegalStateException.
      VmException ex = VmException.invalidProgram("Malformed program: %s", e.getMessage());
      ex.initCause(e);
      throw ex;
    }
  }

  private Program program() throws VmException {
    if (in.readInt() != ProgramWriter.MAGIC) throw VmException.invalidProgram("Not a program");
    int version = readVarint();
    if (version != ProgramWriter.VERSION) {
      throw VmException.invalidProgram("Unsupported program version %d", version);
    }

    ImmutableList.Builder<String> strings = ImmutableList.builder();
    for (int i = readVarint(); i > 0; i--) {
      strings.add(readUTF8());
    }

    ImmutableList.Builder<BlobDefinition> blobs = ImmutableList.builder();
    int blobCount = readVarint();
    for (int id = 0; id < blobCount; id++) {
      String name = readUTF8();
      Map<String, Type> fields = new LinkedHashMap<>();
      for (int i = readVarint(); i > 0; i--) {
        fields.put(readUTF8(), readType());
      }
      blobs.add(BlobDefinition.create(id, name, ImmutableMap.copyOf(fields)));
    }

    ImmutableList.Builder<Value> constants = ImmutableList.builder();
    for (int i = readVarint(); i > 0; i--) {
      constants.add(readConstant());
    }

    ImmutableList.Builder<Block> blocks = ImmutableList.builder();
    for (int i = readVarint(); i > 0; i--) {
      blocks.add(readBlock());
    }

    ImmutableList.Builder<ExternFunction> externs = ImmutableList.builder();
    for (int i = readVarint(); i > 0; i--) {
      String name = readUTF8();
      ExternFunction extern = host.get(name);
      if (extern == null) {
        throw VmException.invalidProgram("Unknown extern function '%s'", name);
      }
      externs.add(extern);
    }

    int globals = readVarint();
    return Program.create(
        blocks.build(),
        constants.build(),
        strings.build(),
        blobs.build(),
        externs.build(),
        globals);
  }

  private Block readBlock() throws VmException {
    Block block = new Block(readUTF8(), readUTF8(), readType());
    for (int i = readVarint(); i > 0; i--) {
      Op.Code code = readEnum(Op.Code.values(), "op");
      Op op = code.hasArg() ? Op.of(code, readVarint()) : Op.of(code);
      block.add(op, readVarint());
    }
    for (int i = readVarint(); i > 0; i--) {
      int index = readVarint();
      block.addCapture(Block.Capture.create(index, in.readBoolean()));
    }
    return block;
  }

  private Type readType() throws VmException {
    Type.Kind kind = readEnum(Type.Kind.values(), "type");
    ImmutableList.Builder<Type> args = ImmutableList.builder();
    for (int i = readVarint(); i > 0; i--) {
      args.add(readType());
    }
    int index = readVarint();
    return Type.restore(kind, args.build(), index, readUTF8());
  }

  private Value readConstant() throws VmException {
    Value.Kind kind = readEnum(Value.Kind.values(), "constant");
    switch (kind) {
      case NIL:
        return Value.nil();
      case BOOL:
        return Value.of(in.readBoolean());
      case INT:
        return Value.of(in.readLong());
      case FLOAT:
        return Value.of(in.readDouble());
      case STRING:
        return Value.of(readUTF8());
      case FUNCTION:
        {
          Type type = readType();
          return Value.function(ImmutableList.of(), type, readVarint());
        }
      case EXTERN_FUNCTION:
        return Value.extern(readVarint());
      case TY:
        return Value.ty(readType());
      case FIELD:
        return Value.field(readUTF8());
      case BLOB:
        {
          int id = readVarint();
          return Value.blob(id, readUTF8());
        }
      default:
        throw VmException.invalidProgram("Constant of kind %s", kind);
    }
  }

  private <E extends Enum<E>> E readEnum(E[] values, String what) throws VmException {
    int ordinal = readVarint();
    if (ordinal >= values.length) {
      throw VmException.invalidProgram("Bad %s tag %d", what, ordinal);
    }
    return values[ordinal];
  }

  private int readVarint() throws VmException {
    int value = 0;
    int shift = 0;
    while (true) {
      int b = in.readUnsignedByte();
      if (shift > 28) throw VmException.invalidProgram("Varint too long");
      value |= (b & 127) << shift;
      if (b < 128) {
        if (value < 0) throw VmException.invalidProgram("Negative varint");
        return value;
      }
      shift += 7;
    }
  }

  private String readUTF8() throws VmException {
    int length = readVarint();
    if (length > source.available()) {
      throw VmException.invalidProgram(
          "String of %d bytes, but only %d bytes are left", length, source.available());
    }
    byte[] bytes = new byte[length];
    in.readFully(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
