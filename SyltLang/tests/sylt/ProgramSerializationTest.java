package sylt;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sylt.SyltTesting.compile;
import static sylt.SyltTesting.output;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

public class ProgramSerializationTest {

  private static final String[] PROGRAM = {
    "Point :: blob { x: int, y: float | str }",
    "origin :: Point { x: 0, y: \"zero\" }",
    "make :: fn step: int -> fn -> int {",
    "  n := 0",
    "  ret fn -> int {",
    "    n += step",
    "    ret n",
    "  }",
    "}",
    "counter := make(5)",
    "counter()",
    "print counter()",
    "print origin",
    "print (1.5, {1: [true]}, {\"a\"})",
    "print len(\"four\")",
    "t: (int, str) = (1, \"a\")",
    "print t"
  };

  private static ImmutableList<String> names(ImmutableList<ExternFunction> externs) {
    return externs.stream().map(ExternFunction::name).collect(ImmutableList.toImmutableList());
  }

  private static Program entryOnly(ImmutableList<Value> constants, Op... ops) {
    Block entry = new Block("entry", "bad.sy", Type.function(ImmutableList.of(), Type.voidType()));
    for (Op op : ops) {
      entry.add(op, 1);
    }
    return Program.create(
        ImmutableList.of(entry),
        constants,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableList.of(),
        0);
  }

  private static VmException runError(Program program) throws VmException {
    Program read = ProgramReader.read(ProgramWriter.write(program), ImmutableList.of());
    return assertThrows(VmException.class, () -> new Vm(read).run());
  }

  private static VmException readError(byte[] bytes) {
    return assertThrows(
        VmException.class, () -> ProgramReader.read(bytes, StandardLibrary.functions()));
  }

  @Test
  public void readProgramRunsTheSame() throws Exception {
    Program program = compile(PROGRAM);
    byte[] bytes = ProgramWriter.write(program);
    Program read = ProgramReader.read(bytes, StandardLibrary.functions());

    assertThat(output(read)).isEqualTo(output(program));
    assertThat(read.globals()).isEqualTo(program.globals());
    assertThat(read.blobs()).isEqualTo(program.blobs());
    assertThat(read.strings()).isEqualTo(program.strings());
    assertThat(read.blocks()).hasSize(program.blocks().size());
    for (int i = 0; i < program.blocks().size(); i++) {
      assertThat(read.blocks().get(i).ops()).isEqualTo(program.blocks().get(i).ops());
      assertThat(read.blocks().get(i).captures()).isEqualTo(program.blocks().get(i).captures());
    }
    assertThat(ProgramWriter.write(read)).isEqualTo(bytes);
  }

  @Test
  public void readProgramTypechecks() throws Exception {
    Program read =
        ProgramReader.read(ProgramWriter.write(compile(PROGRAM)), StandardLibrary.functions());
    assertThat(Typechecker.check(read)).isEmpty();
  }

  @Test
  public void errorsKeepTheirLines() throws Exception {
    byte[] bytes = ProgramWriter.write(compile("print 1", "print 1 / 0"));
    Program read = ProgramReader.read(bytes, StandardLibrary.functions());
    VmException ex = assertThrows(VmException.class, () -> output(read));
    assertThat(ex.span().line()).isEqualTo(2);
    assertThat(ex.span().file()).isEqualTo("main.sy");
  }

  @Test
  public void externsAreLinkedByName() throws Exception {
    byte[] bytes = ProgramWriter.write(compile("print len([1, 2])"));

    ImmutableList<ExternFunction> reversed = StandardLibrary.functions().reverse();
    Program read = ProgramReader.read(bytes, reversed);
    assertThat(names(read.externs())).isEqualTo(names(StandardLibrary.functions()));
    assertThat(output(read)).isEqualTo(SyltTesting.printed("2"));

    VmException ex =
        assertThrows(VmException.class, () -> ProgramReader.read(bytes, ImmutableList.of()));
    assertThat(ex.kind()).isEqualTo(VmException.Kind.INVALID_PROGRAM);
    assertThat(ex).hasMessageThat().startsWith("Unknown extern function");
  }

  @Test
  public void rejectsForeignBytes() {
    assertThat(readError(new byte[] {1, 2, 3, 4})).hasMessageThat().isEqualTo("Not a program");
  }

  @Test
  public void rejectsOtherVersions() {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    out.writeInt(ProgramWriter.MAGIC);
    ProgramWriter.writeVarint(ProgramWriter.VERSION + 1, out);
    assertThat(readError(out.toByteArray()))
        .hasMessageThat()
        .isEqualTo("Unsupported program version " + (ProgramWriter.VERSION + 1));
  }

  @Test
  public void rejectsTruncatedPrograms() throws Exception {
    byte[] bytes = ProgramWriter.write(compile(PROGRAM));
    VmException ex = readError(Arrays.copyOf(bytes, bytes.length / 2));
    assertThat(ex.kind()).isEqualTo(VmException.Kind.INVALID_PROGRAM);
    assertThat(ex).hasMessageThat().startsWith("Malformed program");
    assertThat(readError(new byte[0]).kind()).isEqualTo(VmException.Kind.INVALID_PROGRAM);
  }

  @Test
  public void rejectsOversizedStrings() {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    out.writeInt(ProgramWriter.MAGIC);
    ProgramWriter.writeVarint(ProgramWriter.VERSION, out);
    ProgramWriter.writeVarint(1, out);
    ProgramWriter.writeVarint(0x7ffffff0, out);
    out.write(new byte[] {'a', 'b'});

    VmException ex = readError(out.toByteArray());
    assertThat(ex.kind()).isEqualTo(VmException.Kind.INVALID_PROGRAM);
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("String of 2147483632 bytes, but only 2 bytes are left");
  }

  @Test
  public void badSlotsAreInvalidPrograms() throws Exception {
    ImmutableList<Value> nil = ImmutableList.of(Value.nil());

    VmException local = runError(entryOnly(nil, Op.of(Op.Code.READ_LOCAL, 7)));
    assertThat(local.kind()).isEqualTo(VmException.Kind.INVALID_PROGRAM);
    assertThat(local).hasMessageThat().contains("stack slot (7)");

    VmException global = runError(entryOnly(nil, Op.of(Op.Code.ASSIGN_GLOBAL, 3)));
    assertThat(global.kind()).isEqualTo(VmException.Kind.INVALID_PROGRAM);

    VmException upvalue = runError(entryOnly(nil, Op.of(Op.Code.READ_UPVALUE, 0)));
    assertThat(upvalue.kind()).isEqualTo(VmException.Kind.INVALID_PROGRAM);
    assertThat(upvalue).hasMessageThat().contains("upvalue (0)");
  }

  @Test
  public void badCapturesAreInvalidPrograms() throws Exception {
    Type signature = Type.function(ImmutableList.of(), Type.voidType());
    Block inner = new Block("inner", "bad.sy", signature);
    inner.addCapture(Block.Capture.create(3, false));
    Program outer =
        entryOnly(
            ImmutableList.of(Value.function(ImmutableList.of(), signature, 1)),
            Op.of(Op.Code.CLOSURE, 0));
    Program program =
        Program.create(
            ImmutableList.of(outer.entry(), inner),
            outer.constants(),
            ImmutableList.of(),
            ImmutableList.of(),
            ImmutableList.of(),
            0);

    VmException ex = runError(program);
    assertThat(ex.kind()).isEqualTo(VmException.Kind.INVALID_PROGRAM);
    assertThat(ex).hasMessageThat().contains("upvalue (3)");
  }
}
