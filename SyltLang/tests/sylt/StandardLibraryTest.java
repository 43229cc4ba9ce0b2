package sylt;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sylt.SyltTesting.printed;
import static sylt.SyltTesting.run;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class StandardLibraryTest {

  private static ExternFunction extern(String name) {
    return StandardLibrary.functions().stream()
        .filter(f -> f.name().equals(name))
        .findFirst()
        .orElseThrow();
  }

  private static Type resultType(String name, Type... argTypes) throws VmException {
    return extern(name).resultType(ImmutableList.copyOf(argTypes));
  }

  @Test
  public void conversions() throws Exception {
    assertThat(
            run(
                "print as_int(2.7)",
                "print as_float(3)",
                "print as_str(12) + \"!\"",
                "print abs(-3)",
                "print abs(-2.5)",
                "print sqrt(9.0)",
                "print dbg(5)"))
        .isEqualTo(printed("2", "3.0", "12!", "3", "2.5", "3.0", "5"));
  }

  @Test
  public void lengths() throws Exception {
    assertThat(
            run(
                "print len([1, 2, 3])",
                "print len((1,))",
                "print len({1, 2})",
                "print len({1: 2})",
                "print len(\"abcd\")"))
        .isEqualTo(printed("3", "1", "2", "1", "4"));
  }

  @Test
  public void pushAndPop() throws Exception {
    assertThat(run("l := [1]", "push(l, 2)", "print pop(l)", "print l"))
        .isEqualTo(printed("2", "[1]"));

    VmException ex = assertThrows(VmException.class, () -> run("pop([])"));
    assertThat(ex.kind()).isEqualTo(VmException.Kind.EXTERN_ERROR);
    assertThat(ex).hasMessageThat().isEqualTo("Extern function 'pop' failed: the list is empty");
  }

  @Test
  public void iterators() throws Exception {
    String[] program = {
      "it := range(0, 3)",
      "x := next(it)",
      "loop x != nil {",
      "  print x",
      "  x = next(it)",
      "}",
      "print next(iter({1: 2}))",
      "l := [5]",
      "snapshot := iter(l)",
      "push(l, 6)",
      "print next(snapshot)",
      "print next(snapshot)"
    };
    assertThat(run(program)).isEqualTo(printed("0", "1", "2", "(1, 2)", "5", "nil"));
  }

  @Test
  public void readLines(@TempDir Path dir) throws Exception {
    File file = dir.resolve("lines.txt").toFile();
    Files.asCharSink(file, StandardCharsets.UTF_8).write("a\nb\n");
    String path = file.getPath().replace("\\", "/");
    assertThat(run("print read_lines(\"" + path + "\")")).isEqualTo(printed("[\"a\", \"b\"]"));

    VmException ex =
        assertThrows(
            VmException.class, () -> run("read_lines(\"" + path + ".missing\")"));
    assertThat(ex.kind()).isEqualTo(VmException.Kind.EXTERN_ERROR);
  }

  @Test
  public void wrongArguments() {
    assertThat(assertThrows(VmException.class, () -> run("len(1)")).kind())
        .isEqualTo(VmException.Kind.EXTERN_TYPE_MISMATCH);
    VmException ex = assertThrows(VmException.class, () -> run("len([1], [2])"));
    assertThat(ex)
        .hasMessageThat()
        .isEqualTo("Extern function 'len' cannot be called with ([int], [int])");
  }

  @Test
  public void resultTypes() throws Exception {
    Type ints = Type.list(Type.intType());
    assertThat(resultType("len", ints)).isEqualTo(Type.intType());
    assertThat(resultType("pop", ints)).isEqualTo(Type.intType());
    assertThat(resultType("push", ints, Type.intType())).isEqualTo(Type.voidType());
    assertThat(resultType("range", Type.intType(), Type.intType()))
        .isEqualTo(Type.iter(Type.intType()));
    assertThat(resultType("iter", Type.dict(Type.stringType(), Type.intType())))
        .isEqualTo(
            Type.iter(Type.tuple(ImmutableList.of(Type.stringType(), Type.intType()))));
    assertThat(resultType("next", Type.unknown())).isEqualTo(Type.unknown());
    assertThat(resultType("abs", Type.floatType())).isEqualTo(Type.floatType());

    VmException ex = assertThrows(VmException.class, () -> resultType("sqrt", Type.intType()));
    assertThat(ex.kind()).isEqualTo(VmException.Kind.EXTERN_TYPE_MISMATCH);
  }

  @Test
  public void unionArguments() throws Exception {
    Type number = Type.union(ImmutableList.of(Type.intType(), Type.floatType()));
    assertThat(resultType("abs", number)).isEqualTo(number);
    Type sized = Type.union(ImmutableList.of(Type.stringType(), Type.list(number)));
    assertThat(resultType("len", sized)).isEqualTo(Type.intType());

    Type intOrStr = Type.union(ImmutableList.of(Type.intType(), Type.stringType()));
    assertThat(assertThrows(VmException.class, () -> resultType("abs", intOrStr)).kind())
        .isEqualTo(VmException.Kind.EXTERN_TYPE_MISMATCH);
    assertThat(assertThrows(VmException.class, () -> resultType("len", intOrStr)).kind())
        .isEqualTo(VmException.Kind.EXTERN_TYPE_MISMATCH);
  }
}
