package sylt;

import static com.google.common.truth.Truth.assertThat;
import static sylt.SyltTesting.compile;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TypecheckerTest {

  private static ImmutableList<VmException> check(String... lines) throws Exception {
    return Typechecker.check(compile(lines));
  }

  private static VmException onlyError(String... lines) throws Exception {
    ImmutableList<VmException> errors = check(lines);
    assertThat(errors).hasSize(1);
    return errors.get(0);
  }

  /** An extern that counts how often it really runs. */
  private static final class Counting implements ExternFunction {
    final AtomicInteger invocations = new AtomicInteger();

    @Override
    public String name() {
      return "make";
    }

    @Override
    public Value invoke(ImmutableList<Value> args) {
      invocations.incrementAndGet();
      return Value.list(ImmutableList.of(Value.of(7L)));
    }

    @Override
    public Type resultType(ImmutableList<Type> argTypes) {
      return Type.list(Type.intType());
    }
  }

  @Test
  public void cleanProgram() throws Exception {
    assertThat(
            check(
                "Point :: blob { x: int, y: int }",
                "fib :: fn n: int -> int {",
                "  if n < 2 {",
                "    ret n",
                "  }",
                "  ret fib(n - 1) + fib(n - 2)",
                "}",
                "p := Point { x: 1, y: fib(3) }",
                "p.x = 5",
                "l := [1, 2]",
                "push(l, 3)",
                "i := 0",
                "loop i < len(l) {",
                "  i += 1",
                "}",
                "print p.x + l[0]"))
        .isEmpty();
  }

  @Test
  public void closuresAndUnknownCaptures() throws Exception {
    assertThat(
            check(
                "make :: fn -> fn -> int {",
                "  n := 0",
                "  ret fn -> int {",
                "    n += 1",
                "    ret n",
                "  }",
                "}",
                "print make()()"))
        .isEmpty();
  }

  @Test
  public void externsAreNotInvoked() throws Exception {
    Counting make = new Counting();
    Program program =
        compile(
            ImmutableList.<ExternFunction>builder()
                .addAll(StandardLibrary.functions())
                .add(make)
                .build(),
            "xs := make()",
            "push(xs, 1)",
            "print xs[0] + 1");
    assertThat(Typechecker.check(program)).isEmpty();
    assertThat(make.invocations.get()).isEqualTo(0);

    assertThat(make.call(ImmutableList.of(), true))
        .isEqualTo(Value.list(ImmutableList.of(Value.of(1L))));
    assertThat(make.invocations.get()).isEqualTo(0);
    assertThat(make.call(ImmutableList.of(), false))
        .isEqualTo(Value.list(ImmutableList.of(Value.of(7L))));
    assertThat(make.invocations.get()).isEqualTo(1);
  }

  @Test
  public void wrongReturnType() throws Exception {
    VmException error = onlyError("f :: fn -> int {", "  ret \"s\"", "}");
    assertThat(error.kind()).isEqualTo(VmException.Kind.TYPE_ERROR);
    assertThat(error).hasMessageThat().isEqualTo("'f' should return int, got str");
    assertThat(error.span().line()).isEqualTo(2);
  }

  @Test
  public void wrongArgument() throws Exception {
    VmException error = onlyError("f :: fn a: int -> int {", "  ret a", "}", "f(\"x\")");
    assertThat(error).hasMessageThat().isEqualTo("Argument 1 should be int, got str");
    assertThat(error.span().line()).isEqualTo(4);
  }

  @Test
  public void declaredTypes() throws Exception {
    assertThat(onlyError("a: int = \"x\""))
        .hasMessageThat()
        .isEqualTo("Cannot assign str to a variable declared int");
    assertThat(check("a: int | str = \"x\"", "a = 1")).isEmpty();
  }

  @Test
  public void reassignmentKeepsTheType() throws Exception {
    assertThat(onlyError("a := 1", "a = \"s\""))
        .hasMessageThat()
        .isEqualTo("Cannot assign str to a variable of type int");
    assertThat(check("a := nil", "a = \"s\"")).isEmpty();
  }

  @Test
  public void branchesAndLoopBodiesAreAlwaysChecked() throws Exception {
    assertThat(onlyError("loop false {", "  a := 1 + \"s\"", "}").kind())
        .isEqualTo(VmException.Kind.TYPE_ERROR);
    assertThat(onlyError("if true {", "} else {", "  print -\"s\"", "}").kind())
        .isEqualTo(VmException.Kind.TYPE_ERROR);
  }

  @Test
  public void conditions() throws Exception {
    assertThat(onlyError("if 1 {", "}"))
        .hasMessageThat()
        .isEqualTo("Expected a condition of type bool, got int");
  }

  @Test
  public void blobFields() throws Exception {
    assertThat(onlyError("P :: blob { x: int }", "p := P { x: \"s\" }"))
        .hasMessageThat()
        .isEqualTo("Field 'P.x' is declared int, got str");
    assertThat(onlyError("P :: blob { x: int }", "p := P { x: 1 }", "p.x = 1.0").kind())
        .isEqualTo(VmException.Kind.TYPE_ERROR);
    assertThat(check("P :: blob { x: int }", "p := P {}", "print p.x + 1")).isEmpty();
  }

  @Test
  public void externArguments() throws Exception {
    VmException error = onlyError("l := [1]", "push(l, \"s\")");
    assertThat(error.kind()).isEqualTo(VmException.Kind.EXTERN_TYPE_MISMATCH);
    assertThat(error).hasMessageThat().contains("'push'");
  }

  @Test
  public void containerElements() throws Exception {
    assertThat(onlyError("l := [1]", "l[0] = \"s\"").kind())
        .isEqualTo(VmException.Kind.TYPE_ERROR);
    assertThat(onlyError("d := {1: 2}", "d[\"a\"] = 2").kind())
        .isEqualTo(VmException.Kind.TYPE_ERROR);
  }

  @Test
  public void zeroDivisorIsNotAnError() throws Exception {
    assertThat(check("a := 0", "print 1 / a")).isEmpty();
  }

  @Test
  public void everyBlockReportsItsFirstError() throws Exception {
    ImmutableList<VmException> errors =
        check(
            "f :: fn -> int {",
            "  ret \"a\"",
            "}",
            "g :: fn -> str {",
            "  x := 1 + \"b\"",
            "  ret 1",
            "}",
            "print 1 + nil");
    assertThat(errors).hasSize(3);
    assertThat(errors.get(0).span().line()).isEqualTo(8);
    assertThat(errors.get(1).span().line()).isEqualTo(2);
    assertThat(errors.get(2).span().line()).isEqualTo(5);
  }

  @Test
  public void typecheckingDoesNotPrint() throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    Vm vm =
        new Vm(
            compile("print 1", "f :: fn {", "  print 2", "}", "f()"),
            new PrintStream(bytes, true, StandardCharsets.UTF_8),
            false);
    assertThat(Typechecker.check(vm)).isEmpty();
    assertThat(bytes.size()).isEqualTo(0);

    vm.run();
    assertThat(bytes.toString(StandardCharsets.UTF_8)).isEqualTo(SyltTesting.printed("1", "2"));
  }
}
