package sylt;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sylt.SyltTesting.printed;
import static sylt.SyltTesting.run;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class VmTest {

  private static VmException runError(String... lines) {
    return assertThrows(VmException.class, () -> run(lines));
  }

  @Test
  public void arithmetic() throws Exception {
    assertThat(run("print 1 + 2 * 3", "print 7 / 2", "print 1.5 + 1.0", "print -(2 - 5)"))
        .isEqualTo(printed("7", "3", "2.5", "3"));
  }

  @Test
  public void comparisons() throws Exception {
    assertThat(
            run(
                "print 1 < 2",
                "print 2 <= 1",
                "print 2 >= 2",
                "print 1 != 2",
                "print \"a\" < \"b\"",
                "print !(1 == 1)"))
        .isEqualTo(printed("true", "false", "true", "true", "true", "false"));
  }

  @Test
  public void strings() throws Exception {
    assertThat(run("s := \"ab\" + \"cd\"", "print s", "print [s]", "print \"bc\" in s"))
        .isEqualTo(printed("abcd", "[\"abcd\"]", "true"));
  }

  @Test
  public void tupleArithmetic() throws Exception {
    assertThat(run("print (1, 2) + (3, 4)", "print (2.0, 3) * (0.5, 3)"))
        .isEqualTo(printed("(4, 6)", "(1.0, 9)"));
  }

  @Test
  public void listsAreShared() throws Exception {
    assertThat(run("a := [1, 2]", "b := a", "push(b, 3)", "print a", "print len(a)"))
        .isEqualTo(printed("[1, 2, 3]", "3"));
  }

  @Test
  public void indexAssignment() throws Exception {
    assertThat(run("l := [1, 2, 3]", "l[1] = 5", "l[2] += 10", "print l"))
        .isEqualTo(printed("[1, 5, 13]"));
  }

  @Test
  public void tuplesAreImmutable() {
    VmException ex = runError("t := (1, 2)", "t[0] = 3");
    assertThat(ex.kind()).isEqualTo(VmException.Kind.TYPE_ERROR);
    assertThat(ex.span().line()).isEqualTo(2);
  }

  @Test
  public void dictsAndSets() throws Exception {
    assertThat(
            run(
                "d := {\"a\": 1}",
                "d[\"b\"] = 2",
                "print d[\"b\"]",
                "print \"a\" in d",
                "print d",
                "s := {1, 2}",
                "print 3 in s",
                "print s == {2, 1}"))
        .isEqualTo(printed("2", "true", "{\"a\": 1, \"b\": 2}", "false", "true"));
  }

  @Test
  public void missingDictKey() {
    VmException ex = runError("d := {1: 2}", "print d[3]");
    assertThat(ex.kind()).isEqualTo(VmException.Kind.INDEX_OUT_OF_BOUNDS);
    assertThat(ex).hasMessageThat().contains("No key 3");
  }

  @Test
  public void indexOutOfBounds() {
    VmException ex = runError("l := [1]", "print l[3]");
    assertThat(ex.kind()).isEqualTo(VmException.Kind.INDEX_OUT_OF_BOUNDS);
    assertThat(ex).hasMessageThat().isEqualTo("Index 3 out of bounds for length 1");

    assertThat(runError("l := [1]", "print l[-1]").kind())
        .isEqualTo(VmException.Kind.INDEX_OUT_OF_BOUNDS);
  }

  @Test
  public void divisionByZero() {
    assertThat(runError("print 1 / 0").kind()).isEqualTo(VmException.Kind.DIVISION_BY_ZERO);
  }

  @Test
  public void floatDivisionByZeroIsInfinite() throws Exception {
    assertThat(run("print 1.0 / 0.0")).isEqualTo(printed("Infinity"));
  }

  @Test
  public void mismatchedOperands() {
    VmException ex = runError("print 1 + \"a\"");
    assertThat(ex.kind()).isEqualTo(VmException.Kind.TYPE_ERROR);
    assertThat(ex).hasMessageThat().isEqualTo("Cannot apply '+' to int and str");
  }

  @Test
  public void asserts() throws Exception {
    assertThat(run("1 + 1 <=> 2", "print 1")).isEqualTo(printed("1"));

    VmException ex = runError("print 1", "1 <=> 2");
    assertThat(ex.kind()).isEqualTo(VmException.Kind.ASSERT_FAILED);
    assertThat(ex.span().line()).isEqualTo(2);
  }

  @Test
  public void ifElse() throws Exception {
    String[] program = {
      "x := 3",
      "if x > 5 {",
      "  print \"big\"",
      "} else if x > 1 {",
      "  print \"medium\"",
      "} else {",
      "  print \"small\"",
      "}",
      "if x == 3 {",
      "  print \"three\"",
      "}"
    };
    assertThat(run(program)).isEqualTo(printed("medium", "three"));
  }

  @Test
  public void conditionMustBeBool() {
    assertThat(runError("if 1 {", "}").kind()).isEqualTo(VmException.Kind.TYPE_ERROR);
  }

  @Test
  public void loops() throws Exception {
    String[] program = {
      "i := 0", "sum := 0", "loop i < 5 {", "  sum += i", "  i += 1", "}", "print sum"
    };
    assertThat(run(program)).isEqualTo(printed("10"));
  }

  @Test
  public void blockScopes() throws Exception {
    String[] program = {
      "{", "  a := 1", "  {", "    a := 2", "    print a", "  }", "  print a", "}"
    };
    assertThat(run(program)).isEqualTo(printed("2", "1"));
  }

  @Test
  public void recursion() throws Exception {
    String[] program = {
      "fib :: fn n: int -> int {",
      "  if n < 2 {",
      "    ret n",
      "  }",
      "  ret fib(n - 1) + fib(n - 2)",
      "}",
      "print fib(10)"
    };
    assertThat(run(program)).isEqualTo(printed("55"));
  }

  @Test
  public void localRecursion() throws Exception {
    String[] program = {
      "{",
      "  fact :: fn n: int -> int {",
      "    if n <= 1 {",
      "      ret 1",
      "    }",
      "    ret n * fact(n - 1)",
      "  }",
      "  print fact(5)",
      "}"
    };
    assertThat(run(program)).isEqualTo(printed("120"));
  }

  @Test
  public void closuresCaptureVariables() throws Exception {
    String[] program = {
      "make :: fn -> fn -> int {",
      "  n := 0",
      "  ret fn -> int {",
      "    n += 1",
      "    ret n",
      "  }",
      "}",
      "a := make()",
      "b := make()",
      "a()",
      "a()",
      "print a()",
      "print b()"
    };
    assertThat(run(program)).isEqualTo(printed("3", "1"));
  }

  @Test
  public void closuresObserveLaterAssignments() throws Exception {
    String[] program = {
      "f :: fn -> fn -> int {",
      "  x := 1",
      "  g :: fn -> int {",
      "    ret x",
      "  }",
      "  x = 2",
      "  ret g",
      "}",
      "print f()()"
    };
    assertThat(run(program)).isEqualTo(printed("2"));
  }

  @Test
  public void nestedClosuresShareUpvalues() throws Exception {
    String[] program = {
      "outer :: fn -> int {",
      "  x := 1",
      "  middle :: fn -> fn -> void {",
      "    ret fn {",
      "      x += 10",
      "    }",
      "  }",
      "  middle()()",
      "  ret x",
      "}",
      "print outer()"
    };
    assertThat(run(program)).isEqualTo(printed("11"));
  }

  @Test
  public void blobs() throws Exception {
    String[] program = {
      "Point :: blob { x: int, y: int }",
      "p := Point { x: 1, y: 2 }",
      "q := p",
      "q.x += 10",
      "print p.x",
      "print p",
      "r := Point { x: 5 }",
      "print r.y"
    };
    assertThat(run(program)).isEqualTo(printed("11", "Point { x: 11, y: 2 }", "nil"));
  }

  @Test
  public void unknownField() {
    VmException ex = runError("Point :: blob { x: int }", "p := Point { z: 1 }");
    assertThat(ex.kind()).isEqualTo(VmException.Kind.UNKNOWN_FIELD);
    assertThat(ex).hasMessageThat().isEqualTo("Blob 'Point' has no field 'z'");
  }

  @Test
  public void argumentCount() {
    VmException ex = runError("f :: fn a: int {", "}", "f(1, 2)");
    assertThat(ex.kind()).isEqualTo(VmException.Kind.ARGUMENT_COUNT);
    assertThat(ex.span().line()).isEqualTo(3);
  }

  @Test
  public void missingReturnValue() {
    VmException ex = runError("f :: fn -> int {", "}", "f()");
    assertThat(ex.kind()).isEqualTo(VmException.Kind.UNREACHABLE);
    assertThat(ex).hasMessageThat().contains("'f'");
  }

  @Test
  public void callingANonFunction() {
    assertThat(runError("a := 1", "a()").kind()).isEqualTo(VmException.Kind.TYPE_ERROR);
  }

  @Test
  public void arrowCalls() throws Exception {
    assertThat(run("print [1, 2] -> len()", "print 16.0 -> sqrt()"))
        .isEqualTo(printed("2", "4.0"));
  }

  @Test
  public void externErrorsAreLocated() {
    VmException ex = runError("l := [1]", "pop(l)", "pop(l)");
    assertThat(ex.kind()).isEqualTo(VmException.Kind.EXTERN_ERROR);
    assertThat(ex.span().line()).isEqualTo(3);
  }

  @Test
  public void runnerRunsRepeatedly() throws Exception {
    Program program = SyltTesting.compile("print 1");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    SyltRunner runner =
        new SyltRunner(program, new PrintStream(bytes, true, StandardCharsets.UTF_8), false);
    runner.run();
    runner.run();
    assertThat(bytes.toString(StandardCharsets.UTF_8))
        .isEqualTo(printed("1", "1"));
    assertThat(runner.typecheck()).isEmpty();
  }
}
