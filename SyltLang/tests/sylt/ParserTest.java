package sylt;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ParserTest {

  private static String expr(String source) throws SyntaxException {
    return Parser.parseExpression(source).toString();
  }

  private static Expression parseExpr(String source) throws SyntaxException {
    return Parser.parseExpression(source);
  }

  private static void assertExprError(String errorSubstr, String source) {
    SyntaxException ex = assertThrows(SyntaxException.class, () -> parseExpr(source));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  private static Parser.Result parse(String... lines) {
    return Parser.parse(Path.of("/test/file.sy"), SyltTesting.lines(lines));
  }

  private static Module parseModule(String... lines) {
    Parser.Result result = parse(lines);
    assertThat(result.errors()).isEmpty();
    return result.module();
  }

  @Test
  public void precedence() throws SyntaxException {
    assertThat(expr("1 + 2 * 3")).isEqualTo("(1 + (2 * 3))");
    assertThat(expr("1 * 2 + 3")).isEqualTo("((1 * 2) + 3)");
    assertThat(expr("1 - 2 - 3")).isEqualTo("((1 - 2) - 3)");
    assertThat(expr("a < b && c || d")).isEqualTo("(((a < b) && c) || d)");
    assertThat(expr("1 + 1 <=> 2 || x")).isEqualTo("((1 + 1) <=> (2 || x))");
    assertThat(expr("a + 1 in b")).isEqualTo("(a + (1 in b))");
  }

  @Test
  public void unaryBindsAtFactor() throws SyntaxException {
    assertThat(expr("-a * b")).isEqualTo("(-(a * b))");
    assertThat(expr("-a + b")).isEqualTo("((-a) + b)");
    assertThat(expr("!a && b")).isEqualTo("((!a) && b)");
  }

  @Test
  public void groupingAndTuples() throws SyntaxException {
    assertThat(parseExpr("(1)").kind()).isEqualTo(Expression.Kind.LITERAL);
    assertThat(expr("(1)")).isEqualTo("1");
    assertThat(expr("(1,)")).isEqualTo("(1,)");
    assertThat(expr("(1, 2)")).isEqualTo("(1, 2)");
    assertThat(expr("()")).isEqualTo("()");
    assertThat(expr("(,)")).isEqualTo("()");
    assertThat(parseExpr("(,)").kind()).isEqualTo(Expression.Kind.COLLECTION);
    assertThat(expr("((1 + 2) * 3)")).isEqualTo("((1 + 2) * 3)");
  }

  @Test
  public void setsAndDicts() throws SyntaxException {
    Expression.Collection emptySet = parseExpr("{}").cast();
    assertThat(emptySet.collectionKind()).isEqualTo(Expression.CollectionKind.SET);
    assertThat(emptySet.elements()).isEmpty();

    Expression.Collection emptyDict = parseExpr("{:}").cast();
    assertThat(emptyDict.collectionKind()).isEqualTo(Expression.CollectionKind.DICT);
    assertThat(emptyDict.elements()).isEmpty();

    Expression.Collection dict = parseExpr("{1: 2}").cast();
    assertThat(dict.collectionKind()).isEqualTo(Expression.CollectionKind.DICT);
    assertThat(dict.elements()).hasSize(2);

    assertThat(expr("{1, 2}")).isEqualTo("{1, 2}");
    assertThat(expr("{1: 2, 3: 4}")).isEqualTo("{1: 2, 3: 4}");
  }

  @Test
  public void mixedSetAndDictIsAnError() {
    assertExprError("Expected ':' for dict pair", "{1: 2, 3}");
    assertExprError("Expected ',' or '}'", "{1, 2: 3}");
    assertExprError("Empty dict pair is invalid in a set", "{1, :}");
    assertExprError("Empty dict pair is invalid in a dict", "{1: 2, :}");
  }

  @Test
  public void arrowIsCallSugar() throws SyntaxException {
    assertThat(expr("a -> f(b, c)")).isEqualTo("f(a, b, c)");
    assertThat(expr("a -> f()")).isEqualTo("f(a)");
    assertThat(expr("1 + 2 -> g(3)")).isEqualTo("g((1 + 2), 3)");
    assertExprError("Expected a call-expression after '->'", "a -> 5");
    assertExprError("Expected a call-expression after '->'", "a -> f");
  }

  @Test
  public void assignables() throws SyntaxException {
    assertThat(expr("a.b[1](2).c")).isEqualTo("a.b[1](2).c");
    Expression.Get get = parseExpr("f(1)(2)").cast();
    assertThat(get.assignable().kind()).isEqualTo(Assignable.Kind.CALL);
  }

  @Test
  public void blobLiteral() throws SyntaxException {
    Expression instance = parseExpr("Point { x: 1, y: 2 }");
    assertThat(instance.kind()).isEqualTo(Expression.Kind.INSTANCE);
    assertThat(instance.toString()).isEqualTo("Point { x: 1, y: 2 }");

    Expression.Instance qualified = parseExpr("geo.Point {\n x: 1\n y: 2\n}").cast();
    assertThat(qualified.blob().toString()).isEqualTo("geo.Point");
    assertThat(qualified.fieldNames()).containsExactly("x", "y").inOrder();
  }

  @Test
  public void blobLiteralBeforeElseIsACondition() {
    Module module = parseModule("if a == b {} else { print 1 }");
    Statement.If ifStatement = module.statements().get(0).cast();
    assertThat(ifStatement.condition().toString()).isEqualTo("(a == b)");
    assertThat(ifStatement.otherwise().isPresent()).isTrue();
  }

  @Test
  public void identifierBeforeBlockIsNotABlobLiteral() {
    Module module = parseModule("loop i < n {", "  i += 1", "}");
    Statement.Loop loop = module.statements().get(0).cast();
    assertThat(loop.condition().get().toString()).isEqualTo("(i < n)");
    assertThat(loop.body().statements()).hasSize(1);
  }

  @Test
  public void functions() throws SyntaxException {
    assertThat(expr("fn a: int, b: str -> bool { ret true }"))
        .isEqualTo("fn a: int, b: str -> bool");
    assertThat(expr("fn { }")).isEqualTo("fn  -> void");
    assertThat(expr("fn -> { }")).isEqualTo("fn  -> void");
    assertThat(expr("fn x: [int] -> {int: str} { ret {:} }"))
        .isEqualTo("fn x: [int] -> {int: str}");
    assertThat(expr("fn f: fn int -> int -> int | float { ret 1 }"))
        .isEqualTo("fn f: fn int -> int -> int | float");
  }

  @Test
  public void definitions() {
    Module module =
        parseModule(
            "a := 1",
            "b :: 2",
            "c: float = 1.0",
            "d: int : 4",
            "f :: fn { }",
            "Point :: blob { x: int, y: int }",
            "use other");
    ImmutableList<Statement> statements = module.statements();
    assertThat(statements).hasSize(7);

    Statement.Definition a = statements.get(0).cast();
    assertThat(a.isConstant()).isFalse();
    assertThat(a.type().isPresent()).isFalse();
    Statement.Definition b = statements.get(1).cast();
    assertThat(b.isConstant()).isTrue();
    Statement.Definition c = statements.get(2).cast();
    assertThat(c.isConstant()).isFalse();
    assertThat(c.type().get().toString()).isEqualTo("float");
    Statement.Definition d = statements.get(3).cast();
    assertThat(d.isConstant()).isTrue();

    Statement.Definition f = statements.get(4).cast();
    assertThat(f.value().<Expression.Function>cast().name()).isEqualTo("f");

    Statement.Blob blob = statements.get(5).cast();
    assertThat(blob.name()).isEqualTo("Point");
    assertThat(blob.fields()).hasSize(2);

    assertThat(statements.get(6).kind()).isEqualTo(Statement.Kind.USE);
  }

  @Test
  public void assignmentsAndExpressionStatements() {
    Module module = parseModule("a = 1", "l[0] -= 2", "p.x *= 3", "f(1)", "a <=> 1");
    ImmutableList<Statement> statements = module.statements();

    Statement.Assignment simple = statements.get(0).cast();
    assertThat(simple.op()).isEqualTo(Statement.AssignOp.ASSIGN);
    Statement.Assignment index = statements.get(1).cast();
    assertThat(index.op()).isEqualTo(Statement.AssignOp.SUB);
    assertThat(index.target().kind()).isEqualTo(Assignable.Kind.INDEX);
    Statement.Assignment access = statements.get(2).cast();
    assertThat(access.op()).isEqualTo(Statement.AssignOp.MUL);
    assertThat(access.target().kind()).isEqualTo(Assignable.Kind.ACCESS);

    assertThat(statements.get(3).kind()).isEqualTo(Statement.Kind.STATEMENT_EXPRESSION);
    assertThat(statements.get(4).kind()).isEqualTo(Statement.Kind.STATEMENT_EXPRESSION);
  }

  @Test
  public void ifElseChains() {
    Module module =
        parseModule(
            "if a > 1 {",
            "  print 1",
            "} else if a < 0 {",
            "  print 2",
            "} else {",
            "  print 3",
            "}");
    Statement.If first = module.statements().get(0).cast();
    Statement.If second = first.otherwise().get().cast();
    assertThat(second.otherwise().get().kind()).isEqualTo(Statement.Kind.BLOCK);
  }

  @Test
  public void recoversAndReportsEveryError() {
    Parser.Result result = parse("a := )", "b := 1", "c := ]", "print b");
    assertThat(result.errors()).hasSize(2);
    assertThat(result.errors().get(0).span().line()).isEqualTo(1);
    assertThat(result.errors().get(1).span().line()).isEqualTo(3);
    assertThat(result.module().statements()).hasSize(2);
  }

  @Test
  public void recoversInsideBlocks() {
    Parser.Result result = parse("f :: fn {", "  a := )", "  print 1", "}", "print 2");
    assertThat(result.errors()).hasSize(1);
    assertThat(result.module().statements()).hasSize(2);
  }

  @Test
  public void statementsNeedNewlines() {
    Parser.Result result = parse("a := 1 b := 2");
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0)).hasMessageThat().contains("Expected a newline");
  }

  @Test
  public void lexerErrorsAreSyntaxErrors() {
    Parser.Result result = parse("a := \"oops");
    assertThat(result.errors()).hasSize(1);
    assertThat(result.module().statements()).isEmpty();
  }
}
