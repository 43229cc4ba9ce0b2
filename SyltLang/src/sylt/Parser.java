package sylt;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Recursive descent parser with precedence climbing for infix operators.
 *
 * <p>Errors do not stop the parse: a malformed statement is recorded and the parser skips to the
 * next statement boundary, so one pass reports every independent syntax error.
 */
public class Parser {

  /** Infix precedence classes, lowest binding first. */
  enum Prec {
    NO,
    ARROW,
    ASSERT,
    BOOL_OR,
    BOOL_AND,
    COMP,
    TERM,
    FACTOR,
    INDEX;

    Prec next() {
      return this == INDEX ? INDEX : values()[ordinal() + 1];
    }

    static Prec of(Token.Kind kind) {
      switch (kind) {
        case IN:
          return INDEX;
        case STAR:
        case SLASH:
          return FACTOR;
        case PLUS:
        case MINUS:
          return TERM;
        case EQUAL_EQUAL:
        case NOT_EQUAL:
        case LESS:
        case LESS_EQUAL:
        case GREATER:
        case GREATER_EQUAL:
          return COMP;
        case AND:
          return BOOL_AND;
        case OR:
          return BOOL_OR;
        case ASSERT_EQUAL:
          return ASSERT;
        case ARROW:
          return ARROW;
        default:
          return NO;
      }
    }
  }

  @AutoValue
  public abstract static class Result {
    public abstract Module module();

    public abstract ImmutableList<SyntaxException> errors();

    static Result create(Module module, List<SyntaxException> errors) {
      return new AutoValue_Parser_Result(module, ImmutableList.copyOf(errors));
    }
  }

  @FunctionalInterface
  private interface Rule<T> {
    T parse() throws SyntaxException;
  }

  private final Path file;
  private final ImmutableList<Token> tokens;
  private final List<SyntaxException> errors = new ArrayList<>();
  private int pos = 0;

  private Parser(Path file, ImmutableList<Token> tokens) {
    this.file = file;
    this.tokens = tokens;
  }

  public static Result parse(Path file, String source) {
    ImmutableList<Token> tokens;
    try {
      tokens = new Lexer(file.toString(), source).tokenize();
    } catch (SyntaxException ex) {
      return Result.create(
          new Module(file, ex.span(), ImmutableList.of()), ImmutableList.of(ex));
    }
    return new Parser(file, tokens).module();
  }

  /** Parses a lone expression; for tools and tests. */
  static Expression parseExpression(String source) throws SyntaxException {
    Parser parser = new Parser(Path.of("<expr>"), new Lexer("<expr>", source).tokenize());
    Expression expr = parser.expression();
    parser.skipNewlines();
    parser.expect(Token.Kind.EOF, "Expected end of expression");
    return expr;
  }

  // ---------------------------------------------------------------------------
  // Token plumbing

  private Token peek() {
    return tokens.get(pos);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
  }

  private boolean at(Token.Kind kind) {
    return peek().is(kind);
  }

  private Token advance() {
    Token token = peek();
    if (!token.is(Token.Kind.EOF)) pos++;
    return token;
  }

  private boolean skipIf(Token.Kind kind) {
    if (!at(kind)) return false;
    advance();
    return true;
  }

  private void skipNewlines() {
    while (skipIf(Token.Kind.NEWLINE)) {}
  }

  private Token expect(Token.Kind kind, String msg) throws SyntaxException {
    if (!at(kind)) throw error(msg);
    return advance();
  }

  private SyntaxException error(String msg) {
    return new SyntaxException(peek().span(), String.format("%s, but got %s", msg, peek()));
  }

  /** Runs {@code rule}, rolling back to the current position if it fails. */
  private <T> Optional<T> attempt(Rule<T> rule) {
    int savedPos = pos;
    int savedErrors = errors.size();
    try {
      return Optional.of(rule.parse());
    } catch (SyntaxException ex) {
      pos = savedPos;
      errors.subList(savedErrors, errors.size()).clear();
      return Optional.empty();
    }
  }

  /**
   * Skips to the next statement boundary: a newline outside any braces, or the closing brace of
   * the enclosing block.
   */
  private void synchronize(boolean inBlock) {
    int depth = 0;
    while (!at(Token.Kind.EOF)) {
      Token token = peek();
      if (token.is(Token.Kind.NEWLINE) && depth == 0) {
        advance();
        return;
      }
      if (token.is(Token.Kind.RIGHT_BRACE)) {
        if (depth == 0 && inBlock) return;
        depth = Math.max(0, depth - 1);
      } else if (token.is(Token.Kind.LEFT_BRACE)) {
        depth++;
      }
      advance();
    }
  }

  // ---------------------------------------------------------------------------
  // Statements

  private Result module() {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    while (true) {
      skipNewlines();
      if (at(Token.Kind.EOF)) break;

      try {
        statements.add(statement());
      } catch (SyntaxException ex) {
        errors.add(ex);
        synchronize(false);
      }
    }
    return Result.create(new Module(file, peek().span(), statements.build()), errors);
  }

  private Statement.Block block() throws SyntaxException {
    Span span = expect(Token.Kind.LEFT_BRACE, "Expected '{' to start a block").span();
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    while (true) {
      skipNewlines();
      if (at(Token.Kind.RIGHT_BRACE) || at(Token.Kind.EOF)) break;

      try {
        statements.add(statement());
      } catch (SyntaxException ex) {
        errors.add(ex);
        synchronize(true);
      }
    }
    expect(Token.Kind.RIGHT_BRACE, "Expected '}' to close the block");
    return new Statement.Block(statements.build(), span);
  }

  private Statement statement() throws SyntaxException {
    Statement statement = statementBody();
    if (!skipIf(Token.Kind.NEWLINE) && !at(Token.Kind.RIGHT_BRACE) && !at(Token.Kind.EOF)) {
      throw error("Expected a newline after the statement");
    }
    return statement;
  }

  private Statement statementBody() throws SyntaxException {
    Token token = peek();
    Span span = token.span();
    switch (token.kind()) {
      case USE:
        advance();
        return new Statement.Use(
            expect(Token.Kind.IDENTIFIER, "Expected a module name after 'use'").text(), span);
      case PRINT:
        advance();
        return new Statement.Print(expression(), span);
      case RET:
        advance();
        if (at(Token.Kind.NEWLINE) || at(Token.Kind.RIGHT_BRACE) || at(Token.Kind.EOF)) {
          return new Statement.Ret(Optional.empty(), span);
        }
        return new Statement.Ret(Optional.of(expression()), span);
      case IF:
        return ifStatement();
      case LOOP:
        advance();
        Optional<Expression> condition =
            at(Token.Kind.LEFT_BRACE) ? Optional.empty() : Optional.of(expression());
        return new Statement.Loop(condition, block(), span);
      case LEFT_BRACE:
        return block();
      case IDENTIFIER:
        if (peek(1).is(Token.Kind.COLON_COLON) && peek(2).is(Token.Kind.BLOB)) {
          return blobStatement();
        }
        if (peek(1).is(Token.Kind.COLON_COLON)
            || peek(1).is(Token.Kind.COLON_EQUAL)
            || peek(1).is(Token.Kind.COLON)) {
          return definition();
        }
        break;
      default:
        break;
    }

    Optional<Statement.Assignment> head = attempt(this::assignmentHead);
    if (head.isPresent()) {
      return new Statement.Assignment(head.get().op(), head.get().target(), expression(), span);
    }
    return new Statement.StatementExpression(expression(), span);
  }

  /** {@code target op}, with a placeholder value; the caller parses the real one. */
  private Statement.Assignment assignmentHead() throws SyntaxException {
    Span span = peek().span();
    Assignable target = assignable();
    Statement.AssignOp op;
    switch (peek().kind()) {
      case EQUAL:
        op = Statement.AssignOp.ASSIGN;
        break;
      case PLUS_EQUAL:
        op = Statement.AssignOp.ADD;
        break;
      case MINUS_EQUAL:
        op = Statement.AssignOp.SUB;
        break;
      case STAR_EQUAL:
        op = Statement.AssignOp.MUL;
        break;
      case SLASH_EQUAL:
        op = Statement.AssignOp.DIV;
        break;
      default:
        throw error("Expected an assignment operator");
    }
    advance();
    return new Statement.Assignment(op, target, new Expression.Literal(Value.nil(), span), span);
  }

  private Statement ifStatement() throws SyntaxException {
    Span span = expect(Token.Kind.IF, "Expected 'if'").span();
    Expression condition = expression();
    Statement.Block then = block();
    if (!skipIf(Token.Kind.ELSE)) {
      return new Statement.If(condition, then, Optional.empty(), span);
    }

    Statement otherwise = at(Token.Kind.IF) ? ifStatement() : block();
    return new Statement.If(condition, then, Optional.of(otherwise), span);
  }

  private Statement definition() throws SyntaxException {
    Token name = expect(Token.Kind.IDENTIFIER, "Expected a variable name");
    Optional<TypeNode> type = Optional.empty();
    Statement.VarKind varKind;
    if (skipIf(Token.Kind.COLON_COLON)) {
      varKind = Statement.VarKind.CONST;
    } else if (skipIf(Token.Kind.COLON_EQUAL)) {
      varKind = Statement.VarKind.MUTABLE;
    } else {
      expect(Token.Kind.COLON, "Expected ':' after variable name");
      type = Optional.of(type());
      if (skipIf(Token.Kind.COLON)) {
        varKind = Statement.VarKind.CONST;
      } else {
        expect(Token.Kind.EQUAL, "Expected ':' or '=' after the type of a definition");
        varKind = Statement.VarKind.MUTABLE;
      }
    }

    Expression value = expression();
    if (value.kind() == Expression.Kind.FUNCTION) {
      value = value.<Expression.Function>cast().withName(name.text());
    }
    return new Statement.Definition(name.text(), varKind, type, value, name.span());
  }

  private Statement blobStatement() throws SyntaxException {
    Token name = expect(Token.Kind.IDENTIFIER, "Expected a blob name");
    expect(Token.Kind.COLON_COLON, "Expected '::' after blob name");
    expect(Token.Kind.BLOB, "Expected 'blob'");
    expect(Token.Kind.LEFT_BRACE, "Expected '{' after 'blob'");

    ImmutableList.Builder<Statement.Field> fields = ImmutableList.builder();
    while (true) {
      skipNewlines();
      if (skipIf(Token.Kind.RIGHT_BRACE)) break;

      Token field = expect(Token.Kind.IDENTIFIER, "Expected a field name in blob");
      expect(Token.Kind.COLON, "Expected ':' after field name");
      fields.add(Statement.Field.create(field.text(), type(), field.span()));
      if (!skipIf(Token.Kind.COMMA) && !at(Token.Kind.NEWLINE) && !at(Token.Kind.RIGHT_BRACE)) {
        throw error("Expected a delimiter: newline or ','");
      }
    }
    return new Statement.Blob(name.text(), fields.build(), name.span());
  }

  // ---------------------------------------------------------------------------
  // Types

  TypeNode type() throws SyntaxException {
    Span span = peek().span();
    TypeNode first = singleType();
    if (!at(Token.Kind.PIPE)) return first;

    ImmutableList.Builder<TypeNode> members = ImmutableList.<TypeNode>builder().add(first);
    while (skipIf(Token.Kind.PIPE)) {
      members.add(singleType());
    }
    return TypeNode.composite(TypeNode.Kind.UNION, members.build(), span);
  }

  private TypeNode singleType() throws SyntaxException {
    Token token = peek();
    Span span = token.span();
    switch (token.kind()) {
      case QUESTION:
        advance();
        return TypeNode.resolved(Type.unknown(), span);
      case IDENTIFIER:
        advance();
        switch (token.text()) {
          case "int":
            return TypeNode.resolved(Type.intType(), span);
          case "float":
            return TypeNode.resolved(Type.floatType(), span);
          case "bool":
            return TypeNode.resolved(Type.boolType(), span);
          case "str":
            return TypeNode.resolved(Type.stringType(), span);
          case "void":
            return TypeNode.resolved(Type.voidType(), span);
          default:
            if (skipIf(Token.Kind.DOT)) {
              Token name = expect(Token.Kind.IDENTIFIER, "Expected a blob name after '.'");
              return TypeNode.userDefined(Optional.of(token.text()), name.text(), span);
            }
            return TypeNode.userDefined(Optional.empty(), token.text(), span);
        }
      case LEFT_BRACKET:
        {
          advance();
          TypeNode element = type();
          expect(Token.Kind.RIGHT_BRACKET, "Expected ']' after list type");
          return TypeNode.composite(TypeNode.Kind.LIST, ImmutableList.of(element), span);
        }
      case LEFT_BRACE:
        {
          advance();
          TypeNode key = type();
          if (skipIf(Token.Kind.COLON)) {
            TypeNode value = type();
            expect(Token.Kind.RIGHT_BRACE, "Expected '}' after dict type");
            return TypeNode.composite(TypeNode.Kind.DICT, ImmutableList.of(key, value), span);
          }
          expect(Token.Kind.RIGHT_BRACE, "Expected '}' after set type");
          return TypeNode.composite(TypeNode.Kind.SET, ImmutableList.of(key), span);
        }
      case LEFT_PAREN:
        {
          advance();
          ImmutableList.Builder<TypeNode> elements = ImmutableList.builder();
          while (!skipIf(Token.Kind.RIGHT_PAREN)) {
            elements.add(type());
            if (!skipIf(Token.Kind.COMMA) && !at(Token.Kind.RIGHT_PAREN)) {
              throw error("Expected ',' or ')' in tuple type");
            }
          }
          return TypeNode.composite(TypeNode.Kind.TUPLE, elements.build(), span);
        }
      case FN:
        {
          advance();
          ImmutableList.Builder<TypeNode> args = ImmutableList.builder();
          while (!skipIf(Token.Kind.ARROW)) {
            args.add(type());
            if (!skipIf(Token.Kind.COMMA) && !at(Token.Kind.ARROW)) {
              throw error("Expected ',' or '->' in function type");
            }
          }
          args.add(type());
          return TypeNode.composite(TypeNode.Kind.FUNCTION, args.build(), span);
        }
      default:
        throw error("Expected a type");
    }
  }

  // ---------------------------------------------------------------------------
  // Expressions

  Expression expression() throws SyntaxException {
    if (at(Token.Kind.FN)) return function();
    return parsePrecedence(Prec.NO);
  }

  private Expression parsePrecedence(Prec prec) throws SyntaxException {
    Expression expr = prefix();
    while (true) {
      Prec next = Prec.of(peek().kind());
      if (next == Prec.NO || next.compareTo(prec) < 0) break;
      expr = infix(expr);
    }
    return expr;
  }

  private Expression infix(Expression lhs) throws SyntaxException {
    Token op = advance();
    Span span = op.span();
    Expression rhs = parsePrecedence(Prec.of(op.kind()).next());

    Expression.BinaryOp binaryOp;
    switch (op.kind()) {
      case PLUS:
        binaryOp = Expression.BinaryOp.ADD;
        break;
      case MINUS:
        binaryOp = Expression.BinaryOp.SUB;
        break;
      case STAR:
        binaryOp = Expression.BinaryOp.MUL;
        break;
      case SLASH:
        binaryOp = Expression.BinaryOp.DIV;
        break;
      case EQUAL_EQUAL:
        binaryOp = Expression.BinaryOp.EQ;
        break;
      case NOT_EQUAL:
        binaryOp = Expression.BinaryOp.NEQ;
        break;
      case GREATER:
        binaryOp = Expression.BinaryOp.GT;
        break;
      case GREATER_EQUAL:
        binaryOp = Expression.BinaryOp.GTEQ;
        break;
      case LESS:
        binaryOp = Expression.BinaryOp.LT;
        break;
      case LESS_EQUAL:
        binaryOp = Expression.BinaryOp.LTEQ;
        break;
      case AND:
        binaryOp = Expression.BinaryOp.AND;
        break;
      case OR:
        binaryOp = Expression.BinaryOp.OR;
        break;
      case ASSERT_EQUAL:
        binaryOp = Expression.BinaryOp.ASSERT_EQ;
        break;
      case IN:
        binaryOp = Expression.BinaryOp.IN;
        break;
      case ARROW:
        // a -> f(b) is f(a, b).
        if (rhs.kind() != Expression.Kind.GET
            || rhs.<Expression.Get>cast().assignable().kind() != Assignable.Kind.CALL) {
          throw new SyntaxException(rhs.span(), "Expected a call-expression after '->'");
        }
        Assignable.Call call = rhs.<Expression.Get>cast().assignable().cast();
        return new Expression.Get(call.withFirstArg(lhs));
      default:
        throw new SyntaxException(span, "Unknown infix operator " + op);
    }
    return new Expression.Binary(binaryOp, lhs, rhs, span);
  }

  private Expression prefix() throws SyntaxException {
    Token token = peek();
    Span span = token.span();
    switch (token.kind()) {
      case LEFT_PAREN:
        return groupingOrTuple();
      case LEFT_BRACKET:
        return list();
      case LEFT_BRACE:
        return setOrDict();
      case INT:
        advance();
        return new Expression.Literal(Value.of(Long.parseLong(token.text())), span);
      case FLOAT:
        advance();
        return new Expression.Literal(Value.of(Double.parseDouble(token.text())), span);
      case STRING:
        advance();
        return new Expression.Literal(Value.of(token.text()), span);
      case TRUE:
      case FALSE:
        advance();
        return new Expression.Literal(Value.of(token.is(Token.Kind.TRUE)), span);
      case NIL:
        advance();
        return new Expression.Literal(Value.nil(), span);
      case MINUS:
      case BANG:
        {
          advance();
          Expression operand = parsePrecedence(Prec.FACTOR);
          return new Expression.Unary(
              token.is(Token.Kind.MINUS) ? Expression.UnaryOp.NEG : Expression.UnaryOp.NOT,
              operand,
              span);
        }
      case IDENTIFIER:
        {
          // Blob literals are expressions; anything else starting with a name is an assignable.
          Optional<Expression> instance = attempt(this::instance);
          if (instance.isPresent()) return instance.get();
          return new Expression.Get(assignable());
        }
      default:
        throw error("No valid expression starts here");
    }
  }

  private Expression function() throws SyntaxException {
    Span span = expect(Token.Kind.FN, "Expected 'fn' for function expression").span();
    ImmutableList.Builder<Expression.Parameter> params = ImmutableList.builder();
    TypeNode returnType;
    while (true) {
      if (at(Token.Kind.IDENTIFIER)) {
        Token name = advance();
        expect(Token.Kind.COLON, "Expected ':' after parameter name");
        params.add(Expression.Parameter.create(name.text(), type(), name.span()));
        if (!skipIf(Token.Kind.COMMA) && !at(Token.Kind.ARROW) && !at(Token.Kind.LEFT_BRACE)) {
          throw error("Expected ',' '{' or '->' after type parameter");
        }
      } else if (skipIf(Token.Kind.ARROW)) {
        Span voidSpan = peek().span();
        returnType = attempt(this::type).orElse(TypeNode.resolved(Type.voidType(), voidSpan));
        break;
      } else if (at(Token.Kind.LEFT_BRACE)) {
        returnType = TypeNode.resolved(Type.voidType(), peek().span());
        break;
      } else {
        throw error("Unexpected token in function");
      }
    }

    return new Expression.Function("lambda", params.build(), returnType, block(), span);
  }

  /** {@code (1)} is a grouping; {@code (1,)}, {@code ()} and {@code (,)} are tuples. */
  private Expression groupingOrTuple() throws SyntaxException {
    Span span = expect(Token.Kind.LEFT_PAREN, "Expected '('").span();
    skipNewlines();
    boolean isTuple = at(Token.Kind.COMMA) || at(Token.Kind.RIGHT_PAREN);
    skipIf(Token.Kind.COMMA);

    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    int count = 0;
    while (true) {
      skipNewlines();
      if (at(Token.Kind.RIGHT_PAREN) || at(Token.Kind.EOF)) break;

      elements.add(expression());
      count++;
      skipNewlines();
      if (skipIf(Token.Kind.COMMA)) {
        isTuple = true;
      } else if (!at(Token.Kind.RIGHT_PAREN)) {
        throw error("Expected ',' or ')'");
      }
    }
    expect(Token.Kind.RIGHT_PAREN, "Expected ')'");

    ImmutableList<Expression> exprs = elements.build();
    if (!isTuple && count == 1) return exprs.get(0);
    return new Expression.Collection(Expression.CollectionKind.TUPLE, exprs, span);
  }

  private Expression list() throws SyntaxException {
    Span span = expect(Token.Kind.LEFT_BRACKET, "Expected '['").span();
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    while (true) {
      skipNewlines();
      if (at(Token.Kind.RIGHT_BRACKET) || at(Token.Kind.EOF)) break;

      elements.add(expression());
      skipNewlines();
      if (!skipIf(Token.Kind.COMMA) && !at(Token.Kind.RIGHT_BRACKET)) {
        throw error("Expected ',' or ']'");
      }
    }
    expect(Token.Kind.RIGHT_BRACKET, "Expected ']'");
    return new Expression.Collection(Expression.CollectionKind.LIST, elements.build(), span);
  }

  /** {@code {}} is the empty set, {@code {:}} the empty dict. */
  private Expression setOrDict() throws SyntaxException {
    Span span = expect(Token.Kind.LEFT_BRACE, "Expected '{'").span();
    ImmutableList.Builder<Expression> elements = ImmutableList.builder();
    // Undecided until the first ':' or the first element without one.
    Optional<Boolean> isDict = Optional.empty();
    while (true) {
      skipNewlines();
      if (at(Token.Kind.RIGHT_BRACE) || at(Token.Kind.EOF)) break;

      if (at(Token.Kind.COLON)) {
        if (isDict.isPresent()) {
          throw error("Empty dict pair is invalid in a " + (isDict.get() ? "dict" : "set"));
        }
        isDict = Optional.of(true);
        advance();
        continue;
      }

      elements.add(expression());
      if (!isDict.isPresent()) isDict = Optional.of(at(Token.Kind.COLON));
      if (isDict.get()) {
        expect(Token.Kind.COLON, "Expected ':' for dict pair");
        elements.add(expression());
      }
      skipNewlines();
      if (!skipIf(Token.Kind.COMMA) && !at(Token.Kind.RIGHT_BRACE)) {
        throw error("Expected ',' or '}'");
      }
    }
    expect(Token.Kind.RIGHT_BRACE, "Expected '}'");

    return new Expression.Collection(
        isDict.orElse(false) ? Expression.CollectionKind.DICT : Expression.CollectionKind.SET,
        elements.build(),
        span);
  }

  /** {@code A { b: 55 }}. Fails, so the caller can roll back, if this is not a blob literal. */
  private Expression instance() throws SyntaxException {
    Span span = peek().span();
    Assignable blob = assignable();
    expect(Token.Kind.LEFT_BRACE, "Expected '{' after blob name");

    ImmutableList.Builder<String> names = ImmutableList.builder();
    ImmutableList.Builder<Expression> values = ImmutableList.builder();
    while (true) {
      skipNewlines();
      if (at(Token.Kind.RIGHT_BRACE) || at(Token.Kind.EOF)) break;

      Token name = expect(Token.Kind.IDENTIFIER, "Unexpected token in blob initializer");
      expect(Token.Kind.COLON, "Expected ':' after field name");
      names.add(name.text());
      values.add(expression());
      if (!skipIf(Token.Kind.COMMA) && !at(Token.Kind.NEWLINE) && !at(Token.Kind.RIGHT_BRACE)) {
        throw error("Expected a delimiter: newline or ','");
      }
    }
    expect(Token.Kind.RIGHT_BRACE, "Expected '}' after blob initializer");

    if (at(Token.Kind.ELSE)) {
      throw error("Parsed a blob instance not an if-statement");
    }
    return new Expression.Instance(blob, names.build(), values.build(), span);
  }

  Assignable assignable() throws SyntaxException {
    Token name = expect(Token.Kind.IDENTIFIER, "Expected an identifier");
    Assignable result = new Assignable.Read(name.text(), name.span());
    while (true) {
      Span span = peek().span();
      if (skipIf(Token.Kind.LEFT_PAREN)) {
        ImmutableList.Builder<Expression> args = ImmutableList.builder();
        while (true) {
          skipNewlines();
          if (at(Token.Kind.RIGHT_PAREN) || at(Token.Kind.EOF)) break;

          args.add(expression());
          skipNewlines();
          if (!skipIf(Token.Kind.COMMA) && !at(Token.Kind.RIGHT_PAREN)) {
            throw error("Expected ',' or ')' after argument");
          }
        }
        expect(Token.Kind.RIGHT_PAREN, "Expected ')' after arguments");
        result = new Assignable.Call(result, args.build(), span);
      } else if (skipIf(Token.Kind.DOT)) {
        Token field = expect(Token.Kind.IDENTIFIER, "Expected a field name after '.'");
        result = new Assignable.Access(result, field.text(), span);
      } else if (skipIf(Token.Kind.LEFT_BRACKET)) {
        Expression index = expression();
        expect(Token.Kind.RIGHT_BRACKET, "Expected ']' after index");
        result = new Assignable.Index(result, index, span);
      } else {
        return result;
      }
    }
  }
}
