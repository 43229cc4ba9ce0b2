package sylt;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import sylt.processor.ASTChild;
import sylt.processor.ASTNode;

public abstract class Statement implements ASTNodeInterface {

  public enum Kind {
    DEFINITION,
    ASSIGNMENT,
    PRINT,
    STATEMENT_EXPRESSION,
    USE,
    BLOB,
    BLOCK,
    IF,
    LOOP,
    RET,
    EMPTY;
  }

  public enum VarKind {
    // name :: value
    CONST,
    // name := value
    MUTABLE;
  }

  public enum AssignOp {
    ASSIGN("=", null),
    ADD("+=", Expression.BinaryOp.ADD),
    SUB("-=", Expression.BinaryOp.SUB),
    MUL("*=", Expression.BinaryOp.MUL),
    DIV("/=", Expression.BinaryOp.DIV);

    private final String symbol;
    private final Expression.BinaryOp binaryOp;

    AssignOp(String symbol, Expression.BinaryOp binaryOp) {
      this.symbol = symbol;
      this.binaryOp = binaryOp;
    }

    public String symbol() {
      return symbol;
    }

    /** The arithmetic performed before storing, for compound assignments. */
    public Optional<Expression.BinaryOp> binaryOp() {
      return Optional.ofNullable(binaryOp);
    }
  }

  private final Kind kind;
  private final Span span;

  protected Statement(Kind kind, Span span) {
    this.kind = kind;
    this.span = span;
  }

  public final Kind kind() {
    return kind;
  }

  public final Span span() {
    return span;
  }

  @SuppressWarnings("unchecked")
  public <T extends Statement> T cast() {
    return (T) this;
  }

  @ASTNode
  public static final class Definition extends Statement
      implements Statement_Definition_ASTNode {
    private final String name;
    private final VarKind varKind;
    private final Optional<TypeNode> type;
    private final Expression value;

    public Definition(
        String name, VarKind varKind, Optional<TypeNode> type, Expression value, Span span) {
      super(Kind.DEFINITION, span);
      this.name = name;
      this.varKind = varKind;
      this.type = type;
      this.value = value;
    }

    public String name() {
      return name;
    }

    public VarKind varKind() {
      return varKind;
    }

    public boolean isConstant() {
      return varKind == VarKind.CONST;
    }

    public Optional<TypeNode> type() {
      return type;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    @Override
    public String toString() {
      String op = varKind == VarKind.CONST ? "::" : ":=";
      if (type.isPresent()) {
        op = ": " + type.get() + (varKind == VarKind.CONST ? " :" : " =");
      }
      return String.format("%s %s %s", name, op, value);
    }
  }

  @ASTNode
  public static final class Assignment extends Statement
      implements Statement_Assignment_ASTNode {
    private final AssignOp op;
    private final Assignable target;
    private final Expression value;

    public Assignment(AssignOp op, Assignable target, Expression value, Span span) {
      super(Kind.ASSIGNMENT, span);
      this.op = op;
      this.target = target;
      this.value = value;
    }

    public AssignOp op() {
      return op;
    }

    @ASTChild
    @Override
    public Assignable target() {
      return target;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    @Override
    public String toString() {
      return String.format("%s %s %s", target, op.symbol(), value);
    }
  }

  @ASTNode
  public static final class Print extends Statement implements Statement_Print_ASTNode {
    private final Expression value;

    public Print(Expression value, Span span) {
      super(Kind.PRINT, span);
      this.value = value;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    @Override
    public String toString() {
      return "print " + value;
    }
  }

  @ASTNode
  public static final class StatementExpression extends Statement
      implements Statement_StatementExpression_ASTNode {
    private final Expression value;

    public StatementExpression(Expression value, Span span) {
      super(Kind.STATEMENT_EXPRESSION, span);
      this.value = value;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  @ASTNode
  public static final class Use extends Statement implements Statement_Use_ASTNode {
    private final String module;

    public Use(String module, Span span) {
      super(Kind.USE, span);
      this.module = module;
    }

    public String module() {
      return module;
    }

    @Override
    public String toString() {
      return "use " + module;
    }
  }

  @AutoValue
  public abstract static class Field {
    public abstract String name();

    public abstract TypeNode type();

    public abstract Span span();

    public static Field create(String name, TypeNode type, Span span) {
      return new AutoValue_Statement_Field(name, type, span);
    }
  }

  @ASTNode
  public static final class Blob extends Statement implements Statement_Blob_ASTNode {
    private final String name;
    private final ImmutableList<Field> fields;

    public Blob(String name, ImmutableList<Field> fields, Span span) {
      super(Kind.BLOB, span);
      this.name = name;
      this.fields = fields;
    }

    public String name() {
      return name;
    }

    public ImmutableList<Field> fields() {
      return fields;
    }

    @Override
    public String toString() {
      return name + " :: blob";
    }
  }

  @ASTNode
  public static final class Block extends Statement implements Statement_Block_ASTNode {
    private final ImmutableList<Statement> statements;

    public Block(ImmutableList<Statement> statements, Span span) {
      super(Kind.BLOCK, span);
      this.statements = statements;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> statements() {
      return statements;
    }

    @Override
    public String toString() {
      return Expression.join(statements, "{ ", " }");
    }
  }

  @ASTNode
  public static final class If extends Statement implements Statement_If_ASTNode {
    private final Expression condition;
    private final Block then;
    private final Optional<Statement> otherwise;

    public If(Expression condition, Block then, Optional<Statement> otherwise, Span span) {
      super(Kind.IF, span);
      this.condition = condition;
      this.then = then;
      this.otherwise = otherwise;
    }

    @ASTChild
    @Override
    public Expression condition() {
      return condition;
    }

    @ASTChild
    @Override
    public Block then() {
      return then;
    }

    /** Either a {@link Block} or, for {@code else if}, another {@link If}. */
    @ASTChild
    @Override
    public Optional<Statement> otherwise() {
      return otherwise;
    }

    @Override
    public String toString() {
      return "if " + condition + " " + then + otherwise.map(s -> " else " + s).orElse("");
    }
  }

  @ASTNode
  public static final class Loop extends Statement implements Statement_Loop_ASTNode {
    private final Optional<Expression> condition;
    private final Block body;

    public Loop(Optional<Expression> condition, Block body, Span span) {
      super(Kind.LOOP, span);
      this.condition = condition;
      this.body = body;
    }

    @ASTChild
    @Override
    public Optional<Expression> condition() {
      return condition;
    }

    @ASTChild
    @Override
    public Block body() {
      return body;
    }

    @Override
    public String toString() {
      return "loop " + condition.map(c -> c + " ").orElse("") + body;
    }
  }

  @ASTNode
  public static final class Ret extends Statement implements Statement_Ret_ASTNode {
    private final Optional<Expression> value;

    public Ret(Optional<Expression> value, Span span) {
      super(Kind.RET, span);
      this.value = value;
    }

    @ASTChild
    @Override
    public Optional<Expression> value() {
      return value;
    }

    @Override
    public String toString() {
      return "ret" + value.map(v -> " " + v).orElse("");
    }
  }

  @ASTNode
  public static final class Empty extends Statement implements Statement_Empty_ASTNode {
    public Empty(Span span) {
      super(Kind.EMPTY, span);
    }

    @Override
    public String toString() {
      return "";
    }
  }
}
