package sylt;

import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import sylt.processor.ASTChild;
import sylt.processor.ASTNode;

/** Expressions produce exactly one value on the stack when compiled. */
public abstract class Expression implements ASTNodeInterface {

  public enum Kind {
    LITERAL,
    BINARY,
    UNARY,
    COLLECTION,
    FUNCTION,
    INSTANCE,
    GET;
  }

  public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    EQ("=="),
    NEQ("!="),
    GT(">"),
    GTEQ(">="),
    LT("<"),
    LTEQ("<="),
    AND("&&"),
    OR("||"),
    ASSERT_EQ("<=>"),
    IN("in");

    private final String symbol;

    BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  public enum UnaryOp {
    NEG("-"),
    NOT("!");

    private final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  public enum CollectionKind {
    TUPLE,
    LIST,
    SET,
    DICT;
  }

  private final Kind kind;
  private final Span span;

  protected Expression(Kind kind, Span span) {
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
  public <T extends Expression> T cast() {
    return (T) this;
  }

  @ASTNode
  public static final class Literal extends Expression implements Expression_Literal_ASTNode {
    private final Value value;

    public Literal(Value value, Span span) {
      super(Kind.LITERAL, span);
      this.value = value;
    }

    public Value value() {
      return value;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  @ASTNode
  public static final class Binary extends Expression implements Expression_Binary_ASTNode {
    private final BinaryOp op;
    private final Expression lhs;
    private final Expression rhs;

    public Binary(BinaryOp op, Expression lhs, Expression rhs, Span span) {
      super(Kind.BINARY, span);
      this.op = op;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    public BinaryOp op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression lhs() {
      return lhs;
    }

    @ASTChild
    @Override
    public Expression rhs() {
      return rhs;
    }

    @Override
    public String toString() {
      return String.format("(%s %s %s)", lhs, op.symbol(), rhs);
    }
  }

  @ASTNode
  public static final class Unary extends Expression implements Expression_Unary_ASTNode {
    private final UnaryOp op;
    private final Expression operand;

    public Unary(UnaryOp op, Expression operand, Span span) {
      super(Kind.UNARY, span);
      this.op = op;
      this.operand = operand;
    }

    public UnaryOp op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression operand() {
      return operand;
    }

    @Override
    public String toString() {
      return String.format("(%s%s)", op.symbol(), operand);
    }
  }

  /** Tuple, list, set or dict literal. Dict elements alternate key, value. */
  @ASTNode
  public static final class Collection extends Expression
      implements Expression_Collection_ASTNode {
    private final CollectionKind collectionKind;
    private final ImmutableList<Expression> elements;

    public Collection(
        CollectionKind collectionKind, ImmutableList<Expression> elements, Span span) {
      super(Kind.COLLECTION, span);
      Preconditions.checkArgument(
          collectionKind != CollectionKind.DICT || elements.size() % 2 == 0,
          "dict literal needs key-value pairs");
      this.collectionKind = collectionKind;
      this.elements = elements;
    }

    public CollectionKind collectionKind() {
      return collectionKind;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> elements() {
      return elements;
    }

    @Override
    public String toString() {
      switch (collectionKind) {
        case TUPLE:
          return elements.size() == 1
              ? "(" + elements.get(0) + ",)"
              : join(elements, "(", ")");
        case LIST:
          return join(elements, "[", "]");
        case SET:
          return join(elements, "{", "}");
        case DICT:
          if (elements.isEmpty()) return "{:}";
          StringBuilder sb = new StringBuilder("{");
          for (int i = 0; i < elements.size(); i += 2) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i)).append(": ").append(elements.get(i + 1));
          }
          return sb.append("}").toString();
      }
      throw new AssertionError(collectionKind);
    }
  }

  @AutoValue
  public abstract static class Parameter {
    public abstract String name();

    public abstract TypeNode type();

    public abstract Span span();

    public static Parameter create(String name, TypeNode type, Span span) {
      return new AutoValue_Expression_Parameter(name, type, span);
    }
  }

  @ASTNode
  public static final class Function extends Expression implements Expression_Function_ASTNode {
    private final String name;
    private final ImmutableList<Parameter> params;
    private final TypeNode returnType;
    private final Statement.Block body;

    public Function(
        String name,
        ImmutableList<Parameter> params,
        TypeNode returnType,
        Statement.Block body,
        Span span) {
      super(Kind.FUNCTION, span);
      this.name = name;
      this.params = params;
      this.returnType = returnType;
      this.body = body;
    }

    /** Name of the block this literal compiles to; the defining variable when there is one. */
    public String name() {
      return name;
    }

    public Function withName(String name) {
      return new Function(name, params, returnType, body, span());
    }

    public ImmutableList<Parameter> params() {
      return params;
    }

    public TypeNode returnType() {
      return returnType;
    }

    @ASTChild
    @Override
    public Statement.Block body() {
      return body;
    }

    @Override
    public String toString() {
      return String.format(
          "fn %s -> %s",
          params.stream().map(p -> p.name() + ": " + p.type()).collect(Collectors.joining(", ")),
          returnType);
    }
  }

  /** Blob literal: {@code Point { x: 1, y: 2 }}. */
  @ASTNode
  public static final class Instance extends Expression implements Expression_Instance_ASTNode {
    private final Assignable blob;
    private final ImmutableList<String> fieldNames;
    private final ImmutableList<Expression> fieldValues;

    public Instance(
        Assignable blob,
        ImmutableList<String> fieldNames,
        ImmutableList<Expression> fieldValues,
        Span span) {
      super(Kind.INSTANCE, span);
      Preconditions.checkArgument(fieldNames.size() == fieldValues.size());
      this.blob = blob;
      this.fieldNames = fieldNames;
      this.fieldValues = fieldValues;
    }

    @ASTChild
    @Override
    public Assignable blob() {
      return blob;
    }

    public ImmutableList<String> fieldNames() {
      return fieldNames;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> fieldValues() {
      return fieldValues;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder().append(blob).append(" {");
      for (int i = 0; i < fieldNames.size(); i++) {
        sb.append(i == 0 ? " " : ", ").append(fieldNames.get(i)).append(": ");
        sb.append(fieldValues.get(i));
      }
      return sb.append(" }").toString();
    }
  }

  @ASTNode
  public static final class Get extends Expression implements Expression_Get_ASTNode {
    private final Assignable assignable;

    public Get(Assignable assignable) {
      super(Kind.GET, assignable.span());
      this.assignable = assignable;
    }

    @ASTChild
    @Override
    public Assignable assignable() {
      return assignable;
    }

    @Override
    public String toString() {
      return assignable.toString();
    }
  }

  static String join(ImmutableList<?> elements, String prefix, String suffix) {
    return elements.stream()
        .map(Object::toString)
        .collect(Collectors.joining(", ", prefix, suffix));
  }
}
