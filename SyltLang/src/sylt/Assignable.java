package sylt;

import com.google.common.collect.ImmutableList;

import sylt.processor.ASTChild;
import sylt.processor.ASTNode;

/** Anything that can be read, and possibly written: variables, calls, fields and indices. */
public abstract class Assignable implements ASTNodeInterface {

  public enum Kind {
    READ,
    CALL,
    ACCESS,
    INDEX;
  }

  private final Kind kind;
  private final Span span;

  protected Assignable(Kind kind, Span span) {
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
  public <T extends Assignable> T cast() {
    return (T) this;
  }

  @ASTNode
  public static final class Read extends Assignable implements Assignable_Read_ASTNode {
    private final String name;

    public Read(String name, Span span) {
      super(Kind.READ, span);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  @ASTNode
  public static final class Call extends Assignable implements Assignable_Call_ASTNode {
    private final Assignable callee;
    private final ImmutableList<Expression> args;

    public Call(Assignable callee, ImmutableList<Expression> args, Span span) {
      super(Kind.CALL, span);
      this.callee = callee;
      this.args = args;
    }

    @ASTChild
    @Override
    public Assignable callee() {
      return callee;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> args() {
      return args;
    }

    /** The same call with {@code first} prepended, for {@code a -> f(b)}. */
    public Call withFirstArg(Expression first) {
      return new Call(
          callee, ImmutableList.<Expression>builder().add(first).addAll(args).build(), span());
    }

    @Override
    public String toString() {
      return callee + Expression.join(args, "(", ")");
    }
  }

  @ASTNode
  public static final class Access extends Assignable implements Assignable_Access_ASTNode {
    private final Assignable target;
    private final String field;

    public Access(Assignable target, String field, Span span) {
      super(Kind.ACCESS, span);
      this.target = target;
      this.field = field;
    }

    @ASTChild
    @Override
    public Assignable target() {
      return target;
    }

    public String field() {
      return field;
    }

    @Override
    public String toString() {
      return target + "." + field;
    }
  }

  @ASTNode
  public static final class Index extends Assignable implements Assignable_Index_ASTNode {
    private final Assignable target;
    private final Expression index;

    public Index(Assignable target, Expression index, Span span) {
      super(Kind.INDEX, span);
      this.target = target;
      this.index = index;
    }

    @ASTChild
    @Override
    public Assignable target() {
      return target;
    }

    @ASTChild
    @Override
    public Expression index() {
      return index;
    }

    @Override
    public String toString() {
      return target + "[" + index + "]";
    }
  }
}
