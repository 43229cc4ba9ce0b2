package sylt;

/** Base of every error the pipeline reports to a user: it always knows where it happened. */
public abstract class SyltException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Span span;
  private final String errorMsg;

  protected SyltException(Span span, String errorMsg) {
    super(errorMsg);
    this.span = span;
    this.errorMsg = errorMsg;
  }

  public Span span() {
    return span;
  }

  public String errorMsg() {
    return errorMsg;
  }

  /** The short error category printed in front of the message. */
  protected abstract String category();

  public String render() {
    return String.format("%s: %s@%d %s", category(), span.file(), span.line(), errorMsg);
  }

  public void print() {
    System.out.println(render());
  }
}
