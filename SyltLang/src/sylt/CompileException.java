package sylt;

public class CompileException extends SyltException {
  private static final long serialVersionUID = 1L;

  public CompileException(Span span, String errorMsg) {
    super(span, errorMsg);
  }

  @Override
  protected String category() {
    return "COMPILE ERROR";
  }
}
