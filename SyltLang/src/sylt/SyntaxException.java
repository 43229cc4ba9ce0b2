package sylt;

public class SyntaxException extends SyltException {
  private static final long serialVersionUID = 1L;

  public SyntaxException(Span span, String errorMsg) {
    super(span, errorMsg);
  }

  @Override
  protected String category() {
    return "SYNTAX ERROR";
  }
}
