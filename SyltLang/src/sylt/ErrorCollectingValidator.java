package sylt;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<CompileException> errors = new ArrayList<>();

  protected ImmutableList<CompileException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(Span span, String msg) {
    logError(new CompileException(span, msg));
  }

  protected void logError(CompileException ex) {
    errors.add(ex);
  }
}
