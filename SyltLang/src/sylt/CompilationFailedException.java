package sylt;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Thrown when a pipeline stage collected one or more errors; carries all of them. */
public class CompilationFailedException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<SyltException> errors;

  public CompilationFailedException(List<? extends SyltException> errors) {
    super(errors.isEmpty() ? "" : errors.size() + " error(s), first: " + errors.get(0).render());
    Preconditions.checkArgument(!errors.isEmpty(), "no errors");
    this.errors = ImmutableList.copyOf(errors);
  }

  public ImmutableList<SyltException> errors() {
    return errors;
  }

  public void printErrors() {
    errors.forEach(SyltException::print);
  }
}
