package sylt;

import java.nio.file.Path;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import sylt.processor.ASTChild;
import sylt.processor.ASTNode;

/** The parsed statements of one source file. */
@ASTNode
public final class Module implements Module_ASTNode {
  private final Path file;
  private final Span span;
  private final ImmutableList<Statement> statements;

  public Module(Path file, Span span, ImmutableList<Statement> statements) {
    this.file = file;
    this.span = span;
    this.statements = statements;
  }

  public Path file() {
    return file;
  }

  /** The name other modules import this one by. */
  public String stem() {
    return Files.getNameWithoutExtension(file.getFileName().toString());
  }

  public Span span() {
    return span;
  }

  @ASTChild
  @Override
  public ImmutableList<Statement> statements() {
    return statements;
  }
}
