package sylt;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import sylt.processor.ASTChild;
import sylt.processor.ASTNode;

/** A whole parsed program. The first module is the entry point. */
@ASTNode
public final class Prog implements Prog_ASTNode {
  private final ImmutableList<Module> modules;

  public Prog(ImmutableList<Module> modules) {
    Preconditions.checkArgument(!modules.isEmpty(), "Cannot build an empty program");
    this.modules = modules;
  }

  public Module entry() {
    return modules.get(0);
  }

  @ASTChild
  @Override
  public ImmutableList<Module> modules() {
    return modules;
  }
}
