package sylt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Runs a program in the VM's typecheck mode: the entry block first, then every function block on
 * top of the globals the entry block left behind. Each block reports at most its first error.
 */
public final class Typechecker {
  private static final Logger logger = LoggerFactory.getLogger(Typechecker.class);

  private Typechecker() {}

  public static ImmutableList<VmException> check(Program program) {
    return check(new Vm(program));
  }

  static ImmutableList<VmException> check(Vm vm) {
    Program program = vm.program();
    ImmutableList.Builder<VmException> errors = ImmutableList.builder();

    try {
      vm.checkEntry();
    } catch (VmException e) {
      errors.add(e);
    }
    for (int block = 1; block < program.blocks().size(); block++) {
      try {
        vm.checkBlock(block);
      } catch (VmException e) {
        errors.add(e);
      }
    }

    ImmutableList<VmException> result = errors.build();
    logger.debug("Typechecked {} blocks, {} errors", program.blocks().size(), result.size());
    return result;
  }
}
