package sylt;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/** Entry points of the toolchain: load, compile, typecheck and run. */
public final class Sylt {
  private static final Logger logger = LoggerFactory.getLogger(Sylt.class);

  private Sylt() {}

  public static Program compile(Prog prog, ImmutableList<ExternFunction> externs)
      throws CompilationFailedException {
    return new Compiler(prog, externs).compile();
  }

  /** Loads {@code entry} and its imports and compiles them against the standard library. */
  public static Program compile(Path entry, SyltOptions options)
      throws IOException, CompilationFailedException {
    Prog prog = new SourceLoader(options.sourceExtension()).load(entry);
    Program program = compile(prog, StandardLibrary.functions());
    if (options.printBytecode()) logger.info("Bytecode of {}:\n{}", entry, program.disassemble());
    return program;
  }

  /** Every type error in {@code program}; empty when it typechecks. */
  public static ImmutableList<VmException> typecheck(Program program) {
    return Typechecker.check(program);
  }

  public static void run(Program program) throws VmException {
    run(program, System.out, false);
  }

  public static void run(Program program, PrintStream out, boolean trace) throws VmException {
    new Vm(program, out, trace).run();
  }
}
