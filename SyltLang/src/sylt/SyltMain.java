package sylt;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import ch.qos.logback.classic.Level;

public class SyltMain {
  private static final Logger logger = LoggerFactory.getLogger(SyltMain.class);

  private static final String USAGE =
      "Usage: sylt [-v | -vv] [-c out_file] source_file\n"
          + "       sylt [-v | -vv] -r program_file";

  public static void main(String[] args) throws IOException {
    SyltOptions options = SyltOptions.load();
    Optional<String> compileTo = Optional.empty();
    boolean runBinary = false;
    String input = null;

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "-v":
          options = options.withPrintBytecode(true);
          setLogLevel(Level.INFO);
          break;
        case "-vv":
          options = options.withPrintBytecode(true).withTrace(true);
          setLogLevel(Level.TRACE);
          break;
        case "-c":
          if (++i == args.length) usage();
          compileTo = Optional.of(args[i]);
          break;
        case "-r":
          runBinary = true;
          break;
        default:
          if (input != null || args[i].startsWith("-")) usage();
          input = args[i];
      }
    }
    if (input == null || (runBinary && compileTo.isPresent())) usage();

    Program program;
    if (runBinary) {
      try {
        byte[] bytes = Files.toByteArray(new File(input));
        program = ProgramReader.read(bytes, StandardLibrary.functions());
      } catch (VmException ex) {
        ex.print();
        System.exit(1);
        return;
      }
    } else {
      try {
        program = Sylt.compile(Path.of(input), options);
      } catch (CompilationFailedException ex) {
        ex.printErrors();
        System.out.println("Compilation failed.  See errors above.");
        System.exit(1);
        return;
      }
    }

    if (compileTo.isPresent()) {
      Files.asByteSink(new File(compileTo.get())).write(ProgramWriter.write(program));
      logger.info("Wrote {}", compileTo.get());
      return;
    }

    if (options.typecheck()) {
      ImmutableList<VmException> errors = Sylt.typecheck(program);
      if (!errors.isEmpty()) {
        errors.forEach(VmException::print);
        System.out.println("Typecheck failed.  See errors above.");
        System.exit(1);
      }
    }

    try {
      Sylt.run(program, System.out, options.trace());
    } catch (VmException ex) {
      ex.print();
      System.exit(1);
    }
  }

  private static void setLogLevel(Level level) {
    ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("sylt")).setLevel(level);
  }

  private static void usage() {
    System.err.println(USAGE);
    System.exit(1);
  }
}
