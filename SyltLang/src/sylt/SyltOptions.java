package sylt;

import com.google.auto.value.AutoValue;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/** Settings of the toolchain, read from the {@code sylt} block of the Typesafe config. */
@AutoValue
public abstract class SyltOptions {

  /** Log every executed op at TRACE. */
  public abstract boolean trace();

  /** Log the disassembled program after compiling. */
  public abstract boolean printBytecode();

  /** Extension of source files, without the dot. */
  public abstract String sourceExtension();

  /** Typecheck before running. */
  public abstract boolean typecheck();

  public static SyltOptions create(
      boolean trace, boolean printBytecode, String sourceExtension, boolean typecheck) {
    return new AutoValue_SyltOptions(trace, printBytecode, sourceExtension, typecheck);
  }

  /** Defaults from {@code reference.conf}, overridden by {@code application.conf}. */
  public static SyltOptions load() {
    return fromConfig(ConfigFactory.load());
  }

  public static SyltOptions fromConfig(Config config) {
    Config sylt = config.getConfig("sylt");
    return create(
        sylt.getBoolean("vm.trace"),
        sylt.getBoolean("vm.print-bytecode"),
        sylt.getString("source.extension"),
        sylt.getBoolean("typecheck.enabled"));
  }

  public SyltOptions withTrace(boolean trace) {
    return create(trace, printBytecode(), sourceExtension(), typecheck());
  }

  public SyltOptions withPrintBytecode(boolean printBytecode) {
    return create(trace(), printBytecode, sourceExtension(), typecheck());
  }
}
