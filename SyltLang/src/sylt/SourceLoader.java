package sylt;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/** Reads and parses an entry file and, transitively, every module it imports. */
public final class SourceLoader {
  private static final Logger logger = LoggerFactory.getLogger(SourceLoader.class);

  private final String extension;

  public SourceLoader(String extension) {
    this.extension = extension;
  }

  public SourceLoader() {
    this("sy");
  }

  /** The file {@code use name} refers to from {@code currentFile}: a sibling source file. */
  public Path pathToModule(Path currentFile, String name) {
    return currentFile.resolveSibling(name + "." + extension);
  }

  /**
   * Loads the program rooted at {@code entry}. Modules are in load order, entry first.
   *
   * @throws IOException if the entry file cannot be read
   * @throws CompilationFailedException on syntax errors, or imports that cannot be read
   */
  public Prog load(Path entry) throws IOException, CompilationFailedException {
    List<Module> modules = new ArrayList<>();
    List<SyltException> errors = new ArrayList<>();

    Set<Path> seen = new HashSet<>();
    Deque<Path> queue = new ArrayDeque<>();
    Path root = entry.normalize();
    queue.add(root);
    seen.add(root);

    while (!queue.isEmpty()) {
      Path file = queue.remove();
      Parser.Result result = Parser.parse(file, read(file));
      logger.debug("Parsed {}: {} syntax errors", file, result.errors().size());
      modules.add(result.module());
      errors.addAll(result.errors());

      for (Map.Entry<String, Span> use : ImportCollector.collect(result.module()).entrySet()) {
        Path imported = pathToModule(file, use.getKey()).normalize();
        if (seen.contains(imported)) continue;
        if (!imported.toFile().isFile()) {
          errors.add(
              new CompileException(
                  use.getValue(),
                  String.format("Cannot find module '%s' at %s", use.getKey(), imported)));
          continue;
        }
        seen.add(imported);
        queue.add(imported);
      }
    }

    if (!errors.isEmpty()) throw new CompilationFailedException(errors);
    return new Prog(ImmutableList.copyOf(modules));
  }

  private static String read(Path file) throws IOException {
    return Files.asCharSource(file.toFile(), StandardCharsets.UTF_8).read();
  }
}
