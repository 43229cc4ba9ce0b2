package sylt;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class SourceLoaderTest {

  private static Path resource(String name) throws Exception {
    return Path.of(SourceLoaderTest.class.getResource("/" + name).toURI());
  }

  @Test
  public void pathToModule() {
    SourceLoader loader = new SourceLoader();
    assertThat(loader.pathToModule(Path.of("/src/game/main.sy"), "util").toString())
        .isEqualTo(Path.of("/src/game/util.sy").toString());
    assertThat(new SourceLoader("sylt").pathToModule(Path.of("main.sylt"), "util").toString())
        .isEqualTo("util.sylt");
  }

  @Test
  public void loadsImportsTransitively() throws Exception {
    Prog prog = new SourceLoader().load(resource("modules/main.sy"));
    ImmutableList<String> stems =
        prog.modules().stream().map(Module::stem).collect(ImmutableList.toImmutableList());
    assertThat(stems).containsExactly("main", "geometry", "util").inOrder();
    assertThat(prog.entry().stem()).isEqualTo("main");
  }

  @Test
  public void compilesAndRunsAModuleTree() throws Exception {
    SyltOptions options = SyltOptions.create(false, false, "sy", true);
    Program program = Sylt.compile(resource("modules/main.sy"), options);
    assertThat(Sylt.typecheck(program)).isEmpty();

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    Sylt.run(program, new PrintStream(bytes, true, StandardCharsets.UTF_8), false);
    assertThat(bytes.toString(StandardCharsets.UTF_8))
        .isEqualTo(SyltTesting.printed("25", "14"));
  }

  @Test
  public void missingImport() throws Exception {
    CompilationFailedException ex =
        assertThrows(
            CompilationFailedException.class,
            () -> new SourceLoader().load(resource("missing/main.sy")));
    assertThat(ex.errors()).hasSize(1);
    assertThat(ex.errors().get(0).errorMsg()).startsWith("Cannot find module 'nowhere'");
    assertThat(ex.errors().get(0).span().line()).isEqualTo(1);
  }

  @Test
  public void syntaxErrorsInImports() throws Exception {
    CompilationFailedException ex =
        assertThrows(
            CompilationFailedException.class,
            () -> new SourceLoader().load(resource("broken/main.sy")));
    assertThat(ex.errors()).hasSize(1);
    assertThat(ex.errors().get(0)).isInstanceOf(SyntaxException.class);
    assertThat(ex.errors().get(0).span().file()).endsWith("bad.sy");
  }

  @Test
  public void missingEntry() {
    assertThrows(
        IOException.class,
        () -> new SourceLoader().load(Path.of("/definitely/not/here.sy")));
  }
}
