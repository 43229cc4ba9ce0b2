package sylt;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/** Collects the modules a module imports with {@code use}, with where each import happens. */
public class ImportCollector extends VoidDefaultASTVisitor {
  private final Map<String, Span> imports = new LinkedHashMap<>();

  public static ImmutableMap<String, Span> collect(Module module) {
    ImportCollector collector = new ImportCollector();
    module.accept(collector, null);
    return ImmutableMap.copyOf(collector.imports);
  }

  @Override
  public void visitImpl(Statement.Use use) {
    imports.putIfAbsent(use.module(), use.span());
  }
}
