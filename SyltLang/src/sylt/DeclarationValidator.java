package sylt;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural checks that need no name resolution: duplicate parameters and fields, {@code ret}
 * outside a function, and imports or blob definitions below the top level.
 */
public class DeclarationValidator extends ErrorCollectingValidator {

  private int functionDepth = 0;
  private int blockDepth = 0;

  @Override
  public void visitImpl(Expression.Function function) {
    Set<String> names = new HashSet<>();
    for (Expression.Parameter param : function.params()) {
      if (!names.add(param.name())) {
        logError(param.span(), String.format("Duplicate parameter '%s'", param.name()));
      }
    }

    functionDepth++;
    super.visitImpl(function);
    functionDepth--;
  }

  @Override
  public void visitImpl(Expression.Instance instance) {
    super.visitImpl(instance);

    Set<String> names = new HashSet<>();
    for (int i = 0; i < instance.fieldNames().size(); i++) {
      String name = instance.fieldNames().get(i);
      if (!names.add(name)) {
        logError(
            instance.fieldValues().get(i).span(),
            String.format("Field '%s' is initialized twice", name));
      }
    }
  }

  @Override
  public void visitImpl(Statement.Blob blob) {
    if (blockDepth > 0) {
      logError(blob.span(), "Blobs can only be defined at the top level of a module");
    }

    Set<String> names = new HashSet<>();
    for (Statement.Field field : blob.fields()) {
      if (!names.add(field.name())) {
        logError(
            field.span(),
            String.format("Duplicate field '%s' in blob '%s'", field.name(), blob.name()));
      }
    }
  }

  @Override
  public void visitImpl(Statement.Use use) {
    if (blockDepth > 0) {
      logError(use.span(), "'use' is only allowed at the top level of a module");
    }
  }

  @Override
  public void visitImpl(Statement.Ret ret) {
    super.visitImpl(ret);
    if (functionDepth == 0) {
      logError(ret.span(), "Cannot return outside of a function");
    }
  }

  @Override
  public void visitImpl(Statement.Block block) {
    blockDepth++;
    super.visitImpl(block);
    blockDepth--;
  }
}
