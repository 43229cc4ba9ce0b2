package sylt.processor;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic.Kind;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing of the sylt AST.
 *
 * <p>Every {@link ASTNode} class gets an {@code <Outer>_<Name>_ASTNode} interface implementing
 * {@code accept} and {@code visitChildren} over its {@link ASTChild} accessors. {@code ASTVisitor},
 * {@code DefaultASTVisitor} and {@code VoidDefaultASTVisitor} get one overload per node class.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String PACKAGE = "sylt";

  private static final ClassName NODE = ClassName.get(PACKAGE, "ASTNodeInterface");
  private static final ClassName NODE_UTILS = ClassName.get(PACKAGE, "ASTNodeUtils");
  private static final ClassName VISITOR = ClassName.get(PACKAGE, "ASTVisitor");
  private static final ClassName DEFAULT_VISITOR = ClassName.get(PACKAGE, "DefaultASTVisitor");
  private static final ClassName VOID_VISITOR = ClassName.get(PACKAGE, "VoidDefaultASTVisitor");
  private static final ClassName VOID = ClassName.get(Void.class);
  private static final TypeVariableName V = TypeVariableName.get("V");

  // Accessor results a child may be besides a node.
  private static final ImmutableList<String> CHILD_CONTAINERS =
      ImmutableList.of("java.util.Optional", "java.lang.Iterable");

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  // Sorted so the generated visitors are stable across builds.
  private final Set<ClassName> nodes = new TreeSet<>();
  private boolean visitorsWritten = false;

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    if (roundEnv.processingOver() || annotations.isEmpty()) return true;

    try {
      for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
        writeNodeInterface((TypeElement) element);
        nodes.add(ClassName.get((TypeElement) element));
      }
      // Node classes are all hand-written, so the first round sees every one of them.
      if (!nodes.isEmpty() && !visitorsWritten) {
        writeVisitors();
        visitorsWritten = true;
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }
    return true;
  }

  /** {@code Statement.Block} becomes {@code Statement_Block_ASTNode}. */
  private static String interfaceName(TypeElement element) {
    Deque<String> names = new ArrayDeque<>();
    names.push("ASTNode");
    Element e = element;
    do {
      if (e.getKind() == ElementKind.CLASS) names.addFirst(e.getSimpleName().toString());
      e = e.getEnclosingElement();
    } while (e.getKind() != ElementKind.PACKAGE);
    return String.join("_", names);
  }

  private void error(String message, Element element) {
    processingEnv.getMessager().printMessage(Kind.ERROR, message, element);
  }

  private boolean isChildType(TypeMirror type) {
    // Generated interfaces don't resolve until a later round.
    if (type.getKind() == TypeKind.ERROR) return true;

    Types types = processingEnv.getTypeUtils();
    for (String container : CHILD_CONTAINERS) {
      TypeElement containerElement = processingEnv.getElementUtils().getTypeElement(container);
      if (types.isAssignable(types.erasure(type), types.erasure(containerElement.asType()))) {
        return true;
      }
    }
    TypeElement node = processingEnv.getElementUtils().getTypeElement(NODE.canonicalName());
    return node == null || types.isAssignable(type, node.asType());
  }

  private static MethodSpec.Builder visitorMethod(String name) {
    return MethodSpec.methodBuilder(name)
        .addAnnotation(Override.class)
        .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
        .addTypeVariable(V)
        .returns(V)
        .addParameter(ParameterizedTypeName.get(VISITOR, V), "visitor")
        .addParameter(V, "value");
  }

  private void writeNodeInterface(TypeElement element) throws IOException {
    String name = interfaceName(element);
    if (element.getInterfaces().stream().noneMatch(i -> i.toString().endsWith(name))) {
      error("AST node must implement " + name, element);
      return;
    }

    TypeSpec.Builder spec =
        TypeSpec.interfaceBuilder(name)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(NODE)
            .addJavadoc("Visitor plumbing of {@link $T}.\n", ClassName.get(element))
            .addMethod(
                visitorMethod("accept")
                    .addStatement("return visitor.visit(($T) this, value)", ClassName.get(element))
                    .build());

    MethodSpec.Builder visitChildren = visitorMethod("visitChildren");
    for (Element enclosed : element.getEnclosedElements()) {
      if (enclosed.getKind() != ElementKind.METHOD) continue;
      if (enclosed.getAnnotation(ASTChild.class) == null) continue;

      ExecutableElement child = (ExecutableElement) enclosed;
      if (child.getAnnotation(Override.class) == null) {
        error("@ASTChild accessor must be marked @Override", child);
      }
      if (!child.getParameters().isEmpty()) {
        error("@ASTChild accessor must not take parameters", child);
      }
      if (!isChildType(child.getReturnType())) {
        error("@ASTChild accessor must return a node, an Optional or an Iterable", child);
      }

      spec.addMethod(
          MethodSpec.methodBuilder(child.getSimpleName().toString())
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(child.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", NODE_UTILS, child.getSimpleName());
    }
    spec.addMethod(visitChildren.addStatement("return value").build());

    JavaFile.builder(PACKAGE, spec.build())
        .skipJavaLangImports(true)
        .build()
        .writeTo(processingEnv.getFiler());
  }

  private void writeVisitors() throws IOException {
    TypeSpec.Builder visitor =
        TypeSpec.interfaceBuilder(VISITOR)
            .addTypeVariable(V)
            .addJavadoc("Visits sylt AST nodes, threading a value of type {@code V}.\n");
    TypeSpec.Builder defaultVisitor =
        TypeSpec.classBuilder(DEFAULT_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(VISITOR, V))
            .addJavadoc("Visits every sylt AST node's children, in accessor order.\n");
    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder(VOID_VISITOR)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(DEFAULT_VISITOR, VOID))
            .addJavadoc(
                "A sylt AST pass with no threaded value. Override {@code visitImpl} for the"
                    + " nodes of interest.\n");

    for (ClassName node : nodes) {
      visitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .build());
      defaultVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(VOID)
              .addParameter(node, "node")
              .addParameter(VOID, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(node, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }

    for (TypeSpec.Builder spec : ImmutableList.of(visitor, defaultVisitor, voidVisitor)) {
      JavaFile.builder(PACKAGE, spec.build()).build().writeTo(processingEnv.getFiler());
    }
  }
}
