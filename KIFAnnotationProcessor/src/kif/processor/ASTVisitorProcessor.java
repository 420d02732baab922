package kif.processor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic.Kind;
import javax.tools.FileObject;
import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing for the KIF syntax tree.
 *
 * <p>For every {@link ASTNode} class {@code kif.Outer.Inner} an interface {@code
 * Outer_Inner_ASTNode} is written with default {@code accept} and {@code visitChildren} methods.
 * In the same round {@code ASTVisitor}, {@code DefaultASTVisitor} and {@code
 * VoidDefaultASTVisitor} are written with one overload per node class, so every node class must
 * be seen in the first round that carries the annotations. The set of node classes is
 * persisted to the class output so incremental compiles still see every node.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String PACKAGE = "kif";
  private static final String NODE_LIST = "META-INF/kifNodes/list.txt";
  private static final String NODE_TYPE = PACKAGE + ".Node";

  private static final ClassName AST_NODE_INTERFACE_NAME =
      ClassName.get(PACKAGE, "ASTNodeInterface");
  private static final ClassName AST_VISITOR_NAME = ClassName.get(PACKAGE, "ASTVisitor");
  private static final ClassName AST_NODE_UTILS_NAME = ClassName.get(PACKAGE, "ASTNodeUtils");
  private static final TypeVariableName V = TypeVariableName.get("V");

  private final Set<String> nodeClassNames = new TreeSet<>();
  private boolean visitorsWritten = false;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    if (visitorsWritten || annotations.isEmpty()) return true;

    // Visitors go out in the same round as the node interfaces so that the next round compiles
    // them along with everything that refers to them.
    try {
      processNodes(roundEnv);
      mergeNodeList();
      writeVisitors();
      visitorsWritten = true;
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  private void processNodes(RoundEnvironment roundEnv) {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      try {
        writeNodeInterface(typeElement);
      } catch (IOException ex) {
        error("could not write node interface: " + ex, typeElement);
      }
      nodeClassNames.add(typeElement.getQualifiedName().toString());
    }
  }

  // Reads the node list left by a previous compile, adds this compile's nodes, and rewrites it.
  private void mergeNodeList() throws IOException {
    FileObject file;
    try {
      file =
          processingEnv.getFiler().getResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST);
      try (BufferedReader br =
          new BufferedReader(
              new InputStreamReader(file.openInputStream(), StandardCharsets.UTF_8))) {
        br.lines().map(String::trim).filter(l -> !l.isEmpty()).forEach(nodeClassNames::add);
      }
    } catch (IOException missing) {
      file =
          processingEnv.getFiler().createResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST);
    }

    try (Writer wr = file.openWriter()) {
      wr.append(nodeClassNames.stream().collect(Collectors.joining("\n", "", "\n")));
    }
  }

  private enum VisitorFile {
    AST_VISITOR("ASTVisitor", "interface ASTVisitor<V> {\n\n%s\n\n}\n") {
      @Override
      String renderMethod(String nodeClass) {
        return String.format("  V visit(%s node, V value);", nodeClass);
      }
    },
    DEFAULT_AST_VISITOR(
        "DefaultASTVisitor",
        "public abstract class DefaultASTVisitor<V> implements ASTVisitor<V> {\n\n%s\n\n}\n") {
      @Override
      String renderMethod(String nodeClass) {
        return String.format(
            "  @Override\n"
                + "  public V visit(%s node, V value) {\n"
                + "    return node.visitChildren(this, value);\n"
                + "  }",
            nodeClass);
      }
    },
    VOID_DEFAULT_AST_VISITOR(
        "VoidDefaultASTVisitor",
        "public abstract class VoidDefaultASTVisitor extends DefaultASTVisitor<Void> {\n\n"
            + "%s\n\n}\n") {
      @Override
      String renderMethod(String nodeClass) {
        return String.format(
            "  @Override\n"
                + "  public final Void visit(%1$s node, Void value) {\n"
                + "    visitImpl(node);\n"
                + "    return null;\n"
                + "  }\n\n"
                + "  public void visitImpl(%1$s node) {\n"
                + "    node.visitChildren(this, null);\n"
                + "  }",
            nodeClass);
      }
    };

    private final String simpleName;
    private final String body;

    VisitorFile(String simpleName, String body) {
      this.simpleName = simpleName;
      this.body = body;
    }

    abstract String renderMethod(String nodeClass);

    String render(Set<String> nodeClasses) {
      return "package "
          + PACKAGE
          + ";\n\n"
          + String.format(
              body,
              nodeClasses.stream().map(this::renderMethod).collect(Collectors.joining("\n\n")));
    }
  }

  private void writeVisitors() throws IOException {
    for (VisitorFile visitorFile : VisitorFile.values()) {
      JavaFileObject file =
          processingEnv.getFiler().createSourceFile(PACKAGE + "." + visitorFile.simpleName);
      try (Writer wr = file.openWriter()) {
        wr.append(visitorFile.render(nodeClassNames));
      }
    }
  }

  // Node.Symbol -> Node_Symbol_ASTNode
  private static String interfaceName(Element element) {
    Deque<String> parts = new ArrayDeque<>();
    parts.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        parts.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return String.join("_", parts);
  }

  private void writeNodeInterface(TypeElement element) throws IOException {
    String interfaceName = interfaceName(element);
    if (element
        .getInterfaces()
        .stream()
        .noneMatch(i -> TypeName.get(i).toString().endsWith(interfaceName))) {
      error("Missing interface: " + interfaceName, element);
      return;
    }

    ParameterSpec visitor =
        ParameterSpec.builder(ParameterizedTypeName.get(AST_VISITOR_NAME, V), "visitor").build();
    ParameterSpec value = ParameterSpec.builder(V, "value").build();

    TypeSpec.Builder interfaceBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(AST_NODE_INTERFACE_NAME)
            .addMethod(
                MethodSpec.methodBuilder("accept")
                    .addAnnotation(Override.class)
                    .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
                    .addTypeVariable(V)
                    .returns(V)
                    .addParameter(visitor)
                    .addParameter(value)
                    .addStatement(
                        "return visitor.visit(($L) this, value)",
                        element.getQualifiedName().toString())
                    .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitor)
            .addParameter(value);

    for (Element enclosed : element.getEnclosedElements()) {
      if (enclosed.getKind() != ElementKind.METHOD) continue;
      if (enclosed.getAnnotation(ASTChild.class) == null) continue;

      ExecutableElement method = (ExecutableElement) enclosed;
      if (method.getAnnotation(Override.class) == null) {
        error("Missing @Override", method);
      }
      if (!returnsNodes(method.getReturnType())) {
        error("@ASTChild must return a Node or an Iterable of Nodes", method);
      }

      String name = method.getSimpleName().toString();
      interfaceBuilder.addMethod(
          MethodSpec.methodBuilder(name)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", AST_NODE_UTILS_NAME, name);
    }
    interfaceBuilder.addMethod(visitChildren.addStatement("return value").build());

    JavaFile javaFile = JavaFile.builder(PACKAGE, interfaceBuilder.build()).build();
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + interfaceName);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private boolean returnsNodes(TypeMirror returnType) {
    TypeElement node = processingEnv.getElementUtils().getTypeElement(NODE_TYPE);
    TypeElement iterable = processingEnv.getElementUtils().getTypeElement("java.lang.Iterable");
    if (node == null) return true;

    Types types = processingEnv.getTypeUtils();
    return types.isAssignable(returnType, node.asType())
        || types.isAssignable(types.erasure(returnType), types.erasure(iterable.asType()));
  }

  private void error(String msg, Element element) {
    processingEnv.getMessager().printMessage(Kind.ERROR, msg, element);
  }
}
