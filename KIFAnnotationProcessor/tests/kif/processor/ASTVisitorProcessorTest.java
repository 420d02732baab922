package kif.processor;

import static com.google.common.truth.Truth.assertThat;
import static com.google.testing.compile.CompilationSubject.assertThat;
import static com.google.testing.compile.Compiler.javac;

import java.io.IOException;

import javax.tools.JavaFileObject;

import org.junit.jupiter.api.Test;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;

public class ASTVisitorProcessorTest {

  private static final JavaFileObject AST_NODE_INTERFACE =
      JavaFileObjects.forSourceLines(
          "kif.ASTNodeInterface",
          "package kif;",
          "",
          "public interface ASTNodeInterface {",
          "  <V> V accept(ASTVisitor<V> visitor, V value);",
          "",
          "  <V> V visitChildren(ASTVisitor<V> visitor, V value);",
          "}");

  private static final JavaFileObject AST_NODE_UTILS =
      JavaFileObjects.forSourceLines(
          "kif.ASTNodeUtils",
          "package kif;",
          "",
          "public final class ASTNodeUtils {",
          "  public static <V> V accept(ASTNodeInterface node, ASTVisitor<V> visitor, V value) {",
          "    return node.accept(visitor, value);",
          "  }",
          "",
          "  public static <V> V accept(",
          "      Iterable<? extends ASTNodeInterface> nodes, ASTVisitor<V> visitor, V value) {",
          "    for (ASTNodeInterface node : nodes) {",
          "      value = accept(node, visitor, value);",
          "    }",
          "    return value;",
          "  }",
          "}");

  private static Compilation compileNodes(String... nodeLines) {
    return javac()
        .withProcessors(new ASTVisitorProcessor())
        .compile(
            AST_NODE_INTERFACE,
            AST_NODE_UTILS,
            JavaFileObjects.forSourceLines("kif.Node", nodeLines));
  }

  @Test
  public void generatesInterfacesAndVisitors() throws IOException {
    Compilation compilation =
        compileNodes(
            "package kif;",
            "",
            "import java.util.List;",
            "",
            "import kif.processor.ASTChild;",
            "import kif.processor.ASTNode;",
            "",
            "public abstract class Node implements ASTNodeInterface {",
            "  @ASTNode",
            "  public static final class Leaf extends Node implements Node_Leaf_ASTNode {}",
            "",
            "  @ASTNode",
            "  public static final class Call extends Node implements Node_Call_ASTNode {",
            "    private final Node operator;",
            "    private final List<Node> arguments;",
            "",
            "    Call(Node operator, List<Node> arguments) {",
            "      this.operator = operator;",
            "      this.arguments = arguments;",
            "    }",
            "",
            "    @ASTChild",
            "    @Override",
            "    public Node operator() {",
            "      return operator;",
            "    }",
            "",
            "    @ASTChild",
            "    @Override",
            "    public List<Node> arguments() {",
            "      return arguments;",
            "    }",
            "  }",
            "}");

    assertThat(compilation).succeededWithoutWarnings();

    String call = contents(compilation, "kif.Node_Call_ASTNode");
    assertThat(call).contains("visitor.visit((kif.Node.Call) this, value)");
    int operator = call.indexOf("accept(operator(), visitor, value)");
    int arguments = call.indexOf("accept(arguments(), visitor, value)");
    assertThat(operator).isAtLeast(0);
    assertThat(arguments).isGreaterThan(operator);

    assertThat(contents(compilation, "kif.Node_Leaf_ASTNode")).doesNotContain("ASTNodeUtils");
    assertThat(contents(compilation, "kif.ASTVisitor"))
        .contains("V visit(kif.Node.Call node, V value);");
    assertThat(contents(compilation, "kif.DefaultASTVisitor"))
        .contains("public V visit(kif.Node.Leaf node, V value)");
    assertThat(contents(compilation, "kif.VoidDefaultASTVisitor"))
        .contains("public void visitImpl(kif.Node.Call node)");
  }

  @Test
  public void rejectsNodeWithoutItsInterface() {
    Compilation compilation =
        compileNodes(
            "package kif;",
            "",
            "import kif.processor.ASTNode;",
            "",
            "public abstract class Node implements ASTNodeInterface {",
            "  @ASTNode",
            "  public static final class Leaf extends Node {}",
            "}");

    assertThat(compilation).failed();
    assertThat(compilation).hadErrorContaining("Missing interface: Node_Leaf_ASTNode");
  }

  @Test
  public void rejectsChildWithoutOverride() {
    Compilation compilation =
        compileNodes(
            "package kif;",
            "",
            "import kif.processor.ASTChild;",
            "import kif.processor.ASTNode;",
            "",
            "public abstract class Node implements ASTNodeInterface {",
            "  @ASTNode",
            "  public static final class Wrapper extends Node implements Node_Wrapper_ASTNode {",
            "    @ASTChild",
            "    public Node inner() {",
            "      return this;",
            "    }",
            "  }",
            "}");

    assertThat(compilation).failed();
    assertThat(compilation).hadErrorContaining("Missing @Override");
  }

  @Test
  public void rejectsChildThatIsNotANode() {
    Compilation compilation =
        compileNodes(
            "package kif;",
            "",
            "import kif.processor.ASTChild;",
            "import kif.processor.ASTNode;",
            "",
            "public abstract class Node implements ASTNodeInterface {",
            "  @ASTNode",
            "  public static final class Named extends Node implements Node_Named_ASTNode {",
            "    @ASTChild",
            "    @Override",
            "    public String name() {",
            "      return \"x\";",
            "    }",
            "  }",
            "}");

    assertThat(compilation).failed();
    assertThat(compilation)
        .hadErrorContaining("@ASTChild must return a Node or an Iterable of Nodes");
  }

  private static String contents(Compilation compilation, String qualifiedName)
      throws IOException {
    return compilation.generatedSourceFile(qualifiedName).get().getCharContent(false).toString();
  }
}
