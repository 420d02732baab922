package kif;

public final class NodePrinter extends DefaultASTVisitor<StringBuilder> {
  private static final NodePrinter INSTANCE = new NodePrinter();

  public static String render(Node node) {
    return node.accept(INSTANCE, new StringBuilder()).toString();
  }

  public static String render(Iterable<? extends Node> nodes) {
    return INSTANCE.appendAll(nodes, new StringBuilder()).toString();
  }

  @Override
  public StringBuilder visit(Node.StringLiteral node, StringBuilder out) {
    return out.append("String(").append(node.raw()).append(')');
  }

  @Override
  public StringBuilder visit(Node.NumberLiteral node, StringBuilder out) {
    return out.append("Number(").append(node.value()).append(')');
  }

  @Override
  public StringBuilder visit(Node.BooleanLiteral node, StringBuilder out) {
    return out.append("Boolean(").append(node.value()).append(')');
  }

  @Override
  public StringBuilder visit(Node.Symbol node, StringBuilder out) {
    return out.append("Symbol(").append(node.name()).append(')');
  }

  @Override
  public StringBuilder visit(Node.Variable node, StringBuilder out) {
    return out.append("Variable(").append(node.name()).append(')');
  }

  @Override
  public StringBuilder visit(Node.Expression node, StringBuilder out) {
    out.append("Expression(");
    return appendAll(node.children(), out).append(')');
  }

  @Override
  public StringBuilder visit(Node.Operator node, StringBuilder out) {
    out.append(node.kind().displayName()).append('(').append(node.kind().keyword()).append(", ");
    return appendAll(node.children(), out).append(')');
  }

  private StringBuilder appendAll(Iterable<? extends Node> nodes, StringBuilder out) {
    out.append('[');
    boolean first = true;
    for (Node node : nodes) {
      if (!first) out.append(", ");
      first = false;
      node.accept(this, out);
    }
    return out.append(']');
  }

  private NodePrinter() {}
}
