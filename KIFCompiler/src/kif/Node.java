package kif;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import kif.processor.ASTChild;
import kif.processor.ASTNode;

/**
 * Syntax tree for KIF terms.
 *
 * <p>The set of variants is closed: every node is one of the nested classes below, identified by
 * {@link #type()}. Nodes are immutable. A node produced by the {@link Parser} carries the span of
 * input text it was read from; nodes built through the public factories carry none.
 *
 * <p>Equality is structural: two nodes are equal when they have the same variant, payload and
 * children. Source spans are not compared.
 */
public abstract class Node implements ASTNodeInterface {

  public enum Type {
    STRING_LITERAL,
    NUMBER_LITERAL,
    BOOLEAN_LITERAL,
    SYMBOL,
    VARIABLE,

    // Parenthesized lists
    EXPRESSION,
    OPERATOR;

    public boolean isCompound() {
      return this == EXPRESSION || this == OPERATOR;
    }
  }

  private final Type type;
  private final Optional<SourceSpan> span;

  private Node(Type type, Optional<SourceSpan> span) {
    this.type = type;
    this.span = span;
  }

  public Type type() {
    return type;
  }

  public Optional<SourceSpan> span() {
    return span;
  }

  public Optional<String> sourceText(String input) {
    return span.map(s -> s.slice(input));
  }

  @SuppressWarnings("unchecked")
  public <T extends Node> T cast() {
    return (T) this;
  }

  @Override
  public abstract boolean equals(Object o);

  @Override
  public abstract int hashCode();

  @Override
  public String toString() {
    return NodePrinter.render(this);
  }

  @ASTNode
  public static final class StringLiteral extends Node implements Node_StringLiteral_ASTNode {
    private final String raw;

    private StringLiteral(String raw, Optional<SourceSpan> span) {
      super(Type.STRING_LITERAL, span);
      Preconditions.checkArgument(
          raw.startsWith("\"") || raw.startsWith("`"), "not a string literal: %s", raw);
      this.raw = raw;
    }

    // Quoting is kept and escapes are not decoded.
    public static StringLiteral create(String raw) {
      return new StringLiteral(raw, Optional.empty());
    }

    static StringLiteral create(String raw, SourceSpan span) {
      return new StringLiteral(raw, Optional.of(span));
    }

    public String raw() {
      return raw;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof StringLiteral && raw.equals(((StringLiteral) o).raw);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type(), raw);
    }
  }

  @ASTNode
  public static final class NumberLiteral extends Node implements Node_NumberLiteral_ASTNode {
    private final double value;
    private final String raw;

    private NumberLiteral(double value, String raw, Optional<SourceSpan> span) {
      super(Type.NUMBER_LITERAL, span);
      this.value = value;
      this.raw = raw;
    }

    public static NumberLiteral create(double value, String raw) {
      return new NumberLiteral(value, raw, Optional.empty());
    }

    static NumberLiteral create(double value, String raw, SourceSpan span) {
      return new NumberLiteral(value, raw, Optional.of(span));
    }

    public double value() {
      return value;
    }

    public String raw() {
      return raw;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof NumberLiteral)) return false;

      NumberLiteral other = (NumberLiteral) o;
      return Double.compare(value, other.value) == 0 && raw.equals(other.raw);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type(), value, raw);
    }
  }

  @ASTNode
  public static final class BooleanLiteral extends Node implements Node_BooleanLiteral_ASTNode {
    private final boolean value;

    private BooleanLiteral(boolean value, Optional<SourceSpan> span) {
      super(Type.BOOLEAN_LITERAL, span);
      this.value = value;
    }

    public static BooleanLiteral create(boolean value) {
      return new BooleanLiteral(value, Optional.empty());
    }

    static BooleanLiteral create(boolean value, SourceSpan span) {
      return new BooleanLiteral(value, Optional.of(span));
    }

    public boolean value() {
      return value;
    }

    public String raw() {
      return Boolean.toString(value);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof BooleanLiteral && value == ((BooleanLiteral) o).value;
    }

    @Override
    public int hashCode() {
      return Objects.hash(type(), value);
    }
  }

  @ASTNode
  public static final class Symbol extends Node implements Node_Symbol_ASTNode {
    private final String name;

    private Symbol(String name, Optional<SourceSpan> span) {
      super(Type.SYMBOL, span);
      this.name = name;
    }

    public static Symbol create(String name) {
      return new Symbol(name, Optional.empty());
    }

    static Symbol create(String name, SourceSpan span) {
      return new Symbol(name, Optional.of(span));
    }

    public String name() {
      return name;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Symbol && name.equals(((Symbol) o).name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type(), name);
    }
  }

  @ASTNode
  public static final class Variable extends Node implements Node_Variable_ASTNode {
    public static final char SIGIL = '?';

    private final String name;

    private Variable(String name, Optional<SourceSpan> span) {
      super(Type.VARIABLE, span);
      this.name = name;
    }

    // Without the sigil; may be empty.
    public static Variable create(String name) {
      return new Variable(name, Optional.empty());
    }

    static Variable create(String name, SourceSpan span) {
      return new Variable(name, Optional.of(span));
    }

    public String name() {
      return name;
    }

    public String raw() {
      return SIGIL + name;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Variable && name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type(), name);
    }
  }

  public abstract static class Compound extends Node {
    private Compound(Type type, Optional<SourceSpan> span) {
      super(type, span);
    }

    public abstract ImmutableList<Node> children();

    public Node child(int index) {
      return children().get(index);
    }
  }

  @ASTNode
  public static final class Expression extends Compound implements Node_Expression_ASTNode {
    private final ImmutableList<Node> children;

    private Expression(ImmutableList<Node> children, Optional<SourceSpan> span) {
      super(Type.EXPRESSION, span);
      this.children = children;
    }

    public static Expression create(Iterable<? extends Node> children) {
      return new Expression(ImmutableList.copyOf(children), Optional.empty());
    }

    public static Expression create(Node... children) {
      return create(Arrays.asList(children));
    }

    static Expression create(Iterable<? extends Node> children, SourceSpan span) {
      return new Expression(ImmutableList.copyOf(children), Optional.of(span));
    }

    @ASTChild
    @Override
    public ImmutableList<Node> children() {
      return children;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Expression && children.equals(((Expression) o).children);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type(), children);
    }
  }

  // The head keyword is kind(), not a child. A keyword outside head position has no children.
  @ASTNode
  public static final class Operator extends Compound implements Node_Operator_ASTNode {
    public enum Kind {
      CONDITIONAL("=>", "Conditional"),
      BICONDITIONAL("<=>", "Biconditional"),
      AND("and", "And"),
      OR("or", "Or"),
      NOT("not", "Not"),
      EXISTS("exists", "Exists"),
      FORALL("forall", "Forall"),
      EQUALITY("=", "Equality");

      private static final ImmutableMap<String, Kind> BY_KEYWORD =
          Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(Kind::keyword, k -> k));

      private final String keyword;
      private final String displayName;

      Kind(String keyword, String displayName) {
        this.keyword = keyword;
        this.displayName = displayName;
      }

      public String keyword() {
        return keyword;
      }

      public String displayName() {
        return displayName;
      }

      public static Optional<Kind> forKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
      }
    }

    private final Kind kind;
    private final ImmutableList<Node> children;

    private Operator(Kind kind, ImmutableList<Node> children, Optional<SourceSpan> span) {
      super(Type.OPERATOR, span);
      this.kind = kind;
      this.children = children;
    }

    public static Operator create(Kind kind, Iterable<? extends Node> children) {
      return new Operator(kind, ImmutableList.copyOf(children), Optional.empty());
    }

    public static Operator create(Kind kind, Node... children) {
      return create(kind, Arrays.asList(children));
    }

    static Operator create(Kind kind, Iterable<? extends Node> children, SourceSpan span) {
      return new Operator(kind, ImmutableList.copyOf(children), Optional.of(span));
    }

    public Kind kind() {
      return kind;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> children() {
      return children;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Operator)) return false;

      Operator other = (Operator) o;
      return kind == other.kind && children.equals(other.children);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type(), kind, children);
    }
  }
}
