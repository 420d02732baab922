package kif;

import java.util.ArrayDeque;
import java.util.Deque;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;

/**
 * Maps each symbol name to the nodes it occurs in, in the order the occurrences were read.
 *
 * <p>An occurrence is recorded as the innermost enclosing list of the symbol, or as the symbol
 * itself when it stands at the top level. A list containing the same symbol twice is recorded
 * twice. An index is built once from a finished tree and never updated.
 */
public final class SymbolIndex {
  private static final SymbolIndex EMPTY = new SymbolIndex(ImmutableListMultimap.of());

  private final ImmutableListMultimap<String, Node> usages;

  private SymbolIndex(ImmutableListMultimap<String, Node> usages) {
    this.usages = usages;
  }

  public static SymbolIndex empty() {
    return EMPTY;
  }

  public static SymbolIndex build(Iterable<? extends Node> topLevel) {
    Builder builder = new Builder();
    ASTNodeUtils.accept(topLevel, builder, null);
    return new SymbolIndex(builder.usages.build());
  }

  public ImmutableList<Node> usages(String name) {
    return usages.get(name);
  }

  public boolean contains(String name) {
    return usages.containsKey(name);
  }

  public ImmutableSet<String> symbols() {
    return usages.keySet();
  }

  @Override
  public String toString() {
    return "SymbolIndex(" + symbols() + ")";
  }

  private static final class Builder extends VoidDefaultASTVisitor {
    private final Deque<Node.Compound> parents = new ArrayDeque<>();
    private final ImmutableListMultimap.Builder<String, Node> usages =
        ImmutableListMultimap.builder();

    @Override
    public void visitImpl(Node.Expression expression) {
      visitList(expression);
    }

    @Override
    public void visitImpl(Node.Operator operator) {
      visitList(operator);
    }

    private void visitList(Node.Compound list) {
      parents.push(list);
      list.visitChildren(this, null);
      parents.pop();
    }

    @Override
    public void visitImpl(Node.Symbol symbol) {
      usages.put(symbol.name(), parents.isEmpty() ? symbol : parents.peek());
    }
  }
}
