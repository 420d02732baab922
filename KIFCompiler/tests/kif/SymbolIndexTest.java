package kif;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class SymbolIndexTest {

  private static SymbolIndex index(ImmutableList<Node> nodes) {
    return SymbolIndex.build(nodes);
  }

  @Test
  public void everySymbolOfAListPointsAtTheList() throws CompilerException {
    ImmutableList<Node> nodes = Compiler.parse("(instance Gemini AI)");
    SymbolIndex index = index(nodes);

    assertThat(index.symbols()).containsExactly("instance", "Gemini", "AI").inOrder();
    for (String name : index.symbols()) {
      assertThat(index.usages(name)).hasSize(1);
      assertThat(index.usages(name).get(0)).isSameInstanceAs(nodes.get(0));
    }
    assertThat(nodes.get(0).type()).isEqualTo(Node.Type.EXPRESSION);
  }

  @Test
  public void innermostEnclosingListIsRecorded() throws CompilerException {
    ImmutableList<Node> nodes = Compiler.parse("(=> (and (p ?x) (q ?x)) (r ?x))");
    SymbolIndex index = index(nodes);

    Node.Operator implies = nodes.get(0).cast();
    Node.Operator and = implies.child(0).cast();

    assertThat(index.symbols()).containsExactly("p", "q", "r").inOrder();
    assertThat(index.usages("p")).containsExactly(and.child(0));
    assertThat(index.usages("p").get(0)).isSameInstanceAs(and.child(0));
    assertThat(index.usages("q").get(0)).isSameInstanceAs(and.child(1));
    assertThat(index.usages("r").get(0)).isSameInstanceAs(implies.child(1));
  }

  @Test
  public void symbolDirectlyInsideOperatorPointsAtOperator() throws CompilerException {
    ImmutableList<Node> nodes = Compiler.parse("(not Raining)");

    assertThat(index(nodes).usages("Raining").get(0)).isSameInstanceAs(nodes.get(0));
  }

  @Test
  public void topLevelSymbolPointsAtItself() throws CompilerException {
    ImmutableList<Node> nodes = Compiler.parse("foo (bar foo)");
    SymbolIndex index = index(nodes);

    ImmutableList<Node> usages = index.usages("foo");
    assertThat(usages).hasSize(2);
    assertThat(usages.get(0)).isSameInstanceAs(nodes.get(0));
    assertThat(usages.get(1)).isSameInstanceAs(nodes.get(1));
  }

  @Test
  public void repeatedSymbolInOneListIsRecordedEachTime() throws CompilerException {
    ImmutableList<Node> nodes = Compiler.parse("(likes John John) (knows Mary John)");
    ImmutableList<Node> usages = index(nodes).usages("John");

    assertThat(usages).hasSize(3);
    assertThat(usages.get(0)).isSameInstanceAs(nodes.get(0));
    assertThat(usages.get(1)).isSameInstanceAs(nodes.get(0));
    assertThat(usages.get(2)).isSameInstanceAs(nodes.get(1));
  }

  @Test
  public void onlySymbolsAreIndexed() throws CompilerException {
    SymbolIndex index = index(Compiler.parse("(p ?x \"str\" 12 true and (or))"));

    assertThat(index.symbols()).containsExactly("p");
    assertThat(index.contains("x")).isFalse();
    assertThat(index.contains("and")).isFalse();
    assertThat(index.contains("or")).isFalse();
  }

  @Test
  public void unknownSymbolHasNoUsages() throws CompilerException {
    SymbolIndex index = index(Compiler.parse("(a b)"));

    assertThat(index.usages("c")).isEmpty();
    assertThat(index.contains("c")).isFalse();
    assertThat(SymbolIndex.empty().usages("a")).isEmpty();
  }

  @Test
  public void worksOnHandBuiltTrees() {
    Node.Expression inner = Node.Expression.create(Node.Symbol.create("b"));
    Node.Operator outer =
        Node.Operator.create(Node.Operator.Kind.OR, Node.Symbol.create("a"), inner);

    SymbolIndex index = SymbolIndex.build(ImmutableList.of(outer));

    assertThat(index.usages("a").get(0)).isSameInstanceAs(outer);
    assertThat(index.usages("b").get(0)).isSameInstanceAs(inner);
    assertThat(index.toString()).isEqualTo("SymbolIndex([a, b])");
  }
}
