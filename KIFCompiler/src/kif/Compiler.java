package kif;

import java.io.File;
import java.io.IOException;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Compiles KIF text into a syntax tree and a {@link SymbolIndex}.
 *
 * <p>Every successful call to {@link #compile} replaces the tree and index held by this instance;
 * nothing carries over between calls. A failed call leaves them as they were. Instances are not
 * thread-safe.
 */
public class Compiler {

  private ImmutableList<Node> ast = ImmutableList.of();
  private SymbolIndex symbolIndex = SymbolIndex.empty();

  public static ImmutableList<Node> parse(String text) throws CompilerException {
    if (text.isEmpty()) {
      throw new CompilerException(CompilerException.Reason.EMPTY_INPUT, 0, "input is empty");
    }

    ImmutableList<Tokenizer.Token> tokens = new Tokenizer(text).tokenize();
    if (tokens.isEmpty()) {
      throw new CompilerException(
          CompilerException.Reason.EMPTY_INPUT, 0, "input has nothing but whitespace and comments");
    }

    return Parser.parse(tokens);
  }

  @CanIgnoreReturnValue
  public String compile(String text) throws CompilerException {
    ImmutableList<Node> nodes = parse(text);
    SymbolIndex index = SymbolIndex.build(nodes);

    this.ast = nodes;
    this.symbolIndex = index;
    return "Compiled AST: " + NodePrinter.render(nodes);
  }

  /**
   * Compiles lines {@code startLine} through {@code endLine} (1-based, inclusive) of a UTF-8 file.
   * Spans in the resulting tree are offsets into that range of lines.
   */
  @CanIgnoreReturnValue
  public String compileFile(File file, int startLine, Optional<Integer> endLine)
      throws CompilerException, IOException {
    return compile(SourceText.read(file).lines(startLine, endLine).content());
  }

  public ImmutableList<Node> ast() {
    return ast;
  }

  public SymbolIndex symbolIndex() {
    return symbolIndex;
  }

  public ImmutableList<Node> findSymbolUsages(String name) {
    return symbolIndex.usages(name);
  }
}
