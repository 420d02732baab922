package kif;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Builds the syntax tree from a token stream using an explicit stack of open lists.
 *
 * <p>A list whose first element is an operator keyword token is promoted: it becomes a single
 * {@link Node.Operator} of that kind holding the remaining elements. The operator node is only
 * created once its closing parenthesis is seen.
 */
public final class Parser {

  // One open parenthesized list, or the top level.
  private static final class Frame {
    private final int openOffset;
    private final List<Node> children = new ArrayList<>();
    private Optional<Node.Operator.Kind> headKeyword = Optional.empty();

    private Frame(int openOffset) {
      this.openOffset = openOffset;
    }

    private void addAtom(Node atom) {
      if (children.isEmpty() && atom.type() == Node.Type.OPERATOR) {
        headKeyword = Optional.of(atom.<Node.Operator>cast().kind());
      }
      children.add(atom);
    }

    private void addList(Node.Compound list) {
      children.add(list);
    }

    private Node.Compound close(int closeEnd) {
      SourceSpan span = SourceSpan.create(openOffset, closeEnd);
      if (headKeyword.isPresent()) {
        return Node.Operator.create(headKeyword.get(), children.subList(1, children.size()), span);
      }
      return Node.Expression.create(children, span);
    }
  }

  public static ImmutableList<Node> parse(List<Tokenizer.Token> tokens) throws CompilerException {
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(-1));

    for (Tokenizer.Token token : tokens) {
      switch (token.type()) {
        case OPEN_PAREN:
          stack.push(new Frame(token.start()));
          break;
        case CLOSE_PAREN:
          {
            if (stack.size() == 1) {
              throw new CompilerException(
                  CompilerException.Reason.UNMATCHED_CLOSE_PAREN, token.start(), "unexpected ')'");
            }
            Node.Compound list = stack.pop().close(token.end());
            stack.peek().addList(list);
            break;
          }
        case STRING:
        case ATOM:
          stack.peek().addAtom(AtomClassifier.classify(token));
          break;
      }
    }

    if (stack.size() > 1) {
      // Report the outermost list that is still open.
      Iterator<Frame> outermostFirst = stack.descendingIterator();
      outermostFirst.next();
      throw new CompilerException(
          CompilerException.Reason.UNCLOSED_OPEN_PAREN,
          outermostFirst.next().openOffset,
          "unclosed '('");
    }

    Frame topLevel = stack.pop();
    return ImmutableList.copyOf(topLevel.children);
  }

  private Parser() {}
}
