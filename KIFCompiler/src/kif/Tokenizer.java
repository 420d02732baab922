package kif;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Produces a tokenization of KIF text: parentheses, double-quoted strings and bare atoms, each
 * with its offsets into the input. Comments ({@code ;} to end of line) and whitespace are dropped.
 *
 * <p>A {@code "} with no closing quote anywhere after it does not start a string; it is read as
 * the first character of a bare atom.
 */
public class Tokenizer {

  @AutoValue
  public abstract static class Token {
    public enum Type {
      OPEN_PAREN,
      CLOSE_PAREN,
      STRING,
      ATOM;
    }

    public abstract Type type();

    public abstract String text();

    public abstract int start();

    public int end() {
      return start() + text().length();
    }

    public SourceSpan span() {
      return SourceSpan.create(start(), end());
    }

    public static Token create(Type type, String text, int start) {
      return new AutoValue_Tokenizer_Token(type, text, start);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  public static final char OPEN_PAREN = '(';
  public static final char CLOSE_PAREN = ')';
  public static final char QUOTE = '"';
  public static final char COMMENT = ';';

  private enum State {
    BETWEEN_TOKENS,
    COMMENT,
    ATOM;
  }

  private final String content;
  private int pos = -1; // In the initial state we have not read anything yet.
  private char ch = ' ';
  private State state = State.BETWEEN_TOKENS;
  private int atomStart = -1;

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();

  public Tokenizer(String content) {
    this.content = content;
  }

  public ImmutableList<Token> tokenize() {
    while (advance()) {
      switch (state) {
        case BETWEEN_TOKENS:
          readBetweenTokens();
          break;
        case COMMENT:
          if (ch == '\n') state = State.BETWEEN_TOKENS;
          break;
        case ATOM:
          if (isDelimiter(ch)) {
            closeAtom(pos);
            readBetweenTokens();
          }
          break;
      }
    }

    if (state == State.ATOM) closeAtom(content.length());
    return tokensBuilder.build();
  }

  private boolean advance() {
    if (pos + 1 >= content.length()) return false;

    ch = content.charAt(++pos);
    return true;
  }

  private void readBetweenTokens() {
    state = State.BETWEEN_TOKENS;
    if (isWhitespace(ch)) {
      return;
    } else if (ch == COMMENT) {
      state = State.COMMENT;
      return;
    } else if (ch == OPEN_PAREN) {
      add(Token.Type.OPEN_PAREN, pos, pos + 1);
      return;
    } else if (ch == CLOSE_PAREN) {
      add(Token.Type.CLOSE_PAREN, pos, pos + 1);
      return;
    } else if (ch == QUOTE) {
      int closingQuote = content.indexOf(QUOTE, pos + 1);
      if (closingQuote >= 0) {
        add(Token.Type.STRING, pos, closingQuote + 1);
        pos = closingQuote;
        ch = QUOTE;
        return;
      }
    }

    atomStart = pos;
    state = State.ATOM;
  }

  private void closeAtom(int end) {
    add(Token.Type.ATOM, atomStart, end);
    atomStart = -1;
    state = State.BETWEEN_TOKENS;
  }

  private void add(Token.Type type, int start, int end) {
    tokensBuilder.add(Token.create(type, content.substring(start, end), start));
  }

  private static boolean isDelimiter(char ch) {
    return isWhitespace(ch) || ch == OPEN_PAREN || ch == CLOSE_PAREN;
  }

  static boolean isWhitespace(char ch) {
    return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
  }
}
