package kif;

import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// First match wins: quoting, sigil, boolean, operator keyword, number, symbol.
public final class AtomClassifier {

  private static final char BACKTICK = '`';

  // Decimal and exponential forms only, independent of locale.
  private static final Pattern NUMBER =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  public static Node classify(String text) {
    return classify(text, Optional.empty());
  }

  public static Node classify(Tokenizer.Token token) {
    Preconditions.checkArgument(
        token.type() == Tokenizer.Token.Type.ATOM || token.type() == Tokenizer.Token.Type.STRING,
        "not an atom: %s",
        token);
    return classify(token.text(), Optional.of(token.span()));
  }

  private static Node classify(String text, Optional<SourceSpan> span) {
    Preconditions.checkArgument(!text.isEmpty(), "empty atom");

    char first = text.charAt(0);
    if (first == Tokenizer.QUOTE || first == BACKTICK) {
      return span.isPresent()
          ? Node.StringLiteral.create(text, span.get())
          : Node.StringLiteral.create(text);
    }

    if (first == Node.Variable.SIGIL) {
      String name = text.substring(1);
      return span.isPresent() ? Node.Variable.create(name, span.get()) : Node.Variable.create(name);
    }

    if (text.equals("true") || text.equals("false")) {
      boolean value = Boolean.parseBoolean(text);
      return span.isPresent()
          ? Node.BooleanLiteral.create(value, span.get())
          : Node.BooleanLiteral.create(value);
    }

    Optional<Node.Operator.Kind> kind = Node.Operator.Kind.forKeyword(text);
    if (kind.isPresent()) {
      return span.isPresent()
          ? Node.Operator.create(kind.get(), ImmutableList.of(), span.get())
          : Node.Operator.create(kind.get());
    }

    Optional<Double> number = parseNumber(text);
    if (number.isPresent()) {
      return span.isPresent()
          ? Node.NumberLiteral.create(number.get(), text, span.get())
          : Node.NumberLiteral.create(number.get(), text);
    }

    return span.isPresent() ? Node.Symbol.create(text, span.get()) : Node.Symbol.create(text);
  }

  static Optional<Double> parseNumber(String text) {
    if (!NUMBER.matcher(text).matches()) return Optional.empty();

    return Optional.of(Double.parseDouble(text));
  }

  private AtomClassifier() {}
}
