package regexnfa.parser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Single symbol of a regular expression on its way to becoming an NFA.
 *
 * @param symbol character of the token (a literal or one of {@code ()|.*+?})
 * @param index position in the original expression this token points back to
 */
public record Token(char symbol, int index) {

  /** Start of a group. */
  public static final char OPEN_GROUP = '(';

  /** End of a group. */
  public static final char CLOSE_GROUP = ')';

  /** Alternation. */
  public static final char UNION = '|';

  /** Explicit concatenation (never written by callers, only inserted). */
  public static final char CONCATENATION = '.';

  /** Zero or more. */
  public static final char STAR = '*';

  /** One or more. */
  public static final char PLUS = '+';

  /** Zero or one. */
  public static final char OPTION = '?';

  /**
   * Is this a literal character?
   */
  public boolean isLiteral() {
    return isLiteral(symbol);
  }

  static boolean isRepetition(char symbol) {
    return symbol == STAR || symbol == PLUS || symbol == OPTION;
  }

  static boolean isLiteral(char symbol) {
    switch (symbol) {
      case OPEN_GROUP:
      case CLOSE_GROUP:
      case UNION:
      case CONCATENATION:
      case STAR:
      case PLUS:
      case OPTION:
        return false;
      default:
        return true;
    }
  }

  /**
   * Concatenate the symbols of some tokens back into a string.
   *
   * @param tokens tokens to render
   * @return symbols, in order
   */
  public static String render(List<Token> tokens) {
    return tokens
      .stream()
      .map(token -> String.valueOf(token.symbol()))
      .collect(Collectors.joining());
  }

  @Override
  public String toString() {
    return symbol + "@" + index;
  }
}
