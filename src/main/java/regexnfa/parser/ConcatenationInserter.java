package regexnfa.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Makes the implicit concatenation in an infix expression explicit.
 *
 * <p>A {@code .} goes between two adjacent symbols {@code c} and {@code n}
 * exactly when {@code c} is neither {@code (} nor {@code |} and {@code n} is
 * none of {@code )}, {@code |}, {@code *}, {@code +}, {@code ?}. Put another
 * way: a literal, a closed group or a repetition followed by a literal or an
 * opened group is a concatenation.
 *
 * <p>Nothing is validated here except that the reserved {@code .} does not
 * appear in the input. Unbalanced groups and misplaced operators are caught
 * further down the pipeline.
 */
public final class ConcatenationInserter {

  private ConcatenationInserter() { }

  /**
   * Insert explicit concatenation operators.
   *
   * @param expression infix regular expression
   * @return the same expression with every concatenation spelled out
   */
  public static String insert(String expression) {
    return Token.render(tokenize(expression));
  }

  /**
   * Split an infix expression into tokens, inserting explicit concatenation
   * tokens as needed.
   *
   * <p>Each inserted concatenation points at the symbol it precedes.
   *
   * @param expression infix regular expression
   * @return infix tokens with explicit concatenation
   * @throws UnexpectedSymbolException if the expression contains a {@code .}
   */
  public static List<Token> tokenize(String expression) {
    Objects.requireNonNull(expression, "expression");

    final int length = expression.length();
    final var tokens = new ArrayList<Token>(length * 2);
    for (int i = 0; i < length; i++) {
      final char current = expression.charAt(i);
      if (current == Token.CONCATENATION) {
        throw new UnexpectedSymbolException(current, expression, i);
      }
      tokens.add(new Token(current, i));

      if (i + 1 < length && concatenates(current, expression.charAt(i + 1))) {
        tokens.add(new Token(Token.CONCATENATION, i + 1));
      }
    }
    return tokens;
  }

  private static boolean concatenates(char current, char next) {
    if (current == Token.OPEN_GROUP || current == Token.UNION) {
      return false;
    }
    return next != Token.CLOSE_GROUP && next != Token.UNION && !Token.isRepetition(next);
  }
}
