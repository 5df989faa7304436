package regexnfa.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Stack;

/**
 * Shunting-yard conversion of an infix expression (with explicit
 * concatenation) into postfix.
 *
 * <p>Precedence from loosest to tightest: {@code |}, then {@code .}, then the
 * repetitions {@code *}, {@code +}, {@code ?}. All operators are left
 * associative: an operator on the stack with precedence greater than or equal
 * to the incoming one is emitted first. {@code (} sits on the operator stack as
 * a sentinel and is never emitted.
 */
public final class PostfixConverter {

  private PostfixConverter() { }

  /**
   * Precedence of an operator on the stack.
   *
   * @param symbol operator (or {@code (})
   * @return precedence, {@code 0} for the group sentinel
   */
  static int precedence(char symbol) {
    switch (symbol) {
      case Token.STAR:
      case Token.PLUS:
      case Token.OPTION:
        return 3;
      case Token.CONCATENATION:
        return 2;
      case Token.UNION:
        return 1;
      case Token.OPEN_GROUP:
        return 0;
      default:
        throw new IllegalArgumentException("Not an operator: " + symbol);
    }
  }

  /**
   * Convert an infix expression whose concatenations are already explicit.
   *
   * <p>Error indices refer to positions in {@code explicitInfix}.
   *
   * @param explicitInfix infix expression with explicit {@code .}
   * @return postfix expression
   * @throws MalformedExpressionException if the groups are unbalanced
   */
  public static String toPostfix(String explicitInfix) {
    Objects.requireNonNull(explicitInfix, "explicitInfix");

    final var tokens = new ArrayList<Token>(explicitInfix.length());
    for (int i = 0; i < explicitInfix.length(); i++) {
      tokens.add(new Token(explicitInfix.charAt(i), i));
    }
    return Token.render(toPostfix(tokens, explicitInfix));
  }

  /**
   * Convert infix tokens into postfix tokens.
   *
   * @param infix tokens with explicit concatenation
   * @param pattern expression the tokens index into (for error messages)
   * @return postfix tokens, free of group markers
   * @throws MalformedExpressionException if the groups are unbalanced
   */
  public static List<Token> toPostfix(List<Token> infix, String pattern) {
    Objects.requireNonNull(infix, "infix");
    Objects.requireNonNull(pattern, "pattern");

    final var output = new ArrayList<Token>(infix.size());
    final var operators = new Stack<Token>();

    for (Token token : infix) {
      final char symbol = token.symbol();

      if (symbol == Token.OPEN_GROUP) {
        operators.push(token);
      } else if (symbol == Token.CLOSE_GROUP) {
        // Unwind to the matching open group, dropping it
        while (true) {
          if (operators.isEmpty()) {
            throw new MalformedExpressionException(
              "Unmatched closing parenthesis",
              pattern,
              token.index()
            );
          }
          final Token top = operators.pop();
          if (top.symbol() == Token.OPEN_GROUP) {
            break;
          }
          output.add(top);
        }
      } else if (token.isLiteral()) {
        output.add(token);
      } else {
        final int incoming = precedence(symbol);
        while (!operators.isEmpty() && precedence(operators.peek().symbol()) >= incoming) {
          output.add(operators.pop());
        }
        operators.push(token);
      }
    }

    while (!operators.isEmpty()) {
      final Token top = operators.pop();
      if (top.symbol() == Token.OPEN_GROUP) {
        throw new MalformedExpressionException("Unclosed group", pattern, top.index());
      }
      output.add(top);
    }

    return output;
  }
}
