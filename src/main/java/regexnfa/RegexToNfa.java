package regexnfa;

import regexnfa.graph.Nfa;
import regexnfa.graph.ThompsonConstruction;
import regexnfa.parser.ConcatenationInserter;
import regexnfa.parser.PostfixConverter;
import regexnfa.parser.Token;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Converts simple regular expressions into NFAs.
 *
 * <p>Supported syntax: literal characters, grouping with {@code ( )},
 * alternation {@code |}, implicit concatenation and the postfix repetitions
 * {@code *}, {@code +}, {@code ?}. The character {@code .} is reserved and
 * there is no escaping.
 *
 * <p>The pipeline is: make concatenation explicit, convert to postfix, then
 * evaluate the postfix with Thompson's construction. Each call is independent
 * of every other, so conversions may run concurrently.
 */
public final class RegexToNfa {

  private static final Logger LOGGER = Logger.getLogger(RegexToNfa.class.getName());

  private static final String DEFAULT_EXPRESSION = "(a|b)?a";

  private RegexToNfa() { }

  /**
   * Build an NFA recognizing the same language as a regular expression.
   *
   * @param expression infix regular expression
   * @return automaton for the expression
   * @throws PatternSyntaxException if the expression is invalid (one of
   *   {@code MalformedExpressionException}, {@code UnexpectedSymbolException}
   *   or {@code InvalidPostfixException})
   */
  public static Nfa convert(String expression) throws PatternSyntaxException {
    Objects.requireNonNull(expression, "expression");
    try {
      final List<Token> postfix = postfixTokens(expression);
      final Nfa nfa = ThompsonConstruction.build(postfix, expression);
      if (LOGGER.isLoggable(Level.FINE)) {
        LOGGER.fine("Built " + nfa + " for /" + expression + "/");
      }
      return nfa;
    } catch (PatternSyntaxException e) {
      if (LOGGER.isLoggable(Level.FINE)) {
        LOGGER.log(Level.FINE, "Rejected /" + expression + "/", e);
      }
      throw e;
    }
  }

  /**
   * Postfix form of a regular expression, with {@code .} as concatenation.
   *
   * @param expression infix regular expression
   * @return postfix expression
   * @throws PatternSyntaxException if the groups are unbalanced or the
   *   expression contains a {@code .}
   */
  public static String postfix(String expression) throws PatternSyntaxException {
    Objects.requireNonNull(expression, "expression");
    return Token.render(postfixTokens(expression));
  }

  private static List<Token> postfixTokens(String expression) {
    final List<Token> explicit = ConcatenationInserter.tokenize(expression);
    final List<Token> postfix = PostfixConverter.toPostfix(explicit, expression);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("/" + expression + "/ explicit: " + Token.render(explicit) + ", postfix: " + Token.render(postfix));
    }
    return postfix;
  }

  /**
   * Print the NFA for an expression.
   *
   * <p>Usage: {@code [--dot] [expression]}. Without {@code --dot}, prints the
   * expression, its postfix form, the start and accept states, and the
   * transitions. With {@code --dot}, prints a Graphviz graph instead.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    boolean dot = false;
    String expression = DEFAULT_EXPRESSION;
    for (String arg : args) {
      if (arg.equals("--dot")) {
        dot = true;
      } else {
        expression = arg;
      }
    }

    final String output;
    try {
      output = dot ? convert(expression).dotGraph("nfa") : describe(expression);
    } catch (PatternSyntaxException e) {
      System.err.println(e.getMessage());
      System.exit(1);
      return;
    }
    System.out.println(output);
  }

  /**
   * Summary of the NFA for an expression, as printed by {@link #main}.
   *
   * @param expression infix regular expression
   * @return multi-line description
   */
  static String describe(String expression) {
    final Nfa nfa = convert(expression);
    return "Regular Expression: " + expression + "\n"
      + "Postfix: " + postfix(expression) + "\n"
      + "Start State: " + nfa.startState + "\n"
      + "Accept State: " + nfa.acceptState + "\n"
      + "Transitions:\n"
      + nfa.transitionListing();
  }
}
