package regexnfa.graph;

import regexnfa.parser.InvalidPostfixException;
import regexnfa.parser.Token;
import regexnfa.parser.UnexpectedSymbolException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Stack;

/**
 * Evaluates a postfix regular expression into an NFA using Thompson's
 * construction.
 *
 * <p>Tokens are processed left to right against a stack of fragments:
 *
 * <ul>
 *   <li>a literal {@code a} pushes {@code start --a--> accept}
 *   <li>{@code *} wraps the top fragment so it may be skipped or repeated
 *   <li>{@code +} wraps the top fragment so it may be repeated
 *   <li>{@code ?} wraps the top fragment so it may be skipped
 *   <li>{@code .} links the accept state of the lower fragment to the start
 *       state of the upper one
 *   <li>{@code |} forks into either of the top two fragments and joins them
 *       back up
 * </ul>
 *
 * <p>For binary operators the lower fragment on the stack is the left operand.
 * Every token adds at most two states and four transitions, and each
 * construction owns its own {@link StateAllocator} so states count up from
 * {@code 0} on every call.
 */
public final class ThompsonConstruction {

  private final StateAllocator allocator = new StateAllocator();
  private final Stack<Fragment> fragments = new Stack<>();
  private final String pattern;

  private ThompsonConstruction(String pattern) {
    this.pattern = pattern;
  }

  /**
   * Build an NFA out of a postfix expression.
   *
   * <p>Error indices refer to positions in {@code postfix}.
   *
   * @param postfix postfix expression, using {@code .} for concatenation
   * @return automaton accepting the language of the expression
   * @throws UnexpectedSymbolException if a group marker appears in the input
   * @throws InvalidPostfixException if operands are missing or left over
   */
  public static Nfa build(String postfix) {
    Objects.requireNonNull(postfix, "postfix");

    final var tokens = new ArrayList<Token>(postfix.length());
    for (int i = 0; i < postfix.length(); i++) {
      tokens.add(new Token(postfix.charAt(i), i));
    }
    return build(tokens, postfix);
  }

  /**
   * Build an NFA out of postfix tokens.
   *
   * @param postfix postfix tokens
   * @param pattern expression the tokens index into (for error messages)
   * @return automaton accepting the language of the expression
   * @throws UnexpectedSymbolException if a group marker appears in the input
   * @throws InvalidPostfixException if operands are missing or left over
   */
  public static Nfa build(List<Token> postfix, String pattern) {
    Objects.requireNonNull(postfix, "postfix");
    Objects.requireNonNull(pattern, "pattern");

    final var construction = new ThompsonConstruction(pattern);
    for (Token token : postfix) {
      construction.accept(token);
    }
    return construction.finish();
  }

  private void accept(Token token) {
    final Fragment result;
    Fragment rhs;
    switch (token.symbol()) {
      case Token.STAR:
        result = star(pop(token));
        break;

      case Token.PLUS:
        result = plus(pop(token));
        break;

      case Token.OPTION:
        result = option(pop(token));
        break;

      case Token.CONCATENATION:
        rhs = pop(token);
        result = concatenation(pop(token), rhs);
        break;

      case Token.UNION:
        rhs = pop(token);
        result = union(pop(token), rhs);
        break;

      case Token.OPEN_GROUP:
      case Token.CLOSE_GROUP:
        throw new UnexpectedSymbolException(token.symbol(), pattern, token.index());

      default:
        result = literal(token.symbol());
    }
    fragments.push(result);
  }

  private Nfa finish() {
    if (fragments.size() != 1) {
      throw new InvalidPostfixException(
        "Expected exactly one automaton at the end of the expression but found " + fragments.size(),
        pattern,
        pattern.length()
      );
    }
    return fragments.pop().toNfa();
  }

  private Fragment pop(Token operator) {
    if (fragments.isEmpty()) {
      throw new InvalidPostfixException(
        "Missing operand for '" + operator.symbol() + "'",
        pattern,
        operator.index()
      );
    }
    return fragments.pop();
  }

  private Fragment fresh() {
    final int start = allocator.fresh();
    final int accept = allocator.fresh();
    return new Fragment(start, accept);
  }

  Fragment literal(char symbol) {
    final Fragment nfa = fresh();
    nfa.addTransition(nfa.start, Label.of(symbol), nfa.accept);
    return nfa;
  }

  Fragment star(Fragment inner) {
    final Fragment nfa = fresh();
    nfa.absorb(inner);
    nfa.addTransition(nfa.start, Label.EPSILON, inner.start);
    nfa.addTransition(inner.accept, Label.EPSILON, inner.start);
    nfa.addTransition(nfa.start, Label.EPSILON, nfa.accept);
    nfa.addTransition(inner.accept, Label.EPSILON, nfa.accept);
    return nfa;
  }

  Fragment plus(Fragment inner) {
    final Fragment nfa = fresh();
    nfa.absorb(inner);
    nfa.addTransition(nfa.start, Label.EPSILON, inner.start);
    nfa.addTransition(inner.accept, Label.EPSILON, inner.start);
    nfa.addTransition(inner.accept, Label.EPSILON, nfa.accept);
    return nfa;
  }

  Fragment option(Fragment inner) {
    final Fragment nfa = fresh();
    nfa.absorb(inner);
    nfa.addTransition(nfa.start, Label.EPSILON, inner.start);
    nfa.addTransition(inner.accept, Label.EPSILON, nfa.accept);
    nfa.addTransition(nfa.start, Label.EPSILON, nfa.accept);
    return nfa;
  }

  Fragment concatenation(Fragment lhs, Fragment rhs) {
    final Fragment nfa = new Fragment(lhs.start, rhs.accept);
    nfa.absorb(lhs);
    nfa.absorb(rhs);
    nfa.addTransition(lhs.accept, Label.EPSILON, rhs.start);
    return nfa;
  }

  Fragment union(Fragment lhs, Fragment rhs) {
    final Fragment nfa = fresh();
    nfa.absorb(lhs);
    nfa.absorb(rhs);
    nfa.addTransition(nfa.start, Label.EPSILON, lhs.start);
    nfa.addTransition(nfa.start, Label.EPSILON, rhs.start);
    nfa.addTransition(lhs.accept, Label.EPSILON, nfa.accept);
    nfa.addTransition(rhs.accept, Label.EPSILON, nfa.accept);
    return nfa;
  }
}
