package regexnfa.graph;

/**
 * Label on an NFA transition: either a literal character or epsilon.
 *
 * <p>All epsilon labels are equal to {@link #EPSILON}, whatever character they
 * were constructed with. Labels sort epsilon first, then by character.
 *
 * @param symbol literal character (meaningless for epsilon)
 * @param epsilon whether the transition consumes no input
 */
public record Label(char symbol, boolean epsilon) implements Comparable<Label> {

  /**
   * The no-input move.
   */
  public static final Label EPSILON = new Label('\0', true);

  public Label {
    if (epsilon) {
      symbol = '\0';
    }
  }

  /**
   * Label matching a single literal character.
   *
   * @param symbol character to match
   * @return literal label
   */
  public static Label of(char symbol) {
    return new Label(symbol, false);
  }

  @Override
  public int compareTo(Label other) {
    if (epsilon != other.epsilon) {
      return epsilon ? -1 : 1;
    }
    return Character.compare(symbol, other.symbol);
  }

  /**
   * Label for a DOT graph transition.
   */
  public String dotLabel() {
    if (epsilon) {
      return "&epsilon;";
    }
    switch (symbol) {
      case '&':
        return "&amp;";
      case '<':
        return "&lt;";
      case '>':
        return "&gt;";
      case '"':
        return "&quot;";
      default:
        return String.valueOf(symbol);
    }
  }

  @Override
  public String toString() {
    return epsilon ? "ε" : String.valueOf(symbol);
  }
}
