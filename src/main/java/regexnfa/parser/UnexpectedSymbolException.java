package regexnfa.parser;

import java.util.regex.PatternSyntaxException;

/**
 * A symbol showed up where no literal or operator rule accepts it.
 */
public class UnexpectedSymbolException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = -4410093862215570298L;

  /**
   * Offending symbol.
   */
  public final char symbol;

  public UnexpectedSymbolException(char symbol, String regex, int index) {
    super("Unexpected symbol '" + symbol + "'", regex, index);
    this.symbol = symbol;
  }
}
