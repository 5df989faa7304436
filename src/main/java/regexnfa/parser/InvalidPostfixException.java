package regexnfa.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Postfix evaluation did not end with exactly one automaton, either because an
 * operator ran out of operands or because operands were left over.
 */
public class InvalidPostfixException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 6194405276301829053L;

  public InvalidPostfixException(String description, String regex, int index) {
    super(description, regex, index);
  }
}
