package regexnfa.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Group markers in the expression do not balance: either a {@code )} closes
 * nothing or a {@code (} is never closed.
 */
public class MalformedExpressionException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 2871964018743612215L;

  public MalformedExpressionException(String description, String regex, int index) {
    super(description, regex, index);
  }
}
