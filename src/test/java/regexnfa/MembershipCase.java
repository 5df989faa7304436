package regexnfa;

/**
 * Membership test case in a test file.
 */
public class MembershipCase {

  /**
   * Regular expression pattern.
   */
  public final String pattern;

  /**
   * Input string to feed to the automaton.
   */
  public final String input;

  /**
   * Expected output: {@code true}, {@code false}, or {@code error} followed by
   * the simple name of the expected exception.
   */
  public final String output;

  /**
   * Source file from which the test originated.
   */
  public final String filePath;

  /**
   * Line in the source file from which the test originated.
   */
  public final int lineNumber;

  public MembershipCase(
    String pattern,
    String input,
    String output,
    String filePath,
    int lineNumber
  ) {
    this.pattern = pattern;
    this.input = input;
    this.output = output;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  /**
   * Output string for a construction that failed.
   *
   * @param error exception thrown while building the automaton
   * @return output string
   */
  public static String errorOutput(Exception error) {
    return "error " + error.getClass().getSimpleName();
  }

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return "/" + pattern + "/ on '" + input + "' (at " + filePath + ":" + lineNumber + ")";
  }
}
