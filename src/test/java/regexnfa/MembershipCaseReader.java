package regexnfa;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Reads pattern / input / output triples, skipping over comment and blank
 * lines and processing escape sequences.
 */
public class MembershipCaseReader {

  private static final Pattern UNICODE_ESCAPES = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  /**
   * Line standing in for the empty string (blank lines are skipped).
   */
  private static final String EMPTY_MARKER = "<empty>";

  private final BufferedReader reader;

  private final String filePath;

  private int lineNumber = 0;

  public MembershipCaseReader(Reader reader, String filePath) {
    this.reader = new BufferedReader(reader);
    this.filePath = filePath;
  }

  /**
   * Read the next processed line from the input.
   */
  public String readLine() throws IOException {
    String line;

    while (true) {
      line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return null; // EOF
      } else if (line.startsWith("//") || line.isEmpty()) {
        continue;
      }

      line = processLineEscapes(line);
      break;
    }

    return line;
  }

  /**
   * Read the next test case from the input.
   */
  public MembershipCase readCase() throws IOException {
    final String pattern = readLine();
    if (pattern == null) {
      return null;
    }
    final int lineNumber = this.lineNumber;
    final String input = readLine();
    final String output = readLine();
    if (input == null || output == null) {
      throw new IOException("Incomplete test case at " + filePath + ":" + lineNumber);
    }

    return new MembershipCase(pattern, input, output, filePath, lineNumber);
  }

  /**
   * Run an action for every remaining test case in the file.
   *
   * @param action action to run on each test case
   */
  public void forEachCase(Consumer<? super MembershipCase> action) throws IOException {
    MembershipCase membershipCase;
    while ((membershipCase = readCase()) != null) {
      action.accept(membershipCase);
    }
  }

  /**
   * Process a line to replace some escape sequences with the actual characters
   *
   * @param line line to escape
   * @return escaped line
   */
  private static String processLineEscapes(String line) {
    if (line.equals(EMPTY_MARKER)) {
      return "";
    }

    line = line.replace("\\n", "\n");

    return UNICODE_ESCAPES.matcher(line).replaceAll(result ->
      Character.toString((char) Integer.parseInt(result.group(1), 16))
    );
  }
}
