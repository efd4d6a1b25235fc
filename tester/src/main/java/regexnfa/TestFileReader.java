package regexnfa;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads three-line test cases: pattern, expected postfix, expected state count.
 *
 * <p>Skips over comment lines and blank lines, and processes escape sequences.
 */
public class TestFileReader {

  private static final Pattern UNICODE_ESCAPES = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  private final BufferedReader reader;

  private final String filePath;

  private int lineNumber = 0;

  public TestFileReader(String filePath) throws IOException {
    this(new BufferedReader(new FileReader(filePath, StandardCharsets.UTF_8)), filePath);
  }

  /**
   * @param reader source of the test file
   * @param filePath name used to identify the file in test summaries
   */
  public TestFileReader(BufferedReader reader, String filePath) {
    this.reader = reader;
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
        return line; // EOF
      } else if (line.startsWith("//") || line.isEmpty()) {
        continue; // Not a valid line
      }

      line = processLineEscapes(line);
      break;
    }

    return line;
  }

  /**
   * Read the next test case from the input.
   *
   * @return test case, or {@code null} at the end of the input
   */
  public TestCase readTestCase() throws IOException {
    final String pattern = readLine();
    if (pattern == null) {
      return null;
    }
    final int lineNumber = this.lineNumber;
    final String postfix = readLine();
    final String stateCount = readLine();
    if (postfix == null || stateCount == null) {
      throw new IOException("Truncated test case at " + filePath + ":" + lineNumber);
    }

    return new TestCase(pattern, postfix, stateCount, filePath, lineNumber);
  }

  /**
   * Run an action for every remaining test case in the file.
   *
   * @param action action to run on each test case
   */
  public void forEachTestCase(Consumer<? super TestCase> action) throws IOException {
    TestCase testCase;
    while ((testCase = readTestCase()) != null) {
      action.accept(testCase);
    }
  }

  public int getLineNumber() {
    return lineNumber;
  }

  /**
   * Process a line to replace some escape sequences with the actual characters
   *
   * @param line line to escape
   * @return escaped line
   */
  private static String processLineEscapes(String line) {
    line = line.replace("\\n", "\n");
    return UNICODE_ESCAPES.matcher(line).replaceAll(result ->
      Matcher.quoteReplacement(Character.toString((char) Integer.parseInt(result.group(1), 16)))
    );
  }
}
