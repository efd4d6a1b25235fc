package regexnfa;

/**
 * Test case in a test file.
 */
public class TestCase {

  /**
   * Marker used in place of the expected postfix when compiling should fail.
   */
  public static final String ERROR = "error";

  /**
   * Regular expression pattern.
   */
  public final String pattern;

  /**
   * Expected postfix tokens, separated by single spaces (or {@link #ERROR}).
   */
  public final String postfix;

  /**
   * Expected number of states in the automaton.
   */
  public final String stateCount;

  /**
   * Source file from which the test originated.
   */
  public final String filePath;

  /**
   * Line in the source file from which the test originated.
   */
  public final int lineNumber;

  public TestCase(
    String pattern,
    String postfix,
    String stateCount,
    String filePath,
    int lineNumber
  ) {
    this.pattern = pattern;
    this.postfix = postfix;
    this.stateCount = stateCount;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  public boolean expectsError() {
    return ERROR.equals(postfix);
  }

  /**
   * Expected output, in the format produced by {@link #createOutput}.
   */
  public String expectedOutput() {
    return postfix + " [" + stateCount + " states]";
  }

  /**
   * Construct an output string from a compiled regex.
   *
   * @param compiled compiled regular expression
   * @return output string
   */
  public static String createOutput(CompiledRegex compiled) {
    return String.join(" ", compiled.postfixText()) + " [" + compiled.automaton().states.size() + " states]";
  }

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return "/" + pattern + "/ (at " + filePath + ":" + lineNumber + ")";
  }
}
