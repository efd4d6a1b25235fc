package regexnfa;

import java.util.function.Consumer;

/**
 * Charged with running test cases.
 */
public class TestRunner implements Consumer<TestCase> {

  /**
   * How are test outcomes reported?
   */
  final TestReporter reporter;

  /**
   * Compiler under test.
   */
  final RegexCompiler compiler;

  public TestRunner(TestReporter reporter) {
    this(reporter, RegexCompiler.strict());
  }

  public TestRunner(TestReporter reporter, RegexCompiler compiler) {
    this.reporter = reporter;
    this.compiler = compiler;
  }

  /**
   * Accept a new test case.
   *
   * @param testCase test to run
   */
  public void accept(TestCase testCase) {

    // Compile the pattern
    final CompiledRegex compiled;
    try {
      compiled = compiler.compile(testCase.pattern);
    } catch (IllegalArgumentException error) {
      if (testCase.expectsError()) {
        reporter.onSuccess(testCase, true);
      } else {
        reporter.onPatternError(testCase, error);
      }
      return;
    }

    // Compare the outputs
    final String foundOutput = TestCase.createOutput(compiled);
    if (!testCase.expectsError() && testCase.expectedOutput().equals(foundOutput)) {
      reporter.onSuccess(testCase, false);
    } else {
      reporter.onUnexpectedOutput(testCase, foundOutput);
    }
  }
}
