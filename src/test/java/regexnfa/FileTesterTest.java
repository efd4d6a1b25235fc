package regexnfa;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class FileTesterTest {

  // Collects every outcome instead of printing
  private static class RecordingReporter implements TestReporter {
    final List<String> failures = new ArrayList<>();
    int successes = 0;
    int expectedFailures = 0;

    @Override
    public void onPatternError(TestCase testCase, Exception error) {
      failures.add(testCase.getSummary() + ": " + error.getMessage());
    }

    @Override
    public void onUnexpectedOutput(TestCase testCase, String foundOutput) {
      failures.add(testCase.getSummary() + ": got '" + foundOutput + "'");
    }

    @Override
    public void onSuccess(TestCase testCase, boolean expectedFailure) {
      successes++;
      if (expectedFailure) {
        expectedFailures++;
      }
    }
  }

  @Test
  public void testBundledCases() throws IOException {
    final var reporter = new RecordingReporter();
    final var stream = FileTesterTest.class.getResourceAsStream("TestCases.txt");
    try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      new TestFileReader(reader, "TestCases.txt").forEachTestCase(new TestRunner(reporter));
    }
    assertEquals(List.of(), reporter.failures);
    assertEquals(19, reporter.successes);
    assertEquals(3, reporter.expectedFailures);
  }

  @Test
  public void testMismatchIsReported() throws IOException {
    final var reporter = new RecordingReporter();
    final var input = "// comment\n\nab\na b +\n4\n";
    new TestFileReader(new BufferedReader(new StringReader(input)), "inline").forEachTestCase(new TestRunner(reporter));
    assertEquals(1, reporter.failures.size());
    assertTrue(reporter.failures.get(0), reporter.failures.get(0).contains("got 'a b . [4 states]'"));
    assertTrue(reporter.failures.get(0), reporter.failures.get(0).contains("inline:3"));
  }

  @Test
  public void testUnexpectedSuccessIsReported() throws IOException {
    final var reporter = new RecordingReporter();
    final var input = "ab\nerror\n0\n";
    new TestFileReader(new BufferedReader(new StringReader(input)), "inline").forEachTestCase(new TestRunner(reporter));
    assertEquals(1, reporter.failures.size());
    assertEquals(0, reporter.successes);
  }

  @Test
  public void testEscapes() throws IOException {
    final var input = "\\u0061b\na b .\n4\n";
    final TestCase testCase = new TestFileReader(new BufferedReader(new StringReader(input)), "inline").readTestCase();
    assertEquals("ab", testCase.pattern);
    assertEquals(1, testCase.lineNumber);
  }

  @Test
  public void testEscapedReplacementCharacters() throws IOException {
    final var input = "a\\u0024\na $ .\n4\n\\u005c*\n\\ *\n4\n";
    final var reader = new TestFileReader(new BufferedReader(new StringReader(input)), "inline");
    assertEquals("a$", reader.readTestCase().pattern);
    assertEquals("\\*", reader.readTestCase().pattern);

    final var reporter = new RecordingReporter();
    new TestFileReader(new BufferedReader(new StringReader(input)), "inline").forEachTestCase(new TestRunner(reporter));
    assertEquals(List.of(), reporter.failures);
    assertEquals(2, reporter.successes);
  }

  @Test
  public void testProcessFileOfTests() throws IOException {
    final Path file = Files.createTempFile("regex-cases", ".txt");
    try {
      Files.writeString(file, "a*b\na * b .\n6\n\n(a\nerror\n0\n", StandardCharsets.UTF_8);
      final var reporter = new RecordingReporter();
      FileTesterMain.processFileOfTests(new TestRunner(reporter), file.toString());
      assertEquals(List.of(), reporter.failures);
      assertEquals(2, reporter.successes);
    } finally {
      Files.delete(file);
    }
  }
}
