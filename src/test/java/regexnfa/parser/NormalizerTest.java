package regexnfa.parser;

import static org.junit.Assert.assertEquals;

import java.util.List;
import org.junit.Test;

public class NormalizerTest {

  @Test
  public void testEmptyInputIsUnchanged() {
    assertEquals("", Normalizer.normalize(""));
  }

  @Test
  public void testAdjacentLiterals() {
    assertEquals("1.0", Normalizer.normalize("10"));
    assertEquals("a.b.c", Normalizer.normalize("abc"));
  }

  @Test
  public void testStarFollowedByOperand() {
    assertEquals("a*.b", Normalizer.normalize("a*b"));
    assertEquals("a*.(b)", Normalizer.normalize("a*(b)"));
    assertEquals("a**", Normalizer.normalize("a**"));
  }

  @Test
  public void testGroups() {
    assertEquals("a.(b+c)", Normalizer.normalize("a(b+c)"));
    assertEquals("(a+b).c", Normalizer.normalize("(a+b)c"));
    assertEquals("(a).(b)", Normalizer.normalize("(a)(b)"));
    assertEquals("((a))", Normalizer.normalize("((a))"));
  }

  @Test
  public void testNoInsertionAroundBinaryOperators() {
    assertEquals("a+b", Normalizer.normalize("a+b"));
    assertEquals("1.0*", Normalizer.normalize("1.0*"));
  }

  @Test
  public void testWhitespaceIsKeptButTransparent() {
    assertEquals("a. b", Normalizer.normalize("a b"));
    assertEquals("a*.   (b)", Normalizer.normalize("a*   (b)"));
    assertEquals("a + b", Normalizer.normalize("a + b"));
    assertEquals("  a  ", Normalizer.normalize("  a  "));
  }

  @Test
  public void testNoInsertionBeforeClosingGroup() {
    assertEquals("(a.b)", Normalizer.normalize("(ab)"));
    assertEquals("a)", Normalizer.normalize("a)"));
  }

  @Test
  public void testSupplementaryCodePointIsOneSymbol() {
    final String clef = new String(Character.toChars(0x1D11E));
    assertEquals(clef + ".a", Normalizer.normalize(clef + "a"));
  }

  @Test
  public void testIdempotent() {
    for (String regex : List.of("", "10", "a*b", "a(b+c)", "(2*(2+1)*)**", "{{7*       7}}", "a b c", "a)(")) {
      final String once = Normalizer.normalize(regex);
      assertEquals(regex, once, Normalizer.normalize(once));
    }
  }
}
