package regexnfa.parser;

/**
 * Makes concatenation explicit in a regular expression.
 *
 * <p>A {@code .} is inserted wherever the end of an operand (a literal, a
 * closed group, or a Kleene star) is directly followed by the start of an
 * operand (a literal or an opened group). Whitespace is copied through
 * untouched and is transparent when deciding adjacency, so {@code "a b"}
 * normalizes to {@code "a. b"}.
 *
 * <p>Normalizing is idempotent since {@code .} itself never triggers an
 * insertion.
 */
public final class Normalizer {

  private Normalizer() { }

  /**
   * Insert explicit concatenation operators.
   *
   * @param regex raw regular expression
   * @return equivalent expression with every concatenation explicit
   */
  public static String normalize(String regex) {
    final int[] codePoints = regex.codePoints().toArray();
    final var output = new StringBuilder(regex.length() * 2);

    for (int i = 0; i < codePoints.length; i++) {
      final int current = codePoints[i];
      output.appendCodePoint(current);
      if (Character.isWhitespace(current)) {
        continue;
      }

      // Next token, skipping over whitespace
      int next = i + 1;
      while (next < codePoints.length && Character.isWhitespace(codePoints[next])) {
        next++;
      }

      if (next < codePoints.length && endsOperand(current) && startsOperand(codePoints[next])) {
        output.append(Operator.CONCATENATION.symbol);
      }
    }

    return output.toString();
  }

  private static boolean endsOperand(int codePoint) {
    return Operator
      .fromCodePoint(codePoint)
      .map(op -> op == Operator.CLOSE_GROUP || op == Operator.KLEENE_STAR)
      .orElse(true);
  }

  private static boolean startsOperand(int codePoint) {
    return Operator
      .fromCodePoint(codePoint)
      .map(op -> op == Operator.OPEN_GROUP)
      .orElse(true);
  }
}
