package regexnfa.parser;

/**
 * Literal symbol: any code point which is not a reserved operator.
 *
 * @param codePoint code point being matched
 */
public record Literal(int codePoint) implements Token {

  public Literal {
    if (Operator.isOperator(codePoint)) {
      throw new IllegalArgumentException("Operator '" + Character.toString(codePoint) + "' is not a literal");
    }
  }

  public static Literal of(char symbol) {
    return new Literal(symbol);
  }

  @Override
  public String text() {
    return Character.toString(codePoint);
  }

  @Override
  public String toString() {
    return "Literal[" + text() + "]";
  }
}
