package regexnfa.parser;

import java.util.Optional;

/**
 * Reserved operator characters.
 *
 * <p>The set is closed: every other code point in a pattern is a literal.
 * Parentheses are structural and carry no precedence, and never appear in
 * the output of {@link PostfixConverter}.
 */
public enum Operator implements Token {
  KLEENE_STAR('*', 3),
  CONCATENATION('.', 2),
  ALTERNATION('+', 1),
  OPEN_GROUP('(', 0),
  CLOSE_GROUP(')', 0);

  /**
   * Operator character.
   */
  public final char symbol;

  /**
   * Binding strength: higher binds tighter.
   */
  public final int precedence;

  Operator(char symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  /**
   * Look up the operator for a code point.
   *
   * @param codePoint code point to classify
   * @return operator, or empty if the code point is a literal
   */
  public static Optional<Operator> fromCodePoint(int codePoint) {
    switch (codePoint) {
      case '*':
        return Optional.of(KLEENE_STAR);
      case '.':
        return Optional.of(CONCATENATION);
      case '+':
        return Optional.of(ALTERNATION);
      case '(':
        return Optional.of(OPEN_GROUP);
      case ')':
        return Optional.of(CLOSE_GROUP);
      default:
        return Optional.empty();
    }
  }

  public static boolean isOperator(int codePoint) {
    return fromCodePoint(codePoint).isPresent();
  }

  /**
   * Number of operands consumed when evaluating the postfix form.
   *
   * @return arity (zero for structural operators)
   */
  public int arity() {
    switch (this) {
      case KLEENE_STAR:
        return 1;
      case CONCATENATION:
      case ALTERNATION:
        return 2;
      default:
        return 0;
    }
  }

  public boolean isStructural() {
    return this == OPEN_GROUP || this == CLOSE_GROUP;
  }

  @Override
  public String text() {
    return Character.toString(symbol);
  }
}
