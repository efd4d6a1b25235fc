package regexnfa.graph;

import regexnfa.parser.Token;

/**
 * Postfix token sequence which cannot be evaluated into an automaton.
 *
 * <p>This happens when an operator does not have enough operands on the
 * stack, or when a token which has no postfix meaning (eg. a parenthesis)
 * shows up.
 */
public class InvalidPostfixException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = -4417391590652308842L;

  /**
   * Offending token (may be {@code null}).
   */
  public final transient Token token;

  /**
   * Position of the offending token in the postfix sequence.
   */
  public final int position;

  public InvalidPostfixException(String message, Token token, int position) {
    super(message + " (token " + (token == null ? "null" : "'" + token.text() + "'") + " at position " + position + ")");
    this.token = token;
    this.position = position;
  }
}
