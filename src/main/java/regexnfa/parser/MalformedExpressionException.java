package regexnfa.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Pattern syntax exception for expressions whose parentheses do not balance.
 *
 * <p>Only raised by a {@link PostfixConverter} in strict mode.
 */
public class MalformedExpressionException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 3391782045528841627L;

  /**
   * Operator which could not be matched up.
   */
  public final Operator unmatched;

  public MalformedExpressionException(
    Operator unmatched,
    String regex,
    int index
  ) {
    super(
      "Unmatched " + (unmatched == Operator.OPEN_GROUP ? "opening" : "closing") + " parenthesis",
      regex,
      index
    );
    this.unmatched = unmatched;
  }
}
