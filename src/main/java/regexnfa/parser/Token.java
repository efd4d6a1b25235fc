package regexnfa.parser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Token in a postfix regular expression.
 *
 * <p>Tokens are either a {@link Literal} symbol or one of the fixed set of
 * {@link Operator}s.
 */
public interface Token {

  /**
   * Textual form of the token, exactly as it appeared in the pattern.
   *
   * @return text of the token
   */
  String text();

  /**
   * Render a sequence of tokens as their textual forms.
   *
   * @param tokens tokens to render
   * @return text of each token, in order
   */
  static List<String> texts(List<? extends Token> tokens) {
    return tokens
      .stream()
      .map(Token::text)
      .collect(Collectors.toUnmodifiableList());
  }
}
