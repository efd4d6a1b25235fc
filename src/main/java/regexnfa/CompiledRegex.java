package regexnfa;

import regexnfa.graph.Automaton;
import regexnfa.parser.Token;
import java.util.List;

/**
 * Result of compiling a regular expression.
 *
 * @param regex regular expression which was compiled (stripped)
 * @param postfix expression in postfix order
 * @param automaton NFA recognizing the expression
 */
public record CompiledRegex(
  String regex,
  List<Token> postfix,
  Automaton automaton
) {

  public CompiledRegex {
    postfix = List.copyOf(postfix);
  }

  /**
   * Postfix tokens as text.
   *
   * @return text of each postfix token
   */
  public List<String> postfixText() {
    return Token.texts(postfix);
  }
}
