package regexnfa;

import regexnfa.graph.Automaton;
import regexnfa.graph.InvalidPostfixException;
import regexnfa.graph.NfaBuilder;
import regexnfa.parser.MalformedExpressionException;
import regexnfa.parser.Normalizer;
import regexnfa.parser.PostfixConverter;
import regexnfa.parser.Token;
import java.util.List;
import java.util.Set;

/**
 * Compiles regular expressions over literals, {@code *}, {@code +},
 * {@code .} and parentheses into NFAs.
 *
 * <p>Compilation happens in three stages: concatenations are made explicit
 * ({@link Normalizer}), the expression is put in postfix order
 * ({@link PostfixConverter}), and the postfix sequence is evaluated into an
 * automaton ({@link NfaBuilder}). A compiler holds no mutable state, so it
 * can be shared across threads.
 */
public final class RegexCompiler {

  /**
   * Alphabet used when the caller does not supply one.
   */
  public static final Set<String> DEFAULT_ALPHABET = Set.of("0", "1");

  private final PostfixConverter converter;

  public RegexCompiler() {
    this(PostfixConverter.lenient());
  }

  public RegexCompiler(PostfixConverter converter) {
    this.converter = converter;
  }

  /**
   * Compiler which rejects unbalanced parentheses.
   */
  public static RegexCompiler strict() {
    return new RegexCompiler(PostfixConverter.strict());
  }

  /**
   * Turn a raw regular expression into postfix order.
   *
   * @param regex regular expression
   * @return postfix tokens
   * @throws MalformedExpressionException if the converter is strict and the
   *                                      parentheses do not balance
   */
  public List<Token> toPostfix(String regex) throws MalformedExpressionException {
    return converter.convert(Normalizer.normalize(regex));
  }

  /**
   * Evaluate a postfix sequence into an automaton.
   *
   * @param postfix tokens in postfix order
   * @param alphabet symbols the automaton is defined over
   * @return automaton
   * @throws InvalidPostfixException if the sequence cannot be evaluated
   */
  public Automaton buildAutomaton(List<? extends Token> postfix, Set<String> alphabet) throws InvalidPostfixException {
    return new NfaBuilder(alphabet).build(postfix);
  }

  public CompiledRegex compile(String regex) {
    return compile(regex, DEFAULT_ALPHABET);
  }

  /**
   * Compile a regular expression, keeping the intermediate postfix form.
   *
   * <p>Unlike {@link #toPostfix}, blank input is rejected. Surrounding
   * whitespace is stripped before compiling.
   *
   * @param regex regular expression
   * @param alphabet symbols the automaton is defined over
   * @return regex, postfix form, and automaton
   * @throws IllegalArgumentException if the regex is blank, or cannot be compiled
   */
  public CompiledRegex compile(String regex, Set<String> alphabet) {
    final String stripped = regex.strip();
    if (stripped.isEmpty()) {
      throw new IllegalArgumentException("Regex cannot be empty");
    }
    final List<Token> postfix = toPostfix(stripped);
    return new CompiledRegex(stripped, postfix, buildAutomaton(postfix, alphabet));
  }
}
