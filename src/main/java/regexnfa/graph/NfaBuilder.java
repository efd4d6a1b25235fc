package regexnfa.graph;

import regexnfa.parser.Literal;
import regexnfa.parser.Operator;
import regexnfa.parser.Token;
import java.util.List;
import java.util.Set;
import java.util.Stack;
import java.util.TreeSet;

/**
 * Thompson construction of an NFA from a postfix token sequence.
 *
 * The postfix sequence is evaluated with an explicit stack of fragments:
 * literals push a two-state fragment, and each operator pops its operands
 * and pushes the composed fragment. Every rule allocates exactly two fresh
 * states except concatenation, which only adds an epsilon transition.
 *
 * <p>State IDs come from a counter local to the builder, so a builder may
 * only be used for a single construction.
 */
public final class NfaBuilder {

  private final Set<String> alphabet;
  private final Stack<Fragment> fragments = new Stack<>();
  private boolean used = false;
  private int lastState = 0;

  /**
   * @param alphabet symbols the automaton is defined over (literals found in
   *                 the postfix sequence are added to these)
   */
  public NfaBuilder(Set<String> alphabet) {
    this.alphabet = new TreeSet<>(alphabet);
  }

  /**
   * Summon a fresh state identifier.
   *
   * @return fresh state ID
   */
  private int freshState() {
    return lastState++;
  }

  /**
   * Evaluate the postfix sequence into an automaton.
   *
   * @param postfix tokens in postfix order
   * @return automaton with a single start and a single accepting state
   * @throws InvalidPostfixException if an operator lacks operands or a
   *                                 parenthesis is present
   */
  public Automaton build(List<? extends Token> postfix) throws InvalidPostfixException {
    if (used) {
      throw new IllegalStateException("build may only be called once on an NFA builder");
    } else {
      used = true;
    }

    // The empty expression is a lone state which is both initial and accepting
    if (postfix.isEmpty()) {
      final int state = freshState();
      return new Automaton(Set.of(state), alphabet, new TransitionMap(), state, state);
    }

    int position = 0;
    for (Token token : postfix) {
      if (token == null) {
        throw new InvalidPostfixException("Missing token", null, position);
      } else if (token instanceof Literal literal) {
        pushLiteral(literal.text());
      } else if (token instanceof Operator operator) {
        if (operator.isStructural()) {
          throw new InvalidPostfixException("Parentheses cannot appear in postfix", token, position);
        }
        if (fragments.size() < operator.arity()) {
          throw new InvalidPostfixException(
            "Operator needs " + operator.arity() + " operand(s) but only " + fragments.size() + " available",
            token,
            position
          );
        }
        switch (operator) {
          case CONCATENATION: {
            final Fragment right = fragments.pop();
            final Fragment left = fragments.pop();
            fragments.push(concatenate(left, right));
            break;
          }
          case ALTERNATION: {
            final Fragment right = fragments.pop();
            final Fragment left = fragments.pop();
            fragments.push(alternate(left, right));
            break;
          }
          case KLEENE_STAR:
            fragments.push(closure(fragments.pop()));
            break;
          default:
            throw new IllegalStateException("Unhandled operator " + operator);
        }
      } else {
        throw new InvalidPostfixException("Unknown token type", token, position);
      }
      position++;
    }

    // Only reachable for sequences missing concatenations: glue leftovers together
    while (fragments.size() > 1) {
      final Fragment right = fragments.pop();
      final Fragment left = fragments.pop();
      fragments.push(concatenate(left, right));
    }

    final Fragment result = fragments.pop();
    return new Automaton(result.states(), alphabet, result.transitions(), result.entry(), result.exit());
  }

  private void pushLiteral(String symbol) {
    final int start = freshState();
    final int end = freshState();
    final var transitions = new TransitionMap();
    transitions.add(start, symbol, end);
    alphabet.add(symbol);
    fragments.push(new Fragment(start, end, states(start, end), transitions));
  }

  private Fragment concatenate(Fragment left, Fragment right) {
    final var transitions = TransitionMap.merge(left.transitions(), right.transitions());
    transitions.addEpsilon(left.exit(), right.entry());

    final var states = new TreeSet<>(left.states());
    states.addAll(right.states());
    return new Fragment(left.entry(), right.exit(), states, transitions);
  }

  private Fragment alternate(Fragment left, Fragment right) {
    final int start = freshState();
    final int end = freshState();
    final var transitions = TransitionMap.merge(left.transitions(), right.transitions());
    transitions.addEpsilon(start, left.entry());
    transitions.addEpsilon(start, right.entry());
    transitions.addEpsilon(left.exit(), end);
    transitions.addEpsilon(right.exit(), end);

    final var states = states(start, end);
    states.addAll(left.states());
    states.addAll(right.states());
    return new Fragment(start, end, states, transitions);
  }

  private Fragment closure(Fragment inner) {
    final int start = freshState();
    final int end = freshState();
    final var transitions = TransitionMap.merge(inner.transitions());
    transitions.addEpsilon(start, inner.entry());
    transitions.addEpsilon(start, end);
    transitions.addEpsilon(inner.exit(), inner.entry());
    transitions.addEpsilon(inner.exit(), end);

    final var states = states(start, end);
    states.addAll(inner.states());
    return new Fragment(start, end, states, transitions);
  }

  private static TreeSet<Integer> states(int start, int end) {
    final var states = new TreeSet<Integer>();
    states.add(start);
    states.add(end);
    return states;
  }
}
