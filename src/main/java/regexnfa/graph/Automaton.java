package regexnfa.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Nondeterministic finite automaton with epsilon transitions.
 *
 * The states are unique non-negative integers. Transitions are indexed by
 * source state and then by symbol, with epsilon transitions stored under
 * {@link TransitionMap#EPSILON}. Every state has an entry in the transition
 * table (possibly empty), so lookups never fail for a known state.
 *
 * <p>Instances are immutable.
 */
public final class Automaton implements DotGraph<Integer, String> {

  /**
   * Label drawn on epsilon edges.
   */
  public static final String EPSILON_LABEL = "ε";

  /**
   * All states, in ascending order.
   */
  public final SortedSet<Integer> states;

  /**
   * Symbols the automaton may transition on (never contains epsilon).
   */
  public final Set<String> alphabet;

  /**
   * Transition relation: state to symbol to destination states.
   */
  public final Map<Integer, Map<String, Set<Integer>>> transitions;

  /**
   * Initial state.
   */
  public final int startState;

  /**
   * Single accepting state.
   */
  public final int acceptState;

  // Private copy backing `transitions`, never handed out
  private final TransitionMap table;

  Automaton(
    Set<Integer> states,
    Set<String> alphabet,
    TransitionMap transitions,
    int startState,
    int acceptState
  ) {
    final var table = TransitionMap.merge(transitions);
    for (int state : states) {
      table.addState(state);
    }
    if (!states.containsAll(table.states())) {
      throw new IllegalArgumentException("Transitions reference states outside of the automaton");
    }
    if (!states.contains(startState) || !states.contains(acceptState)) {
      throw new IllegalArgumentException("Start and accept states must be states of the automaton");
    }

    this.states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
    this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(alphabet));
    this.table = table;
    this.transitions = table.freeze();
    this.startState = startState;
    this.acceptState = acceptState;
  }

  /**
   * Outgoing transitions of a state.
   *
   * @param state source state
   * @return symbol to destinations (empty for a state with no transitions)
   */
  public Map<String, Set<Integer>> transitionsFrom(int state) {
    final var outgoing = transitions.get(state);
    if (outgoing == null) {
      throw new IllegalArgumentException("Unknown state " + state);
    }
    return outgoing;
  }

  /**
   * Destinations reachable from a state on one symbol.
   *
   * @param state source state
   * @param symbol symbol consumed, or {@link TransitionMap#EPSILON}
   * @return destination states (possibly empty)
   */
  public Set<Integer> targets(int state, String symbol) {
    return transitionsFrom(state).getOrDefault(symbol, Collections.emptySortedSet());
  }

  /**
   * Flatten the transition relation.
   *
   * @return every (state, symbol, destination) triple
   */
  public Stream<TransitionMap.Transition> transitionStream() {
    return table.stream();
  }

  public int transitionCount() {
    return (int) transitionStream().count();
  }

  /**
   * Serialization-ready view of the transitions.
   *
   * <p>State IDs become strings, epsilon stays under the empty string key,
   * and destination sets become ascending lists. Every state is present.
   *
   * @return state to symbol to destinations
   */
  public Map<String, Map<String, List<Integer>>> toTransitionTable() {
    final var view = new LinkedHashMap<String, Map<String, List<Integer>>>();
    for (var stateEntry : transitions.entrySet()) {
      final var symbols = new LinkedHashMap<String, List<Integer>>();
      for (var symbolEntry : stateEntry.getValue().entrySet()) {
        symbols.put(symbolEntry.getKey(), new ArrayList<>(symbolEntry.getValue()));
      }
      view.put(stateEntry.getKey().toString(), symbols);
    }
    return view;
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return states
      .stream()
      .map((Integer id) -> new DotGraph.Vertex<Integer>(id, id == acceptState));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, String>> edges() {
    final var initialEdge = Stream
      .of(new DotGraph.Edge<Integer, String>(null, startState, null));
    final var transitionEdges = transitionStream()
      .map(t -> new DotGraph.Edge<Integer, String>(t.from(), t.to(), t.symbol()));
    return Stream.concat(initialEdge, transitionEdges);
  }

  @Override
  public String renderEdgeLabel(DotGraph.Edge<Integer, String> edge) {
    final String label = edge.label();
    if (label == null) {
      return "";
    } else if (label.equals(TransitionMap.EPSILON)) {
      return EPSILON_LABEL;
    } else {
      return DotGraph.escapeHtml(label);
    }
  }

  @Override
  public String toString() {
    return "Automaton[start=" + startState + ", accept=" + acceptState + ", transitions=" + transitions + "]";
  }
}
