package regexnfa.graph;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Nondeterministic transition relation, indexed by source state and then by
 * symbol.
 *
 * <p>Epsilon transitions use the reserved {@link #EPSILON} key. Maps are
 * combined with {@link #merge}, which unions the destination sets of every
 * (state, symbol) pair and is associative.
 */
public final class TransitionMap {

  /**
   * Symbol key for transitions which consume no input.
   */
  public static final String EPSILON = "";

  /**
   * Single transition in the relation.
   *
   * @param from source state
   * @param symbol symbol consumed, or {@link #EPSILON}
   * @param to destination state
   */
  public record Transition(int from, String symbol, int to) {

    public boolean isEpsilon() {
      return EPSILON.equals(symbol);
    }
  }

  private final SortedMap<Integer, SortedMap<String, SortedSet<Integer>>> transitions = new TreeMap<>();

  /**
   * Union any number of transition maps into a fresh map.
   *
   * <p>The arguments are left untouched.
   *
   * @param maps maps to combine
   * @return new map containing every transition of every argument
   */
  public static TransitionMap merge(TransitionMap... maps) {
    final var merged = new TransitionMap();
    for (TransitionMap map : maps) {
      for (var stateEntry : map.transitions.entrySet()) {
        final var outgoing = merged.outgoing(stateEntry.getKey());
        for (var symbolEntry : stateEntry.getValue().entrySet()) {
          outgoing
            .computeIfAbsent(symbolEntry.getKey(), k -> new TreeSet<>())
            .addAll(symbolEntry.getValue());
        }
      }
    }
    return merged;
  }

  /**
   * Record a transition on a symbol.
   *
   * @param from source state
   * @param symbol symbol consumed (or {@link #EPSILON})
   * @param to destination state
   */
  public void add(int from, String symbol, int to) {
    outgoing(to);
    outgoing(from)
      .computeIfAbsent(symbol, k -> new TreeSet<>())
      .add(to);
  }

  public void addEpsilon(int from, int to) {
    add(from, EPSILON, to);
  }

  /**
   * Make sure the state has an entry, even if it has no outgoing transitions.
   *
   * @param state state to register
   */
  public void addState(int state) {
    outgoing(state);
  }

  private SortedMap<String, SortedSet<Integer>> outgoing(int state) {
    return transitions.computeIfAbsent(state, k -> new TreeMap<>());
  }

  /**
   * States which have an entry in the map (as a source or a destination).
   *
   * @return states in ascending order
   */
  public Set<Integer> states() {
    return Collections.unmodifiableSet(transitions.keySet());
  }

  /**
   * All transitions, ordered by source state, then symbol, then destination.
   *
   * @return stream of transitions
   */
  public Stream<Transition> stream() {
    return transitions
      .entrySet()
      .stream()
      .flatMap(stateEntry -> stateEntry
        .getValue()
        .entrySet()
        .stream()
        .flatMap(symbolEntry -> symbolEntry
          .getValue()
          .stream()
          .map(to -> new Transition(stateEntry.getKey(), symbolEntry.getKey(), to))
        )
      );
  }

  /**
   * Deep, unmodifiable copy of the relation.
   *
   * @return state to symbol to destinations
   */
  Map<Integer, Map<String, Set<Integer>>> freeze() {
    final var frozen = new TreeMap<Integer, Map<String, Set<Integer>>>();
    for (var stateEntry : transitions.entrySet()) {
      final var symbols = new TreeMap<String, Set<Integer>>();
      for (var symbolEntry : stateEntry.getValue().entrySet()) {
        symbols.put(symbolEntry.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(symbolEntry.getValue())));
      }
      frozen.put(stateEntry.getKey(), Collections.unmodifiableSortedMap(symbols));
    }
    return Collections.unmodifiableSortedMap(frozen);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof TransitionMap map && transitions.equals(map.transitions);
  }

  @Override
  public int hashCode() {
    return transitions.hashCode();
  }

  @Override
  public String toString() {
    return transitions.toString();
  }
}
