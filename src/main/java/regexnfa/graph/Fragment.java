package regexnfa.graph;

import java.util.Set;

/**
 * Partially built automaton sitting on the builder's stack.
 *
 * <p>A fragment owns its states and transitions until a composition rule
 * consumes it, after which it must not be used again.
 *
 * @param entry state where the fragment is entered
 * @param exit state where the fragment is left
 * @param states states owned by the fragment
 * @param transitions transitions owned by the fragment
 */
record Fragment(
  int entry,
  int exit,
  Set<Integer> states,
  TransitionMap transitions
) { }
