package regexnfa.graph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import regexnfa.parser.Normalizer;
import regexnfa.parser.PostfixConverter;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Test;

public class AutomatonTest {

  private static Automaton build(String regex) {
    return new NfaBuilder(Set.of()).build(PostfixConverter.lenient().convert(Normalizer.normalize(regex)));
  }

  @Test
  public void testTransitionTable() {
    final Map<String, Map<String, List<Integer>>> table = build("10").toTransitionTable();
    assertEquals(List.of("0", "1", "2", "3"), List.copyOf(table.keySet()));
    assertEquals(Map.of("1", List.of(1)), table.get("0"));
    assertEquals(Map.of("", List.of(2)), table.get("1"));
    assertEquals(Map.of("0", List.of(3)), table.get("2"));
    assertEquals(Map.of(), table.get("3"));
  }

  @Test
  public void testTransitionTableOfEmptyAutomaton() {
    final Map<String, Map<String, List<Integer>>> table = build("").toTransitionTable();
    assertEquals(Map.of("0", Map.of()), table);
  }

  @Test
  public void testTransitionTableListsAllDestinations() {
    final Map<String, Map<String, List<Integer>>> table = build("a*").toTransitionTable();
    assertEquals(List.of(0, 3), table.get("2").get(TransitionMap.EPSILON));
    assertEquals(List.of(0, 3), table.get("1").get(TransitionMap.EPSILON));
  }

  @Test
  public void testDotGraph() {
    final String dot = build("10").dotGraph("10");
    assertTrue(dot, dot.startsWith("digraph \"10\" {\n  rankdir = LR;\n"));
    assertTrue(dot, dot.contains("  \"0\" [shape = circle, label = <0>];\n"));
    assertTrue(dot, dot.contains("  \"3\" [shape = doublecircle, label = <3>];\n"));
    assertTrue(dot, dot.contains("  \"_gen1\" [shape = none, label = <>];\n"));
    assertTrue(dot, dot.contains("  \"_gen1\" -> \"0\" [label = <>];\n"));
    assertTrue(dot, dot.contains("  \"0\" -> \"1\" [label = <1>];\n"));
    assertTrue(dot, dot.contains("  \"1\" -> \"2\" [label = <ε>];\n"));
    assertTrue(dot, dot.endsWith("}"));
  }

  @Test
  public void testDotGraphEscapesLabels() {
    final String dot = build("<&").dotGraph("a\"b");
    assertTrue(dot, dot.startsWith("digraph \"a\\\"b\" {"));
    assertTrue(dot, dot.contains("[label = <&lt;>]"));
    assertTrue(dot, dot.contains("[label = <&amp;>]"));
  }

  @Test
  public void testUnknownStateLookup() {
    try {
      build("a").transitionsFrom(42);
      fail("expected unknown state");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testTransitionsMustStayInsideStates() {
    final var transitions = new TransitionMap();
    transitions.add(0, "a", 1);
    try {
      new Automaton(Set.of(0), Set.of("a"), transitions, 0, 0);
      fail("expected dangling transition to be rejected");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testImmutable() {
    final Automaton automaton = build("a");
    try {
      automaton.transitions.get(0).get("a").add(5);
      fail("expected an unmodifiable view");
    } catch (UnsupportedOperationException e) {
      // expected
    }
  }
}
