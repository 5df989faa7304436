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
 * Immutable non-deterministic finite state automaton.
 *
 * The states are unique integers and the transitions are labelled with either
 * a literal character or epsilon. There is exactly one initial and one
 * accepting state.
 */
public final class Nfa implements DotGraph<Integer, Label> {

  /**
   * State transitions, indexed along all of the starting states.
   *
   * Every state of the automaton is a key, including states with no outgoing
   * transitions (such as the accepting one). States iterate in ascending order
   * and labels iterate epsilon first. None of the nested maps or sets are
   * modifiable.
   */
  public final SortedMap<Integer, SortedMap<Label, SortedSet<Integer>>> transitions;

  /**
   * Initial state.
   */
  public final int startState;

  /**
   * Sole accepting state.
   */
  public final int acceptState;

  private Nfa(
    SortedMap<Integer, SortedMap<Label, SortedSet<Integer>>> transitions,
    int startState,
    int acceptState
  ) {
    this.transitions = transitions;
    this.startState = startState;
    this.acceptState = acceptState;
  }

  /**
   * Deep copy a transition table into a new automaton.
   *
   * @param startState initial state
   * @param acceptState accepting state
   * @param source transition table, which is not retained
   * @return frozen automaton
   */
  static Nfa copyOf(int startState, int acceptState, Map<Integer, ? extends Map<Label, ? extends Set<Integer>>> source) {
    final var states = new TreeMap<Integer, SortedMap<Label, SortedSet<Integer>>>();
    states.put(startState, new TreeMap<>());
    states.put(acceptState, new TreeMap<>());

    for (var stateEntry : source.entrySet()) {
      final var labels = states.computeIfAbsent(stateEntry.getKey(), s -> new TreeMap<>());
      for (var labelEntry : stateEntry.getValue().entrySet()) {
        for (Integer to : labelEntry.getValue()) {
          labels.computeIfAbsent(labelEntry.getKey(), l -> new TreeSet<>()).add(to);
          states.computeIfAbsent(to, s -> new TreeMap<>());
        }
      }
    }

    // Defensively prevent updates to the nested maps and sets
    states.replaceAll((state, labels) -> {
      final var frozenLabels = new TreeMap<Label, SortedSet<Integer>>();
      labels.forEach((label, to) -> frozenLabels.put(label, Collections.unmodifiableSortedSet(to)));
      return Collections.unmodifiableSortedMap(frozenLabels);
    });

    return new Nfa(Collections.unmodifiableSortedMap(states), startState, acceptState);
  }

  /**
   * All states in the automaton, in ascending order.
   */
  public Set<Integer> states() {
    return transitions.keySet();
  }

  /**
   * States reached from a state by a single transition with the given label.
   *
   * @param from source state
   * @param label transition label
   * @return destinations (empty if there are none)
   */
  public SortedSet<Integer> destinations(int from, Label label) {
    final var labels = transitions.get(from);
    final var to = labels == null ? null : labels.get(label);
    return to == null ? Collections.emptySortedSet() : to;
  }

  /**
   * Number of {@code (from, label, to)} triples in the automaton.
   */
  public int transitionCount() {
    return (int) transitionTriples().count();
  }

  /**
   * Number of {@code (from, label, to)} triples whose label is not epsilon.
   */
  public int literalTransitionCount() {
    return (int) transitionTriples().filter(edge -> !edge.label().epsilon()).count();
  }

  /**
   * Human readable listing of the transitions, one {@code from --label--> [to, ...]}
   * line per state and label, indented by two spaces.
   */
  public String transitionListing() {
    final var builder = new StringBuilder();
    transitions.forEach((from, labels) ->
      labels.forEach((label, to) ->
        builder.append("  ").append(from).append(" --").append(label).append("--> ").append(to).append('\n')
      )
    );
    return builder.toString();
  }

  private Stream<DotGraph.Edge<Integer, Label>> transitionTriples() {
    return transitions
      .entrySet()
      .stream()
      .flatMap(stateEntry -> stateEntry
        .getValue()
        .entrySet()
        .stream()
        .flatMap(labelEntry -> labelEntry
          .getValue()
          .stream()
          .map(to -> new DotGraph.Edge<Integer, Label>(stateEntry.getKey(), to, labelEntry.getKey()))
        )
      );
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return states()
      .stream()
      .map(state -> new DotGraph.Vertex<Integer>(state, state == acceptState));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, Label>> edges() {
    final var initialEdge = Stream.of(new DotGraph.Edge<Integer, Label>(null, startState, null));
    return Stream.concat(initialEdge, transitionTriples());
  }

  @Override
  public String renderEdgeLabel(DotGraph.Edge<Integer, Label> edge) {
    final Label label = edge.label();
    return label == null ? "" : label.dotLabel();
  }

  @Override
  public String renderEdgeAttributes(DotGraph.Edge<Integer, Label> edge) {
    final Label label = edge.label();
    return label != null && label.epsilon() ? ", style = dashed" : "";
  }

  @Override
  public String toString() {
    return "Nfa(start = " + startState + ", accept = " + acceptState + ", states = " + transitions.size() + ")";
  }
}
