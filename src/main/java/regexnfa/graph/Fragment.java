package regexnfa.graph;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Partially built NFA with one start and one accept state.
 *
 * <p>Fragments are the unit Thompson's construction composes. When one fragment
 * becomes part of a larger one, the larger one {@link #absorb absorbs} its
 * transitions and the smaller one is sealed: destination sets are moved rather
 * than shared, so two live fragments never observe each other's transitions.
 * A sealed fragment rejects every further use.
 */
public final class Fragment {

  /**
   * Initial state of the fragment.
   */
  public final int start;

  /**
   * Sole accepting state of the fragment.
   */
  public final int accept;

  // State -> label -> destinations, or `null` once sealed
  private Map<Integer, Map<Label, Set<Integer>>> transitions = new HashMap<>();

  /**
   * Empty fragment over two already allocated states.
   *
   * @param start initial state
   * @param accept accepting state
   */
  public Fragment(int start, int accept) {
    this.start = start;
    this.accept = accept;
  }

  /**
   * Add a single transition.
   *
   * @param from state the transition leaves
   * @param label input consumed (or epsilon)
   * @param to state the transition enters
   */
  public void addTransition(int from, Label label, int to) {
    live()
      .computeIfAbsent(from, state -> new HashMap<>())
      .computeIfAbsent(label, l -> new HashSet<>())
      .add(to);
  }

  /**
   * Take over all of the transitions of another fragment, sealing it.
   *
   * <p>The larger of the two tables is kept and the smaller one is merged
   * into it, so a chain of absorptions never re-walks what it already owns.
   *
   * @param other fragment whose transitions move into this one
   */
  public void absorb(Fragment other) {
    if (other == this) {
      throw new IllegalArgumentException("A fragment cannot absorb itself");
    }
    var kept = live();
    var merged = other.live();
    other.transitions = null;

    if (merged.size() > kept.size()) {
      final var swap = kept;
      kept = merged;
      merged = swap;
    }
    transitions = kept;

    for (var stateEntry : merged.entrySet()) {
      final var existing = kept.putIfAbsent(stateEntry.getKey(), stateEntry.getValue());
      if (existing == null) {
        continue;
      }
      for (var labelEntry : stateEntry.getValue().entrySet()) {
        final var destinations = existing.putIfAbsent(labelEntry.getKey(), labelEntry.getValue());
        if (destinations != null) {
          destinations.addAll(labelEntry.getValue());
        }
      }
    }
  }

  /**
   * Has this fragment been absorbed or turned into an {@code Nfa}?
   */
  public boolean isSealed() {
    return transitions == null;
  }

  /**
   * Destinations reachable from a state over one label.
   *
   * @param from source state
   * @param label transition label
   * @return read-only view of the destinations (empty if there are none)
   */
  public Set<Integer> destinations(int from, Label label) {
    final var labels = live().get(from);
    final var destinations = labels == null ? null : labels.get(label);
    return destinations == null ? Set.of() : Collections.unmodifiableSet(destinations);
  }

  /**
   * Freeze the fragment into an immutable automaton, sealing the fragment.
   *
   * @return automaton with the same start, accept and transitions
   */
  public Nfa toNfa() {
    final var frozen = Nfa.copyOf(start, accept, live());
    transitions = null;
    return frozen;
  }

  private Map<Integer, Map<Label, Set<Integer>>> live() {
    if (transitions == null) {
      throw new IllegalStateException(
        "Fragment " + start + " -> " + accept + " has already been consumed"
      );
    }
    return transitions;
  }
}
