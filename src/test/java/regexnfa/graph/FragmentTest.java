package regexnfa.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

/**
 * Tests for {@link Fragment}.
 */
public class FragmentTest {

  private static final Label A = Label.of('a');
  private static final Label B = Label.of('b');

  @Test
  public void addTransitionCreatesNestedEntries() {
    final var fragment = new Fragment(0, 1);
    assertThat(fragment.destinations(0, A), is(empty()));

    fragment.addTransition(0, A, 1);
    fragment.addTransition(0, A, 0);
    fragment.addTransition(0, Label.EPSILON, 1);

    assertThat(fragment.destinations(0, A), containsInAnyOrder(0, 1));
    assertThat(fragment.destinations(0, Label.EPSILON), contains(1));
    assertThat(fragment.destinations(1, A), is(empty()));
  }

  @Test
  public void destinationsAreReadOnly() {
    final var fragment = new Fragment(0, 1);
    fragment.addTransition(0, A, 1);
    assertThrows(UnsupportedOperationException.class, () -> fragment.destinations(0, A).add(7));
  }

  @Test
  public void absorbMovesTransitionsAndSealsTheSource() {
    final var outer = new Fragment(2, 3);
    final var inner = new Fragment(0, 1);
    inner.addTransition(0, A, 1);

    outer.absorb(inner);
    outer.addTransition(2, Label.EPSILON, 0);

    assertThat(inner.isSealed(), is(true));
    assertThat(outer.isSealed(), is(false));
    assertThat(outer.destinations(0, A), contains(1));
    assertThat(outer.destinations(2, Label.EPSILON), contains(0));
  }

  @Test
  public void absorbedFragmentCannotBeUsedAgain() {
    final var outer = new Fragment(2, 3);
    final var inner = new Fragment(0, 1);
    inner.addTransition(0, A, 1);
    outer.absorb(inner);

    assertThrows(IllegalStateException.class, () -> inner.addTransition(0, A, 0));
    assertThrows(IllegalStateException.class, () -> inner.destinations(0, A));
    assertThrows(IllegalStateException.class, () -> new Fragment(4, 5).absorb(inner));
    assertThrows(IllegalStateException.class, inner::toNfa);
  }

  @Test
  public void absorbMergesOverlappingStates() {
    final var first = new Fragment(0, 1);
    first.addTransition(0, A, 1);
    final var second = new Fragment(0, 2);
    second.addTransition(0, A, 2);
    second.addTransition(0, B, 2);
    second.addTransition(2, B, 0);

    first.absorb(second);

    assertThat(first.destinations(0, A), containsInAnyOrder(1, 2));
    assertThat(first.destinations(0, B), contains(2));
    assertThat(first.destinations(2, B), contains(0));
  }

  @Test
  public void absorbKeepsTheLargerTable() {
    final var small = new Fragment(10, 11);
    small.addTransition(10, B, 11);
    final var large = new Fragment(0, 3);
    large.addTransition(0, A, 1);
    large.addTransition(1, Label.EPSILON, 2);
    large.addTransition(2, A, 3);

    small.absorb(large);
    small.addTransition(11, Label.EPSILON, 0);

    assertThat(large.isSealed(), is(true));
    assertThat(small.destinations(10, B), contains(11));
    assertThat(small.destinations(0, A), contains(1));
    assertThat(small.destinations(1, Label.EPSILON), contains(2));
    assertThat(small.destinations(2, A), contains(3));
    assertThat(small.destinations(11, Label.EPSILON), contains(0));
    assertThat(small.toNfa().transitionCount(), is(5));
  }

  @Test
  public void absorbSelfIsRejected() {
    final var fragment = new Fragment(0, 1);
    assertThrows(IllegalArgumentException.class, () -> fragment.absorb(fragment));
  }

  @Test
  public void toNfaSealsAndCopies() {
    final var fragment = new Fragment(0, 1);
    fragment.addTransition(0, A, 1);

    final Nfa nfa = fragment.toNfa();

    assertThat(fragment.isSealed(), is(true));
    assertThat(nfa.startState, is(0));
    assertThat(nfa.acceptState, is(1));
    assertThat(nfa.destinations(0, A), contains(1));
    assertThat(nfa.states(), contains(0, 1));
  }
}
