package regexnfa.graph;

/**
 * Hands out fresh state identifiers for a single construction.
 *
 * <p>Identifiers start at {@code 0} and strictly increase. Every construction
 * owns its own allocator, so independent constructions never interfere.
 */
public final class StateAllocator {

  private int next = 0;

  /**
   * Summon a fresh state identifier.
   *
   * @return fresh state ID
   */
  public int fresh() {
    return next++;
  }

  /**
   * How many states have been handed out so far.
   */
  public int allocated() {
    return next;
  }
}
