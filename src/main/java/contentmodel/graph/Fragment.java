package contentmodel.graph;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Partially built piece of an NFA.
 *
 * @param start state where the fragment is entered
 * @param vacant states which still have pending outgoing transitions (the
 *               exits of the fragment)
 */
public record Fragment(int start, SortedSet<Integer> vacant) {

  public Fragment {
    vacant = Collections.unmodifiableSortedSet(new TreeSet<>(vacant));
  }

  /**
   * Fragment with a single exit.
   *
   * @param start state where the fragment is entered
   * @param vacant only state with pending transitions
   * @return fragment
   */
  public static Fragment of(int start, int vacant) {
    final var vacantStates = new TreeSet<Integer>();
    vacantStates.add(vacant);
    return new Fragment(start, vacantStates);
  }
}
