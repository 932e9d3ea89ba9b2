package contentmodel.graph;

import contentmodel.model.AllGroupTooLargeException;
import contentmodel.model.ContentNode;
import contentmodel.model.EmptyGroupException;
import contentmodel.model.Occurs;
import contentmodel.model.UnsupportedGroupKindException;
import contentmodel.model.UnsupportedOccursException;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Content model visitor which builds up the corresponding epsilon-NFA, one
 * fragment per node.
 *
 * <p>The choice of how to store the NFA is left abstract. Fragments are
 * connected by leaving their exits pending and patching them once the state
 * that follows is known, so no node ever needs to know state IDs allocated
 * after it.
 */
public abstract class FragmentBuilder {

  private static final Logger logger = Logger.getLogger("contentmodel.graph");

  /**
   * Largest all group which gets expanded into permutations.
   */
  public final int maxAllGroupSize;

  /**
   * Behaviour for all groups above {@link #maxAllGroupSize}.
   */
  public final AllGroupOverflow allGroupOverflow;

  private long permutationsExpanded = 0;

  protected FragmentBuilder(int maxAllGroupSize, AllGroupOverflow allGroupOverflow) {
    if (maxAllGroupSize < 0) {
      throw new IllegalArgumentException("All group size limit cannot be negative: " + maxAllGroupSize);
    }
    this.maxAllGroupSize = maxAllGroupSize;
    this.allGroupOverflow = allGroupOverflow;
  }

  /**
   * Summon a fresh state identifier.
   *
   * @return fresh state ID
   */
  public abstract int freshState();

  /**
   * Register a transition.
   *
   * @param from state where the transition starts
   * @param label symbol consumed (or epsilon)
   * @param to target state, possibly {@link Target#PENDING}
   */
  public abstract void addTransition(int from, EnfaTransition label, Target to);

  /**
   * Resolve every pending transition out of a state.
   *
   * @param state state whose pending transitions get resolved
   * @param to state the pending transitions now go to
   * @throws IllegalStateException if the state has no pending transition
   */
  public abstract void patch(int state, int to);

  /**
   * Check whether some resolved transition already leads to a state.
   *
   * @param state state to check
   * @return whether the state has incoming transitions
   */
  public abstract boolean hasIncomingTransitions(int state);

  /**
   * Record the descriptor for an element symbol.
   *
   * @param element leaf of the content model
   */
  public abstract void registerElement(ContentNode.Element element);

  /**
   * Number of sequence fragments built for the orderings of all groups.
   *
   * @return permutations expanded so far
   */
  public long permutationsExpanded() {
    return permutationsExpanded;
  }

  /**
   * Build the fragment for a node (and, recursively, its children).
   *
   * @param node content model node
   * @return fragment accepting the language of the node
   */
  public Fragment build(ContentNode node) {
    final Occurs occurs = node.occurs();
    if (!occurs.isCanonical()) {
      throw new UnsupportedOccursException(occurs);
    }

    final Fragment base;
    if (node instanceof ContentNode.Element element) {
      base = buildElement(element);
    } else if (node instanceof ContentNode.Sequence sequence) {
      base = buildSequence(sequence.children());
    } else if (node instanceof ContentNode.Choice choice) {
      base = buildChoice(choice.children());
    } else if (node instanceof ContentNode.All all) {
      base = buildAll(all.children());
    } else {
      throw new UnsupportedGroupKindException(node);
    }

    return wrapOccurs(base, occurs);
  }

  // start --a-->
  private Fragment buildElement(ContentNode.Element element) {
    final int start = freshState();
    addTransition(start, new SymbolTransition(element.name()), Target.PENDING);
    registerElement(element);
    return Fragment.of(start, start);
  }

  // start --a--> O --b--> O --c-->
  private Fragment buildSequence(List<ContentNode> children) {
    if (children.isEmpty()) {
      throw new EmptyGroupException("sequence");
    }

    final Fragment first = build(children.get(0));
    Fragment previous = first;
    for (ContentNode child : children.subList(1, children.size())) {
      final Fragment next = build(child);
      for (int vacant : previous.vacant()) {
        patch(vacant, next.start());
      }
      previous = next;
    }
    return new Fragment(first.start(), previous.vacant());
  }

  //   |--ε--> --a-->
  // start --ε--> --b-->
  //   |--ε--> --c-->
  private Fragment buildChoice(List<ContentNode> children) {
    final int branch = freshState();
    final var vacant = new TreeSet<Integer>();
    for (ContentNode child : children) {
      final Fragment fragment = build(child);
      addTransition(branch, EpsilonTransition.EPSILON, new Target.Resolved(fragment.start()));
      vacant.addAll(fragment.vacant());
    }
    return new Fragment(branch, vacant);
  }

  //   |--ε--> --a--> O --b--> O --c-->
  // start --ε--> --a--> O --c--> O --b-->
  //   |--ε--> --b--> ...
  private Fragment buildAll(List<ContentNode> children) {
    final int size = children.size();
    if (size > maxAllGroupSize) {
      switch (allGroupOverflow) {
        case REJECT:
          throw new AllGroupTooLargeException(size, maxAllGroupSize);
        case WARN:
          logger.warning(
            "Expanding all group with " + size + " children (limit " + maxAllGroupSize
              + "): the NFA grows factorially with the group size"
          );
          break;
      }
    }

    final int branch = freshState();
    if (size == 0) {
      addTransition(branch, EpsilonTransition.EPSILON, Target.PENDING);
      return Fragment.of(branch, branch);
    }

    final var vacant = new TreeSet<Integer>();
    final int[] order = new int[size];
    for (int i = 0; i < size; i++) {
      order[i] = i;
    }
    do {
      final var permuted = new ArrayList<ContentNode>(size);
      for (int index : order) {
        permuted.add(children.get(index));
      }
      final Fragment fragment = buildSequence(permuted);
      permutationsExpanded++;
      addTransition(branch, EpsilonTransition.EPSILON, new Target.Resolved(fragment.start()));
      vacant.addAll(fragment.vacant());
    } while (nextPermutation(order));

    return new Fragment(branch, vacant);
  }

  /**
   * Apply an occurrence constraint to a built fragment.
   *
   * <p>The optional and zero-or-more shapes put their skip transition on the
   * start of the fragment. That is only sound if the start cannot be reached
   * again from inside the fragment (eg. through a nested repetition), so a
   * fresh entry state is used whenever the start already has incoming
   * transitions.
   */
  private Fragment wrapOccurs(Fragment fragment, Occurs occurs) {
    final int init = fragment.start();

    if (occurs.equals(Occurs.ONCE)) {
      return fragment;
    } else if (occurs.equals(Occurs.OPTIONAL)) {
      final int entry = reentrantEntry(init);
      addTransition(entry, EpsilonTransition.EPSILON, Target.PENDING);
      final var vacant = new TreeSet<Integer>(fragment.vacant());
      vacant.add(entry);
      return new Fragment(entry, vacant);
    } else if (occurs.equals(Occurs.ZERO_OR_MORE)) {
      final int entry = reentrantEntry(init);
      for (int vacant : fragment.vacant()) {
        patch(vacant, entry);
      }
      addTransition(entry, EpsilonTransition.EPSILON, Target.PENDING);
      return Fragment.of(entry, entry);
    } else if (occurs.equals(Occurs.ONE_OR_MORE)) {
      final int gate = freshState();
      for (int vacant : fragment.vacant()) {
        patch(vacant, gate);
      }
      addTransition(gate, EpsilonTransition.EPSILON, new Target.Resolved(init));
      addTransition(gate, EpsilonTransition.EPSILON, Target.PENDING);
      return Fragment.of(init, gate);
    } else {
      throw new UnsupportedOccursException(occurs);
    }
  }

  /**
   * State on which a skip transition can be placed for a fragment.
   *
   * @param init start of the fragment
   * @return {@code init} if nothing inside the fragment leads back to it,
   *         otherwise a fresh state with an epsilon transition to {@code init}
   */
  private int reentrantEntry(int init) {
    if (!hasIncomingTransitions(init)) {
      return init;
    }
    final int entry = freshState();
    addTransition(entry, EpsilonTransition.EPSILON, new Target.Resolved(init));
    return entry;
  }

  /**
   * Advance to the next lexicographic permutation in place.
   *
   * @param order permutation of {@code 0..n-1}
   * @return false if {@code order} was the last permutation
   */
  private static boolean nextPermutation(int[] order) {
    int i = order.length - 2;
    while (i >= 0 && order[i] >= order[i + 1]) {
      i--;
    }
    if (i < 0) {
      return false;
    }

    int j = order.length - 1;
    while (order[j] <= order[i]) {
      j--;
    }
    swap(order, i, j);
    for (int lo = i + 1, hi = order.length - 1; lo < hi; lo++, hi--) {
      swap(order, lo, hi);
    }
    return true;
  }

  private static void swap(int[] array, int i, int j) {
    final int temp = array[i];
    array[i] = array[j];
    array[j] = temp;
  }
}
