package contentmodel;

import contentmodel.codegen.AcceptorCodegen;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.objectweb.asm.Opcodes;

/**
 * Content model acceptor with its transition table compiled into bytecode.
 *
 * <p>Instances are created with {@link #compile(AutomatonRecord)}, which
 * generates a fresh hidden subclass implementing {@link #initialState()},
 * {@link #step(int, int)} and {@link #isAccepting(int)} as switches over the
 * table. Symbols are passed to {@code step} as indices into
 * {@link AutomatonRecord#alphabet()}.
 */
public abstract class CompiledAcceptor {

  /**
   * State returned by {@link #step(int, int)} once the input is rejected.
   */
  public static final int TRAP_STATE = AcceptorCodegen.TRAP_STATE;

  private final AutomatonRecord record;
  private final Map<String, Integer> symbolIndices;

  protected CompiledAcceptor(AutomatonRecord record) {
    this.record = Objects.requireNonNull(record, "record");

    final List<String> alphabet = record.alphabet();
    final var indices = new HashMap<String, Integer>();
    for (int i = 0; i < alphabet.size(); i++) {
      indices.put(alphabet.get(i), i);
    }
    this.symbolIndices = Map.copyOf(indices);
  }

  /**
   * Compile a transition table into an acceptor.
   *
   * @param record canonical minimal DFA
   * @return acceptor for the same language
   */
  public static CompiledAcceptor compile(AutomatonRecord record)
  throws IllegalAccessException, NoSuchMethodException {
    final String className = "contentmodel/CompiledAcceptor$Table";
    final int classFlags = Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC;
    final byte[] classBytes = AcceptorCodegen
      .generateAcceptorSubclass(record, className, classFlags)
      .toByteArray();

    // Load the class and get a handle on the constructor
    final MethodHandles.Lookup lookup = MethodHandles
      .lookup()
      .defineHiddenClass(classBytes, true);
    final MethodHandle constructor = lookup.findConstructor(
      lookup.lookupClass(),
      MethodType.methodType(void.class, AutomatonRecord.class)
    );

    try {
      return (CompiledAcceptor)constructor.invoke(record);
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to construct acceptor", error);
    }
  }

  /**
   * Transition table this acceptor was compiled from.
   *
   * @return canonical minimal DFA
   */
  public AutomatonRecord record() {
    return record;
  }

  /**
   * Index of an element symbol, as understood by {@link #step(int, int)}.
   *
   * @param symbol element symbol
   * @return index of the symbol, or {@code -1} if no element has that symbol
   */
  public int symbolIndex(String symbol) {
    return symbolIndices.getOrDefault(symbol, -1);
  }

  public abstract int initialState();

  /**
   * Take one transition.
   *
   * @param state current state (must not be {@link #TRAP_STATE})
   * @param symbol index of the symbol read
   * @return next state, or {@link #TRAP_STATE} if the input is rejected
   */
  public abstract int step(int state, int symbol);

  public abstract boolean isAccepting(int state);

  /**
   * Run the acceptor on a sequence of element symbols.
   *
   * @param input symbols of the child elements, in order
   * @return whether the whole input is accepted
   */
  public boolean matches(List<String> input) {
    int state = initialState();
    for (String symbol : input) {
      final int index = symbolIndex(symbol);
      if (index < 0) {
        return false;
      }
      state = step(state, index);
      if (state == TRAP_STATE) {
        return false;
      }
    }
    return isAccepting(state);
  }

  @Override
  public String toString() {
    return "CompiledAcceptor(" + record.states().size() + " states, alphabet " + record.alphabet() + ")";
  }
}
