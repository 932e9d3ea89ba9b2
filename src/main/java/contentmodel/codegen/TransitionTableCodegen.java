package contentmodel.codegen;

import contentmodel.AutomatonRecord;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Functionality for generating the bodies of the transition methods of a
 * compiled acceptor.
 *
 * <p>States and symbols are both dispatched on with switches: the outer switch
 * picks the row of the current state and the inner switch picks the target for
 * the symbol index. Anything not in the table falls through to the trap, which
 * is encoded as {@code -1}.
 */
class TransitionTableCodegen extends BytecodeHelpers {

  /**
   * Value returned by {@code step} when the input is rejected.
   */
  static final int TRAP_STATE = -1;

  // Locals of `step(int state, int symbol)` and `isAccepting(int state)`
  private static final int STATE_LOCAL = 1;
  private static final int SYMBOL_LOCAL = 2;

  private final AutomatonRecord record;

  /**
   * Symbol indices, as assigned by {@link AutomatonRecord#alphabet()}.
   */
  private final Map<String, Integer> symbolIndices;

  public TransitionTableCodegen(MethodVisitor mv, AutomatonRecord record) {
    super(mv);
    this.record = record;

    final List<String> alphabet = record.alphabet();
    final var indices = new HashMap<String, Integer>();
    for (int i = 0; i < alphabet.size(); i++) {
      indices.put(alphabet.get(i), i);
    }
    this.symbolIndices = indices;
  }

  /**
   * Emit the body of {@code initialState()}.
   */
  public void visitInitialStateBody() {
    visitReturnConstantInt(record.start());
  }

  /**
   * Emit the body of {@code step(int state, int symbol)}.
   *
   * <p>Rows are visited in ascending state order and cells in ascending symbol
   * order, which also makes symbol indices ascending.
   */
  public void visitStepBody() {
    final Label trap = new Label();
    final var transitions = record.transitions();

    final int[] states = new int[transitions.size()];
    final Label[] rowLabels = new Label[transitions.size()];
    int rowIndex = 0;
    for (int state : transitions.keySet()) {
      states[rowIndex] = state;
      rowLabels[rowIndex] = new Label();
      rowIndex++;
    }

    mv.visitVarInsn(Opcodes.ILOAD, STATE_LOCAL);
    visitLookupBranch(trap, states, rowLabels);

    rowIndex = 0;
    for (SortedMap<String, Integer> row : transitions.values()) {
      mv.visitLabel(rowLabels[rowIndex++]);

      final int[] symbols = new int[row.size()];
      final int[] targets = new int[row.size()];
      final Label[] cellLabels = new Label[row.size()];
      int cellIndex = 0;
      for (var cell : row.entrySet()) {
        symbols[cellIndex] = symbolIndices.get(cell.getKey());
        targets[cellIndex] = cell.getValue();
        cellLabels[cellIndex] = new Label();
        cellIndex++;
      }

      mv.visitVarInsn(Opcodes.ILOAD, SYMBOL_LOCAL);
      visitLookupBranch(trap, symbols, cellLabels);
      for (int i = 0; i < cellLabels.length; i++) {
        mv.visitLabel(cellLabels[i]);
        visitReturnConstantInt(targets[i]);
      }
    }

    mv.visitLabel(trap);
    visitReturnConstantInt(TRAP_STATE);
  }

  /**
   * Emit the body of {@code isAccepting(int state)}.
   */
  public void visitIsAcceptingBody() {
    final Label accept = new Label();
    final Label reject = new Label();

    final int[] accepting = record.accepts().stream().mapToInt(Integer::intValue).toArray();
    final Label[] labels = new Label[accepting.length];
    Arrays.fill(labels, accept);

    mv.visitVarInsn(Opcodes.ILOAD, STATE_LOCAL);
    visitLookupBranch(reject, accepting, labels);

    mv.visitLabel(accept);
    visitReturnConstantInt(1);

    mv.visitLabel(reject);
    visitReturnConstantInt(0);
  }
}
