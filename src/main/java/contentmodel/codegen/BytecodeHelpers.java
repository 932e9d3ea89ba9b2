package contentmodel.codegen;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Superclass containing utility methods for emitting bytecode.
 *
 * <p>Some of the utilities could be replaced with a single method call on
 * {@code MethodVisitor}, but they emit shorter bytecode. Method bodies are
 * limited in length by the fact the code array must have length fitting in an
 * unsigned 16-bit number, and transition tables get big fast.
 */
class BytecodeHelpers {

  /**
   * Method visitor into which code will be emitted.
   */
  protected final MethodVisitor mv;

  public BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  /**
   * Generate bytecode equivalent to `lookupswitch`, but possibly more compact.
   *
   * <p>Equivalent to {@code mv.visitLookupSwitchInsn(dflt, values, labels)},
   * but possibly shorter. {@code lookupswitch} in particular is a very long
   * bytecode instruction.
   *
   * @param dflt label to jump to if nothing else matches
   * @param values test values in the switch (sorted in ascending order)
   * @param labels labels to jump to if the scrutinee is in the test values
   */
  protected void visitLookupBranch(
    Label dflt,
    int[] values,
    Label[] labels
  ) {
    if (values.length == 0) {
      mv.visitInsn(Opcodes.POP);
      mv.visitJumpInsn(Opcodes.GOTO, dflt);
    } else if (values.length == 1) {
      if (values[0] == 0) {
        mv.visitJumpInsn(Opcodes.IFEQ, labels[0]);
        mv.visitJumpInsn(Opcodes.GOTO, dflt);
      } else {
        visitConstantInt(values[0]);
        mv.visitJumpInsn(Opcodes.IF_ICMPEQ, labels[0]);
        mv.visitJumpInsn(Opcodes.GOTO, dflt);
      }
    } else {

      // If the range of values is dense, a tableswitch saves space
      boolean useTableSwitch = true;
      for (int i = 0; i < values.length - 1; i++) {
        if (values[i] + 1 != values[i + 1]) {
          useTableSwitch = false;
          break;
        }
      }

      if (useTableSwitch) {
        mv.visitTableSwitchInsn(values[0], values[values.length - 1], dflt, labels);
      } else {
        mv.visitLookupSwitchInsn(dflt, values, labels);
      }
    }
  }

  /**
   * Push an integer constant onto the stack.
   *
   * <p>Equivalent to {@code mv.visitLdcInsn(constant)}, but possibly shorter
   * and ideally not consuming a slot in the constants table.
   *
   * @param constant integer constant
   */
  protected void visitConstantInt(int constant) {
    switch (constant) {
      case -1:
        mv.visitInsn(Opcodes.ICONST_M1);
        return;

      case 0:
        mv.visitInsn(Opcodes.ICONST_0);
        return;

      case 1:
        mv.visitInsn(Opcodes.ICONST_1);
        return;

      case 2:
        mv.visitInsn(Opcodes.ICONST_2);
        return;

      case 3:
        mv.visitInsn(Opcodes.ICONST_3);
        return;

      case 4:
        mv.visitInsn(Opcodes.ICONST_4);
        return;

      case 5:
        mv.visitInsn(Opcodes.ICONST_5);
        return;
    }

    if (Byte.MIN_VALUE <= constant && constant <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }

  /**
   * Emit code returning an integer constant.
   *
   * @param constant value returned
   */
  protected void visitReturnConstantInt(int constant) {
    visitConstantInt(constant);
    mv.visitInsn(Opcodes.IRETURN);
  }
}
