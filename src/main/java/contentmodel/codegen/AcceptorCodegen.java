package contentmodel.codegen;

import static contentmodel.codegen.Method.ACCEPTOR_CLASS_NAME;
import static contentmodel.codegen.Method.INITIALSTATE_M;
import static contentmodel.codegen.Method.ISACCEPTING_M;
import static contentmodel.codegen.Method.RECORDINIT_M;
import static contentmodel.codegen.Method.STEP_M;

import contentmodel.AutomatonRecord;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;

/**
 * Code generator for compiled acceptors.
 *
 * <p>The generated class extends {@code CompiledAcceptor} and hardcodes the
 * transition table of one {@link AutomatonRecord} into its methods.
 */
public final class AcceptorCodegen {

  private AcceptorCodegen() { }

  /**
   * Value the generated {@code step} returns for rejected transitions.
   */
  public static final int TRAP_STATE = TransitionTableCodegen.TRAP_STATE;

  /**
   * Generate a subclass of {@code CompiledAcceptor} for a transition table.
   *
   * <p>The class has a single constructor, taking the record and passing it
   * on to the superclass.
   *
   * @param record canonical minimal DFA
   * @param className internal name of the class to generate
   * @param classFlags class flags to set (visibility, `final`, `synthetic` etc.)
   * @return class writer with the finished class
   */
  public static ClassWriter generateAcceptorSubclass(
    AutomatonRecord record,
    String className,
    int classFlags
  ) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | classFlags,
      className,
      null, // signature
      ACCEPTOR_CLASS_NAME,
      null  // interfaces
    );

    // Constructor just forwards the record
    {
      final var mv = RECORDINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      mv.visitVarInsn(Opcodes.ALOAD, 1);
      RECORDINIT_M.invokeMethod(mv, ACCEPTOR_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `initialState` method
    {
      final var mv = INITIALSTATE_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new TransitionTableCodegen(mv, record).visitInitialStateBody();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `step` method
    {
      final var mv = STEP_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new TransitionTableCodegen(mv, record).visitStepBody();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `isAccepting` method
    {
      final var mv = ISACCEPTING_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      new TransitionTableCodegen(mv, record).visitIsAcceptingBody();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }
}
