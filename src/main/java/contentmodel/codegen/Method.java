package contentmodel.codegen;

import contentmodel.AutomatonRecord;
import contentmodel.CompiledAcceptor;
import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Helper class to simplify codegen around declaring and calling methods.
 *
 * @param name name of the method
 * @param typ type of the method (does not include the receiver)
 * @param invokeSort one of the {@code Opcodes.INVOKE*} codes
 */
final record Method(
  String name,
  MethodType typ,
  int invokeSort
) {

  // Class name constants
  public static final String ACCEPTOR_CLASS_NAME = Type.getInternalName(CompiledAcceptor.class);

  // Method name constants
  public static final Method RECORDINIT_M = new Method(
    "<init>",
    MethodType.methodType(void.class, AutomatonRecord.class),
    Opcodes.INVOKESPECIAL
  );
  public static final Method INITIALSTATE_M = new Method(
    "initialState",
    MethodType.methodType(int.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method STEP_M = new Method(
    "step",
    MethodType.methodType(int.class, int.class, int.class),
    Opcodes.INVOKEVIRTUAL
  );
  public static final Method ISACCEPTING_M = new Method(
    "isAccepting",
    MethodType.methodType(boolean.class, int.class),
    Opcodes.INVOKEVIRTUAL
  );

  /**
   * Start this method on an existing class visitor.
   *
   * @param cv class on which the method is started
   * @param accessFlags access flags for the method (`static` or not is computed)
   * @return method visitor for this method
   */
  public MethodVisitor newMethod(ClassVisitor cv, int accessFlags) {
    int staticFlag = (invokeSort == Opcodes.INVOKESTATIC) ? Opcodes.ACC_STATIC : 0;
    return cv.visitMethod(
      accessFlags | staticFlag,
      name,
      typ.descriptorString(),
      null, // signature
      null  // exceptions
    );
  }

  /**
   * Invoke this method inside another method body.
   *
   * @param mv method inside of which this method is called
   * @param className name of the class on which this method is defined
   */
  public void invokeMethod(MethodVisitor mv, String className) {
    mv.visitMethodInsn(
      invokeSort,
      className,
      name,
      typ.descriptorString(),
      invokeSort == Opcodes.INVOKEINTERFACE
    );
  }
}
