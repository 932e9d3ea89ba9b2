package contentmodel.model;

/**
 * Occurrence constraint other than {@code (1,1)}, {@code (0,1)},
 * {@code (0,unbounded)}, or {@code (1,unbounded)}.
 */
public class UnsupportedOccursException extends InvalidContentModelException {

  @java.io.Serial
  private static final long serialVersionUID = 5429016397208741176L;

  /**
   * Offending occurrence constraint.
   */
  public final Occurs occurs;

  public UnsupportedOccursException(Occurs occurs) {
    super("(minOccurs, maxOccurs) pair " + occurs + " is not supported");
    this.occurs = occurs;
  }
}
