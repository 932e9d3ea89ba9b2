package contentmodel.model;

/**
 * Group which requires at least one child but has none.
 */
public class EmptyGroupException extends InvalidContentModelException {

  @java.io.Serial
  private static final long serialVersionUID = 7702931584120963354L;

  /**
   * (Lowercase) name of the group kind, eg. {@code "sequence"}.
   */
  public final String groupKind;

  public EmptyGroupException(String groupKind) {
    super(groupKind + " groups must have at least one child");
    this.groupKind = groupKind;
  }
}
