package contentmodel.model;

/**
 * Content model node which is not an element, sequence, choice, or all group.
 */
public class UnsupportedGroupKindException extends InvalidContentModelException {

  @java.io.Serial
  private static final long serialVersionUID = -6089461570915384721L;

  /**
   * Node whose kind is not recognized.
   */
  public final transient ContentNode node;

  public UnsupportedGroupKindException(ContentNode node) {
    super("Unsupported content model node kind " + node.getClass().getName() + ": " + node);
    this.node = node;
  }
}
