package contentmodel.model;

/**
 * Content model which cannot be turned into an automaton.
 *
 * <p>These are always input problems: nothing is retried and no partial
 * automaton is produced.
 */
public class InvalidContentModelException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 3117820466127735502L;

  public InvalidContentModelException(String message) {
    super(message);
  }
}
