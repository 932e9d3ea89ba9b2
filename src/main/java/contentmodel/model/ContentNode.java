package contentmodel.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Node in a schema content model.
 *
 * <p>The tree is built by whatever processes the schema source and is only
 * read by the automaton construction. The four kinds below are the ones that
 * can be compiled; other implementations of this interface are rejected with
 * {@link UnsupportedGroupKindException}.
 */
public interface ContentNode {

  /**
   * How many times the node may repeat.
   *
   * @return occurrence constraint
   */
  Occurs occurs();

  /**
   * Leaf element. Its name is a symbol of the automaton's input alphabet and
   * the record itself is the descriptor handed on to code generation.
   *
   * @param name element name
   * @param occurs occurrence constraint
   */
  record Element(String name, Occurs occurs) implements ContentNode {

    public Element {
      Objects.requireNonNull(name, "element name");
      Objects.requireNonNull(occurs, "occurs");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("Element name cannot be empty");
      }
    }

    public Element withOccurs(Occurs newOccurs) {
      return new Element(name, newOccurs);
    }
  }

  /**
   * Children must appear in order.
   *
   * @param children nodes in the order they must appear
   * @param occurs occurrence constraint
   */
  record Sequence(List<ContentNode> children, Occurs occurs) implements ContentNode {

    public Sequence {
      children = List.copyOf(children);
      Objects.requireNonNull(occurs, "occurs");
    }

    public Sequence withOccurs(Occurs newOccurs) {
      return new Sequence(children, newOccurs);
    }
  }

  /**
   * Exactly one of the children must appear.
   *
   * @param children alternatives
   * @param occurs occurrence constraint
   */
  record Choice(List<ContentNode> children, Occurs occurs) implements ContentNode {

    public Choice {
      children = List.copyOf(children);
      Objects.requireNonNull(occurs, "occurs");
    }

    public Choice withOccurs(Occurs newOccurs) {
      return new Choice(children, newOccurs);
    }
  }

  /**
   * Every child appears once, in any order.
   *
   * @param children unordered members of the group
   * @param occurs occurrence constraint
   */
  record All(List<ContentNode> children, Occurs occurs) implements ContentNode {

    public All {
      children = List.copyOf(children);
      Objects.requireNonNull(occurs, "occurs");
    }

    public All withOccurs(Occurs newOccurs) {
      return new All(children, newOccurs);
    }
  }

  static Element element(String name) {
    return new Element(name, Occurs.ONCE);
  }

  static Element element(String name, Occurs occurs) {
    return new Element(name, occurs);
  }

  static Sequence sequence(ContentNode... children) {
    return new Sequence(Arrays.asList(children), Occurs.ONCE);
  }

  static Choice choice(ContentNode... children) {
    return new Choice(Arrays.asList(children), Occurs.ONCE);
  }

  static All all(ContentNode... children) {
    return new All(Arrays.asList(children), Occurs.ONCE);
  }
}
