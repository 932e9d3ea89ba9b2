package contentmodel.graph;

import java.util.Objects;

/**
 * Transition which consumes one child element.
 *
 * @param symbol name of the element consumed
 */
public record SymbolTransition(String symbol) implements EnfaTransition, Comparable<SymbolTransition> {

  public SymbolTransition {
    Objects.requireNonNull(symbol, "symbol");
  }

  @Override
  public int compareTo(SymbolTransition other) {
    return symbol.compareTo(other.symbol);
  }

  @Override
  public String dotLabel() {
    return DotGraph.escapeHtml(symbol);
  }
}
