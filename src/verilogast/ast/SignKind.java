package verilogast.ast;

/**
 * Sign prefixes of a {@link Sign} node.
 */
public enum SignKind {
  Minus("-");

  public final String symbol;

  private SignKind(String symbol) { this.symbol = symbol; }
}
