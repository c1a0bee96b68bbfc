package verilogast.ast;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Operators of an {@link Expression}. Each operator fixes the number of operands.
 */
public enum ExprKind {
  Add("add", "+", 2, 4),
  Mul("mul", "*", 2, 5),
  Not("not", "~", 1, 6),
  And("and", "&", 2, 3),
  Or("or", "|", 2, 1),
  Xor("xor", "^", 2, 2);

  public final String serialName;
  /** Verilog operator token */
  public final String symbol;
  private final int arity;
  private final int precedence;

  private ExprKind(String serialName, String symbol, int arity, int precedence) {
    this.serialName = serialName;
    this.symbol = symbol;
    this.arity = arity;
    this.precedence = precedence;
  }

  public int getArity() { return arity; }
  public boolean isUnary() { return arity == 1; }
  /**
   * Binding strength of the operator in Verilog text, higher binds tighter.
   * @return the precedence level
   */
  public int getPrecedence() { return precedence; }

  public static Optional<ExprKind> fromSerialName(String serialName) {
    return Stream.of(ExprKind.values()).filter(kindVal -> kindVal.serialName.equals(serialName)).findAny();
  }
}
