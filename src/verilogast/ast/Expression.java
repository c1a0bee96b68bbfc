package verilogast.ast;

import java.util.List;

/**
 * A unary or binary operator expression.
 * The number of operands always matches {@link ExprKind#getArity()}.
 */
public final class Expression extends AstNode {
  private final ExprKind exprKind;

  public Expression(int id, ExprKind exprKind, List<Integer> operands) {
    super(id, operands);
    if (operands.size() != exprKind.getArity())
      throw new AstContractException("Operator " + exprKind.serialName + " takes " + exprKind.getArity() + " operand(s), got " +
                                     operands.size());
    this.exprKind = exprKind;
  }

  public ExprKind getExprKind() { return exprKind; }
  public int getLeft() { return children.get(0); }
  public int getRight() {
    if (exprKind.isUnary())
      throw new AstContractException("Unary expression " + this + " has no right operand");
    return children.get(1);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.Expression;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
