package verilogast.ast;

import java.util.List;

/**
 * A most-significant/least-significant bit pair of form
 *   `[` MSB `:` LSB `]`
 */
public final class RangeExpression extends AstNode {
  public RangeExpression(int id, int hi, int lo) { super(id, List.of(hi, lo)); }

  public int getHi() { return children.get(0); }
  public int getLo() { return children.get(1); }

  @Override
  public NodeKind getKind() {
    return NodeKind.RangeExpression;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
