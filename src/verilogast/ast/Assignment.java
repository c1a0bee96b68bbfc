package verilogast.ast;

import java.util.List;

/** A continuous assignment `assign SIGNAL = EXPR;`. */
public final class Assignment extends AstNode {
  public Assignment(int id, int signal, int expr) { super(id, List.of(signal, expr)); }

  public int getSignal() { return children.get(0); }
  public int getExpr() { return children.get(1); }

  @Override
  public NodeKind getKind() {
    return NodeKind.Assignment;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
