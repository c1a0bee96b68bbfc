package verilogast.ast;

import java.util.List;

/** A signed sub-expression, e.g. `-x`. */
public final class Sign extends AstNode {
  private final SignKind signKind;

  public Sign(int id, SignKind signKind, int expr) {
    super(id, List.of(expr));
    this.signKind = signKind;
  }

  public SignKind getSignKind() { return signKind; }
  public int getExpr() { return children.get(0); }

  @Override
  public NodeKind getKind() {
    return NodeKind.Sign;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
