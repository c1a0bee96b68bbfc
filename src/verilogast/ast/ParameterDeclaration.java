package verilogast.ast;

import java.util.List;

/** `parameter` IDENTIFIER `=` EXPR `;` */
public final class ParameterDeclaration extends AstNode {
  public ParameterDeclaration(int id, int identifier, int expr) { super(id, List.of(identifier, expr)); }

  public int getIdentifier() { return children.get(0); }
  public int getExpr() { return children.get(1); }

  @Override
  public NodeKind getKind() {
    return NodeKind.ParameterDeclaration;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
