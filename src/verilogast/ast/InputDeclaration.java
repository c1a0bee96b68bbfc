package verilogast.ast;

import java.util.List;

/** An `input` declaration. */
public final class InputDeclaration extends Declaration {
  public InputDeclaration(int id, List<Integer> identifiers) { super(id, identifiers); }
  public InputDeclaration(int id, List<Integer> identifiers, int hi, int lo) { super(id, identifiers, hi, lo); }

  @Override
  public String getKeyword() {
    return "input";
  }
  @Override
  public NodeKind getKind() {
    return NodeKind.InputDeclaration;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
