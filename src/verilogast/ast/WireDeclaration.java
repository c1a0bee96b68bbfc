package verilogast.ast;

import java.util.List;

/** A `wire` declaration, i.e. an internal net of the module. */
public final class WireDeclaration extends Declaration {
  public WireDeclaration(int id, List<Integer> identifiers) { super(id, identifiers); }
  public WireDeclaration(int id, List<Integer> identifiers, int hi, int lo) { super(id, identifiers, hi, lo); }

  @Override
  public String getKeyword() {
    return "wire";
  }
  @Override
  public NodeKind getKind() {
    return NodeKind.WireDeclaration;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
