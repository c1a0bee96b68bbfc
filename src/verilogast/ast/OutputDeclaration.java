package verilogast.ast;

import java.util.List;

/** An `output` declaration. */
public final class OutputDeclaration extends Declaration {
  public OutputDeclaration(int id, List<Integer> identifiers) { super(id, identifiers); }
  public OutputDeclaration(int id, List<Integer> identifiers, int hi, int lo) { super(id, identifiers, hi, lo); }

  @Override
  public String getKeyword() {
    return "output";
  }
  @Override
  public NodeKind getKind() {
    return NodeKind.OutputDeclaration;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
