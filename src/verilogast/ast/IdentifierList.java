package verilogast.ast;

import java.util.List;

/**
 * A list of identifiers of form
 *   IDENTIFIER `,` ... `,` IDENTIFIER
 */
public final class IdentifierList extends AstNode {
  public IdentifierList(int id, List<Integer> identifiers) { super(id, identifiers); }

  public List<Integer> getIdentifiers() { return children; }

  @Override
  public NodeKind getKind() {
    return NodeKind.IdentifierList;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
