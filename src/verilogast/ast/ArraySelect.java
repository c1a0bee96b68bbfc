package verilogast.ast;

import java.util.List;

/**
 * A bit select of form
 *   IDENTIFIER `[` INDEX `]`
 */
public final class ArraySelect extends AstNode {
  public ArraySelect(int id, int array, int index) { super(id, List.of(array, index)); }

  public int getArray() { return children.get(0); }
  public int getIndex() { return children.get(1); }

  @Override
  public NodeKind getKind() {
    return NodeKind.ArraySelect;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
