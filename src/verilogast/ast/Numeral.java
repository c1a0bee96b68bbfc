package verilogast.ast;

/** A numeral literal (leaf). The text is kept as written, e.g. "8'hff". */
public final class Numeral extends AstNode {
  private final String value;

  public Numeral(int id, String value) {
    super(id);
    this.value = value;
  }

  public String getValue() { return value; }

  @Override
  public NodeKind getKind() {
    return NodeKind.Numeral;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
