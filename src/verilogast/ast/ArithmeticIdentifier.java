package verilogast.ast;

/**
 * An identifier used inside an arithmetic expression (leaf).
 * Interned separately from {@link Identifier}, so the same name may exist once as each kind.
 */
public final class ArithmeticIdentifier extends AstNode {
  private final String name;

  public ArithmeticIdentifier(int id, String name) {
    super(id);
    this.name = name;
  }

  public String getName() { return name; }

  @Override
  public NodeKind getKind() {
    return NodeKind.ArithmeticIdentifier;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
