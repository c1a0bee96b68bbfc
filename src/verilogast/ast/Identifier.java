package verilogast.ast;

/** An identifier (leaf). Only created through the graph's identifier table. */
public final class Identifier extends AstNode {
  private final String name;

  public Identifier(int id, String name) {
    super(id);
    this.name = name;
  }

  public String getName() { return name; }

  @Override
  public NodeKind getKind() {
    return NodeKind.Identifier;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
