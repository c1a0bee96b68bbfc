package verilogast.ast;

import java.util.List;
import java.util.function.IntConsumer;

/**
 * Base class of all syntax nodes.
 * A node knows its own id and the ids of its children, never the child objects themselves.
 * Nodes are immutable; they are created and owned by a {@link verilogast.graph.AstGraph}.
 */
public abstract class AstNode {
  protected final int id;
  protected final List<Integer> children;

  protected AstNode(int id) { this(id, List.of()); }
  protected AstNode(int id, List<Integer> children) {
    this.id = id;
    this.children = List.copyOf(children);
  }

  public int getId() { return id; }

  public abstract NodeKind getKind();

  /**
   * Dispatches to the visit method of the visitor that matches this node's kind.
   * Does not descend into the children.
   * @param visitor the visitor
   */
  public abstract void accept(AstVisitor visitor);

  /**
   * Numerals and identifiers are always leaves. A composite node is a leaf only if it references nothing,
   * e.g. an empty module.
   * @return true iff this node has no children
   */
  public boolean isLeaf() { return children.isEmpty(); }

  /**
   * Returns the child ids in order. Composite nodes list every id they reference.
   * @return a read-only List of child ids
   */
  public List<Integer> getChildren() { return children; }

  public void forEachChild(IntConsumer fn) {
    for (int child : children)
      fn.accept(child);
  }

  @Override
  public String toString() {
    return getKind().serialName + "#" + id;
  }
}
