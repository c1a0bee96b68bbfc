package verilogast.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.stream.Stream;
import verilogast.ast.AstVisitor;
import verilogast.graph.AstGraph;

/**
 * Whole-graph traversals built from {@link AstGraph#children(int)} and {@link AstGraph#accept(int, AstVisitor)}.
 *
 * Since children can be shared, a node reachable over several paths is reported once per path,
 * unless the traversal is requested as distinct.
 */
public class AstWalker {
  private final AstGraph graph;
  private final boolean distinct;

  public AstWalker(AstGraph graph) { this(graph, false); }
  /**
   * @param graph the graph to walk
   * @param distinct if set, visits each node at most once per walk
   */
  public AstWalker(AstGraph graph, boolean distinct) {
    this.graph = graph;
    this.distinct = distinct;
  }

  /**
   * Lists the ids below root (inclusive), parents before children, children in order.
   * @param root the start node
   * @return the ids in pre-order
   */
  public List<Integer> preorder(int root) {
    List<Integer> ret = new ArrayList<>();
    BitSet seen = new BitSet();
    ArrayDeque<Integer> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      int id = stack.pop();
      if (distinct) {
        if (seen.get(id))
          continue;
        seen.set(id);
      }
      ret.add(id);
      List<Integer> children = graph.children(id);
      for (int i = children.size() - 1; i >= 0; --i)
        stack.push(children.get(i));
    }
    return ret;
  }

  /**
   * Lists the ids below root (inclusive), children before parents, children in order.
   * @param root the start node
   * @return the ids in post-order
   */
  public List<Integer> postorder(int root) {
    List<Integer> ret = new ArrayList<>();
    BitSet seen = new BitSet();
    // Entries are {id, next child index}
    ArrayDeque<int[]> stack = new ArrayDeque<>();
    stack.push(new int[] {root, 0});
    if (distinct)
      seen.set(root);
    while (!stack.isEmpty()) {
      int[] top = stack.peek();
      List<Integer> children = graph.children(top[0]);
      if (top[1] < children.size()) {
        int child = children.get(top[1]++);
        if (distinct) {
          if (seen.get(child))
            continue;
          seen.set(child);
        }
        stack.push(new int[] {child, 0});
      } else {
        stack.pop();
        ret.add(top[0]);
      }
    }
    return ret;
  }

  public Stream<Integer> streamPreorder(int root) { return preorder(root).stream(); }

  /** Calls accept on every node below root in pre-order. */
  public void walkPreorder(int root, AstVisitor visitor) {
    for (int id : preorder(root))
      graph.accept(id, visitor);
  }

  /** Calls accept on every node below root in post-order. */
  public void walkPostorder(int root, AstVisitor visitor) {
    for (int id : postorder(root))
      graph.accept(id, visitor);
  }
}
