package verilogast.ast;

import java.util.ArrayList;
import java.util.List;

/** A system function call such as `$clog2(N)`. Children are the function reference followed by the arguments. */
public final class SystemFunction extends AstNode {
  public SystemFunction(int id, int function, List<Integer> args) { super(id, concat(function, args)); }

  private static List<Integer> concat(int function, List<Integer> args) {
    List<Integer> ret = new ArrayList<>(args.size() + 1);
    ret.add(function);
    ret.addAll(args);
    return ret;
  }

  public int getFunction() { return children.get(0); }
  public List<Integer> getArgs() { return children.subList(1, children.size()); }

  @Override
  public NodeKind getKind() {
    return NodeKind.SystemFunction;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
