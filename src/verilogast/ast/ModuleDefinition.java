package verilogast.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A module definition with its port argument list and its body (declarations and statements).
 * Children are the port arguments followed by the body items.
 */
public final class ModuleDefinition extends AstNode {
  private final String moduleName;
  private final int numArgs;

  public ModuleDefinition(int id, String moduleName, List<Integer> args, List<Integer> decls) {
    super(id, concat(args, decls));
    this.moduleName = moduleName;
    this.numArgs = args.size();
  }

  private static List<Integer> concat(List<Integer> args, List<Integer> decls) {
    List<Integer> ret = new ArrayList<>(args);
    ret.addAll(decls);
    return ret;
  }

  public String getModuleName() { return moduleName; }
  public List<Integer> getArgs() { return children.subList(0, numArgs); }
  public List<Integer> getDecls() { return children.subList(numArgs, children.size()); }

  @Override
  public NodeKind getKind() {
    return NodeKind.Module;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
