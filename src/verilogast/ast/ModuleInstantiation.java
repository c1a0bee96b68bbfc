package verilogast.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A module instantiation of form
 *   IDENTIFIER (ParameterAssignment)? IDENTIFIER `(` PortAssignment `)` `;`
 * with
 *   ParameterAssignment ::= `#` `(` ARITH_EXPR `,` ... `,` ARITH_EXPR `)`
 *   PortAssignment ::= `.` IDENTIFIER `(` SIGNAL `)` `,` ... `,` `.` IDENTIFIER `(` SIGNAL `)`
 *
 * Children are the module name, the instance name, each port/signal pair and finally the parameters.
 */
public final class ModuleInstantiation extends AstNode {
  private final int moduleName;
  private final int instanceName;
  private final List<PortAssignment> portAssignments;
  private final List<Integer> parameters;

  public ModuleInstantiation(int id, int moduleName, int instanceName, List<PortAssignment> portAssignments, List<Integer> parameters) {
    super(id, flatten(moduleName, instanceName, portAssignments, parameters));
    this.moduleName = moduleName;
    this.instanceName = instanceName;
    this.portAssignments = List.copyOf(portAssignments);
    this.parameters = List.copyOf(parameters);
  }

  private static List<Integer> flatten(int moduleName, int instanceName, List<PortAssignment> portAssignments, List<Integer> parameters) {
    List<Integer> ret = new ArrayList<>(2 + 2 * portAssignments.size() + parameters.size());
    ret.add(moduleName);
    ret.add(instanceName);
    for (PortAssignment assignment : portAssignments) {
      ret.add(assignment.port());
      ret.add(assignment.signal());
    }
    ret.addAll(parameters);
    return ret;
  }

  public int getModuleName() { return moduleName; }
  public int getInstanceName() { return instanceName; }
  public List<PortAssignment> getPortAssignments() { return portAssignments; }
  public List<Integer> getParameters() { return parameters; }

  @Override
  public NodeKind getKind() {
    return NodeKind.ModuleInstantiation;
  }
  @Override
  public void accept(AstVisitor visitor) {
    visitor.visit(this);
  }
}
