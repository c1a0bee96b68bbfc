package verilogast.util;

import java.util.List;
import verilogast.ast.ArithmeticIdentifier;
import verilogast.ast.ArraySelect;
import verilogast.ast.Assignment;
import verilogast.ast.AstVisitor;
import verilogast.ast.Declaration;
import verilogast.ast.ExprKind;
import verilogast.ast.Expression;
import verilogast.ast.Identifier;
import verilogast.ast.IdentifierList;
import verilogast.ast.InputDeclaration;
import verilogast.ast.ModuleDefinition;
import verilogast.ast.ModuleInstantiation;
import verilogast.ast.NodeKind;
import verilogast.ast.Numeral;
import verilogast.ast.OutputDeclaration;
import verilogast.ast.ParameterDeclaration;
import verilogast.ast.PortAssignment;
import verilogast.ast.RangeExpression;
import verilogast.ast.Sign;
import verilogast.ast.SystemFunction;
import verilogast.ast.WireDeclaration;
import verilogast.graph.AstGraph;

/**
 * Renders nodes of a graph back to Verilog text.
 * Module items are printed one per line, expressions with the minimal set of parentheses.
 */
public class AstPrinter implements AstVisitor {
  private final AstGraph graph;
  private final StringBuilder out = new StringBuilder();
  private String indent = "";

  public String tab = "    ";

  public AstPrinter(AstGraph graph) { this.graph = graph; }

  /**
   * Renders a single node, including everything below it.
   * @param id the node to render
   * @return the Verilog text
   */
  public String print(int id) {
    out.setLength(0);
    indent = "";
    emit(id);
    return out.toString();
  }

  private void emit(int id) { graph.accept(id, this); }

  private void emitList(List<Integer> ids) {
    for (int i = 0; i < ids.size(); ++i) {
      if (i > 0)
        out.append(", ");
      emit(ids.get(i));
    }
  }

  /** Emits an operand, adding parentheses if it binds weaker than the enclosing operator. */
  private void emitOperand(int operand, int parentPrecedence, boolean isRight) {
    boolean parens = false;
    if (graph.kind(operand) == NodeKind.Expression) {
      ExprKind operandKind = graph.node(operand, Expression.class).getExprKind();
      if (!operandKind.isUnary()) {
        int precedence = operandKind.getPrecedence();
        parens = precedence < parentPrecedence || (isRight && precedence == parentPrecedence);
      }
    }
    if (parens)
      out.append('(');
    emit(operand);
    if (parens)
      out.append(')');
  }

  private void emitDeclaration(Declaration node) {
    out.append(indent).append(node.getKeyword());
    if (node.isWordLevel()) {
      out.append(" [");
      emit(node.getHi());
      out.append(':');
      emit(node.getLo());
      out.append(']');
    }
    out.append(' ');
    emitList(node.getIdentifiers());
    out.append(";\n");
  }

  @Override
  public void visit(Numeral node) {
    out.append(node.getValue());
  }
  @Override
  public void visit(Identifier node) {
    out.append(node.getName());
  }
  @Override
  public void visit(ArithmeticIdentifier node) {
    out.append(node.getName());
  }
  @Override
  public void visit(IdentifierList node) {
    emitList(node.getIdentifiers());
  }
  @Override
  public void visit(ArraySelect node) {
    emit(node.getArray());
    out.append('[');
    emit(node.getIndex());
    out.append(']');
  }
  @Override
  public void visit(RangeExpression node) {
    out.append('[');
    emit(node.getHi());
    out.append(':');
    emit(node.getLo());
    out.append(']');
  }
  @Override
  public void visit(Sign node) {
    out.append(node.getSignKind().symbol);
    if (graph.kind(node.getExpr()) == NodeKind.Sign) {
      // "--" would lex as decrement
      out.append('(');
      emit(node.getExpr());
      out.append(')');
      return;
    }
    emitOperand(node.getExpr(), ExprKind.Not.getPrecedence(), false);
  }
  @Override
  public void visit(Expression node) {
    ExprKind kind = node.getExprKind();
    if (kind.isUnary()) {
      out.append(kind.symbol);
      emitOperand(node.getLeft(), kind.getPrecedence(), false);
      return;
    }
    emitOperand(node.getLeft(), kind.getPrecedence(), false);
    out.append(' ').append(kind.symbol).append(' ');
    emitOperand(node.getRight(), kind.getPrecedence(), true);
  }
  @Override
  public void visit(SystemFunction node) {
    emit(node.getFunction());
    out.append('(');
    emitList(node.getArgs());
    out.append(')');
  }
  @Override
  public void visit(InputDeclaration node) {
    emitDeclaration(node);
  }
  @Override
  public void visit(OutputDeclaration node) {
    emitDeclaration(node);
  }
  @Override
  public void visit(WireDeclaration node) {
    emitDeclaration(node);
  }
  @Override
  public void visit(ModuleInstantiation node) {
    out.append(indent);
    emit(node.getModuleName());
    if (!node.getParameters().isEmpty()) {
      out.append(" #(");
      emitList(node.getParameters());
      out.append(')');
    }
    out.append(' ');
    emit(node.getInstanceName());
    out.append('(');
    List<PortAssignment> ports = node.getPortAssignments();
    for (int i = 0; i < ports.size(); ++i) {
      if (i > 0)
        out.append(", ");
      out.append('.');
      emit(ports.get(i).port());
      out.append('(');
      emit(ports.get(i).signal());
      out.append(')');
    }
    out.append(");\n");
  }
  @Override
  public void visit(ParameterDeclaration node) {
    out.append(indent).append("parameter ");
    emit(node.getIdentifier());
    out.append(" = ");
    emit(node.getExpr());
    out.append(";\n");
  }
  @Override
  public void visit(Assignment node) {
    out.append(indent).append("assign ");
    emit(node.getSignal());
    out.append(" = ");
    emit(node.getExpr());
    out.append(";\n");
  }
  @Override
  public void visit(ModuleDefinition node) {
    out.append("module ").append(node.getModuleName()).append('(');
    emitList(node.getArgs());
    out.append(");\n");
    String outerIndent = indent;
    indent = outerIndent + tab;
    for (int decl : node.getDecls())
      emit(decl);
    indent = outerIndent;
    out.append("endmodule\n");
  }
}
