package verilogast.ast;

/**
 * Visitor over the syntax node kinds. Every method defaults to a no-op,
 * so an implementation only overrides the kinds it is interested in.
 *
 * {@link AstNode#accept(AstVisitor)} calls exactly one of these methods and does not recurse.
 * Traversal order is up to the caller, see {@link verilogast.util.AstWalker}.
 * A visitor must not add nodes to the graph it is traversing.
 */
public interface AstVisitor {
  default void visit(Numeral node) {}
  default void visit(Identifier node) {}
  default void visit(ArithmeticIdentifier node) {}
  default void visit(IdentifierList node) {}
  default void visit(ArraySelect node) {}
  default void visit(RangeExpression node) {}
  default void visit(Sign node) {}
  default void visit(Expression node) {}
  default void visit(SystemFunction node) {}
  default void visit(InputDeclaration node) {}
  default void visit(OutputDeclaration node) {}
  default void visit(WireDeclaration node) {}
  default void visit(ModuleInstantiation node) {}
  default void visit(ParameterDeclaration node) {}
  default void visit(Assignment node) {}
  default void visit(ModuleDefinition node) {}
}
