package verilogast.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import verilogast.ast.ArithmeticIdentifier;
import verilogast.ast.ArraySelect;
import verilogast.ast.Assignment;
import verilogast.ast.AstContractException;
import verilogast.ast.AstNode;
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
import verilogast.ast.SignKind;
import verilogast.ast.SystemFunction;
import verilogast.ast.WireDeclaration;
import verilogast.ui.AstConfig;

/**
 * Owns all syntax nodes of one parse and hands out their ids.
 *
 * Ids are assigned in creation order starting at 0 and are never reused.
 * Every child id passed to a create method must already exist, which keeps the graph acyclic.
 * Nodes may share children (identifiers are interned), so the result is a DAG rather than a tree.
 *
 * Not thread-safe. Callers that share a graph between threads have to serialize access themselves.
 */
public class AstGraph {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ArrayList<AstNode> nodes;
  private final IdentifierTable identifierTable = new IdentifierTable("identifiers");
  private final IdentifierTable arithmeticIdentifierTable = new IdentifierTable("arithmetic identifiers");
  private final boolean allowEmptyIdentifierLists;

  @FunctionalInterface
  private interface BitLevelFactory {
    Declaration create(int id, List<Integer> identifiers);
  }
  @FunctionalInterface
  private interface WordLevelFactory {
    Declaration create(int id, List<Integer> identifiers, int hi, int lo);
  }

  public AstGraph() { this(new AstConfig()); }
  public AstGraph(AstConfig cfg) {
    this.nodes = new ArrayList<>(Math.max(cfg.initial_capacity, 0));
    this.allowEmptyIdentifierLists = cfg.allow_empty_identifier_lists;
  }

  ////////// inspection //////////

  /** Returns the number of nodes, which is also the next id to be assigned. */
  public int size() { return nodes.size(); }

  public boolean contains(int id) { return id >= 0 && id < nodes.size(); }

  /**
   * Retrieves a node by id.
   * @param id an id returned by one of the create methods
   * @return the node
   */
  public AstNode node(int id) {
    checkId(id, "node");
    return nodes.get(id);
  }

  /**
   * Retrieves a node by id, narrowed to the expected node class.
   * @param id an id returned by one of the create methods
   * @param type the expected node class
   * @return the node
   */
  public <T extends AstNode> T node(int id, Class<T> type) {
    AstNode node = node(id);
    if (!type.isInstance(node))
      throw violation("Node " + node + " is not a " + type.getSimpleName());
    return type.cast(node);
  }

  public NodeKind kind(int id) { return node(id).getKind(); }
  public boolean isLeaf(int id) { return node(id).isLeaf(); }

  /**
   * Returns the child ids of a node. The returned List can be iterated any number of times.
   * @param id the parent id
   * @return a read-only List of child ids in order
   */
  public List<Integer> children(int id) { return node(id).getChildren(); }

  public void forEachChild(int id, IntConsumer fn) { node(id).forEachChild(fn); }

  /** Calls the visit method matching the kind of node id. Does not recurse. */
  public void accept(int id, AstVisitor visitor) { node(id).accept(visitor); }

  /** Calls fn for all nodes in id order. */
  public void forEachNode(Consumer<AstNode> fn) { nodes.forEach(fn); }

  public int identifierCount() { return identifierTable.size(); }
  public int arithmeticIdentifierCount() { return arithmeticIdentifierTable.size(); }

  /**
   * Looks up an interned identifier without creating it.
   * @param name the identifier text
   * @return the id, or an invalid AstOrError if no identifier of that name exists
   */
  public AstOrError lookupIdentifier(String name) { return identifierTable.lookup(name); }
  /** Same as {@link #lookupIdentifier(String)} for arithmetic identifiers. */
  public AstOrError lookupArithmeticIdentifier(String name) { return arithmeticIdentifierTable.lookup(name); }

  ////////// construction //////////

  public int createNumeral(String numeral) {
    requireValue(numeral, "numeral");
    return createNode(id -> new Numeral(id, numeral));
  }

  /** Returns the id of the identifier with this name, creating it on first use. */
  public int createIdentifier(String identifier) {
    return identifierTable.intern(identifier, name -> createNode(id -> new Identifier(id, name)));
  }

  /** Returns the id of the arithmetic identifier with this name, creating it on first use. */
  public int createArithmeticIdentifier(String identifier) {
    return arithmeticIdentifierTable.intern(identifier, name -> createNode(id -> new ArithmeticIdentifier(id, name)));
  }

  public int createIdentifierList(List<Integer> identifiers) {
    checkIds(identifiers, "identifier list entry");
    if (identifiers.isEmpty() && !allowEmptyIdentifierLists)
      throw violation("Empty identifier list");
    return createNode(id -> new IdentifierList(id, identifiers));
  }

  public int createRangeExpression(int hi, int lo) {
    checkId(hi, "range hi");
    checkId(lo, "range lo");
    return createNode(id -> new RangeExpression(id, hi, lo));
  }

  public int createArraySelect(int array, int index) {
    checkId(array, "array");
    checkId(index, "array index");
    return createNode(id -> new ArraySelect(id, array, index));
  }

  public int createNegativeSign(int expr) {
    checkId(expr, "signed expression");
    return createNode(id -> new Sign(id, SignKind.Minus, expr));
  }

  /**
   * Creates an operator expression.
   * @param kind the operator
   * @param operands exactly {@link ExprKind#getArity()} operand ids
   * @return the id of the new expression
   */
  public int createExpression(ExprKind kind, int... operands) {
    if (operands.length != kind.getArity())
      throw violation("Operator " + kind.serialName + " takes " + kind.getArity() + " operand(s), got " + operands.length);
    List<Integer> operandList = new ArrayList<>(operands.length);
    for (int operand : operands) {
      checkId(operand, "operand");
      operandList.add(operand);
    }
    return createNode(id -> new Expression(id, kind, operandList));
  }

  public int createSumExpression(int term, int expr) { return createExpression(ExprKind.Add, term, expr); }
  public int createMulExpression(int term, int expr) { return createExpression(ExprKind.Mul, term, expr); }
  public int createNotExpression(int expr) { return createExpression(ExprKind.Not, expr); }
  public int createAndExpression(int term, int expr) { return createExpression(ExprKind.And, term, expr); }
  public int createOrExpression(int term, int expr) { return createExpression(ExprKind.Or, term, expr); }
  public int createXorExpression(int term, int expr) { return createExpression(ExprKind.Xor, term, expr); }

  public int createSystemFunction(int function, List<Integer> args) {
    checkId(function, "system function");
    checkIds(args, "system function argument");
    return createNode(id -> new SystemFunction(id, function, args));
  }

  /**
   * Creates a bit-level input declaration.
   * @param id an identifier or an identifier list
   * @return the id of the declaration
   */
  public int createInputDeclaration(int id) { return createDeclaration(id, InputDeclaration::new); }
  /**
   * Creates a word-level input declaration.
   * @param id an identifier or an identifier list
   * @param rangeId a range expression giving the bounds
   * @return the id of the declaration
   */
  public int createInputDeclaration(int id, int rangeId) { return createDeclaration(id, rangeId, InputDeclaration::new); }
  public int createOutputDeclaration(int id) { return createDeclaration(id, OutputDeclaration::new); }
  public int createOutputDeclaration(int id, int rangeId) { return createDeclaration(id, rangeId, OutputDeclaration::new); }
  public int createWireDeclaration(int id) { return createDeclaration(id, WireDeclaration::new); }
  public int createWireDeclaration(int id, int rangeId) { return createDeclaration(id, rangeId, WireDeclaration::new); }

  public int createModuleInstantiation(int moduleName, int instanceName, List<PortAssignment> portAssignments, List<Integer> parameters) {
    checkId(moduleName, "module name");
    checkId(instanceName, "instance name");
    requireValue(portAssignments, "port assignment list");
    for (PortAssignment assignment : portAssignments) {
      requireValue(assignment, "port assignment");
      checkId(assignment.port(), "port name");
      checkId(assignment.signal(), "port signal");
    }
    checkIds(parameters, "instance parameter");
    return createNode(id -> new ModuleInstantiation(id, moduleName, instanceName, portAssignments, parameters));
  }

  public int createParameterDeclaration(int identifier, int expr) {
    checkId(identifier, "parameter name");
    checkId(expr, "parameter value");
    return createNode(id -> new ParameterDeclaration(id, identifier, expr));
  }

  public int createAssignment(int signal, int expr) {
    checkId(signal, "assignment target");
    checkId(expr, "assignment value");
    return createNode(id -> new Assignment(id, signal, expr));
  }

  public int createModule(String moduleName, List<Integer> args, List<Integer> decls) {
    requireValue(moduleName, "module name");
    checkIds(args, "module argument");
    checkIds(decls, "module item");
    int id = createNode(newId -> new ModuleDefinition(newId, moduleName, args, decls));
    logger.debug("Created module {} as node {} ({} nodes, {} identifiers, {} arithmetic identifiers)", moduleName, id, nodes.size(),
                 identifierTable.size(), arithmeticIdentifierTable.size());
    return id;
  }

  ////////// internals //////////

  private int createNode(IntFunction<? extends AstNode> factory) {
    final int index = nodes.size();
    AstNode node = factory.apply(index);
    nodes.add(node);
    logger.trace("Created {}", node);
    return index;
  }

  private int createDeclaration(int id, BitLevelFactory factory) {
    List<Integer> identifiers = resolveDeclaredIdentifiers(id);
    return createNode(newId -> factory.create(newId, identifiers));
  }
  private int createDeclaration(int id, int rangeId, WordLevelFactory factory) {
    List<Integer> identifiers = resolveDeclaredIdentifiers(id);
    RangeExpression range = node(rangeId, RangeExpression.class);
    return createNode(newId -> factory.create(newId, identifiers, range.getHi(), range.getLo()));
  }

  /**
   * The declaration grammar admits both `input a;` and `input a, b;`,
   * so the declared names arrive either as a single identifier or as an identifier list.
   */
  private List<Integer> resolveDeclaredIdentifiers(int id) {
    AstNode node = node(id);
    switch (node.getKind()) {
    case IdentifierList:
      return ((IdentifierList)node).getIdentifiers();
    case Identifier:
      return List.of(id);
    default:
      throw violation("Declaration expects an identifier or identifier list, got " + node);
    }
  }

  private void checkId(int id, String role) {
    if (id < 0 || id >= nodes.size())
      throw violation("Unknown " + role + " id " + Integer.toUnsignedString(id) + " (graph has " + nodes.size() + " nodes)");
  }
  private void checkIds(Collection<Integer> ids, String role) {
    requireValue(ids, role + " list");
    for (Integer id : ids) {
      if (id == null)
        throw violation("Null " + role + " id");
      checkId(id, role);
    }
  }
  private void requireValue(Object value, String role) {
    if (value == null)
      throw violation("Missing " + role);
  }

  private AstContractException violation(String message) {
    logger.error(message);
    return new AstContractException(message);
  }

  @Override
  public String toString() {
    return "AstGraph[nodes=" + nodes.size() + ", identifiers=" + identifierTable.size() +
        ", arithmeticIdentifiers=" + arithmeticIdentifierTable.size() + "]";
  }
}
