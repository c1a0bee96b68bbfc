package verilogast.ast;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * The closed set of syntax node kinds.
 */
public enum NodeKind {
  Numeral("numeral"),
  Identifier("identifier"),
  ArithmeticIdentifier("arithmetic_identifier"),
  IdentifierList("identifier_list"),
  ArraySelect("array_select"),
  RangeExpression("range_expression"),
  Sign("sign"),
  Expression("expression"),
  SystemFunction("system_function"),
  InputDeclaration("input_declaration"),
  OutputDeclaration("output_declaration"),
  WireDeclaration("wire_declaration"),
  ModuleInstantiation("module_instantiation"),
  ParameterDeclaration("parameter_declaration"),
  Assignment("assignment"),
  Module("module");

  public final String serialName;

  private NodeKind(String serialName) { this.serialName = serialName; }

  public static Optional<NodeKind> fromSerialName(String serialName) {
    return Stream.of(NodeKind.values()).filter(kindVal -> kindVal.serialName.equals(serialName)).findAny();
  }
}
