package verilogast.frontend;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import verilogast.ast.ArithmeticIdentifier;
import verilogast.ast.Assignment;
import verilogast.ast.InputDeclaration;
import verilogast.ast.ModuleDefinition;
import verilogast.ast.NodeKind;
import verilogast.ast.OutputDeclaration;
import verilogast.ast.WireDeclaration;
import verilogast.graph.AstGraph;
import verilogast.util.AstPrinter;

class DesignLoaderTest {

  AstGraph graph;
  DesignLoader loader;

  @BeforeEach
  void setUp() {
    graph = new AstGraph();
    loader = new DesignLoader(graph);
  }

  @Test
  void testSimpleModule() throws DesignFormatException {
    List<Integer> modules = loader.load("- module: m\n"
                                        + "  inputs: [a]\n"
                                        + "  outputs: [b]\n"
                                        + "  assigns: {b: a}\n");
    Assertions.assertEquals(1, modules.size());
    ModuleDefinition m = graph.node(modules.get(0), ModuleDefinition.class);
    Assertions.assertEquals("m", m.getModuleName());
    Assertions.assertEquals(3, m.getDecls().size());
    int a = graph.lookupIdentifier("a").id();
    int b = graph.lookupIdentifier("b").id();
    Assertions.assertEquals(List.of(a), graph.node(m.getDecls().get(0), InputDeclaration.class).getIdentifiers());
    Assertions.assertEquals(List.of(b), graph.node(m.getDecls().get(1), OutputDeclaration.class).getIdentifiers());
    Assignment assign = graph.node(m.getDecls().get(2), Assignment.class);
    Assertions.assertEquals(b, assign.getSignal());
    Assertions.assertEquals(a, assign.getExpr());
    Assertions.assertEquals(2, graph.identifierCount());
  }

  @Test
  void testFullModuleRoundTripsThroughPrinter() throws DesignFormatException {
    String design = "module: top\n"
                    + "ports: [a, b, y, s]\n"
                    + "parameters: {W: 8}\n"
                    + "inputs:\n"
                    + "  - {names: [a, b], range: [{add: [W, -1]}, 0]}\n"
                    + "outputs: [y, s]\n"
                    + "wires:\n"
                    + "  - {names: [t]}\n"
                    + "assigns:\n"
                    + "  t: {xor: [a, b, 8'hff]}\n"
                    + "  y: {or: [{and: [a, {not: b}]}, t]}\n"
                    + "  'y2[3]': {neg: {mul: [a, 2]}}\n"
                    + "  s: {select: [t, {call: [$clog2, W]}]}\n"
                    + "instances:\n"
                    + "  - {module: sub, name: u0, parameters: [W, 4], ports: {x: a, z: 'y[0]'}}\n";
    int module = loader.load(design).get(0);
    String expected = "module top(a, b, y, s);\n"
                      + "    parameter W = 8;\n"
                      + "    input [W + -1:0] a, b;\n"
                      + "    output y;\n"
                      + "    output s;\n"
                      + "    wire t;\n"
                      + "    assign t = a ^ b ^ 8'hff;\n"
                      + "    assign y = a & ~b | t;\n"
                      + "    assign y2[3] = -(a * 2);\n"
                      + "    assign s = t[$clog2(W)];\n"
                      + "    sub #(W, 4) u0(.x(a), .z(y[0]));\n"
                      + "endmodule\n";
    Assertions.assertEquals(expected, new AstPrinter(graph).print(module));
  }

  @Test
  void testArithmeticContexts() throws DesignFormatException {
    loader.load("module: m\n"
                + "parameters: {N: {mul: [M, 2]}}\n"
                + "assigns: {M: N}\n");
    // names in parameter values are arithmetic, names in assignments are not
    Assertions.assertTrue(graph.lookupArithmeticIdentifier("M").valid());
    Assertions.assertTrue(graph.lookupIdentifier("M").valid());
    Assertions.assertTrue(graph.lookupIdentifier("N").valid());
    Assertions.assertFalse(graph.lookupArithmeticIdentifier("N").valid());
    Assertions.assertEquals("M", graph.node(graph.lookupArithmeticIdentifier("M").id(), ArithmeticIdentifier.class).getName());
  }

  @Test
  void testListAndSingleDeclarations() throws DesignFormatException {
    int module = loader.load("module: m\n"
                             + "wires: [w0, {names: [w1, w2]}, {name: w3, range: [3, 0]}]\n")
                     .get(0);
    List<Integer> decls = graph.node(module, ModuleDefinition.class).getDecls();
    Assertions.assertEquals(3, decls.size());
    Assertions.assertEquals(1, graph.node(decls.get(0), WireDeclaration.class).getIdentifiers().size());
    Assertions.assertEquals(2, graph.node(decls.get(1), WireDeclaration.class).getIdentifiers().size());
    WireDeclaration ranged = graph.node(decls.get(2), WireDeclaration.class);
    Assertions.assertTrue(ranged.isWordLevel());
    Assertions.assertEquals(NodeKind.Numeral, graph.kind(ranged.getHi()));
    // only the two-name entry needed an identifier list
    int[] lists = {0};
    graph.forEachNode(node -> {
      if (node.getKind() == NodeKind.IdentifierList)
        ++lists[0];
    });
    Assertions.assertEquals(1, lists[0]);
  }

  @Test
  void testSeveralModulesShareIdentifiers() throws DesignFormatException {
    List<Integer> modules = loader.load("- {module: a, ports: [clk], inputs: [clk]}\n"
                                        + "- {module: b, ports: [clk], inputs: [clk]}\n");
    Assertions.assertEquals(2, modules.size());
    int clk = graph.lookupIdentifier("clk").id();
    for (int module : modules)
      Assertions.assertEquals(List.of(clk), graph.node(module, ModuleDefinition.class).getArgs());
  }

  @ParameterizedTest
  @ValueSource(strings = {"just a string",
                          "- [not, a, module]",
                          "- {ports: [a]}",
                          "- {module: '1bad'}",
                          "- {module: m, inputs: [{range: [1, 0]}]}",
                          "- {module: m, inputs: [{names: []}]}",
                          "- {module: m, inputs: [{names: [a], range: [1]}]}",
                          "- {module: m, assigns: {a: {sub: [a, b]}}}",
                          "- {module: m, assigns: {a: {add: [b]}}}",
                          "- {module: m, assigns: {a: {not: [b, c]}}}",
                          "- {module: m, assigns: {a: {call: [clog2, b]}}}",
                          "- {module: m, assigns: {a: true}}",
                          "- {module: m, instances: [{module: sub}]}",
                          "- {module: m, ports: {a: b}}",
                          "- {module: m\n  inputs: [a",
                          "- module: m\n  ~: x\n",
                          "- module: m\n  assigns: {y: {~: a}}\n",
                          "- module: m\n  1: x\n"})
  void testMalformedDesigns(String design) {
    Assertions.assertThrows(DesignFormatException.class, () -> loader.load(design));
  }

  @Test
  void testUnknownKeysAreIgnored() throws DesignFormatException {
    int module = loader.load("module: m\ncomment: ignored\ninputs: [a]\n").get(0);
    Assertions.assertEquals(1, graph.node(module, ModuleDefinition.class).getDecls().size());
  }
}
