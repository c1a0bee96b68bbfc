package verilogast.util;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import verilogast.ast.PortAssignment;
import verilogast.graph.AstGraph;

class AstPrinterTest {

  AstGraph graph;
  AstPrinter printer;

  @BeforeEach
  void setUp() {
    graph = new AstGraph();
    printer = new AstPrinter(graph);
  }

  @Test
  void testOperatorPrecedence() {
    int a = graph.createIdentifier("a");
    int b = graph.createIdentifier("b");
    int c = graph.createIdentifier("c");
    Assertions.assertEquals("(a + b) * c", printer.print(graph.createMulExpression(graph.createSumExpression(a, b), c)));
    Assertions.assertEquals("a + b * c", printer.print(graph.createSumExpression(a, graph.createMulExpression(b, c))));
    Assertions.assertEquals("a + b + c", printer.print(graph.createSumExpression(graph.createSumExpression(a, b), c)));
    Assertions.assertEquals("a + (b + c)", printer.print(graph.createSumExpression(a, graph.createSumExpression(b, c))));
    Assertions.assertEquals("a | b ^ c", printer.print(graph.createOrExpression(a, graph.createXorExpression(b, c))));
    Assertions.assertEquals("a & (b | c)", printer.print(graph.createAndExpression(a, graph.createOrExpression(b, c))));
    Assertions.assertEquals("~(a & b)", printer.print(graph.createNotExpression(graph.createAndExpression(a, b))));
    Assertions.assertEquals("~~a", printer.print(graph.createNotExpression(graph.createNotExpression(a))));
  }

  @Test
  void testArithmeticNodes() {
    int n = graph.createArithmeticIdentifier("N");
    int one = graph.createNumeral("1");
    Assertions.assertEquals("-(N + 1)", printer.print(graph.createNegativeSign(graph.createSumExpression(n, one))));
    Assertions.assertEquals("-N", printer.print(graph.createNegativeSign(n)));
    Assertions.assertEquals("-(-N)", printer.print(graph.createNegativeSign(graph.createNegativeSign(n))));
    Assertions.assertEquals("-~N", printer.print(graph.createNegativeSign(graph.createNotExpression(n))));
    int clog2 = graph.createArithmeticIdentifier("$clog2");
    Assertions.assertEquals("$clog2(N, 1)", printer.print(graph.createSystemFunction(clog2, List.of(n, one))));
    Assertions.assertEquals("[N:1]", printer.print(graph.createRangeExpression(n, one)));
    Assertions.assertEquals("mem[N]", printer.print(graph.createArraySelect(graph.createIdentifier("mem"), n)));
  }

  @Test
  void testModule() {
    int a = graph.createIdentifier("a");
    int y = graph.createIdentifier("y");
    int w1 = graph.createIdentifier("w1");
    int w2 = graph.createIdentifier("w2");
    int seven = graph.createNumeral("7");
    int zero = graph.createNumeral("0");
    int inA = graph.createInputDeclaration(a, graph.createRangeExpression(seven, zero));
    int outY = graph.createOutputDeclaration(y);
    int wires = graph.createWireDeclaration(graph.createIdentifierList(List.of(w1, w2)));
    int width = graph.createIdentifier("W");
    int param = graph.createParameterDeclaration(width, graph.createNumeral("8"));
    int assign = graph.createAssignment(y, graph.createAndExpression(graph.createArraySelect(a, zero), graph.createNotExpression(w1)));
    int inst = graph.createModuleInstantiation(graph.createIdentifier("sub"), graph.createIdentifier("u0"),
                                               List.of(new PortAssignment(graph.createIdentifier("x"), a),
                                                       new PortAssignment(graph.createIdentifier("z"), w2)),
                                               List.of(graph.createArithmeticIdentifier("W")));
    int noParams = graph.createModuleInstantiation(graph.createIdentifier("sub"), graph.createIdentifier("u1"), List.of(), List.of());
    int module = graph.createModule("m", List.of(a, y), List.of(inA, outY, wires, param, assign, inst, noParams));

    String expected = "module m(a, y);\n"
                      + "    input [7:0] a;\n"
                      + "    output y;\n"
                      + "    wire w1, w2;\n"
                      + "    parameter W = 8;\n"
                      + "    assign y = a[0] & ~w1;\n"
                      + "    sub #(W) u0(.x(a), .z(w2));\n"
                      + "    sub u1();\n"
                      + "endmodule\n";
    Assertions.assertEquals(expected, printer.print(module));
    // statements on their own are not indented
    Assertions.assertEquals("output y;\n", printer.print(outY));
  }

  @Test
  void testCustomTab() {
    int a = graph.createIdentifier("a");
    int module = graph.createModule("t", List.of(a), List.of(graph.createInputDeclaration(a)));
    printer.tab = "\t";
    Assertions.assertEquals("module t(a);\n\tinput a;\nendmodule\n", printer.print(module));
  }
}
