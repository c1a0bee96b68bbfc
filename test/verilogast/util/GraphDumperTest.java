package verilogast.util;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;
import verilogast.graph.AstGraph;

class GraphDumperTest {

  AstGraph graph;

  @BeforeEach
  void setUp() {
    graph = new AstGraph();
    int a = graph.createIdentifier("a");
    int one = graph.createNumeral("1");
    int sum = graph.createSumExpression(a, one);
    int hi = graph.createNumeral("3");
    int range = graph.createRangeExpression(hi, graph.createNumeral("0"));
    int decl = graph.createWireDeclaration(a, range);
    graph.createModule("top", List.of(), List.of(decl, graph.createAssignment(a, sum)));
  }

  @Test
  void testTextDump() {
    List<String> lines = new GraphDumper(graph).dump(GraphDumper.Format.text).lines().collect(Collectors.toList());
    Assertions.assertEquals(List.of("#nodes = 9",
                                    "0 kind=identifier name=a",
                                    "1 kind=numeral value=1",
                                    "2 kind=expression children=[0, 1] op=add",
                                    "3 kind=numeral value=3",
                                    "4 kind=numeral value=0",
                                    "5 kind=range_expression children=[3, 4]",
                                    "6 kind=wire_declaration children=[0, 3, 4] level=word",
                                    "7 kind=assignment children=[0, 2]",
                                    "8 kind=module children=[6, 7] name=top"),
                            lines);
  }

  @Test
  void testYamlDumpReadsBack() {
    String dumped = new GraphDumper(graph).dump(GraphDumper.Format.yaml);
    List<Map<String, Object>> entries = new Yaml().load(dumped);
    Assertions.assertEquals(graph.size(), entries.size());
    Assertions.assertEquals(new GraphDumper(graph).describe(), entries);
    Assertions.assertEquals(Map.of("id", 2, "kind", "expression", "children", List.of(0, 1), "op", "add"), entries.get(2));
  }

  @Test
  void testFormatNames() {
    Assertions.assertEquals(GraphDumper.Format.yaml, GraphDumper.Format.fromName("YAML"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> GraphDumper.Format.fromName("json"));
  }
}
