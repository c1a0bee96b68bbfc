package verilogast.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import verilogast.ast.ArithmeticIdentifier;
import verilogast.ast.AstNode;
import verilogast.ast.AstVisitor;
import verilogast.ast.Declaration;
import verilogast.ast.Expression;
import verilogast.ast.Identifier;
import verilogast.ast.InputDeclaration;
import verilogast.ast.ModuleDefinition;
import verilogast.ast.Numeral;
import verilogast.ast.OutputDeclaration;
import verilogast.ast.Sign;
import verilogast.ast.WireDeclaration;
import verilogast.graph.AstGraph;

/**
 * Debug dump of a graph, one entry per node in id order.
 * The output is meant for humans and may change at any time.
 */
public class GraphDumper {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public enum Format {
    text,
    yaml;

    public static Format fromName(String name) {
      for (Format format : values())
        if (format.name().equalsIgnoreCase(name))
          return format;
      throw new IllegalArgumentException("Unknown dump format '" + name + "', expected one of text, yaml");
    }
  }

  /** Collects the non-structural fields of one node. */
  private static class AttributeCollector implements AstVisitor {
    final Map<String, Object> attributes = new LinkedHashMap<>();

    @Override
    public void visit(Numeral node) {
      attributes.put("value", node.getValue());
    }
    @Override
    public void visit(Identifier node) {
      attributes.put("name", node.getName());
    }
    @Override
    public void visit(ArithmeticIdentifier node) {
      attributes.put("name", node.getName());
    }
    @Override
    public void visit(Sign node) {
      attributes.put("sign", node.getSignKind().symbol);
    }
    @Override
    public void visit(Expression node) {
      attributes.put("op", node.getExprKind().serialName);
    }
    @Override
    public void visit(InputDeclaration node) {
      declaration(node);
    }
    @Override
    public void visit(OutputDeclaration node) {
      declaration(node);
    }
    @Override
    public void visit(WireDeclaration node) {
      declaration(node);
    }
    private void declaration(Declaration node) {
      attributes.put("level", node.isWordLevel() ? "word" : "bit");
    }
    @Override
    public void visit(ModuleDefinition node) {
      attributes.put("name", node.getModuleName());
    }
  }

  private final AstGraph graph;

  public GraphDumper(AstGraph graph) { this.graph = graph; }

  /**
   * Builds one map per node with id, kind, children and kind specific attributes.
   * @return the entries in id order
   */
  public List<Map<String, Object>> describe() {
    List<Map<String, Object>> ret = new ArrayList<>(graph.size());
    graph.forEachNode(node -> ret.add(describe(node)));
    return ret;
  }

  private static Map<String, Object> describe(AstNode node) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("id", node.getId());
    entry.put("kind", node.getKind().serialName);
    if (!node.getChildren().isEmpty())
      entry.put("children", new ArrayList<>(node.getChildren()));
    AttributeCollector collector = new AttributeCollector();
    node.accept(collector);
    entry.putAll(collector.attributes);
    return entry;
  }

  public void dump(Writer writer, Format format) throws IOException {
    logger.debug("Dumping {} as {}", graph, format);
    switch (format) {
    case yaml:
      DumperOptions options = new DumperOptions();
      options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
      new Yaml(options).dump(describe(), writer);
      break;
    case text:
      PrintWriter printer = new PrintWriter(writer);
      printer.println("#nodes = " + graph.size());
      for (Map<String, Object> entry : describe()) {
        StringBuilder line = new StringBuilder();
        entry.forEach((key, value) -> {
          if (key.equals("id"))
            line.append(value);
          else
            line.append(' ').append(key).append('=').append(value);
        });
        printer.println(line);
      }
      printer.flush();
      break;
    }
    writer.flush();
  }

  public String dump(Format format) {
    StringWriter writer = new StringWriter();
    try {
      dump(writer, format);
    } catch (IOException e) {
      // StringWriter does not throw
      throw new IllegalStateException(e);
    }
    return writer.toString();
  }

  /** Prints the text dump to stdout. */
  public void print() { System.out.print(dump(Format.text)); }
}
