package verilogast.frontend;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import verilogast.ast.ExprKind;
import verilogast.ast.PortAssignment;
import verilogast.graph.AstGraph;

/**
 * Builds modules in an {@link AstGraph} from a YAML design description.
 *
 * The root is a list of module maps (or a single module map). Keys of a module map are processed in file order,
 * so the module body keeps the order of the description:
 * <pre>
 * - module: top
 *   ports: [a, y]
 *   inputs: [{names: [a], range: [7, 0]}]
 *   outputs: [y]
 *   parameters: {W: 8}
 *   assigns: {y: {xor: [a, 8'hff]}}
 *   instances: [{module: sub, name: u0, parameters: [W], ports: {x: a}}]
 * </pre>
 * Expressions are numbers, names or single-entry maps with one of the keys
 * add, mul, and, or, xor, not, neg, select, call.
 * Plain names inside parameter values, ranges, indices and instance parameters become arithmetic identifiers,
 * everywhere else they become identifiers.
 */
public class DesignLoader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern NUMERAL = Pattern.compile("\\d+|\\d*'[sS]?[bBoOdDhH][0-9a-fA-F_xXzZ?]+");
  private static final Pattern NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
  private static final Pattern SELECT = Pattern.compile("([A-Za-z_][A-Za-z0-9_$]*)\\s*\\[(.+)\\]");

  private final AstGraph graph;

  public DesignLoader(AstGraph graph) { this.graph = graph; }

  public List<Integer> load(String description) throws DesignFormatException { return load(new StringReader(description)); }
  public List<Integer> load(InputStream description) throws DesignFormatException {
    return load(new InputStreamReader(description, StandardCharsets.UTF_8));
  }

  /**
   * Reads a design description and creates all modules in it.
   * @param description the YAML text
   * @return the ids of the created modules, in file order
   * @throws DesignFormatException if the description is not valid YAML or not a valid design
   */
  public List<Integer> load(Reader description) throws DesignFormatException {
    Object root;
    try {
      root = new Yaml().load(description);
    } catch (YAMLException e) {
      throw new DesignFormatException("Design is not valid YAML: " + e.getMessage(), e);
    }
    List<?> moduleEntries;
    if (root instanceof List)
      moduleEntries = (List<?>)root;
    else if (root instanceof Map)
      moduleEntries = List.of(root);
    else
      throw new DesignFormatException("Design must be a list of modules");

    List<Integer> modules = new ArrayList<>();
    for (Object entry : moduleEntries) {
      if (!(entry instanceof Map))
        throw new DesignFormatException("Module entry must be a map, got " + entry);
      modules.add(loadModule((Map<?, ?>)entry));
    }
    logger.debug("Loaded {} module(s) into {}", modules.size(), graph);
    return modules;
  }

  public int loadModule(Map<?, ?> moduleEntry) throws DesignFormatException {
    Object nameObj = moduleEntry.get("module");
    if (!(nameObj instanceof String))
      throw new DesignFormatException("Module entry without a 'module' name: " + moduleEntry);
    String moduleName = (String)nameObj;
    checkName(moduleName);

    List<Integer> args = new ArrayList<>();
    List<Integer> decls = new ArrayList<>();
    for (Map.Entry<?, ?> setting : moduleEntry.entrySet()) {
      String key = asKey(setting.getKey(), "module " + moduleName);
      Object value = setting.getValue();
      switch (key) {
      case "module":
        break;
      case "ports":
        for (Object port : asList(value, moduleName + ".ports"))
          args.add(graph.createIdentifier(asName(port)));
        break;
      case "inputs":
      case "outputs":
      case "wires":
        for (Object declEntry : asList(value, moduleName + "." + key))
          decls.add(loadDeclaration(key, declEntry));
        break;
      case "parameters":
        for (Map.Entry<?, ?> parameter : asMap(value, moduleName + ".parameters").entrySet()) {
          int identifier = graph.createIdentifier(asName(parameter.getKey()));
          decls.add(graph.createParameterDeclaration(identifier, expression(parameter.getValue(), true)));
        }
        break;
      case "assigns":
        for (Map.Entry<?, ?> assign : asMap(value, moduleName + ".assigns").entrySet()) {
          int signal = expression(assign.getKey(), false);
          int expr = expression(assign.getValue(), false);
          decls.add(graph.createAssignment(signal, expr));
        }
        break;
      case "instances":
        for (Object instance : asList(value, moduleName + ".instances"))
          decls.add(loadInstance(instance));
        break;
      default:
        logger.warn("Ignoring unknown key '{}' in module {}", key, moduleName);
      }
    }
    int id = graph.createModule(moduleName, args, decls);
    logger.debug("Loaded module {} with {} port(s) and {} item(s)", moduleName, args.size(), decls.size());
    return id;
  }

  private int loadDeclaration(String key, Object declEntry) throws DesignFormatException {
    List<?> names;
    Object range = null;
    if (declEntry instanceof Map) {
      Map<?, ?> declMap = (Map<?, ?>)declEntry;
      if (declMap.containsKey("names"))
        names = asList(declMap.get("names"), key + ".names");
      else if (declMap.containsKey("name"))
        names = Collections.singletonList(declMap.get("name"));
      else
        throw new DesignFormatException("Declaration in " + key + " without names: " + declMap);
      range = declMap.get("range");
    } else {
      names = Collections.singletonList(declEntry);
    }
    if (names.isEmpty())
      throw new DesignFormatException("Declaration in " + key + " declares no names");

    int declared;
    if (names.size() == 1) {
      declared = graph.createIdentifier(asName(names.get(0)));
    } else {
      List<Integer> identifiers = new ArrayList<>(names.size());
      for (Object name : names)
        identifiers.add(graph.createIdentifier(asName(name)));
      declared = graph.createIdentifierList(identifiers);
    }

    if (range == null) {
      switch (key) {
      case "inputs":
        return graph.createInputDeclaration(declared);
      case "outputs":
        return graph.createOutputDeclaration(declared);
      default:
        return graph.createWireDeclaration(declared);
      }
    }
    List<?> bounds = asList(range, key + ".range");
    if (bounds.size() != 2)
      throw new DesignFormatException("Range must be [hi, lo], got " + bounds);
    int hi = expression(bounds.get(0), true);
    int lo = expression(bounds.get(1), true);
    int rangeId = graph.createRangeExpression(hi, lo);
    switch (key) {
    case "inputs":
      return graph.createInputDeclaration(declared, rangeId);
    case "outputs":
      return graph.createOutputDeclaration(declared, rangeId);
    default:
      return graph.createWireDeclaration(declared, rangeId);
    }
  }

  private int loadInstance(Object instanceEntry) throws DesignFormatException {
    Map<?, ?> instance = asMap(instanceEntry, "instance");
    if (!instance.containsKey("module") || !instance.containsKey("name"))
      throw new DesignFormatException("Instance needs 'module' and 'name': " + instance);
    int moduleName = graph.createIdentifier(asName(instance.get("module")));
    int instanceName = graph.createIdentifier(asName(instance.get("name")));
    List<Integer> parameters = new ArrayList<>();
    if (instance.containsKey("parameters")) {
      for (Object parameter : asList(instance.get("parameters"), "instance parameters"))
        parameters.add(expression(parameter, true));
    }
    List<PortAssignment> ports = new ArrayList<>();
    if (instance.containsKey("ports")) {
      for (Map.Entry<?, ?> port : asMap(instance.get("ports"), "instance ports").entrySet()) {
        int portName = graph.createIdentifier(asName(port.getKey()));
        ports.add(new PortAssignment(portName, expression(port.getValue(), false)));
      }
    }
    return graph.createModuleInstantiation(moduleName, instanceName, ports, parameters);
  }

  /**
   * Creates the nodes for an expression, operands first.
   * @param value the parsed YAML value
   * @param arithmetic whether plain names become arithmetic identifiers
   * @return the id of the expression root
   */
  int expression(Object value, boolean arithmetic) throws DesignFormatException {
    if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
      String text = value.toString();
      if (text.startsWith("-"))
        return graph.createNegativeSign(graph.createNumeral(text.substring(1)));
      return graph.createNumeral(text);
    }
    if (value instanceof String) {
      String text = ((String)value).trim();
      if (NUMERAL.matcher(text).matches())
        return graph.createNumeral(text);
      Matcher select = SELECT.matcher(text);
      if (select.matches()) {
        int array = name(select.group(1), arithmetic);
        return graph.createArraySelect(array, expression(select.group(2), true));
      }
      return name(text, arithmetic);
    }
    if (value instanceof Map && ((Map<?, ?>)value).size() == 1) {
      Map.Entry<?, ?> op = ((Map<?, ?>)value).entrySet().iterator().next();
      String opName = asKey(op.getKey(), "expression");
      switch (opName) {
      case "not":
        return graph.createNotExpression(expression(singleOperand(op.getValue(), opName), arithmetic));
      case "neg":
        return graph.createNegativeSign(expression(singleOperand(op.getValue(), opName), arithmetic));
      case "select": {
        List<?> operands = asList(op.getValue(), opName);
        if (operands.size() != 2)
          throw new DesignFormatException("select takes [signal, index], got " + operands);
        int array = expression(operands.get(0), arithmetic);
        return graph.createArraySelect(array, expression(operands.get(1), true));
      }
      case "call": {
        List<?> operands = asList(op.getValue(), opName);
        if (operands.isEmpty() || !(operands.get(0) instanceof String) || !((String)operands.get(0)).startsWith("$"))
          throw new DesignFormatException("call takes [$function, args...], got " + operands);
        int function = graph.createArithmeticIdentifier(asName(operands.get(0)));
        List<Integer> args = new ArrayList<>();
        for (Object arg : operands.subList(1, operands.size()))
          args.add(expression(arg, arithmetic));
        return graph.createSystemFunction(function, args);
      }
      default:
        ExprKind kind = ExprKind.fromSerialName(opName).orElseThrow(() -> new DesignFormatException("Unknown operator '" + opName + "'"));
        List<?> operands = asList(op.getValue(), opName);
        if (operands.size() < 2)
          throw new DesignFormatException("Operator " + opName + " needs at least two operands, got " + operands);
        // left-associative chain
        int ret = expression(operands.get(0), arithmetic);
        for (Object operand : operands.subList(1, operands.size()))
          ret = graph.createExpression(kind, ret, expression(operand, arithmetic));
        return ret;
      }
    }
    throw new DesignFormatException("Not an expression: " + value);
  }

  private int name(String name, boolean arithmetic) throws DesignFormatException {
    checkName(name);
    return arithmetic ? graph.createArithmeticIdentifier(name) : graph.createIdentifier(name);
  }

  private static Object singleOperand(Object value, String opName) throws DesignFormatException {
    if (value instanceof List) {
      List<?> operands = (List<?>)value;
      if (operands.size() != 1)
        throw new DesignFormatException("Operator " + opName + " takes one operand, got " + operands);
      return operands.get(0);
    }
    return value;
  }

  /**
   * Returns a map key as String.
   * @param key the key as parsed by SnakeYAML
   * @param where the enclosing map, for the error message
   * @throws DesignFormatException if the key is null or not a plain string
   */
  public static String asKey(Object key, String where) throws DesignFormatException {
    if (!(key instanceof String))
      throw new DesignFormatException("Keys in " + where + " must be strings, got " + key);
    return (String)key;
  }
  private static String asName(Object value) throws DesignFormatException {
    if (!(value instanceof String))
      throw new DesignFormatException("Expected a name, got " + value);
    return checkName((String)value);
  }
  private static String checkName(String name) throws DesignFormatException {
    if (!NAME.matcher(name).matches())
      throw new DesignFormatException("Invalid name '" + name + "'");
    return name;
  }
  private static List<?> asList(Object value, String what) throws DesignFormatException {
    if (!(value instanceof List))
      throw new DesignFormatException(what + " must be a list, got " + value);
    return (List<?>)value;
  }
  private static Map<?, ?> asMap(Object value, String what) throws DesignFormatException {
    if (!(value instanceof Map))
      throw new DesignFormatException(what + " must be a map, got " + value);
    return (Map<?, ?>)value;
  }
}
