package verilogast.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import verilogast.frontend.DesignFormatException;
import verilogast.frontend.DesignLoader;
import verilogast.graph.AstGraph;
import verilogast.util.AstPrinter;
import verilogast.util.GraphDumper;

public class AstCmd {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  // options for cmdline parser
  static Options options = new Options();
  static {
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("design.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file describing the modules to build")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options (initial_capacity, allow_empty_identifier_lists, dump_format)")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("File to write the result to; stdout by default")
                          .build());
    options.addOption(Option.builder("d").longOpt("dump").required(false).desc("Print the node graph instead of Verilog").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print trace information and enable -v").build());
  }

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(PrintStream out) {
    helper.printHelp(new java.io.PrintWriter(out, true), helper.getWidth(), "vastcmd - build a Verilog syntax graph from a YAML design",
                     null, options, helper.getLeftPadding(), helper.getDescPadding(), null, true);
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout carries the result
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stderr")));
    Configurator.initialize(builder.build());

    System.exit(run(args, System.out));
  }

  /**
   * Runs the tool.
   * @param args command line arguments
   * @param stdout stream for the result if no output file is given
   * @return the process exit code
   */
  public static int run(String[] args, PrintStream stdout) {
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    for (String arg : args) {
      if (arg.equals("-h") || arg.equals("--help")) {
        printHelp(stdout);
        return 0;
      }
    }
    CommandLine line;
    try {
      // parse the command line arguments
      line = parser.parse(options, args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(System.err);
      return 1;
    }
    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    AstConfig cfg = new AstConfig();
    if (line.hasOption("c")) {
      try (InputStream configFile = new FileInputStream(line.getOptionValue("c"))) {
        cfg = parseConfig(configFile);
      } catch (FileNotFoundException e) {
        logger.error("Config file {} could not be opened", line.getOptionValue("c"));
        return 1;
      } catch (IOException | DesignFormatException e) {
        logger.error("Cannot read config file {}: {}", line.getOptionValue("c"), e.getMessage());
        return 1;
      }
    }

    //////////   build the graph   //////////
    AstGraph graph = new AstGraph(cfg);
    List<Integer> modules;
    File designFile = new File(line.getOptionValue("i"));
    try (InputStream design = new FileInputStream(designFile)) {
      modules = new DesignLoader(graph).load(design);
    } catch (FileNotFoundException e) {
      logger.error("Design file {} could not be opened", designFile);
      return 1;
    } catch (IOException | DesignFormatException e) {
      logger.error("Cannot load design {}: {}", designFile, e.getMessage());
      return 1;
    }
    logger.info("Built {} module(s), {}", modules.size(), graph);

    //////////   write the result   //////////
    try {
      if (line.hasOption("o")) {
        try (Writer writer = Files.newBufferedWriter(new File(line.getOptionValue("o")).toPath(), StandardCharsets.UTF_8)) {
          writeResult(graph, modules, cfg, line.hasOption("d"), writer);
        }
      } else {
        Writer writer = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
        writeResult(graph, modules, cfg, line.hasOption("d"), writer);
        writer.flush();
      }
    } catch (IOException e) {
      logger.error("Cannot write result: {}", e.getMessage());
      return 1;
    }
    return 0;
  }

  private static void writeResult(AstGraph graph, List<Integer> modules, AstConfig cfg, boolean dump, Writer writer) throws IOException {
    if (dump) {
      new GraphDumper(graph).dump(writer, GraphDumper.Format.fromName(cfg.dump_format));
      return;
    }
    AstPrinter printer = new AstPrinter(graph);
    for (int i = 0; i < modules.size(); ++i) {
      if (i > 0)
        writer.write("\n");
      writer.write(printer.print(modules.get(i)));
    }
  }

  // parse yaml and translate the options to an AstConfig
  //
  static AstConfig parseConfig(InputStream configFile) throws DesignFormatException {
    AstConfig cfg = new AstConfig();
    Object readData;
    try {
      readData = new Yaml().load(configFile);
    } catch (YAMLException e) {
      throw new DesignFormatException("Config is not valid YAML: " + e.getMessage(), e);
    }
    if (readData == null)
      return cfg;
    if (!(readData instanceof Map))
      throw new DesignFormatException("Config must be a map of options");
    for (Map.Entry<?, ?> setting : ((Map<?, ?>)readData).entrySet()) {
      String key = DesignLoader.asKey(setting.getKey(), "config");
      Object value = setting.getValue();
      if (key.equals("initial_capacity")) {
        if (!(value instanceof Integer) || (int)value < 0)
          throw new DesignFormatException("initial_capacity must be a non-negative integer, got " + value);
        cfg.initial_capacity = (int)value;
      } else if (key.equals("allow_empty_identifier_lists")) {
        if (!(value instanceof Boolean))
          throw new DesignFormatException("allow_empty_identifier_lists must be true or false, got " + value);
        cfg.allow_empty_identifier_lists = (boolean)value;
      } else if (key.equals("dump_format")) {
        try {
          cfg.dump_format = GraphDumper.Format.fromName(String.valueOf(value)).name();
        } catch (IllegalArgumentException e) {
          throw new DesignFormatException(e.getMessage(), e);
        }
      } else {
        logger.warn("Ignoring unknown option {}", key);
      }
    }
    logger.debug("Config: initial_capacity={} allow_empty_identifier_lists={} dump_format={}", cfg.initial_capacity,
                 cfg.allow_empty_identifier_lists, cfg.dump_format);
    return cfg;
  }
}
