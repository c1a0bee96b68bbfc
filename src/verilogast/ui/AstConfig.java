package verilogast.ui;

/**
 * Data-Class to hold tool options.
 */
public class AstConfig {

  /** initial node storage capacity of a graph */
  public int initial_capacity = 64;
  /** if false, an identifier list must name at least one identifier */
  public boolean allow_empty_identifier_lists = false;

  /** "text" or "yaml" */
  public String dump_format = "text";
}
