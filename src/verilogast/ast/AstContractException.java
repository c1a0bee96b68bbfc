package verilogast.ast;

/**
 * Thrown when a caller of the syntax graph breaks its construction or inspection contract,
 * e.g. by referencing an id that does not exist yet or by handing in a node of the wrong kind.
 * This always indicates a defect in the caller (typically the parser), never bad input data.
 */
public class AstContractException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public AstContractException(String message) { super(message); }
}
