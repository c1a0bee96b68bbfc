package verilogast.graph;

import java.util.function.IntConsumer;
import verilogast.ast.AstContractException;

/**
 * Either a node id or "no node", packed into one 32 bit word.
 * The top bit is the validity flag, the lower 31 bits hold the id.
 * Ids wrapped this way are therefore limited to {@link #MAX_ID}.
 */
public final class AstOrError {
  private static final int VALID_BIT = 0x80000000;
  private static final int ID_MASK = 0x7FFFFFFF;

  /** Largest id that can be wrapped */
  public static final int MAX_ID = 0x7FFFFFFE;

  private static final AstOrError ERROR = new AstOrError();

  private final int packed;

  /** Constructs an invalid value. */
  public AstOrError() { this.packed = 0; }
  private AstOrError(int packed) { this.packed = packed; }

  /**
   * Wraps a node id.
   * @param id the id, in [0, MAX_ID]
   * @return a valid AstOrError
   */
  public static AstOrError of(int id) {
    if (id < 0 || id > MAX_ID)
      throw new AstContractException("Id " + Integer.toUnsignedString(id) + " does not fit into 31 bits");
    return new AstOrError(id | VALID_BIT);
  }
  public static AstOrError error() { return ERROR; }

  public boolean valid() { return (packed & VALID_BIT) != 0; }

  /**
   * Returns the wrapped id. Callers have to check {@link #valid()} first.
   * @return the id
   */
  public int id() {
    if (!valid())
      throw new AstContractException("Read the id of an invalid AstOrError");
    return packed & ID_MASK;
  }

  public void ifValid(IntConsumer fn) {
    if (valid())
      fn.accept(packed & ID_MASK);
  }

  /** Returns the packed representation. */
  public int raw() { return packed; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    return packed == ((AstOrError)obj).packed;
  }
  @Override
  public int hashCode() {
    return packed;
  }
  @Override
  public String toString() {
    return valid() ? "AstOrError(" + (packed & ID_MASK) + ")" : "AstOrError(invalid)";
  }
}
