package verilogast.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Common shape of input, output and wire declarations of form
 *   KEYWORD ( `[` MSB `:` LSB `]` )? IDENTIFIER `,` ... `,` IDENTIFIER `;`
 * A declaration with a range is word-level, one without is bit-level.
 * Children are the declared identifiers, followed by hi and lo for word-level declarations.
 */
public abstract class Declaration extends AstNode {
  private final int numIdentifiers;
  private final boolean wordLevel;

  /** Constructs a bit-level declaration. */
  protected Declaration(int id, List<Integer> identifiers) {
    super(id, identifiers);
    this.numIdentifiers = identifiers.size();
    this.wordLevel = false;
  }
  /** Constructs a word-level declaration. */
  protected Declaration(int id, List<Integer> identifiers, int hi, int lo) {
    super(id, withRange(identifiers, hi, lo));
    this.numIdentifiers = identifiers.size();
    this.wordLevel = true;
  }

  private static List<Integer> withRange(List<Integer> identifiers, int hi, int lo) {
    List<Integer> ret = new ArrayList<>(identifiers);
    ret.add(hi);
    ret.add(lo);
    return ret;
  }

  /**
   * Returns the declaration keyword, e.g. "input".
   * @return the keyword
   */
  public abstract String getKeyword();

  public boolean isWordLevel() { return wordLevel; }
  public boolean isBitLevel() { return !wordLevel; }

  public List<Integer> getIdentifiers() { return children.subList(0, numIdentifiers); }

  public int getHi() {
    if (!wordLevel)
      throw new AstContractException("Bit-level declaration " + this + " has no range");
    return children.get(numIdentifiers);
  }
  public int getLo() {
    if (!wordLevel)
      throw new AstContractException("Bit-level declaration " + this + " has no range");
    return children.get(numIdentifiers + 1);
  }
}
