package verilogast.frontend;

/**
 * Thrown when a design or tool configuration file does not have the expected structure.
 */
public class DesignFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  public DesignFormatException(String message) { super(message); }
  public DesignFormatException(String message, Throwable cause) { super(message, cause); }
}
