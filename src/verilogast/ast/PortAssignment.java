package verilogast.ast;

/**
 * One named port connection `.port(signal)` of a module instantiation.
 * @param port id of the port name identifier
 * @param signal id of the connected signal expression
 */
public record PortAssignment(int port, int signal) {}
