package vgs;

import java.util.Optional;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Optional<String> nodeId;

  public CompilerException(String errorMsg) {
    super(errorMsg);
    this.nodeId = Optional.empty();
  }

  public CompilerException(String nodeId, String errorMsg) {
    super(String.format("node '%s': %s", nodeId, errorMsg));
    this.nodeId = Optional.of(nodeId);
  }

  public CompilerException(String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.nodeId = Optional.empty();
  }

  public Optional<String> nodeId() {
    return nodeId;
  }

  public void print() {
    System.out.println(String.format("ERROR: %s", getMessage()));
  }

  public void printWarning() {
    System.out.println(String.format("WARNING: %s", getMessage()));
  }
}
