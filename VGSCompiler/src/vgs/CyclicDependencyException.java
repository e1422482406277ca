package vgs;

public class CyclicDependencyException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public CyclicDependencyException(String nodeId) {
    super(nodeId, "cyclic data dependency; the node's value depends on itself");
  }
}
