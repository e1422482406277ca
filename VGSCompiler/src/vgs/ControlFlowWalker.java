package vgs;

import java.util.Optional;

public final class ControlFlowWalker {
  private final CompilationContext ctx;

  ControlFlowWalker(CompilationContext ctx) {
    this.ctx = ctx;
  }

  public void walk(String nodeId) throws CompilerException {
    Optional<Graph.Node> node = ctx.index().node(nodeId);
    if (!node.isPresent() || !ctx.markVisited(nodeId)) {
      return;
    }

    ctx.emit(node.get());
  }

  public void followExec(Graph.Node node, String portId) throws CompilerException {
    for (Graph.Connection conn : ctx.index().outgoing(node.id(), portId)) {
      walk(conn.to().nodeId());
    }
  }
}
