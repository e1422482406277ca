package vgs;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;

public final class GraphValidator {
  private final Graph graph;
  private final List<CompilerException> warnings = new ArrayList<>();

  public GraphValidator(Graph graph) {
    this.graph = graph;
  }

  public ImmutableList<CompilerException> validate() {
    warnings.clear();
    GraphIndex index = graph.index();

    checkDuplicateIds();
    checkDanglingConnections(index);
    checkDuplicateRoots();
    detectCycles(dataDependencies(index), this::logCycle);

    return ImmutableList.copyOf(warnings);
  }

  private void checkDuplicateIds() {
    Set<String> seen = new HashSet<>();
    for (Graph.Node node : graph.nodes()) {
      if (!seen.add(node.id())) {
        logWarning(node.id(), "duplicate node id; only the first node with this id is used");
      }
    }
  }

  private void checkDanglingConnections(GraphIndex index) {
    for (Graph.Connection conn : index.danglingConnections()) {
      warnings.add(
          new CompilerException(
              String.format(
                  "connection '%s' (%s -> %s) references a missing node or port; ignored",
                  conn.id(), conn.from(), conn.to())));
    }
  }

  private void checkDuplicateRoots() {
    Multiset<String> roots = LinkedHashMultiset.create();
    for (Graph.Node node : graph.nodes()) {
      if (Compiler.RootKind.isInit(node)) {
        roots.add(node.type());
      }
    }
    for (Multiset.Entry<String> entry : roots.entrySet()) {
      if (entry.getCount() > 1) {
        warnings.add(
            new CompilerException(
                String.format(
                    "%d '%s' nodes; only the first one is compiled",
                    entry.getCount(), entry.getElement())));
      }
    }
  }

  // Edge producer -> consumer for every data connection.
  private static com.google.common.graph.Graph<String> dataDependencies(GraphIndex index) {
    MutableGraph<String> deps = GraphBuilder.directed().allowsSelfLoops(true).build();
    for (Graph.Connection conn : index.connections()) {
      Graph.Node producer = index.node(conn.from().nodeId()).get();
      boolean isData = producer.output(conn.from().portId()).map(p -> !p.isExec()).orElse(false);
      if (isData) {
        deps.putEdge(conn.from().nodeId(), conn.to().nodeId());
      }
    }
    return deps;
  }

  private void logCycle(String nodeId) {
    logWarning(nodeId, "node is part of a data dependency cycle");
  }

  // Returns true if cycles were detected.
  static <T> boolean detectCycles(com.google.common.graph.Graph<T> graph, Consumer<T> logError) {
    com.google.common.graph.Graph<T> closure = Graphs.transitiveClosure(graph);
    Set<T> logged = new HashSet<>();
    for (T node : closure.nodes()) {
      if (graph.successors(node).contains(node)) {
        if (logged.add(node)) {
          logError.accept(node);
        }
      } else {
        for (T node2 : closure.successors(node)) {
          if (!node2.equals(node) && closure.successors(node2).contains(node)) {
            if (logged.add(node)) {
              logError.accept(node);
            }
            break;
          }
        }
      }
    }

    return !logged.isEmpty();
  }

  private void logWarning(String nodeId, String msg) {
    warnings.add(new CompilerException(nodeId, msg));
  }
}
