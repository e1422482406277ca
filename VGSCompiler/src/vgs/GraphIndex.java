package vgs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

public final class GraphIndex {
  private final ImmutableMap<String, Graph.Node> nodesById;
  private final ImmutableListMultimap<Graph.Endpoint, Graph.Connection> bySource;
  private final ImmutableListMultimap<Graph.Endpoint, Graph.Connection> byTarget;
  private final ImmutableList<Graph.Connection> resolved;
  private final ImmutableList<Graph.Connection> dangling;

  private GraphIndex(
      ImmutableMap<String, Graph.Node> nodesById,
      ImmutableListMultimap<Graph.Endpoint, Graph.Connection> bySource,
      ImmutableListMultimap<Graph.Endpoint, Graph.Connection> byTarget,
      ImmutableList<Graph.Connection> resolved,
      ImmutableList<Graph.Connection> dangling) {
    this.nodesById = nodesById;
    this.bySource = bySource;
    this.byTarget = byTarget;
    this.resolved = resolved;
    this.dangling = dangling;
  }

  public static GraphIndex of(Graph graph) {
    // First occurrence wins on duplicate ids.
    Map<String, Graph.Node> nodes = new LinkedHashMap<>();
    graph.nodes().forEach(n -> nodes.putIfAbsent(n.id(), n));

    ImmutableListMultimap.Builder<Graph.Endpoint, Graph.Connection> bySource =
        ImmutableListMultimap.builder();
    ImmutableListMultimap.Builder<Graph.Endpoint, Graph.Connection> byTarget =
        ImmutableListMultimap.builder();
    ImmutableList.Builder<Graph.Connection> resolved = ImmutableList.builder();
    ImmutableList.Builder<Graph.Connection> dangling = ImmutableList.builder();
    for (Graph.Connection conn : graph.connections()) {
      Graph.Node from = nodes.get(conn.from().nodeId());
      Graph.Node to = nodes.get(conn.to().nodeId());
      if (from == null
          || to == null
          || !from.output(conn.from().portId()).isPresent()
          || !to.input(conn.to().portId()).isPresent()) {
        dangling.add(conn);
        continue;
      }

      bySource.put(conn.from(), conn);
      byTarget.put(conn.to(), conn);
      resolved.add(conn);
    }

    return new GraphIndex(
        ImmutableMap.copyOf(nodes),
        bySource.build(),
        byTarget.build(),
        resolved.build(),
        dangling.build());
  }

  public Optional<Graph.Node> node(String nodeId) {
    return Optional.ofNullable(nodesById.get(nodeId));
  }

  public ImmutableList<Graph.Node> nodes() {
    return nodesById.values().asList();
  }

  public Optional<Graph.Node> firstNodeOfType(String type) {
    return nodesById.values().stream().filter(n -> n.type().equals(type)).findFirst();
  }

  public ImmutableList<Graph.Connection> outgoing(String nodeId, String portId) {
    return bySource.get(Graph.Endpoint.of(nodeId, portId));
  }

  public ImmutableList<Graph.Connection> incoming(String nodeId, String portId) {
    return byTarget.get(Graph.Endpoint.of(nodeId, portId));
  }

  public ImmutableList<Graph.Connection> connections() {
    return resolved;
  }

  public ImmutableList<Graph.Connection> danglingConnections() {
    return dangling;
  }
}
