package vgs;

import static com.google.common.truth.Truth.assertThat;
import static vgs.TestNodes.initServer;
import static vgs.TestNodes.mathAdd;
import static vgs.TestNodes.print;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;

public class GraphValidatorTest {

  private static ImmutableList<String> messages(Graph graph) {
    return new GraphValidator(graph)
        .validate()
        .stream()
        .map(CompilerException::getMessage)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void cleanGraph() {
    Graph graph =
        Graph.builder()
            .addNode(initServer("s").build())
            .addNode(print("p", "hi").build())
            .connect("s", "output_0", "p", "input_0")
            .build();

    assertThat(messages(graph)).isEmpty();
  }

  @Test
  public void reportsStructuralProblems() {
    Graph graph =
        Graph.builder()
            .addNode(initServer("s").build())
            .addNode(initServer("s2").build())
            .addNode(print("p", "hi").build())
            .addNode(print("p", "again").build())
            .connect("s", "output_0", "missing", "input_0")
            .build();

    assertThat(messages(graph))
        .containsExactly(
            "node 'p': duplicate node id; only the first node with this id is used",
            "connection 'conn_0' (s:output_0 -> missing:input_0) references a missing node or"
                + " port; ignored",
            "2 'init-server' nodes; only the first one is compiled")
        .inOrder();
  }

  @Test
  public void reportsDataCycles() {
    Graph graph =
        Graph.builder()
            .addNode(initServer("s").build())
            .addNode(print("p", "hi").build())
            .addNode(mathAdd("a").build())
            .addNode(mathAdd("b").build())
            .addNode(mathAdd("self").build())
            .connect("s", "output_0", "p", "input_0")
            .connect("a", "output_0", "p", "input_1")
            .connect("b", "output_0", "a", "input_0")
            .connect("a", "output_0", "b", "input_0")
            .connect("self", "output_0", "self", "input_1")
            .build();

    assertThat(messages(graph))
        .containsExactly(
            "node 'a': node is part of a data dependency cycle",
            "node 'b': node is part of a data dependency cycle",
            "node 'self': node is part of a data dependency cycle");
  }

  @Test
  public void execLoopsAreNotDataCycles() {
    Graph graph =
        Graph.builder()
            .addNode(print("p1", "a").build())
            .addNode(print("p2", "b").build())
            .connect("p1", "output_0", "p2", "input_0")
            .connect("p2", "output_0", "p1", "input_0")
            .build();

    assertThat(messages(graph)).isEmpty();
  }

  @Test
  public void detectCyclesReportsEachNodeOnce() {
    MutableGraph<Integer> graph = GraphBuilder.directed().allowsSelfLoops(true).build();
    graph.putEdge(1, 2);
    graph.putEdge(2, 3);
    graph.putEdge(3, 1);
    graph.putEdge(3, 4);
    List<Integer> logged = new ArrayList<>();

    assertThat(GraphValidator.detectCycles(graph, logged::add)).isTrue();
    assertThat(logged).containsExactly(1, 2, 3);
  }
}
