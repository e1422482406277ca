package vgs;

import static com.google.common.truth.Truth.assertThat;
import static vgs.TestNodes.initServer;
import static vgs.TestNodes.print;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class GraphIndexTest {

  private static ImmutableList<String> ids(ImmutableList<Graph.Connection> connections) {
    return connections.stream().map(Graph.Connection::id).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void lookupsPreserveConnectionOrder() {
    GraphIndex index =
        Graph.builder()
            .addNode(initServer("s").build())
            .addNode(print("p1", "a").build())
            .addNode(print("p2", "b").build())
            .connect("s", "output_0", "p2", "input_0")
            .connect("s", "output_0", "p1", "input_0")
            .build()
            .index();

    assertThat(ids(index.outgoing("s", "output_0"))).containsExactly("conn_0", "conn_1").inOrder();
    assertThat(ids(index.incoming("p1", "input_0"))).containsExactly("conn_1");
    assertThat(index.outgoing("s", "output_1")).isEmpty();
    assertThat(index.node("p2").get().label()).isEqualTo("Print");
    assertThat(index.node("missing").isPresent()).isFalse();
  }

  @Test
  public void danglingConnectionsAreExcluded() {
    GraphIndex index =
        Graph.builder()
            .addNode(initServer("s").build())
            .addNode(print("p", "a").build())
            .connect("s", "output_0", "p", "input_0")
            .connect("s", "output_0", "gone", "input_0")
            .connect("s", "output_7", "p", "input_0")
            .connect("s", "output_0", "p", "input_9")
            .build()
            .index();

    assertThat(ids(index.connections())).containsExactly("conn_0");
    assertThat(ids(index.danglingConnections()))
        .containsExactly("conn_1", "conn_2", "conn_3")
        .inOrder();
    assertThat(ids(index.outgoing("s", "output_0"))).containsExactly("conn_0");
    assertThat(index.incoming("p", "input_9")).isEmpty();
  }

  @Test
  public void firstDuplicateIdWins() {
    GraphIndex index =
        Graph.builder()
            .addNode(print("p", "first").build())
            .addNode(print("p", "second").build())
            .addNode(initServer("s").build())
            .build()
            .index();

    assertThat(index.nodes()).hasSize(2);
    assertThat(index.node("p").get().data("message").get().rawText()).isEqualTo("first");
    assertThat(index.firstNodeOfType("init-server").get().id()).isEqualTo("s");
    assertThat(index.firstNodeOfType("init-ui").isPresent()).isFalse();
  }
}
