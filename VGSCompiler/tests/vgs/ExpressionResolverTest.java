package vgs;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static vgs.TestNodes.getOrigin;
import static vgs.TestNodes.mathAdd;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ExpressionResolverTest {

  private static CompilationContext context(Graph graph) {
    return new CompilationContext(
        graph.index(),
        StatementEmitter.standard(),
        CompilerOptions.defaults(),
        new CallableNames());
  }

  // An exec node whose data inputs start at input_1.
  private static Graph.Node consumer(String... labels) {
    Graph.Node.Builder builder = Graph.Node.builder("c", "custom").addExecInput("Exec");
    for (String label : labels) {
      builder.addDataInput(label);
    }
    return builder.build();
  }

  @Test
  public void defaultFromMatchingDataKey() throws CompilerException {
    Graph.Node node =
        Graph.Node.builder("n", "custom")
            .addDataInput("Damage Amount")
            .addDataInput("Sound Name", "asset")
            .addDataInput("Unmatched")
            .putData("damageamount", 25)
            .putData("sound", "wpn_fire")
            .build();
    CompilationContext ctx = context(Graph.builder().addNode(node).build());

    assertThat(ctx.valueOf(node, "input_0")).isEqualTo("25");
    assertThat(ctx.valueOf(node, "input_1")).isEqualTo("wpn_fire");
    assertThat(ctx.valueOf(node, "input_2")).isEqualTo("null");
    assertThat(ctx.valueOf(node, "input_9")).isEqualTo("null");
  }

  @Test
  public void stringDefaultsAreQuotedOnOtherPorts() throws CompilerException {
    Graph.Node node =
        Graph.Node.builder("n", "custom")
            .addDataInput("Text", "string")
            .putData("", "ignored")
            .putData("text", "hi")
            .build();
    CompilationContext ctx = context(Graph.builder().addNode(node).build());

    assertThat(ctx.valueOf(node, "input_0")).isEqualTo("\"hi\"");
  }

  @Test
  public void producerIsMaterializedOnce() throws CompilerException {
    Graph.Node c = consumer("A", "B");
    Graph graph =
        Graph.builder()
            .addNode(c)
            .addNode(getOrigin("g").build())
            .connect("g", "output_0", "c", "input_1")
            .connect("g", "output_0", "c", "input_2")
            .build();
    CompilationContext ctx = context(graph);

    ImmutableList<String> lines =
        ctx.capture(
            0,
            () -> {
              assertThat(ctx.valueOf(c, "input_1")).isEqualTo("origin0");
              assertThat(ctx.valueOf(c, "input_2")).isEqualTo("origin0");
            });

    assertThat(lines).containsExactly("local origin0 = null.GetOrigin()");
    assertThat(ctx.isVisited("g")).isTrue();
  }

  @Test
  public void inlineValuesEmitNoLines() throws CompilerException {
    Graph.Node c = consumer("A");
    Graph graph =
        Graph.builder()
            .addNode(c)
            .addNode(
                Graph.Node.builder("k", "const-vector")
                    .addDataOutput("Vector", "vector")
                    .putData("x", 1)
                    .putData("y", Literal.of(2.5))
                    .build())
            .connect("k", "output_0", "c", "input_1")
            .build();
    CompilationContext ctx = context(graph);

    ImmutableList<String> lines =
        ctx.capture(
            0, () -> assertThat(ctx.valueOf(c, "input_1")).isEqualTo("Vector(1, 2.5, 0)"));

    assertThat(lines).isEmpty();
  }

  @Test
  public void cycleIsDetected() {
    Graph.Node c = consumer("A");
    Graph graph =
        Graph.builder()
            .addNode(c)
            .addNode(mathAdd("a").build())
            .addNode(mathAdd("b").build())
            .connect("a", "output_0", "c", "input_1")
            .connect("b", "output_0", "a", "input_1")
            .connect("a", "output_0", "b", "input_0")
            .build();
    CompilationContext ctx = context(graph);

    CyclicDependencyException ex =
        assertThrows(CyclicDependencyException.class, () -> ctx.valueOf(c, "input_1"));
    assertThat(ex.nodeId().get()).isEqualTo("a");
  }

  @Test
  public void selfLoopIsDetected() {
    Graph.Node c = consumer("A");
    Graph graph =
        Graph.builder()
            .addNode(c)
            .addNode(mathAdd("a").build())
            .connect("a", "output_0", "c", "input_1")
            .connect("a", "output_0", "a", "input_0")
            .build();
    CompilationContext ctx = context(graph);

    assertThrows(CyclicDependencyException.class, () -> ctx.valueOf(c, "input_1"));
  }
}
