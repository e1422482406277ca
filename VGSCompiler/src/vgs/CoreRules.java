package vgs;

final class CoreRules {

  static void register(StatementEmitter.Builder builder) {
    builder.register("sequence", CoreRules::sequence);
    builder.register("branch", CoreRules::branch);
    builder.register(NodeRule.statement("wait %s", "input_1"), "delay", "wait");
    builder.register("loop-for", CoreRules::loopFor);
    builder.register("loop-foreach", CoreRules::loopForeach);
    builder.register("loop-while", CoreRules::loopWhile);
    builder.register("thread", CoreRules::thread);
    builder.register("call-function", NodeRule.statement("%s()", "input_1"));
    builder.register("return", (ctx, node) -> ctx.line("return"));
    builder.register("reroute-exec", (ctx, node) -> ctx.followExec(node, "output_0"));
  }

  private static void sequence(CompilationContext ctx, Graph.Node node) throws CompilerException {
    for (Graph.Port out : node.execOutputs()) {
      ctx.followExec(node, out.id());
    }
  }

  // output_0 is the true branch, output_1 the false branch.
  private static void branch(CompilationContext ctx, Graph.Node node) throws CompilerException {
    String condition = ctx.valueOf(node, "input_1");
    ctx.block(String.format("if (%s)", condition), () -> ctx.followExec(node, "output_0"));

    if (!ctx.index().outgoing(node.id(), "output_1").isEmpty()) {
      ctx.block("else", () -> ctx.followExec(node, "output_1"));
    }
  }

  // Outputs: body, index, done.
  private static void loopFor(CompilationContext ctx, Graph.Node node) throws CompilerException {
    String start = ctx.valueOf(node, "input_1");
    String end = ctx.valueOf(node, "input_2");
    String step = ctx.valueOf(node, "input_3");
    String index = ctx.newName("i");
    ctx.define(node, "output_1", index);

    ctx.block(
        String.format(
            "for (local %1$s = %2$s; %1$s < %3$s; %1$s += %4$s)", index, start, end, step),
        () -> ctx.followExec(node, "output_0"));
    ctx.followExec(node, "output_2");
  }

  // Outputs: body, element, index, done.
  private static void loopForeach(CompilationContext ctx, Graph.Node node)
      throws CompilerException {
    String array = ctx.valueOf(node, "input_1");
    String element = ctx.newName("elem");
    String index = ctx.newName("idx");
    ctx.define(node, "output_1", element);
    ctx.define(node, "output_2", index);

    ctx.block(
        String.format("foreach (%s, %s in %s)", index, element, array),
        () -> ctx.followExec(node, "output_0"));
    ctx.followExec(node, "output_3");
  }

  // Outputs: body, done. The condition is evaluated where the loop starts.
  private static void loopWhile(CompilationContext ctx, Graph.Node node) throws CompilerException {
    String condition = ctx.valueOf(node, "input_1");
    ctx.block(String.format("while (%s)", condition), () -> ctx.followExec(node, "output_0"));
    ctx.followExec(node, "output_1");
  }

  // The body (output_0) becomes its own function; execution continues through output_1.
  private static void thread(CompilationContext ctx, Graph.Node node) throws CompilerException {
    String name = ctx.hoist(node, "output_0");
    ctx.line("thread %s()", name);
    ctx.followExec(node, "output_1");
  }

  private CoreRules() {}
}
