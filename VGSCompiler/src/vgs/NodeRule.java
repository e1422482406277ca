package vgs;

import java.util.function.Function;

@FunctionalInterface
public interface NodeRule {
  void emit(CompilationContext ctx, Graph.Node node) throws CompilerException;

  static NodeRule constant(Function<Graph.Node, String> value) {
    return (ctx, node) -> ctx.define(node, "output_0", value.apply(node));
  }

  static NodeRule inline(String format, String... inputs) {
    return (ctx, node) ->
        ctx.define(node, "output_0", String.format(format, values(ctx, node, inputs)));
  }

  static NodeRule local(String prefix, String format, String... inputs) {
    return (ctx, node) -> {
      Object[] args = values(ctx, node, inputs);
      String name = ctx.newName(prefix);
      ctx.define(node, "output_0", name);
      ctx.line("local %s = %s", name, String.format(format, args));
    };
  }

  static NodeRule statement(String format, String... inputs) {
    return (ctx, node) -> {
      ctx.line(String.format(format, values(ctx, node, inputs)));
      ctx.followExec(node, "output_0");
    };
  }

  // Inputs are resolved left to right; producers pulled in by an earlier input come first.
  private static Object[] values(CompilationContext ctx, Graph.Node node, String... inputs)
      throws CompilerException {
    Object[] values = new Object[inputs.length];
    for (int i = 0; i < inputs.length; i++) {
      values[i] = ctx.valueOf(node, inputs[i]);
    }
    return values;
  }
}
