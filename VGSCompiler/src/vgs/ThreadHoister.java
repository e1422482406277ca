package vgs;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

final class ThreadHoister {

  @AutoValue
  abstract static class Callable {
    abstract String name();

    abstract String nodeId();

    abstract String bodyPortId();

    static Callable create(String name, String nodeId, String bodyPortId) {
      return new AutoValue_ThreadHoister_Callable(name, nodeId, bodyPortId);
    }
  }

  private final CompilationContext ctx;

  ThreadHoister(CompilationContext ctx) {
    this.ctx = ctx;
  }

  ImmutableList<String> emitAll() throws CompilerException {
    ImmutableList.Builder<String> out = ImmutableList.builder();
    // hoistedCount() grows while bodies are emitted.
    for (int i = 0; i < ctx.hoistedCount(); i++) {
      Callable callable = ctx.hoisted(i);
      Graph.Node thread = ctx.index().node(callable.nodeId()).get();

      out.add("");
      out.add(String.format("void function %s()", callable.name()));
      out.add("{");
      out.addAll(ctx.capture(1, () -> ctx.followExec(thread, callable.bodyPortId())));
      out.add("}");
    }
    return out.build();
  }
}
