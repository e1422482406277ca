package vgs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

public final class StatementEmitter {
  private static final Logger log = LoggerFactory.getLogger(StatementEmitter.class);

  private static final StatementEmitter STANDARD;

  static {
    Builder builder = builder();
    CoreRules.register(builder);
    GameRules.register(builder);
    ValueRules.register(builder);
    STANDARD = builder.build();
  }

  private final ImmutableMap<String, NodeRule> rules;

  private StatementEmitter(ImmutableMap<String, NodeRule> rules) {
    this.rules = rules;
  }

  public static StatementEmitter standard() {
    return STANDARD;
  }

  public ImmutableSet<String> types() {
    return rules.keySet();
  }

  public Optional<NodeRule> rule(String type) {
    return Optional.ofNullable(rules.get(type));
  }

  public void emit(CompilationContext ctx, Graph.Node node) throws CompilerException {
    NodeRule rule = rules.get(node.type());
    if (rule == null) {
      emitUnknown(ctx, node);
      return;
    }

    rule.emit(ctx, node);
  }

  // Leave a marker and keep going through the first exec output, if any.
  private static void emitUnknown(CompilationContext ctx, Graph.Node node)
      throws CompilerException {
    log.debug("No rule for node type '{}' (node '{}')", node.type(), node.id());
    ctx.line("// TODO: %s - %s", node.type(), node.label());
    Optional<Graph.Port> next = node.firstExecOutput();
    if (next.isPresent()) {
      ctx.followExec(node, next.get().id());
    }
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.rules.putAll(rules);
    return builder;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, NodeRule> rules = new LinkedHashMap<>();

    private Builder() {}

    public Builder register(String type, NodeRule rule) {
      Preconditions.checkState(
          rules.putIfAbsent(type, rule) == null, "duplicate rule for node type '%s'", type);
      return this;
    }

    public Builder register(NodeRule rule, String... types) {
      for (String type : types) {
        register(type, rule);
      }
      return this;
    }

    public Builder override(String type, NodeRule rule) {
      rules.put(type, rule);
      return this;
    }

    public StatementEmitter build() {
      return new StatementEmitter(ImmutableMap.copyOf(rules));
    }
  }
}
