package vgs;

import java.util.Map;
import java.util.Optional;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Resolves the source expression feeding a data input. Producers are generated on first demand:
 * a value node has no place in the control flow, so its statements are emitted where its value is
 * first needed.
 */
public final class ExpressionResolver {
  public static final String NULL = "null";

  // Strings on ports of these types are identifiers or asset paths, not string literals.
  private static final ImmutableSet<String> BARE_DATA_TYPES = ImmutableSet.of("asset", "function");

  private final CompilationContext ctx;

  ExpressionResolver(CompilationContext ctx) {
    this.ctx = ctx;
  }

  public String valueOf(Graph.Node node, String portId) throws CompilerException {
    ImmutableList<Graph.Connection> incoming = ctx.index().incoming(node.id(), portId);
    if (incoming.isEmpty()) {
      return defaultValue(node, portId);
    }

    Graph.Endpoint source = incoming.get(0).from();
    Optional<String> value = ctx.variable(source);
    if (value.isPresent()) {
      return value.get();
    }

    if (ctx.isResolving(source.nodeId())) {
      throw new CyclicDependencyException(source.nodeId());
    }

    if (ctx.markVisited(source.nodeId())) {
      ctx.emit(ctx.index().node(source.nodeId()).get());
    }

    return ctx.variable(source).orElse(NULL);
  }

  private static String defaultValue(Graph.Node node, String portId) {
    Optional<Graph.Port> port = node.input(portId);
    if (!port.isPresent()) {
      return NULL;
    }

    String label = normalize(port.get().label());
    for (Map.Entry<String, Literal> entry : node.data().entrySet()) {
      String key = normalize(entry.getKey());
      if (key.isEmpty() || !label.contains(key)) {
        continue;
      }

      Literal literal = entry.getValue();
      if (literal.type() == Literal.Type.STRING
          && port.get().dataType().map(BARE_DATA_TYPES::contains).orElse(false)) {
        return literal.rawText();
      }
      return literal.toSource();
    }

    return NULL;
  }

  private static String normalize(String text) {
    return Ascii.toLowerCase(CharMatcher.whitespace().removeFrom(text));
  }
}
