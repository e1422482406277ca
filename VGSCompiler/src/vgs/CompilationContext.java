package vgs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * State of one compilation pass: everything emitted for a single entry point. A fresh context is
 * created per entry point, so nothing here is shared between the blocks of the output.
 *
 * <p>Node rules write lines through {@link #line}, read their inputs through {@link #valueOf} and
 * continue control flow through {@link #followExec}. Lines go to a single buffer in emission order,
 * so the statements of a producer pulled in by {@link #valueOf} land directly before the line that
 * consumes the value.
 */
public final class CompilationContext {

  public interface Block {
    void emit() throws CompilerException;
  }

  private static final CharMatcher IDENTIFIER_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'));

  private final GraphIndex index;
  private final StatementEmitter emitter;
  private final CompilerOptions options;
  private final CallableNames callableNames;
  private final ExpressionResolver resolver;
  private final ControlFlowWalker walker;

  private final Set<String> visited = new HashSet<>();
  // Nodes still reading their inputs.
  private final Set<String> resolving = new HashSet<>();
  private final Map<Graph.Endpoint, String> variables = new HashMap<>();
  private final List<ThreadHoister.Callable> hoisted = new ArrayList<>();
  private int nameCounter = 0;
  private int depth = 0;
  private List<String> lines = new ArrayList<>();

  public CompilationContext(
      GraphIndex index,
      StatementEmitter emitter,
      CompilerOptions options,
      CallableNames callableNames) {
    this.index = index;
    this.emitter = emitter;
    this.options = options;
    this.callableNames = callableNames;
    this.resolver = new ExpressionResolver(this);
    this.walker = new ControlFlowWalker(this);
  }

  public GraphIndex index() {
    return index;
  }

  // Control flow

  public void walk(String nodeId) throws CompilerException {
    walker.walk(nodeId);
  }

  public void followExec(Graph.Node node, String portId) throws CompilerException {
    // Control only moves on once the node's inputs are read.
    resolving.remove(node.id());
    walker.followExec(node, portId);
  }

  void emit(Graph.Node node) throws CompilerException {
    resolving.add(node.id());
    try {
      emitter.emit(this, node);
    } finally {
      resolving.remove(node.id());
    }
  }

  // False if the node was already visited in this pass.
  public boolean markVisited(String nodeId) {
    return visited.add(nodeId);
  }

  public boolean isVisited(String nodeId) {
    return visited.contains(nodeId);
  }

  public ImmutableSet<String> visited() {
    return ImmutableSet.copyOf(visited);
  }

  // Values

  public String valueOf(Graph.Node node, String portId) throws CompilerException {
    return resolver.valueOf(node, portId);
  }

  public Optional<String> variable(Graph.Endpoint endpoint) {
    return Optional.ofNullable(variables.get(endpoint));
  }

  // Each port is bound at most once per pass.
  public void define(Graph.Node node, String portId, String expression) {
    Graph.Endpoint endpoint = Graph.Endpoint.of(node.id(), portId);
    Preconditions.checkState(
        variables.putIfAbsent(endpoint, expression) == null, "%s is already defined", endpoint);
  }

  public String newName(String prefix) {
    return prefix + nameCounter++;
  }

  boolean isResolving(String nodeId) {
    return resolving.contains(nodeId);
  }

  // Threads

  public String hoist(Graph.Node threadNode, String bodyPortId) {
    String name =
        callableNames.claim(
            "__Thread_" + IDENTIFIER_CHARS.negate().replaceFrom(threadNode.id(), '_'));
    hoisted.add(ThreadHoister.Callable.create(name, threadNode.id(), bodyPortId));
    return name;
  }

  int hoistedCount() {
    return hoisted.size();
  }

  ThreadHoister.Callable hoisted(int i) {
    return hoisted.get(i);
  }

  // Output

  public void line(String text) {
    lines.add(Strings.repeat(options.indentUnit(), depth) + text);
  }

  public void line(String format, Object... args) {
    line(String.format(format, args));
  }

  public void indented(Block body) throws CompilerException {
    depth++;
    try {
      body.emit();
    } finally {
      depth--;
    }
  }

  public void block(String header, Block body) throws CompilerException {
    line(header);
    line("{");
    indented(body);
    line("}");
  }

  public ImmutableList<String> capture(int atDepth, Block body) throws CompilerException {
    List<String> savedLines = lines;
    int savedDepth = depth;
    lines = new ArrayList<>();
    depth = atDepth;
    try {
      body.emit();
      return ImmutableList.copyOf(lines);
    } finally {
      lines = savedLines;
      depth = savedDepth;
    }
  }
}
