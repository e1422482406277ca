package vgs;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Compiles a graph into script source. Each entry point (the init nodes, then every event not
 * reached from an earlier one) is compiled in its own pass with a fresh {@link
 * CompilationContext}; only the function names are shared, so that they stay unique in the file.
 */
public class Compiler {
  private static final Logger log = LoggerFactory.getLogger(Compiler.class);

  public enum RootKind {
    SERVER("init-server", "SERVER", "CodeCallback_ModInit"),
    CLIENT("init-client", "CLIENT", "ClientCodeCallback_ModInit"),
    UI("init-ui", "UI", "UICodeCallback_ModInit"),
    EVENT("", "", "");

    public static final ImmutableList<RootKind> INIT_KINDS = ImmutableList.of(SERVER, CLIENT, UI);

    private final String nodeType;
    private final String guard;
    private final String defaultFunction;

    private RootKind(String nodeType, String guard, String defaultFunction) {
      this.nodeType = nodeType;
      this.guard = guard;
      this.defaultFunction = defaultFunction;
    }

    public String nodeType() {
      return nodeType;
    }

    public Optional<String> guard() {
      return guard.isEmpty() ? Optional.empty() : Optional.of(guard);
    }

    public String defaultFunction(Graph.Node root) {
      return this == EVENT ? root.type().replace('-', '_') + "_handler" : defaultFunction;
    }

    public static boolean isInit(Graph.Node node) {
      return INIT_KINDS.stream().anyMatch(kind -> kind.nodeType.equals(node.type()));
    }
  }

  private final Graph graph;
  private final CompilerOptions options;
  private final StatementEmitter rules;

  private String output;
  private ImmutableList<CompilerException> errors = ImmutableList.of();

  public Compiler(Graph graph) {
    this(graph, CompilerOptions.defaults(), StatementEmitter.standard());
  }

  public Compiler(Graph graph, CompilerOptions options, StatementEmitter rules) {
    this.graph = graph;
    this.options = options;
    this.rules = rules;
  }

  public void compile() {
    Preconditions.checkState(output == null, "compile() was already called");

    if (graph.isEmpty()) {
      output = Joiner.on('\n').join(options.emptyGraphPlaceholder());
      return;
    }

    GraphIndex index = graph.index();
    CallableNames names = new CallableNames();
    Set<String> reached = new HashSet<>();
    List<CompilerException> errorsBuilder = new ArrayList<>();
    List<String> lines = new ArrayList<>(options.preamble());

    int passes = 0;
    for (RootKind kind : RootKind.INIT_KINDS) {
      Optional<Graph.Node> root = index.firstNodeOfType(kind.nodeType());
      if (root.isPresent()) {
        compileRoot(kind, root.get(), index, names, reached, errorsBuilder, lines);
        passes++;
      }
    }

    for (Graph.Node node : index.nodes()) {
      if (!node.isEvent() || RootKind.isInit(node) || reached.contains(node.id())) {
        continue;
      }
      compileRoot(RootKind.EVENT, node, index, names, reached, errorsBuilder, lines);
      passes++;
    }

    output = Joiner.on('\n').join(lines);
    errors = ImmutableList.copyOf(errorsBuilder);
    log.debug("Compiled {} entry points with {} errors", passes, errors.size());
  }

  private void compileRoot(
      RootKind kind,
      Graph.Node root,
      GraphIndex index,
      CallableNames names,
      Set<String> reached,
      List<CompilerException> errorsBuilder,
      List<String> lines) {
    String function =
        names.claim(
            root.data("functionName")
                .filter(Literal::isTruthy)
                .map(Literal::rawText)
                .orElse(kind.defaultFunction(root)));

    CompilationContext ctx = new CompilationContext(index, rules, options, names);
    ctx.markVisited(root.id());

    ImmutableList<String> body;
    ImmutableList<String> callables;
    try {
      body = ctx.capture(1, () -> walkFromRoot(ctx, root));
      callables = new ThreadHoister(ctx).emitAll();
    } catch (CompilerException ex) {
      log.error("Compilation of '{}' aborted: {}", function, ex.getMessage());
      errorsBuilder.add(ex);
      body = ImmutableList.of(options.indentUnit() + "// ERROR: " + ex.getMessage());
      callables = ImmutableList.of();
    }

    if (kind == RootKind.EVENT) {
      lines.add("// Event: " + root.label());
    }
    kind.guard().ifPresent(guard -> lines.add("#if " + guard));
    lines.add(String.format("void function %s()", function));
    lines.add("{");
    lines.addAll(body);
    lines.add("}");
    lines.addAll(callables);
    if (kind.guard().isPresent()) {
      lines.add("#endif");
    }
    lines.add("");

    reached.addAll(ctx.visited());
  }

  private static void walkFromRoot(CompilationContext ctx, Graph.Node root)
      throws CompilerException {
    Optional<Graph.Port> exec = root.firstExecOutput();
    if (exec.isPresent()) {
      ctx.followExec(root, exec.get().id());
    }
  }

  public String output() {
    Preconditions.checkState(output != null, "compile() has not been called");
    return output;
  }

  public ImmutableList<CompilerException> errors() {
    return errors;
  }
}
