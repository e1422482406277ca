package vgs;

import java.util.Optional;

// Value nodes only run when pulled.
final class ValueRules {

  static void register(StatementEmitter.Builder builder) {
    // Constants
    builder.register(
        NodeRule.constant(
            node -> Literal.quote(truthy(node, "value").map(Literal::rawText).orElse(""))),
        "const-string",
        "string");
    builder.register(
        NodeRule.constant(node -> number(node, "value")),
        "const-int",
        "const-float",
        "int",
        "float");
    builder.register(
        NodeRule.constant(node -> truthy(node, "value").isPresent() ? "true" : "false"),
        "const-bool",
        "bool");
    builder.register(
        "const-vector",
        NodeRule.constant(
            node ->
                String.format(
                    "Vector(%s, %s, %s)",
                    number(node, "x"), number(node, "y"), number(node, "z"))));
    builder.register(
        "const-asset",
        NodeRule.constant(node -> truthy(node, "value").map(Literal::rawText).orElse("$\"\"")));
    builder.register(
        "function-ref",
        NodeRule.constant(
            node -> truthy(node, "functionName").map(Literal::rawText).orElse("MyFunction")));
    builder.register(
        "reroute",
        (ctx, node) -> ctx.define(node, "output_0", ctx.valueOf(node, "input_0")));

    // Vectors
    builder.register(
        "vector-create",
        NodeRule.local("vec", "Vector(%s, %s, %s)", "input_0", "input_1", "input_2"));
    builder.register("vector-add", NodeRule.local("vec", "%s + %s", "input_0", "input_1"));
    builder.register(
        "vector-normalize", NodeRule.local("normalized", "Normalize(%s)", "input_0"));

    // Math
    builder.register("math-add", NodeRule.local("result", "%s + %s", "input_0", "input_1"));
    builder.register("math-multiply", NodeRule.local("result", "%s * %s", "input_0", "input_1"));
    builder.register(
        "math-random-float",
        NodeRule.local("rand", "RandomFloatRange(%s, %s)", "input_0", "input_1"));

    // Arrays
    builder.register("array-create", NodeRule.local("arr", "[]"));
    builder.register("array-get", NodeRule.local("elem", "%s[%s]", "input_0", "input_1"));
    builder.register("array-length", NodeRule.local("len", "%s.len()", "input_0"));
    builder.register("array-append", ValueRules::arrayAppend);

    // Comparisons
    builder.register("compare-equal", NodeRule.inline("(%s == %s)", "input_0", "input_1"));
    builder.register("compare-greater", NodeRule.inline("(%s > %s)", "input_0", "input_1"));
    builder.register("compare-less", NodeRule.inline("(%s < %s)", "input_0", "input_1"));
  }

  // Exec node: appends, passes the array through on output_1 and continues through output_0.
  private static void arrayAppend(CompilationContext ctx, Graph.Node node)
      throws CompilerException {
    String array = ctx.valueOf(node, "input_1");
    String element = ctx.valueOf(node, "input_2");
    ctx.line("%s.append(%s)", array, element);
    ctx.define(node, "output_1", array);
    ctx.followExec(node, "output_0");
  }

  private static Optional<Literal> truthy(Graph.Node node, String key) {
    return node.data(key).filter(Literal::isTruthy);
  }

  private static String number(Graph.Node node, String key) {
    return node.data(key).filter(value -> !value.isNull()).map(Literal::rawText).orElse("0");
  }

  private ValueRules() {}
}
