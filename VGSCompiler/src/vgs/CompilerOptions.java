package vgs;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ForOverride;

@AutoValue
public abstract class CompilerOptions {

  public static final ImmutableList<String> DEFAULT_PREAMBLE =
      ImmutableList.of(
          "// Generated by R5V Mod Studio Visual Scripting",
          "// https://github.com/r5valkyrie/r5v_mod_studio",
          "",
          "global function CodeCallback_ModInit",
          "");

  public static final ImmutableList<String> DEFAULT_EMPTY_GRAPH_PLACEHOLDER =
      ImmutableList.of(
          "// No nodes in the visual script", "// Add nodes from the palette to get started");

  private static final CompilerOptions DEFAULTS = builder().build();

  public abstract ImmutableList<String> preamble();

  public abstract ImmutableList<String> emptyGraphPlaceholder();

  public abstract String indentUnit();

  public static CompilerOptions defaults() {
    return DEFAULTS;
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setPreamble(DEFAULT_PREAMBLE)
        .setEmptyGraphPlaceholder(DEFAULT_EMPTY_GRAPH_PLACEHOLDER)
        .setIndentUnit("    ");
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPreamble(Iterable<String> preamble);

    public abstract Builder setEmptyGraphPlaceholder(Iterable<String> placeholder);

    public abstract Builder setIndentUnit(String indentUnit);

    @ForOverride
    abstract CompilerOptions autoBuild();

    public final CompilerOptions build() {
      CompilerOptions options = autoBuild();
      Preconditions.checkArgument(
          !options.indentUnit().isEmpty()
              && CharMatcher.whitespace().matchesAllOf(options.indentUnit()),
          "indent unit must be non-empty whitespace: '%s'",
          options.indentUnit());
      return options;
    }
  }
}
