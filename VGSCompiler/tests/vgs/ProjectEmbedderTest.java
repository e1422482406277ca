package vgs;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;

public class ProjectEmbedderTest {

  private static final Instant GENERATED = Instant.parse("2025-03-04T05:06:07Z");

  @Test
  public void fullHeader() {
    ProjectMetadata metadata =
        ProjectMetadata.builder()
            .setName("Fire Sale")
            .setVersion("2.1.0")
            .setAuthor("modder")
            .setDescription("Discounted weapons")
            .build();

    assertThat(ProjectEmbedder.header(metadata, true, GENERATED))
        .isEqualTo(
            "// ========================================\n"
                + "// R5V Mod Studio - Generated Code\n"
                + "// ========================================\n"
                + "// Project: Fire Sale\n"
                + "// Version: 2.1.0\n"
                + "// Author: modder\n"
                + "// Description: Discounted weapons\n"
                + "// Generated: 2025-03-04T05:06:07.000Z\n"
                + "// Editor Version: 0.1.0\n"
                + "// ========================================\n"
                + "//\n"
                + "// WARNING: Do not manually edit the metadata below.\n"
                + "// It is used to restore the visual script in the editor.\n"
                + "//\n\n");
  }

  @Test
  public void minimalHeader() {
    String header = ProjectEmbedder.header(ProjectMetadata.defaults(), false, GENERATED);

    assertThat(header).contains("// Project: Untitled Project\n// Version: 1.0.0\n// Generated:");
    assertThat(header).doesNotContain("Author");
    assertThat(header).doesNotContain("WARNING");
    assertThat(header).endsWith("// ========================================\n\n");
  }

  @Test
  public void embedWrapsAt80Columns() throws CompilerException {
    String json =
        "{\"version\":\"1.0.0\",\"data\":{\"label\":\"" + Strings.repeat("ü", 200) + "\"}}";

    String script = ProjectEmbedder.embed("void function f()\n{\n}\n", json);

    List<String> lines = Splitter.on('\n').splitToList(script);
    int begin = lines.indexOf(ProjectEmbedder.BEGIN_MARKER);
    int end = lines.indexOf(ProjectEmbedder.END_MARKER);
    assertThat(begin).isGreaterThan(0);
    assertThat(end).isGreaterThan(begin + 1);
    for (String line : lines.subList(begin + 1, end)) {
      assertThat(line).startsWith("// ");
      assertThat(line.length()).isAtMost(3 + 80);
    }
    assertThat(lines.get(begin + 1)).hasLength(83);
    assertThat(script).startsWith("void function f()\n{\n}\n\n\n" + ProjectEmbedder.BEGIN_MARKER);
    assertThat(script).endsWith(ProjectEmbedder.END_MARKER + "\n");

    assertThat(ProjectEmbedder.extract(script).get()).isEqualTo(json);
  }

  @Test
  public void generateProducesCompleteScript() throws CompilerException {
    Project project =
        Project.create(ProjectMetadata.defaults(), Graph.empty(), "{\"version\":\"1.0.0\"}");

    String script = ProjectEmbedder.generate(project, "// code", GENERATED);

    assertThat(script).startsWith("// ========================================\n");
    assertThat(script)
        .contains("// It is used to restore the visual script in the editor.\n//\n\n// code\n\n");
    assertThat(ProjectEmbedder.extract(script).get()).isEqualTo("{\"version\":\"1.0.0\"}");
  }

  @Test
  public void extractWithoutBlock() throws CompilerException {
    assertThat(ProjectEmbedder.extract("void function f()\n{\n}\n").isPresent()).isFalse();

    String reversed = ProjectEmbedder.END_MARKER + "\n" + ProjectEmbedder.BEGIN_MARKER;
    assertThat(ProjectEmbedder.extract(reversed).isPresent()).isFalse();
  }

  @Test
  public void extractSkipsEndMarkerBeforeBlock() throws CompilerException {
    String json = "{\"version\":\"1.0.0\"}";
    String code = "// stray\n" + ProjectEmbedder.END_MARKER + "\nvoid function f()";
    String script = ProjectEmbedder.embed(code, json);

    assertThat(ProjectEmbedder.extract(script).get()).isEqualTo(json);
  }

  @Test
  public void extractRejectsCorruptBlock() {
    String script =
        ProjectEmbedder.BEGIN_MARKER + "\n// not*base64!\n" + ProjectEmbedder.END_MARKER + "\n";

    assertThrows(CompilerException.class, () -> ProjectEmbedder.extract(script));
  }
}
