package vgs;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;

/**
 * Writes the metadata header of a generated script and stores the project document inside the
 * script as a block of base64 comment lines, so that the editor can restore the graph from the
 * script alone.
 */
public final class ProjectEmbedder {
  public static final String BEGIN_MARKER = "// @r5v-project-data-begin";
  public static final String END_MARKER = "// @r5v-project-data-end";

  static final int CHUNK_SIZE = 80;

  private static final String RULE = "// ========================================";

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  private ProjectEmbedder() {}

  // Ends with a blank line.
  public static String header(ProjectMetadata metadata, boolean includeGraph, Instant generated) {
    List<String> lines = new ArrayList<>();
    lines.add(RULE);
    lines.add("// R5V Mod Studio - Generated Code");
    lines.add(RULE);
    lines.add("// Project: " + metadata.name());
    lines.add("// Version: " + metadata.version());
    if (!metadata.author().isEmpty()) {
      lines.add("// Author: " + metadata.author());
    }
    if (!metadata.description().isEmpty()) {
      lines.add("// Description: " + metadata.description());
    }
    lines.add("// Generated: " + TIMESTAMP.format(generated));
    lines.add("// Editor Version: " + metadata.editorVersion());
    lines.add(RULE);

    if (includeGraph) {
      lines.add("//");
      lines.add("// WARNING: Do not manually edit the metadata below.");
      lines.add("// It is used to restore the visual script in the editor.");
      lines.add("//");
    }

    return Joiner.on('\n').join(lines) + "\n\n";
  }

  public static String embed(String code, String documentJson) {
    String encoded = BaseEncoding.base64().encode(documentJson.getBytes(StandardCharsets.UTF_8));

    ImmutableList.Builder<String> lines = ImmutableList.builder();
    lines.add(BEGIN_MARKER);
    for (String chunk : Splitter.fixedLength(CHUNK_SIZE).split(encoded)) {
      lines.add("// " + chunk);
    }
    lines.add(END_MARKER);
    lines.add("");

    return code + "\n\n" + Joiner.on('\n').join(lines.build());
  }

  public static String generate(Project project, String code, Instant generated) {
    return embed(header(project.metadata(), true, generated) + code, project.documentJson());
  }

  public static Optional<String> extract(String code) throws CompilerException {
    int begin = code.indexOf(BEGIN_MARKER);
    int end = begin == -1 ? -1 : code.indexOf(END_MARKER, begin);
    if (end == -1) {
      return Optional.empty();
    }

    StringBuilder encoded = new StringBuilder();
    for (String line : LINE_SPLITTER.split(code.substring(begin + BEGIN_MARKER.length(), end))) {
      String trimmed = CharMatcher.whitespace().trimFrom(line);
      if (trimmed.startsWith("//")) {
        encoded.append(CharMatcher.whitespace().trimFrom(trimmed.substring(2)));
      }
    }

    try {
      byte[] decoded = BaseEncoding.base64().decode(encoded);
      return Optional.of(new String(decoded, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException ex) {
      throw new CompilerException("embedded project data is not valid base64", ex);
    }
  }
}
