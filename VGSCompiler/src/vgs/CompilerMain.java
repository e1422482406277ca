package vgs;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class CompilerMain {

  private static final String EXTRACT_FLAG = "--extract";

  public static void main(String[] args) throws IOException {
    if (args.length == 3 && args[0].equals(EXTRACT_FLAG)) {
      System.exit(extract(new File(args[1]), new File(args[2])));
    }
    if (args.length != 2) {
      System.err.println("Usage: $COMPILER project_file output_file");
      System.err.println("       $COMPILER --extract script_file project_file");
      System.exit(1);
    }

    System.exit(compile(new File(args[0]), new File(args[1])));
  }

  static int compile(File projectFile, File outputFile) throws IOException {
    Project project;
    try {
      project = GraphReader.read(projectFile);
    } catch (CompilerException ex) {
      ex.print();
      System.out.println("Compilation failed.  See errors above.");
      return 1;
    }

    ImmutableList<CompilerException> warnings = new GraphValidator(project.graph()).validate();
    warnings.forEach(CompilerException::printWarning);

    Compiler compiler = new Compiler(project.graph());
    compiler.compile();
    if (!compiler.errors().isEmpty()) {
      compiler.errors().forEach(CompilerException::print);
      System.out.println("Compilation failed.  See errors above.");
      return 1;
    }

    write(ProjectEmbedder.generate(project, compiler.output(), Instant.now()), outputFile);
    System.out.println("Compilation succeeded!");
    return 0;
  }

  static int extract(File scriptFile, File projectFile) throws IOException {
    Optional<String> document;
    try {
      document = ProjectEmbedder.extract(read(scriptFile));
      if (document.isPresent()) {
        // Fail on a document the reader would not accept.
        GraphReader.read(document.get());
      }
    } catch (CompilerException ex) {
      ex.print();
      return 1;
    }

    if (!document.isPresent()) {
      System.out.println("No embedded project found in " + scriptFile);
      return 1;
    }

    write(document.get(), projectFile);
    System.out.println("Project extracted to " + projectFile);
    return 0;
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
