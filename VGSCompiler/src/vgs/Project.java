package vgs;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Project {
  public abstract ProjectMetadata metadata();

  public abstract Graph graph();

  // Serialized-project form; this is what gets embedded into scripts.
  public abstract String documentJson();

  public static Project create(ProjectMetadata metadata, Graph graph, String documentJson) {
    return new AutoValue_Project(metadata, graph, documentJson);
  }
}
