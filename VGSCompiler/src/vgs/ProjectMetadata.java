package vgs;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class ProjectMetadata {
  public static final String DEFAULT_NAME = "Untitled Project";
  public static final String DEFAULT_VERSION = "1.0.0";
  public static final String DEFAULT_EDITOR_VERSION = "0.1.0";

  public abstract String name();

  public abstract String version();

  public abstract String author();

  public abstract String description();

  public abstract String editorVersion();

  public static ProjectMetadata defaults() {
    return builder().build();
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_ProjectMetadata.Builder()
        .setName(DEFAULT_NAME)
        .setVersion(DEFAULT_VERSION)
        .setAuthor("")
        .setDescription("")
        .setEditorVersion(DEFAULT_EDITOR_VERSION);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setVersion(String version);

    public abstract Builder setAuthor(String author);

    public abstract Builder setDescription(String description);

    public abstract Builder setEditorVersion(String editorVersion);

    public abstract ProjectMetadata build();
  }
}
