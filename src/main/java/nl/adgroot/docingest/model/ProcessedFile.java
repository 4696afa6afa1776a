package nl.adgroot.docingest.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * An artifact produced for a {@link Document}: either a generated file or an original file passed
 * through unchanged.
 */
public class ProcessedFile {

  private final Path path;
  private final String content;
  private final List<SourceFile> sources;
  private final boolean passThrough;

  private Categorization categorization = Categorization.empty();
  private final List<String> extraTags = new ArrayList<>();

  private ProcessedFile(Path path, String content, List<SourceFile> sources, boolean passThrough) {
    this.path = Objects.requireNonNull(path, "path");
    this.content = content == null ? "" : content;
    this.sources = List.copyOf(sources);
    this.passThrough = passThrough;
  }

  public static ProcessedFile generated(Path artifact, String content, List<SourceFile> sources) {
    return new ProcessedFile(artifact, content, sources, false);
  }

  public static ProcessedFile passThrough(SourceFile file) {
    return new ProcessedFile(file.path(), "", List.of(file), true);
  }

  public Path getPath() {
    return path;
  }

  /** Text the artifact was generated from; empty for pass-through files. */
  public String getContent() {
    return content;
  }

  public List<SourceFile> getSources() {
    return sources;
  }

  public boolean isPassThrough() {
    return passThrough;
  }

  public Categorization getCategorization() {
    return categorization;
  }

  public void setCategorization(Categorization categorization) {
    this.categorization = categorization == null ? Categorization.empty() : categorization;
  }

  public String getCategory() {
    return categorization.category();
  }

  /** Tags from categorization followed by tags added by later stages. */
  public List<String> getTags() {
    List<String> all = new ArrayList<>(categorization.tags());
    all.addAll(extraTags);
    return Collections.unmodifiableList(all);
  }

  public void addTag(String tag) {
    if (tag == null || tag.isBlank() || getTags().contains(tag)) {
      return;
    }
    extraTags.add(tag);
  }

  public List<String> getInsights() {
    return categorization.insights();
  }

  @NotNull
  @Override
  public String toString() {
    return path.getFileName() + (passThrough ? " (pass-through)" : "");
  }
}
