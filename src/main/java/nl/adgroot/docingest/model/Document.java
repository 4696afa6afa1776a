package nl.adgroot.docingest.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

/**
 * One logical document: a directory of source files and the artifacts produced from them.
 * Created by traversal and mutated in place by every later stage.
 */
public class Document {

  private final String id;
  private final String name;
  private final Path directory;
  private final Instant createdAt;
  private final List<SourceFile> files;
  private final List<ProcessedFile> processedFiles = new ArrayList<>();

  private String content;
  private Categorization categorization;

  public Document(String id, String name, Path directory, Instant createdAt, List<SourceFile> files) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = Objects.requireNonNull(name, "name");
    this.directory = directory;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    this.files = List.copyOf(files);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public Path getDirectory() {
    return directory;
  }

  /** Creation time of the source directory. */
  public Instant getCreatedAt() {
    return createdAt;
  }

  public List<SourceFile> getFiles() {
    return files;
  }

  public List<ProcessedFile> getProcessedFiles() {
    return Collections.unmodifiableList(processedFiles);
  }

  public void addProcessedFile(ProcessedFile processedFile) {
    processedFiles.add(Objects.requireNonNull(processedFile, "processedFile"));
  }

  public Optional<String> getContent() {
    return Optional.ofNullable(content);
  }

  public void setContent(String content) {
    this.content = content;
  }

  public Optional<Categorization> getCategorization() {
    return Optional.ofNullable(categorization);
  }

  public void setCategorization(Categorization categorization) {
    this.categorization = categorization;
  }

  @NotNull
  @Override
  public String toString() {
    return name + " (files=" + files.size() + ", processed=" + processedFiles.size() + ")";
  }
}
