package nl.adgroot.docingest.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import nl.adgroot.docingest.model.Document;

/**
 * Mutable state shared by the stages of one pipeline run.
 *
 * <p>Holds the run configuration, the results produced by the built-in stages and an
 * {@link #attributes()} map for custom stages. Not thread-safe; one instance per run.
 */
public class PipelineState {

  private final RunConfiguration configuration;
  private final Map<String, Object> attributes = new HashMap<>();

  private List<Document> documents;
  private final List<Path> generatedArtifacts = new ArrayList<>();
  private final List<Path> deliveredFiles = new ArrayList<>();

  public PipelineState(RunConfiguration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  public RunConfiguration configuration() {
    return configuration;
  }

  /** Documents discovered by traversal; empty until a traversal stage ran. */
  public List<Document> documents() {
    return documents == null ? List.of() : Collections.unmodifiableList(documents);
  }

  public boolean hasDocuments() {
    return documents != null;
  }

  public void setDocuments(List<Document> documents) {
    this.documents = new ArrayList<>(Objects.requireNonNull(documents, "documents"));
  }

  public List<Path> generatedArtifacts() {
    return Collections.unmodifiableList(generatedArtifacts);
  }

  public void addGeneratedArtifact(Path artifact) {
    generatedArtifacts.add(artifact);
  }

  public List<Path> deliveredFiles() {
    return Collections.unmodifiableList(deliveredFiles);
  }

  public void addDeliveredFiles(List<Path> files) {
    deliveredFiles.addAll(files);
  }

  /** Free-form values for custom stages. Built-in stages never read or write this map. */
  public Map<String, Object> attributes() {
    return attributes;
  }

  public <T> Optional<T> attribute(String key, Class<T> type) {
    Object value = attributes.get(key);
    return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
  }
}
