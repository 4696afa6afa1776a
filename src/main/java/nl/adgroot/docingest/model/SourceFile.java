package nl.adgroot.docingest.model;

import java.nio.file.Path;
import java.time.Instant;

/** A file discovered inside a document directory. */
public record SourceFile(String name, Path path, Instant lastModified) {

  public String extension() {
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(java.util.Locale.ROOT);
  }
}
