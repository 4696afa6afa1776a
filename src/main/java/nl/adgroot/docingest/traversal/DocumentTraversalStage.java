package nl.adgroot.docingest.traversal;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import nl.adgroot.docingest.model.Document;
import nl.adgroot.docingest.model.SourceFile;
import nl.adgroot.docingest.pipeline.NextStage;
import nl.adgroot.docingest.pipeline.PipelineState;
import nl.adgroot.docingest.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns every immediate subdirectory of the input root into a {@link Document}.
 *
 * <p>Discovery is single-level: only regular files directly inside a document directory are
 * listed; nested directories and hidden files are ignored. Files are ordered by last-modified time,
 * ties broken by name. Document directories are visited in name order.
 */
public class DocumentTraversalStage implements Stage {

  private static final Logger log = LoggerFactory.getLogger(DocumentTraversalStage.class);

  static final Comparator<SourceFile> DISCOVERY_ORDER =
      Comparator.comparing(SourceFile::lastModified).thenComparing(SourceFile::name);

  @Override
  public void process(PipelineState state, NextStage next) throws IOException {
    Path root = state.configuration().inputRoot();
    log.info("Traversing input root {}", root);

    state.setDocuments(traverse(root));
    log.info("Found {} documents", state.documents().size());

    next.invoke(state);
  }

  public List<Document> traverse(Path root) throws IOException {
    if (!Files.isDirectory(root)) {
      throw new IllegalStateException("Input root is not a directory: " + root);
    }

    List<Path> directories;
    try (Stream<Path> children = Files.list(root)) {
      directories = children
          .filter(p -> Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .toList();
    }

    List<Document> documents = new ArrayList<>(directories.size());
    for (Path dir : directories) {
      try {
        List<SourceFile> files = listFiles(dir);
        if (files.isEmpty()) {
          log.info("Skipping {}: no files", dir.getFileName());
          continue;
        }
        documents.add(toDocument(dir, files));
      } catch (IOException e) {
        log.warn("Skipping unreadable directory {}: {}", dir, e.toString());
      }
    }
    return documents;
  }

  static List<SourceFile> listFiles(Path dir) throws IOException {
    List<SourceFile> files = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        BasicFileAttributes attrs;
        try {
          attrs = Files.readAttributes(entry, BasicFileAttributes.class);
        } catch (IOException e) {
          // e.g. a dangling symlink; its siblings are still listed
          log.warn("Skipping unreadable entry {}: {}", entry, e.toString());
          continue;
        }
        if (attrs.isDirectory()) {
          log.debug("Ignoring nested directory {}", entry);
          continue;
        }
        if (!attrs.isRegularFile() || name.startsWith(".")) {
          continue;
        }
        files.add(new SourceFile(name, entry.toAbsolutePath(), attrs.lastModifiedTime().toInstant()));
      }
    }
    files.sort(DISCOVERY_ORDER);
    return files;
  }

  private static Document toDocument(Path dir, List<SourceFile> files) throws IOException {
    Path absolute = dir.toAbsolutePath().normalize();
    BasicFileAttributes attrs = Files.readAttributes(absolute, BasicFileAttributes.class);
    String name = absolute.getFileName().toString();
    return new Document(absolute.toString(), name, absolute, attrs.creationTime().toInstant(), files);
  }
}
