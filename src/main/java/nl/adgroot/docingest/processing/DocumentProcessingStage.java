package nl.adgroot.docingest.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import nl.adgroot.docingest.generate.DefaultDocumentGenerator;
import nl.adgroot.docingest.generate.DocumentGenerator;
import nl.adgroot.docingest.generate.OutputFormat;
import nl.adgroot.docingest.model.Document;
import nl.adgroot.docingest.model.ProcessedFile;
import nl.adgroot.docingest.model.SourceFile;
import nl.adgroot.docingest.ocr.OcrService;
import nl.adgroot.docingest.pipeline.NextStage;
import nl.adgroot.docingest.pipeline.PipelineState;
import nl.adgroot.docingest.pipeline.RunConfiguration;
import nl.adgroot.docingest.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the artifacts of every document.
 *
 * <p>Image groups are stacked into one bitmap and sent through OCR once; document groups have
 * their text extracted and joined with page-break markers. Each group is then rendered by the
 * {@link DocumentGenerator} into {@code <outputDirectory>/<documentName>/}. Files of any other type
 * are passed through unchanged; generated names skip any name a pass-through file already uses.
 *
 * <p>A group whose files cannot be decoded or read is skipped with a warning. OCR and generation
 * failures abort the run.
 */
public class DocumentProcessingStage implements Stage {

  private static final Logger log = LoggerFactory.getLogger(DocumentProcessingStage.class);

  private final OcrService ocrService;
  private final DocumentGenerator generator;
  private final FileGrouper grouper;
  private final ImageCombiner imageCombiner;
  private final DocumentTextExtractor textExtractor;

  public DocumentProcessingStage(OcrService ocrService, DocumentGenerator generator) {
    this(ocrService, generator, new FileGrouper(), new ImageCombiner(), new DocumentTextExtractor());
  }

  public DocumentProcessingStage(
      OcrService ocrService,
      DocumentGenerator generator,
      FileGrouper grouper,
      ImageCombiner imageCombiner,
      DocumentTextExtractor textExtractor
  ) {
    this.ocrService = ocrService;
    this.generator = generator;
    this.grouper = grouper;
    this.imageCombiner = imageCombiner;
    this.textExtractor = textExtractor;
  }

  @Override
  public void process(PipelineState state, NextStage next) throws IOException {
    if (!state.hasDocuments()) {
      log.warn("No documents found in state");
      next.invoke(state);
      return;
    }

    RunConfiguration cfg = state.configuration();
    // fail on a bad selector before any OCR time is spent
    OutputFormat.parse(cfg.outputFormat());
    Files.createDirectories(cfg.outputDirectory());

    log.info("Starting document processing");
    List<Document> documents = state.documents();
    ProgressTracker tracker = new ProgressTracker(documents.size());
    Set<String> usedDirs = new HashSet<>();

    for (Document document : documents) {
      long start = System.nanoTime();
      Path documentDir = cfg.outputDirectory().resolve(documentDirName(document, usedDirs));
      List<Path> artifacts = processDocument(document, cfg, documentDir);
      artifacts.forEach(state::addGeneratedArtifact);

      tracker.finishDocument(document.getProcessedFiles().size());
      log.info(tracker.formatStatus(document.getName(), (System.nanoTime() - start) / 1_000_000));
    }

    log.info("Document processing completed");
    next.invoke(state);
  }

  /** Sanitized document name, suffixed with {@code _2}, {@code _3}, ... when another document already took it. */
  static String documentDirName(Document document, Set<String> usedDirs) {
    String base = DefaultDocumentGenerator.safeFileName(document.getName());
    String candidate = base;
    for (int n = 2; !usedDirs.add(candidate.toLowerCase(Locale.ROOT)); n++) {
      candidate = base + "_" + n;
    }
    return candidate;
  }

  /** Processes one document into {@code documentDir} and returns the paths of the artifacts it generated. */
  List<Path> processDocument(Document document, RunConfiguration cfg, Path documentDir) throws IOException {
    FileGrouper.Partition partition = grouper.partition(document.getFiles());
    if (partition.groups().isEmpty() && partition.passThrough().isEmpty()) {
      log.info("No processable files in document {}", document.getName());
      return List.of();
    }

    log.info("Processing document {} with {} groups", document.getName(), partition.groups().size());

    OutputFormat format = OutputFormat.parse(cfg.outputFormat());
    Set<String> taken = new HashSet<>();
    for (SourceFile file : partition.passThrough()) {
      taken.add(file.name().toLowerCase(Locale.ROOT));
    }

    List<Path> generated = new ArrayList<>();
    List<String> texts = new ArrayList<>();
    int counter = 1;

    for (FileGroup group : partition.groups()) {
      String text = groupText(document, group);
      if (text == null) {
        continue;
      }

      String artifactName;
      do {
        artifactName = counter == 1 ? document.getName() : document.getName() + "_" + counter;
        counter++;
      } while (clashes(artifactName, format, taken));

      Files.createDirectories(documentDir);
      Path artifact = generator.generate(text, artifactName, cfg.outputFormat(), documentDir);
      taken.add(artifact.getFileName().toString().toLowerCase(Locale.ROOT));

      document.addProcessedFile(ProcessedFile.generated(artifact, text, group.members()));
      generated.add(artifact);
      texts.add(text);
    }

    for (SourceFile file : partition.passThrough()) {
      document.addProcessedFile(ProcessedFile.passThrough(file));
    }

    if (!texts.isEmpty()) {
      document.setContent(String.join(DocumentTextExtractor.PAGE_BREAK, texts));
    }
    return generated;
  }

  /** True if an artifact named {@code name} could land on a file name already used by this document. */
  static boolean clashes(String name, OutputFormat format, Set<String> taken) {
    String base = DefaultDocumentGenerator.safeFileName(name).toLowerCase(Locale.ROOT);
    // PDF may fall back to .txt
    return taken.contains(base + "." + format.extension())
        || taken.contains(base + "." + OutputFormat.TEXT.extension());
  }

  /** Text of one group, or null when its files could not be read. */
  private String groupText(Document document, FileGroup group) throws IOException {
    byte[] combined;
    try {
      if (group.kind() == FileKind.DOCUMENT) {
        return textExtractor.extractGroup(group.members());
      }
      ImageCombiner.CombinedImage image = imageCombiner.combine(group.members().stream().map(SourceFile::path).toList());
      log.debug("Combined {} pages of group '{}' into {}x{}", image.pages(), group.key(), image.width(), image.height());
      combined = image.png();
    } catch (IOException e) {
      log.warn("Skipping group '{}' of document {}: {}", group.key(), document.getName(), e.getMessage());
      return null;
    }
    return ocrService.extractText(combined);
  }
}
