package nl.adgroot.docingest;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneId;

import nl.adgroot.docingest.categorize.CategorizationStage;
import nl.adgroot.docingest.categorize.OllamaCategorizer;
import nl.adgroot.docingest.config.AppConfig;
import nl.adgroot.docingest.config.ConfigLoader;
import nl.adgroot.docingest.delivery.DeliveryStage;
import nl.adgroot.docingest.delivery.FolderDeliveryService;
import nl.adgroot.docingest.generate.DefaultDocumentGenerator;
import nl.adgroot.docingest.llm.OllamaClient;
import nl.adgroot.docingest.model.Document;
import nl.adgroot.docingest.ocr.OllamaOcrService;
import nl.adgroot.docingest.organize.DateParsingStage;
import nl.adgroot.docingest.pipeline.LoggingStage;
import nl.adgroot.docingest.pipeline.Pipeline;
import nl.adgroot.docingest.pipeline.PipelineBuilder;
import nl.adgroot.docingest.pipeline.PipelineState;
import nl.adgroot.docingest.pipeline.RunConfiguration;
import nl.adgroot.docingest.processing.DocumentProcessingStage;
import nl.adgroot.docingest.traversal.DocumentTraversalStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point. Usage: {@code Main [config.json]}; without an argument the
 * {@code config.json} on the classpath (or built-in defaults) is used.
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) {
    AppConfig cfg = args.length > 0
        ? ConfigLoader.load(Path.of(args[0]))
        : ConfigLoader.loadFromClasspath("config.json");

    PipelineState state = new PipelineState(runConfiguration(cfg));
    try {
      buildPipeline(cfg).execute(state);
    } catch (IOException | RuntimeException e) {
      log.error("Pipeline failed", e);
      System.exit(1);
    }

    System.out.println("Found " + state.documents().size() + " documents");
    for (Document doc : state.documents()) {
      System.out.println("Document: " + doc.getName()
          + ", Files: " + doc.getFiles().size()
          + ", Processed: " + doc.getProcessedFiles().size());
    }
    System.out.println("Delivered " + state.deliveredFiles().size() + " files. Processing complete.");
  }

  static RunConfiguration runConfiguration(AppConfig cfg) {
    AppConfig.PipelineConfig p = cfg.pipeline;
    ZoneId zone = p.zone == null || p.zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(p.zone);
    return new RunConfiguration(
        Path.of(p.inputRoot),
        Path.of(p.outputDirectory),
        p.outputFormat,
        p.organizationCriteria,
        null,
        zone
    );
  }

  static Pipeline buildPipeline(AppConfig cfg) {
    PipelineBuilder builder = new PipelineBuilder()
        .use(new LoggingStage())
        .use(new DocumentTraversalStage())
        .use(new DocumentProcessingStage(
            new OllamaOcrService(new OllamaClient(cfg.ollama, cfg.ollama.visionModel)),
            new DefaultDocumentGenerator()));

    if (cfg.categorization.enabled) {
      builder.use(new CategorizationStage(
          new OllamaCategorizer(new OllamaClient(cfg.ollama, cfg.ollama.textModel))));
    }
    if (cfg.dateParsing.enabled) {
      builder.use(new DateParsingStage());
    }

    return builder
        .use(new DeliveryStage(new FolderDeliveryService(Path.of(cfg.pipeline.destinationRoot))))
        .build();
  }
}
