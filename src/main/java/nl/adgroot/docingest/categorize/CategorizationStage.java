package nl.adgroot.docingest.categorize;

import java.io.IOException;

import nl.adgroot.docingest.model.Categorization;
import nl.adgroot.docingest.model.Document;
import nl.adgroot.docingest.model.ProcessedFile;
import nl.adgroot.docingest.pipeline.NextStage;
import nl.adgroot.docingest.pipeline.PipelineState;
import nl.adgroot.docingest.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Categorizes every generated artifact. The document takes the categorization of its first
 * artifact that got a category, or an empty one.
 */
public class CategorizationStage implements Stage {

  private static final Logger log = LoggerFactory.getLogger(CategorizationStage.class);

  private final Categorizer categorizer;

  public CategorizationStage(Categorizer categorizer) {
    this.categorizer = categorizer;
  }

  @Override
  public void process(PipelineState state, NextStage next) throws IOException {
    for (Document document : state.documents()) {
      Categorization documentCategory = null;

      for (ProcessedFile file : document.getProcessedFiles()) {
        if (file.isPassThrough() || file.getContent().isBlank()) {
          continue;
        }
        Categorization result = categorize(file.getContent());
        file.setCategorization(result);
        if (documentCategory == null && result.hasCategory()) {
          documentCategory = result;
        }
      }

      document.setCategorization(documentCategory == null ? Categorization.empty() : documentCategory);
      log.info("Categorized {} as '{}'", document.getName(), document.getCategorization().get().category());
    }
    next.invoke(state);
  }

  private Categorization categorize(String text) {
    try {
      Categorization result = categorizer.categorize(text);
      return result == null ? Categorization.empty() : result;
    } catch (RuntimeException e) {
      log.warn("Categorizer failed, leaving artifact uncategorized: {}", e.toString());
      return Categorization.empty();
    }
  }
}
