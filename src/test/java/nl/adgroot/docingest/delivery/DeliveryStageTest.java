package nl.adgroot.docingest.delivery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import nl.adgroot.docingest.model.Document;
import nl.adgroot.docingest.model.ProcessedFile;
import nl.adgroot.docingest.pipeline.PipelineState;
import nl.adgroot.docingest.pipeline.RunConfiguration;
import org.junit.jupiter.api.Test;

class DeliveryStageTest {

  private static Document document(String name, String artifact) {
    Document doc = new Document(name, name, Path.of("in", name), Instant.parse("2023-01-15T10:00:00Z"), List.of());
    if (artifact != null) {
      doc.addProcessedFile(ProcessedFile.generated(Path.of(artifact), "", List.of()));
    }
    return doc;
  }

  @Test
  void process_deliversUnderResolvedFragment_andRecordsFiles() throws Exception {
    List<String> keys = new ArrayList<>();
    DeliveryService service = (sources, key) -> {
      keys.add(key);
      return List.of(Path.of("dest", key, sources.get(0).getFileName().toString()));
    };
    RunConfiguration cfg = new RunConfiguration(Path.of("in"), Path.of("out"), "Word", "month", null, ZoneOffset.UTC);
    PipelineState state = new PipelineState(cfg);
    state.setDocuments(List.of(document("Invoices", "out/Invoices.docx"), document("Empty", null)));
    boolean[] continued = {false};

    new DeliveryStage(service).process(state, s -> continued[0] = true);

    assertEquals(List.of("2023-01/Invoices"), keys);
    assertEquals(List.of(Path.of("dest/2023-01/Invoices/Invoices.docx")), state.deliveredFiles());
    assertTrue(continued[0]);
  }

  @Test
  void process_customResolverTakesPrecedence() throws Exception {
    List<String> keys = new ArrayList<>();
    RunConfiguration cfg = new RunConfiguration(Path.of("in"), Path.of("out"), "Word", "month")
        .withCustomResolver(doc -> "custom");
    PipelineState state = new PipelineState(cfg);
    state.setDocuments(List.of(document("Invoices", "out/Invoices.docx")));

    new DeliveryStage((sources, key) -> {
      keys.add(key);
      return List.of();
    }).process(state, s -> { });

    assertEquals(List.of("custom/Invoices"), keys);
  }

  @Test
  void process_deliveryFailure_propagatesAndStopsChain() {
    PipelineState state = new PipelineState(new RunConfiguration(Path.of("in"), Path.of("out"), "Word", "name"));
    state.setDocuments(List.of(document("Invoices", "out/Invoices.docx")));
    boolean[] continued = {false};

    assertThrows(IOException.class, () -> new DeliveryStage((sources, key) -> {
      throw new IOException("disk full");
    }).process(state, s -> continued[0] = true));
    assertFalse(continued[0]);
  }
}
