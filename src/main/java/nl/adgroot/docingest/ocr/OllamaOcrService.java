package nl.adgroot.docingest.ocr;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

import nl.adgroot.docingest.llm.LlmResult;
import nl.adgroot.docingest.llm.OllamaClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OCR through a vision model served by Ollama. */
public class OllamaOcrService implements OcrService {

  private static final Logger log = LoggerFactory.getLogger(OllamaOcrService.class);

  static final String PROMPT = """
      Transcribe all text visible in this image exactly as written.
      Keep the reading order and line breaks. Do not summarize, translate or add commentary.
      If the image contains no text, answer with an empty response.""";

  private final OllamaClient client;

  public OllamaOcrService(OllamaClient client) {
    this.client = client;
  }

  @Override
  public String extractText(byte[] imageBytes) throws IOException {
    long start = System.nanoTime();
    LlmResult result = client.generate(PROMPT, List.of(imageBytes));
    log.debug("OCR of {} KB with {} took {} ms ({} tok/s)",
        imageBytes.length / 1024, client.getModel(), (System.nanoTime() - start) / 1_000_000,
        String.format(Locale.ROOT, "%.1f", result.tokensPerSecond()));
    return result.response().strip();
  }
}
