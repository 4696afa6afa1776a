package nl.adgroot.docingest.categorize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import nl.adgroot.docingest.llm.OllamaClient;
import nl.adgroot.docingest.model.Categorization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks an Ollama model to categorize a document and parses its JSON answer.
 * Any transport or parse failure degrades to {@link Categorization#empty()}.
 */
public class OllamaCategorizer implements Categorizer {

  private static final Logger log = LoggerFactory.getLogger(OllamaCategorizer.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  // keeps prompts bounded for very long scans
  static final int MAX_TEXT_CHARS = 8000;

  static final String PROMPT = """
      Categorize the following document.
      Answer with JSON only, no prose, in exactly this shape:
      {"category": "<one or two words, e.g. Invoice, Receipt, Contract>", "tags": ["..."], "insights": ["..."]}

      Document:
      %s""";

  private final OllamaClient client;

  public OllamaCategorizer(OllamaClient client) {
    this.client = client;
  }

  @Override
  public Categorization categorize(String text) {
    String input = text.length() > MAX_TEXT_CHARS ? text.substring(0, MAX_TEXT_CHARS) : text;
    String answer;
    try {
      answer = client.generate(String.format(PROMPT, input)).response();
    } catch (IOException e) {
      log.warn("Categorization request failed: {}", e.getMessage());
      return Categorization.empty();
    }
    return parse(answer);
  }

  /** Parses a model answer; anything that is not the expected JSON object gives an empty result. */
  static Categorization parse(String answer) {
    if (answer == null || answer.isBlank()) {
      log.warn("Empty categorization response");
      return Categorization.empty();
    }
    try {
      JsonNode json = MAPPER.readTree(stripCodeFence(answer));
      if (json == null || !json.isObject()) {
        log.warn("Categorization response is not a JSON object: {}", answer);
        return Categorization.empty();
      }
      return new Categorization(
          json.path("category").asText(""),
          strings(json.path("tags")),
          strings(json.path("insights"))
      );
    } catch (JsonProcessingException e) {
      log.warn("Could not parse categorization response: {}", e.getOriginalMessage());
      return Categorization.empty();
    }
  }

  private static List<String> strings(JsonNode node) {
    List<String> out = new ArrayList<>();
    if (node.isArray()) {
      for (JsonNode item : node) {
        String s = item.asText("").trim();
        if (!s.isEmpty()) out.add(s);
      }
    } else if (node.isTextual() && !node.asText().isBlank()) {
      out.add(node.asText().trim());
    }
    return out;
  }

  private static String stripCodeFence(String answer) {
    String s = answer.trim();
    if (s.startsWith("```")) {
      int firstNewline = s.indexOf('\n');
      s = firstNewline < 0 ? "" : s.substring(firstNewline + 1);
      if (s.endsWith("```")) {
        s = s.substring(0, s.length() - 3);
      }
    }
    return s.trim();
  }
}
