package nl.adgroot.docingest.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import nl.adgroot.docingest.config.AppConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Blocking client for Ollama's {@code /api/generate} endpoint. */
public class OllamaClient {

  private static final MediaType JSON = MediaType.parse("application/json");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient http;
  private final String url;
  private final String model;
  private final double temperature;

  public OllamaClient(AppConfig.OllamaConfig cfg, String model) {
    this(cfg.url(), model, cfg.temperature, Duration.ofSeconds(cfg.timeoutSeconds));
  }

  public OllamaClient(String url, String model, double temperature, Duration timeout) {
    this.url = url;
    this.model = model;
    this.temperature = temperature;
    this.http = new OkHttpClient.Builder()
        .connectTimeout(timeout)
        .readTimeout(timeout)
        .writeTimeout(timeout)
        .callTimeout(timeout)
        .build();
  }

  public LlmResult generate(String prompt) throws IOException {
    return generate(prompt, List.of());
  }

  /** Sends a prompt with optional images (raw bytes, sent base64-encoded) and waits for the answer. */
  public LlmResult generate(String prompt, List<byte[]> images) throws IOException {
    ObjectNode req = MAPPER.createObjectNode();
    req.put("model", model);
    req.put("prompt", prompt);
    req.put("stream", false);
    req.putObject("options").put("temperature", temperature);
    if (!images.isEmpty()) {
      ArrayNode encoded = req.putArray("images");
      for (byte[] image : images) {
        encoded.add(Base64.getEncoder().encodeToString(image));
      }
    }

    Request request = new Request.Builder()
        .url(url)
        .post(RequestBody.create(req.toString(), JSON))
        .build();

    try (Response r = http.newCall(request).execute()) {
      ResponseBody body = r.body();
      String text = body == null ? "" : body.string();
      if (!r.isSuccessful()) {
        throw new IOException("Ollama error: " + r.code() + " " + r.message() + "\n" + text);
      }
      return parse(text);
    }
  }

  static LlmResult parse(String body) throws IOException {
    JsonNode json = MAPPER.readTree(body);
    String response = json.path("response").asText("");
    return new LlmResult(
        response,
        json.path("eval_count").asInt(),
        json.path("eval_duration").asLong()
    );
  }

  public String getUrl() {
    return url;
  }

  public String getModel() {
    return model;
  }
}
