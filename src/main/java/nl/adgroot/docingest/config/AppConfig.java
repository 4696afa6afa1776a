package nl.adgroot.docingest.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public PipelineConfig pipeline = new PipelineConfig();
  public OllamaConfig ollama = new OllamaConfig();
  public CategorizationConfig categorization = new CategorizationConfig();
  public DateParsingConfig dateParsing = new DateParsingConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class PipelineConfig {
    // one subdirectory per document
    public String inputRoot = "input";

    // generated artifacts land here before delivery
    public String outputDirectory = "temp";

    public String destinationRoot = "output";

    // Word, PDF or Text
    public String outputFormat = "Word";

    // date, year, month, name or type
    public String organizationCriteria = "month";

    // zone for directory timestamps; empty means system default
    public String zone = "";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class OllamaConfig {
    public String host = "127.0.0.1";
    public int port = 11434;
    public String generatePath = "/api/generate";

    // used for categorization
    public String textModel = "llama3.1:8b";

    // must accept images, used for OCR
    public String visionModel = "llama3.2-vision";

    public double temperature = 0.1;
    public int timeoutSeconds = 300;

    public String url() {
      return "http://" + host + ":" + port + generatePath;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CategorizationConfig {
    public boolean enabled = false;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class DateParsingConfig {
    public boolean enabled = true;
  }
}
