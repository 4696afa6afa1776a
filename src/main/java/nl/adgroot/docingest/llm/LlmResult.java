package nl.adgroot.docingest.llm;

/**
 * Answer of one generate call.
 *
 * @param response the model's text
 * @param evalCount tokens generated
 * @param evalDurationNs time spent generating them
 */
public record LlmResult(String response, int evalCount, long evalDurationNs) {

  public static LlmResult of(String response) {
    return new LlmResult(response, 0, 0);
  }

  public double tokensPerSecond() {
    return evalDurationNs == 0 ? 0 : evalCount / (evalDurationNs / 1_000_000_000.0);
  }
}
