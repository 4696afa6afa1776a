package nl.adgroot.docingest.pipeline;

import java.io.IOException;
import java.util.Objects;

/**
 * An immutable, composed chain of stages. Build one with {@link PipelineBuilder}.
 *
 * <p>The same pipeline may be executed any number of times, each time with its own
 * {@link PipelineState}. Exceptions thrown by a stage abort the remaining stages and are rethrown
 * from {@link #execute(PipelineState)}.
 */
public final class Pipeline {

  private final NextStage entry;
  private final int size;

  Pipeline(NextStage entry, int size) {
    this.entry = entry;
    this.size = size;
  }

  public void execute(PipelineState state) throws IOException {
    entry.invoke(Objects.requireNonNull(state, "state"));
  }

  /** Number of stages in this chain. */
  public int size() {
    return size;
  }
}
