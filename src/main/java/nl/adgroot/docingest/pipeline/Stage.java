package nl.adgroot.docingest.pipeline;

import java.io.IOException;

/**
 * One unit of work in a {@link Pipeline}.
 *
 * <p>A stage reads and mutates the {@link PipelineState} and calls {@code next.invoke(state)} to hand
 * control to the remaining stages. Returning without calling {@code next} skips everything after it.
 */
@FunctionalInterface
public interface Stage {

  void process(PipelineState state, NextStage next) throws IOException;
}
