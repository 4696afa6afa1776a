package nl.adgroot.docingest.pipeline;

import java.io.IOException;

/** Continuation handed to a {@link Stage}: runs the rest of the chain. */
@FunctionalInterface
public interface NextStage {

  NextStage TERMINAL = state -> { };

  void invoke(PipelineState state) throws IOException;
}
