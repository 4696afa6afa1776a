package nl.adgroot.docingest.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects stages in registration order and composes them into a {@link Pipeline}.
 *
 * <p>The first registered stage runs first. The chain is folded right-to-left at {@link #build()}
 * time, so stages added after a build do not change pipelines built earlier.
 */
public class PipelineBuilder {

  private final List<Stage> stages = new ArrayList<>();

  public PipelineBuilder use(Stage stage) {
    stages.add(Objects.requireNonNull(stage, "stage"));
    return this;
  }

  public Pipeline build() {
    NextStage chain = NextStage.TERMINAL;
    for (int i = stages.size() - 1; i >= 0; i--) {
      chain = link(stages.get(i), chain);
    }
    return new Pipeline(chain, stages.size());
  }

  private static NextStage link(Stage stage, NextStage next) {
    return state -> stage.process(state, next);
  }
}
