package nl.adgroot.docingest.pipeline;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs around the remainder of the chain. */
public class LoggingStage implements Stage {

  private static final Logger log = LoggerFactory.getLogger(LoggingStage.class);

  @Override
  public void process(PipelineState state, NextStage next) throws IOException {
    log.info("Before processing {}", state.configuration().inputRoot());
    long start = System.nanoTime();
    next.invoke(state);
    log.info("After processing, took {} ms", (System.nanoTime() - start) / 1_000_000);
  }
}
