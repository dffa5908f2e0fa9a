package dev.pooleval.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the evaluation pipeline once at startup when {@code pooleval.pipeline.enabled=true}.
 *
 * <p>A failing stage fails startup, so a batch invocation exits non-zero.
 */
@Component
@ConditionalOnProperty(prefix = "pooleval.pipeline", name = "enabled", havingValue = "true")
public class PipelineRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

  private final EvaluationPipeline pipeline;
  private final PipelineProperties properties;

  public PipelineRunner(EvaluationPipeline pipeline, PipelineProperties properties) {
    this.pipeline = pipeline;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    long start = System.nanoTime();
    pipeline.run(properties);
    log.info("Pipeline step {} finished in {} ms",
        properties.getStep(), (System.nanoTime() - start) / 1_000_000);
  }
}
