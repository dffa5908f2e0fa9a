package dev.pooleval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the pooled retrieval evaluation tool.
 *
 * <p>Runs as a batch job: enable {@code pooleval.pipeline.enabled} and pick a step (POOL, LABEL,
 * METRICS or ALL) under {@code pooleval.pipeline.*}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PoolEvalApplication {
    public static void main(String[] args) {
        SpringApplication.run(PoolEvalApplication.class, args);
    }
}
