package dev.pooleval.metrics;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for evaluation, bound from {@code pooleval.metrics.*}.
 *
 * <ul>
 *   <li>{@code cutoffs} - cutoff values K (default 5, 10, 20)
 *   <li>{@code output-dir} - directory for exported CSVs (read by {@link MetricsExporter})
 *   <li>{@code extreme-queries} - how many best and worst queries to log per method (default 10)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "pooleval.metrics")
public class MetricsProperties {

  private List<Integer> cutoffs = new ArrayList<>(MetricsRequest.DEFAULT_CUTOFFS);
  private String outputDir = "results/metrics";
  private int extremeQueries = 10;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (cutoffs == null || cutoffs.isEmpty()) {
      throw new IllegalStateException("pooleval.metrics.cutoffs must not be empty");
    }
    for (Integer k : cutoffs) {
      if (k == null || k < 1) {
        throw new IllegalStateException("pooleval.metrics.cutoffs must be >= 1, got: " + k);
      }
    }
    if (extremeQueries < 0) {
      throw new IllegalStateException(
          "pooleval.metrics.extreme-queries must be >= 0, got: " + extremeQueries);
    }
  }

  public List<Integer> getCutoffs() {
    return cutoffs;
  }

  public void setCutoffs(List<Integer> cutoffs) {
    this.cutoffs = cutoffs;
  }

  public String getOutputDir() {
    return outputDir;
  }

  public void setOutputDir(String outputDir) {
    this.outputDir = outputDir;
  }

  public int getExtremeQueries() {
    return extremeQueries;
  }

  public void setExtremeQueries(int extremeQueries) {
    this.extremeQueries = extremeQueries;
  }
}
