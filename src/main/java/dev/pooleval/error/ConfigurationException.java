package dev.pooleval.error;

/** Invalid run configuration (method/input count mismatch, bad cutoffs, unknown methods). Fatal. */
public class ConfigurationException extends PoolEvalException {

  public ConfigurationException(String message) {
    super(message);
  }
}
