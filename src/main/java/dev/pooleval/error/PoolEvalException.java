package dev.pooleval.error;

/**
 * Base type of every failure raised by the pooling, labeling and metrics components.
 *
 * <p>Subclasses encode the propagation policy: {@link ConfigurationException} aborts a run,
 * {@link HitValidationException} and {@link ClassificationException} are counted and skipped by
 * their enclosing batch, and {@link MissingDataException} marks a metric cell that cannot be
 * measured.
 */
public abstract class PoolEvalException extends RuntimeException {

  protected PoolEvalException(String message) {
    super(message);
  }

  protected PoolEvalException(String message, Throwable cause) {
    super(message, cause);
  }
}
