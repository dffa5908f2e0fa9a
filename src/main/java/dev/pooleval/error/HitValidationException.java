package dev.pooleval.error;

/**
 * A single search hit row is malformed (missing query, document id or rank). The row is skipped
 * and counted; pooling continues.
 */
public class HitValidationException extends PoolEvalException {

  public HitValidationException(String message) {
    super(message);
  }
}
