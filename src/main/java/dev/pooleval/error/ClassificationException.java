package dev.pooleval.error;

/**
 * A single relevance classification call failed: timeout, malformed response or rejection by the
 * judge. Recorded as a failed judgment; the labeling batch continues.
 */
public class ClassificationException extends PoolEvalException {

  public ClassificationException(String message) {
    super(message);
  }

  public ClassificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
