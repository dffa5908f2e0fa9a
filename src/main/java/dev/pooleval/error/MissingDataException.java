package dev.pooleval.error;

/** Thrown when reading the value of a metric cell that has no underlying ranked results. */
public class MissingDataException extends PoolEvalException {

  public MissingDataException(String message) {
    super(message);
  }
}
