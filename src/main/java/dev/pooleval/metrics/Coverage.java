package dev.pooleval.metrics;

/**
 * Whether a cell's cutoff lies within the pooling depth.
 *
 * <p>Beyond the pool depth, documents a method ranked below K were never pooled or judged, so the
 * value is computed over partial coverage rather than truncated.
 */
public enum Coverage {
  EXACT,
  PARTIAL_COVERAGE;

  static Coverage of(int k, int poolDepth) {
    return k > poolDepth ? PARTIAL_COVERAGE : EXACT;
  }
}
