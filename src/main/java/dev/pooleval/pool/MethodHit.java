package dev.pooleval.pool;

import org.jspecify.annotations.Nullable;

/**
 * Rank and score a single method assigned to a pooled document.
 *
 * @param rank the 1-based rank within the method's top-K list
 * @param score the retrieval score, or null when the input score was absent or non-numeric
 */
public record MethodHit(int rank, @Nullable Double score) {}
