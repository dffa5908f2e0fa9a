package dev.pooleval.metrics;

/**
 * A (method, query) pair that could not be measured at any cutoff.
 *
 * @param method the retrieval method
 * @param query the evaluated query
 * @param reason why the cell is missing
 */
public record MissingCell(String method, String query, String reason) {}
