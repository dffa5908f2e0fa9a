package dev.pooleval.table;

import dev.pooleval.pool.PooledDocument;
import java.util.List;

/**
 * A pooled table read back from CSV.
 *
 * @param methods methods detected from the {@code <method>_rank} columns, in column order
 * @param documents pooled documents in file order
 */
public record PooledTable(List<String> methods, List<PooledDocument> documents) {

  public PooledTable {
    methods = List.copyOf(methods);
    documents = List.copyOf(documents);
  }
}
