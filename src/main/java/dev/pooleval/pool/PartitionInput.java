package dev.pooleval.pool;

import java.util.List;

/**
 * One independently pooled input group of a partitioned merge.
 *
 * @param tag partition tag stamped on every document of the group (e.g. HEAD, TAIL)
 * @param hitsPerMethod ranked hits per method, in the same order as the merge's method list
 */
public record PartitionInput(String tag, List<List<SearchHit>> hitsPerMethod) {

  public PartitionInput {
    if (tag == null || tag.isBlank()) {
      throw new IllegalArgumentException("Partition tag must not be blank");
    }
    hitsPerMethod = List.copyOf(hitsPerMethod);
  }
}
