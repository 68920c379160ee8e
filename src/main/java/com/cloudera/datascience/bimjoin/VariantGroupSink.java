package com.cloudera.datascience.bimjoin;

/**
 * An interface implemented by clients to receive the groups found by an
 * {@link InnerJoin}, in the order the join finds them. Implementations may be stateful.
 */
public interface VariantGroupSink {
  /**
   * Takes one group of records, one per input, that share a locus.
   * @param group a matched or mismatched group
   */
  void add(VariantGroup group);

  /**
   * Call to indicate that there are no more groups.
   */
  void finish();
}
