package com.cloudera.datascience.bimjoin;

/**
 * What the join does when every input is at the same locus but the alleles do not
 * match. No input is behind the others, so catching up cannot resolve it.
 */
public enum EqualLocusMismatchPolicy {
  /** Report the group as a mismatch and move every input on by one record. */
  ADVANCE_ALL,
  /** Stop the join with a {@link BimJoinException.InconsistentAlleles}. */
  FAIL
}
