package com.cloudera.datascience.bimjoin;

/**
 * What to do with a line that does not parse as a .bim record.
 */
public enum MalformedRecordPolicy {
  /** Stop the join with a {@link BimJoinException.MalformedRecord}. */
  STRICT,
  /** Log a warning and move on to the next line. */
  SKIP,
  /**
   * Log a warning and keep whatever could be read from the line, with unreadable numbers
   * set to 0 and missing fields left empty.
   */
  LEGACY
}
