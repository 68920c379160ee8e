package com.cloudera.datascience.bimjoin;

import com.google.common.collect.ImmutableList;
import java.util.List;

public class JoinSummary {
  private final long steps;
  private final long matchedGroups;
  private final long mismatchedGroups;
  private final List<String> inputNames;
  private final List<Long> recordsRead;
  private final List<Long> recordsSkipped;

  public JoinSummary(long steps, long matchedGroups, long mismatchedGroups,
      List<String> inputNames, List<Long> recordsRead, List<Long> recordsSkipped) {
    this.steps = steps;
    this.matchedGroups = matchedGroups;
    this.mismatchedGroups = mismatchedGroups;
    this.inputNames = ImmutableList.copyOf(inputNames);
    this.recordsRead = ImmutableList.copyOf(recordsRead);
    this.recordsSkipped = ImmutableList.copyOf(recordsSkipped);
  }

  public long getSteps() {
    return steps;
  }

  public long getMatchedGroups() {
    return matchedGroups;
  }

  public long getMismatchedGroups() {
    return mismatchedGroups;
  }

  public List<String> getInputNames() {
    return inputNames;
  }

  public long getRecordsRead(int inputIndex) {
    return recordsRead.get(inputIndex);
  }

  public long getRecordsSkipped(int inputIndex) {
    return recordsSkipped.get(inputIndex);
  }

  @Override
  public String toString() {
    return "JoinSummary{" +
        "steps=" + steps +
        ", matchedGroups=" + matchedGroups +
        ", mismatchedGroups=" + mismatchedGroups +
        ", inputNames=" + inputNames +
        ", recordsRead=" + recordsRead +
        ", recordsSkipped=" + recordsSkipped +
        '}';
  }
}
