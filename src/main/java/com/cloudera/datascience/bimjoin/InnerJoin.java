package com.cloudera.datascience.bimjoin;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Joins k inputs, each sorted by chromosome then position, without holding more than one
 * record per input in memory. Iterating returns the groups of records that share a locus
 * in every input.
 * <p>
 * Each step looks at the current record of every input (the frontier). If they all match
 * the first input's record, the group is returned and every input moves on. Otherwise
 * the inputs behind the furthest record move on by one, so lagging inputs catch up one
 * record at a time. If they are all at the same locus but the alleles disagree, the
 * {@link EqualLocusMismatchPolicy} decides. The join ends as soon as any input runs out;
 * records left in the other inputs are never read.
 */
public class InnerJoin extends AbstractIterator<VariantGroup> {

  private static final Logger logger = LogManager.getLogger(InnerJoin.class);

  private final List<VariantStream> streams;
  private final EqualLocusMismatchPolicy equalLocusMismatchPolicy;
  private boolean started;
  private long steps;
  private long matchedGroups;
  private long mismatchedGroups;

  public InnerJoin(List<VariantStream> streams,
      EqualLocusMismatchPolicy equalLocusMismatchPolicy) {
    Preconditions.checkArgument(streams.size() >= 2,
        "at least two inputs are needed, found %s", streams.size());
    this.streams = ImmutableList.copyOf(streams);
    this.equalLocusMismatchPolicy = Preconditions.checkNotNull(equalLocusMismatchPolicy);
  }

  /**
   * Sends every group to the sink, then finishes the sink.
   * @return counts for the run
   */
  public JoinSummary run(VariantGroupSink sink) {
    while (hasNext()) {
      sink.add(next());
    }
    sink.finish();
    return getSummary();
  }

  @Override
  protected VariantGroup computeNext() {
    while (!isFinished()) {
      VariantGroup group = step();
      if (group != null) {
        return group;
      }
    }
    return endOfData();
  }

  /**
   * Reads the first record of every input, if that has not happened yet, then reports
   * whether any input has run out.
   */
  @VisibleForTesting
  boolean isFinished() {
    if (!started) {
      started = true;
      advanceAll();
    }
    for (VariantStream stream : streams) {
      if (stream.isExhausted()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Compares the frontier once and advances the inputs accordingly.
   * @return the group at the frontier if it was a match or an equal-locus mismatch,
   * otherwise null
   */
  @VisibleForTesting
  VariantGroup step() {
    Preconditions.checkState(!isFinished(), "an input is exhausted");
    List<VariantRecord> frontier = getFrontier();
    steps++;
    logger.debug("Frontier: {}", frontier);

    if (AlleleMatcher.allMatch(frontier)) {
      matchedGroups++;
      advanceAll();
      return new VariantGroup(frontier, true);
    }

    if (AlleleMatcher.allAtSameLocus(frontier)) {
      if (equalLocusMismatchPolicy == EqualLocusMismatchPolicy.FAIL) {
        throw new BimJoinException.InconsistentAlleles(frontier);
      }
      logger.debug("Allele mismatch at a shared locus: {}", frontier);
      mismatchedGroups++;
      advanceAll();
      return new VariantGroup(frontier, false);
    }

    VariantRecord max = frontier.get(indexOfMax(frontier));
    for (VariantStream stream : streams) {
      if (stream.current().isLocusBefore(max)) {
        stream.advance();
      }
    }
    return null;
  }

  /**
   * Finds the furthest record. Ties go to the earliest input, since a later record only
   * replaces the current maximum if it is strictly greater.
   */
  @VisibleForTesting
  static int indexOfMax(List<VariantRecord> frontier) {
    int greatest = 0;
    for (int i = 1; i < frontier.size(); i++) {
      if (VariantRecord.compare(frontier.get(i), frontier.get(greatest)) > 0) {
        greatest = i;
      }
    }
    return greatest;
  }

  private void advanceAll() {
    for (VariantStream stream : streams) {
      stream.advance();
    }
  }

  private List<VariantRecord> getFrontier() {
    List<VariantRecord> frontier = new ArrayList<>(streams.size());
    for (VariantStream stream : streams) {
      frontier.add(stream.current());
    }
    return frontier;
  }

  public JoinSummary getSummary() {
    List<String> names = new ArrayList<>(streams.size());
    List<Long> read = new ArrayList<>(streams.size());
    List<Long> skipped = new ArrayList<>(streams.size());
    for (VariantStream stream : streams) {
      names.add(stream.getName());
      read.add(stream.getRecordsRead());
      skipped.add(stream.getRecordsSkipped());
    }
    return new JoinSummary(steps, matchedGroups, mismatchedGroups, names, read, skipped);
  }
}
