package com.cloudera.datascience.bimjoin;

import com.google.common.base.Preconditions;
import java.util.List;

/**
 * Decides whether the records at the front of each input agree with each other.
 */
public final class AlleleMatcher {

  private AlleleMatcher() {
  }

  /**
   * Checks every record against the first one, which acts as the reference. Records are
   * not checked against each other, so two non-reference records may each be compatible
   * with the reference without being compatible with one another.
   * @return true if every record is at the reference's locus with compatible alleles
   */
  public static boolean allMatch(List<VariantRecord> frontier) {
    Preconditions.checkArgument(!frontier.isEmpty(), "empty frontier");
    VariantRecord reference = frontier.get(0);
    for (int i = 1; i < frontier.size(); i++) {
      if (!VariantRecord.allelesEqual(reference, frontier.get(i))) {
        return false;
      }
    }
    return true;
  }

  public static boolean allAtSameLocus(List<VariantRecord> frontier) {
    Preconditions.checkArgument(!frontier.isEmpty(), "empty frontier");
    VariantRecord reference = frontier.get(0);
    for (int i = 1; i < frontier.size(); i++) {
      if (!VariantRecord.locusEquals(reference, frontier.get(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Picks the record to write out for a group: the first one that has both alleles,
   * falling back to the first record if every record is missing an allele.
   */
  public static VariantRecord representative(List<VariantRecord> group) {
    Preconditions.checkArgument(!group.isEmpty(), "empty group");
    for (VariantRecord record : group) {
      if (!record.hasMissingAllele()) {
        return record;
      }
    }
    return group.get(0);
  }
}
